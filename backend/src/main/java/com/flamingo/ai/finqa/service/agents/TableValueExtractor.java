package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.domain.enums.FinancialMetric;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads line-item values from the Markdown pipe tables inside chunk content.
 *
 * <p>Rows are matched by label against the metric aliases, preferring an exact label match so
 * that "Total equity" is not read from "Total liabilities and equity". Columns are matched by the
 * fiscal period named in the header rows.
 */
@Component
@RequiredArgsConstructor
public class TableValueExtractor {

  private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\|(\\s*:?-{3,}:?\\s*\\|)+$");
  private static final Pattern CELL_SPLIT = Pattern.compile("(?<!\\\\)\\|");
  private static final Pattern CURRENCY =
      Pattern.compile("(?i)[$€£¥%]|\\b(?:aed|usd|eur|gbp)\\b");
  private static final Pattern DASHES = Pattern.compile("[-–—]+");
  private static final int FIRST_NUMERIC_COLUMN = -1;

  private final FiscalPeriodParser periodParser;

  /**
   * Finds the value of a metric for a fiscal period.
   *
   * @param chunk chunk whose content may contain tables
   * @param metric line item to read
   * @param period column to read, or {@code null} for the most recent period in the table
   * @return the value, or empty when no table row and column match
   */
  public Optional<MetricValue> find(Chunk chunk, FinancialMetric metric, FiscalPeriod period) {
    for (MarkdownTable table : parseTables(chunk.content())) {
      Optional<List<String>> row = selectRow(table, metric);
      if (row.isEmpty()) {
        continue;
      }
      OptionalInt column = selectColumn(table, chunk, period);
      if (column.isEmpty()) {
        continue;
      }
      int index = column.getAsInt();
      if (index == FIRST_NUMERIC_COLUMN) {
        index = firstNumericColumn(row.get());
      }
      if (index < 1 || index >= row.get().size()) {
        continue;
      }
      Optional<Double> value = parseNumber(row.get().get(index));
      if (value.isPresent()) {
        return Optional.of(
            new MetricValue(
                metric, value.get(), row.get().get(0), table.columnHeader(index), chunk));
      }
    }
    return Optional.empty();
  }

  /** Parses a reported figure: thousands separators, currency marks and parentheses allowed. */
  public static Optional<Double> parseNumber(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String text = CURRENCY.matcher(raw).replaceAll("").replaceAll("\\s+", "");
    if (text.isEmpty() || DASHES.matcher(text).matches()) {
      return Optional.empty();
    }
    boolean negative = text.startsWith("(") && text.endsWith(")");
    if (negative) {
      text = text.substring(1, text.length() - 1);
    }
    try {
      double value = Double.parseDouble(text.replace(",", ""));
      return Optional.of(negative ? -value : value);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @VisibleForTesting
  List<MarkdownTable> parseTables(String content) {
    List<MarkdownTable> tables = new ArrayList<>();
    List<String> block = new ArrayList<>();
    for (String line : content.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.startsWith("|")) {
        block.add(trimmed);
      } else if (!block.isEmpty()) {
        tables.add(toTable(block));
        block = new ArrayList<>();
      }
    }
    if (!block.isEmpty()) {
      tables.add(toTable(block));
    }
    return tables;
  }

  private MarkdownTable toTable(List<String> lines) {
    int separator = -1;
    for (int i = 0; i < lines.size(); i++) {
      if (SEPARATOR_ROW.matcher(lines.get(i)).matches()) {
        separator = i;
        break;
      }
    }
    int headerEnd = separator >= 0 ? separator : 1;
    int bodyStart = separator >= 0 ? separator + 1 : 1;
    List<List<String>> header =
        lines.subList(0, headerEnd).stream().map(TableValueExtractor::cells).toList();
    List<List<String>> body =
        lines.subList(Math.min(bodyStart, lines.size()), lines.size()).stream()
            .map(TableValueExtractor::cells)
            .toList();
    return new MarkdownTable(header, body);
  }

  private static List<String> cells(String line) {
    String inner = line.substring(1);
    if (inner.endsWith("|") && !inner.endsWith("\\|")) {
      inner = inner.substring(0, inner.length() - 1);
    }
    return Arrays.stream(CELL_SPLIT.split(inner, -1))
        .map(cell -> cell.strip().replace("\\|", "|"))
        .toList();
  }

  private Optional<List<String>> selectRow(MarkdownTable table, FinancialMetric metric) {
    List<String> exact = null;
    List<String> partial = null;
    for (List<String> row : table.body()) {
      if (row.isEmpty()) {
        continue;
      }
      String label = normalizeLabel(row.get(0));
      for (String alias : metric.getAliases()) {
        if (label.equals(alias)) {
          exact = exact == null ? row : exact;
        } else if (label.contains(alias)
            && (partial == null || label.length() < normalizeLabel(partial.get(0)).length())) {
          partial = row;
        }
      }
    }
    return Optional.ofNullable(exact != null ? exact : partial);
  }

  private OptionalInt selectColumn(MarkdownTable table, Chunk chunk, FiscalPeriod period) {
    List<List<FiscalPeriod>> columnPeriods = new ArrayList<>();
    boolean anyPeriod = false;
    for (int col = 0; col < table.width(); col++) {
      List<FiscalPeriod> periods =
          col == 0 ? List.of() : periodParser.parse(table.columnHeader(col));
      columnPeriods.add(periods);
      anyPeriod |= !periods.isEmpty();
    }
    if (!anyPeriod) {
      boolean coversPeriod =
          period == null || chunk.metadata().fiscalYears().contains(period.year());
      return coversPeriod ? OptionalInt.of(FIRST_NUMERIC_COLUMN) : OptionalInt.empty();
    }
    if (period == null) {
      int latest = -1;
      FiscalPeriod latestPeriod = null;
      for (int col = 1; col < columnPeriods.size(); col++) {
        for (FiscalPeriod candidate : columnPeriods.get(col)) {
          if (latestPeriod == null || candidate.compareTo(latestPeriod) > 0) {
            latestPeriod = candidate;
            latest = col;
          }
        }
      }
      return OptionalInt.of(latest);
    }
    for (int col = 1; col < columnPeriods.size(); col++) {
      if (columnPeriods.get(col).contains(period)) {
        return OptionalInt.of(col);
      }
    }
    if (period.isAnnual()) {
      for (int col = 1; col < columnPeriods.size(); col++) {
        if (columnPeriods.get(col).stream().anyMatch(p -> p.year() == period.year())) {
          return OptionalInt.of(col);
        }
      }
    }
    return OptionalInt.empty();
  }

  private static int firstNumericColumn(List<String> row) {
    for (int col = 1; col < row.size(); col++) {
      if (parseNumber(row.get(col)).isPresent()) {
        return col;
      }
    }
    return -1;
  }

  private static String normalizeLabel(String label) {
    return label
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\(\\w\\)|\\*|:$", "")
        .replaceAll("\\s+", " ")
        .strip();
  }

  /** Header rows and body rows of one Markdown table. */
  @VisibleForTesting
  record MarkdownTable(List<List<String>> header, List<List<String>> body) {

    int width() {
      return Math.max(
          header.stream().mapToInt(List::size).max().orElse(0),
          body.stream().mapToInt(List::size).max().orElse(0));
    }

    /** Header cells of one column joined across header rows. */
    String columnHeader(int column) {
      return String.join(
              " ",
              header.stream()
                  .filter(row -> column < row.size())
                  .map(row -> row.get(column))
                  .filter(cell -> !cell.isBlank())
                  .toList())
          .strip();
    }
  }
}
