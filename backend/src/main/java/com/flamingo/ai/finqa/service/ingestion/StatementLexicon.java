package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.TableRegion;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Keyword lexicon naming the statements and report sections of a financial report.
 *
 * <p>Entries are checked in declaration order, so notes headings such as "Notes to the income
 * statement" classify as notes rather than as the statement they annotate.
 */
@Component
public class StatementLexicon {

  private static final Map<StatementType, List<String>> HEADING_PHRASES = new LinkedHashMap<>();

  static {
    HEADING_PHRASES.put(
        StatementType.NOTES,
        List.of(
            "notes to the financial",
            "notes to the consolidated",
            "accounting policies",
            "significant accounting"));
    HEADING_PHRASES.put(
        StatementType.CASH_FLOW,
        List.of(
            "cash flow statement",
            "statement of cash flows",
            "statements of cash flows",
            "consolidated cash flow"));
    HEADING_PHRASES.put(
        StatementType.INCOME_STATEMENT,
        List.of(
            "income statement",
            "profit and loss",
            "profit or loss",
            "statement of comprehensive income",
            "statement of income",
            "statements of income",
            "statement of operations"));
    HEADING_PHRASES.put(
        StatementType.BALANCE_SHEET,
        List.of(
            "balance sheet",
            "statement of financial position",
            "statements of financial position",
            "statement of financial condition"));
    HEADING_PHRASES.put(
        StatementType.RISK_MANAGEMENT,
        List.of(
            "risk management",
            "risk factors",
            "credit risk",
            "market risk",
            "operational risk",
            "liquidity risk"));
    HEADING_PHRASES.put(
        StatementType.MANAGEMENT_COMMENTARY,
        List.of(
            "management discussion",
            "management's discussion",
            "executive summary",
            "financial review",
            "chairman's statement",
            "chief executive",
            "board of directors"));
  }

  private static final List<String> INCOME_HEADER_WORDS =
      List.of("revenue", "income", "profit", "expense");
  private static final List<String> BALANCE_HEADER_WORDS =
      List.of("assets", "liabilities", "equity");
  private static final List<String> CASH_FLOW_HEADER_WORDS =
      List.of("cash flow", "operating activities", "investing", "financing activities");

  /** Statement named by a heading line, if any. */
  public Optional<StatementType> classifyHeading(String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }
    String lower = line.toLowerCase(Locale.ROOT);
    for (Map.Entry<StatementType, List<String>> entry : HEADING_PHRASES.entrySet()) {
      if (entry.getValue().stream().anyMatch(lower::contains)) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  /**
   * Classifies a table that appears outside any recognised statement, first by its caption and
   * then by keywords in its header rows.
   */
  public Optional<StatementType> classifyTable(TableRegion table) {
    Optional<StatementType> byCaption = classifyHeading(table.caption());
    if (byCaption.isPresent()) {
      return byCaption;
    }
    String header =
        table.headerRows().stream()
            .flatMap(List::stream)
            .filter(Objects::nonNull)
            .map(cell -> cell.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    if (CASH_FLOW_HEADER_WORDS.stream().anyMatch(header::contains)) {
      return Optional.of(StatementType.CASH_FLOW);
    }
    if (INCOME_HEADER_WORDS.stream().anyMatch(header::contains)) {
      return Optional.of(StatementType.INCOME_STATEMENT);
    }
    if (BALANCE_HEADER_WORDS.stream().anyMatch(header::contains)) {
      return Optional.of(StatementType.BALANCE_SHEET);
    }
    return Optional.empty();
  }
}
