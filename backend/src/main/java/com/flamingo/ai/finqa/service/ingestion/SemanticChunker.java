package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.domain.enums.BoundaryKind;
import com.flamingo.ai.finqa.domain.enums.ChunkKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.Boundary;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.ChunkMetadata;
import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import com.flamingo.ai.finqa.domain.model.ExtractedPage;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.PageItem;
import com.flamingo.ai.finqa.domain.model.TableRegion;
import com.flamingo.ai.finqa.domain.model.TextSpan;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that keeps accounting structure intact.
 *
 * <p>The document is walked in reading order. The current chunk is closed at every statement
 * change and table edge, and narrative is split at sentence ends before it would exceed the upper
 * bound. Every table becomes its own tabular unit rendered as a Markdown pipe table; tables above
 * the upper bound are split by row groups (a label row plus its detail rows) with the header rows
 * repeated in every part. Rows are never split.
 *
 * <p>A second pass merges units below the lower bound into their successor (the last unit into
 * its predecessor) unless the merge would cross a statement change, exceed the upper bound, span
 * more than one table edge or join two parts of the same table.
 *
 * <p>A single sentence or table row larger than the upper bound is kept whole.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticChunker implements DocumentChunker {

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final String SEPARATOR = "\n\n";

  private final StatementLexicon lexicon;
  private final FiscalPeriodParser periodParser;

  @Override
  public List<Chunk> chunk(
      ExtractedDocument document, List<Boundary> boundaries, ChunkingBounds bounds) {
    List<Boundary> ordered = new ArrayList<>(boundaries);
    ordered.sort(Boundary.BY_POSITION);

    Walk walk = new Walk(ordered, bounds);
    for (ExtractedPage page : document.pages()) {
      int tableIndex = 0;
      for (PageItem item : page.orderedItems()) {
        if (item instanceof TextSpan span) {
          walk.text(page.pageNumber(), span);
        } else if (item instanceof TableRegion table && !table.isEmpty()) {
          walk.table(page.pageNumber(), table, page.pageNumber() + ":" + tableIndex++);
        }
      }
    }

    List<Unit> units = merge(walk.finish(), bounds);
    List<Chunk> chunks = new ArrayList<>(units.size());
    for (int i = 0; i < units.size(); i++) {
      chunks.add(toChunk(document, i, units.get(i)));
    }
    log.debug(
        "SemanticChunker produced {} chunks for document {}",
        chunks.size(),
        document.documentId());
    return chunks;
  }

  // ---- merge pass ----

  private List<Unit> merge(List<Unit> units, ChunkingBounds bounds) {
    List<Unit> result = new ArrayList<>(units);
    int i = 0;
    while (i < result.size()) {
      Unit unit = result.get(i);
      if (unit.tokens() >= bounds.lower()) {
        i++;
        continue;
      }
      if (i + 1 < result.size()) {
        Optional<Unit> merged = tryMerge(unit, result.get(i + 1), bounds);
        if (merged.isPresent()) {
          result.set(i, merged.get());
          result.remove(i + 1);
          continue;
        }
      } else if (i > 0) {
        Optional<Unit> merged = tryMerge(result.get(i - 1), unit, bounds);
        if (merged.isPresent()) {
          result.set(i - 1, merged.get());
          result.remove(i);
          continue;
        }
      }
      i++;
    }
    return result;
  }

  private Optional<Unit> tryMerge(Unit first, Unit second, ChunkingBounds bounds) {
    if (first.statement() != second.statement() || second.opensWithStatementChange()) {
      return Optional.empty();
    }
    if (!Collections.disjoint(first.tableKeys(), second.tableKeys())) {
      return Optional.empty();
    }
    int tableEdges =
        first.tableEdges()
            + second.tableEdges()
            + (first.endsWithTable() ? 1 : 0)
            + (second.startsWithTable() ? 1 : 0);
    if (tableEdges > 1) {
      return Optional.empty();
    }
    String content = first.content() + SEPARATOR + second.content();
    if (TokenEstimator.estimate(content) > bounds.upper()) {
      return Optional.empty();
    }

    List<String> ids = new ArrayList<>(first.boundaryIds());
    ids.addAll(second.boundaryIds());
    Set<String> tableKeys = new HashSet<>(first.tableKeys());
    tableKeys.addAll(second.tableKeys());
    TreeSet<FiscalPeriod> periods = new TreeSet<>(first.periods());
    periods.addAll(second.periods());
    ChunkKind kind =
        first.kind() == ChunkKind.NARRATIVE && second.kind() == ChunkKind.NARRATIVE
            ? ChunkKind.NARRATIVE
            : ChunkKind.MIXED;

    return Optional.of(
        new Unit(
            content,
            first.statement(),
            Math.min(first.pageStart(), second.pageStart()),
            Math.max(first.pageEnd(), second.pageEnd()),
            ids,
            kind,
            tableKeys,
            first.startsWithTable(),
            second.endsWithTable(),
            first.opensWithStatementChange(),
            tableEdges,
            new ArrayList<>(periods)));
  }

  private Chunk toChunk(ExtractedDocument document, int index, Unit unit) {
    TreeSet<FiscalPeriod> periods = new TreeSet<>(unit.periods());
    if (document.reportingPeriod() != null) {
      periods.add(document.reportingPeriod());
    }
    ChunkMetadata metadata =
        new ChunkMetadata(
            new ArrayList<>(periods),
            unit.statement(),
            unit.pageStart(),
            unit.pageEnd(),
            unit.boundaryIds(),
            unit.kind());
    return new Chunk(
        Chunk.idFor(document.documentId(), index),
        document.documentId(),
        index,
        unit.content(),
        metadata,
        unit.tokens());
  }

  // ---- table rendering ----

  /** Renders a table as one or more Markdown parts, each starting with the header rows. */
  private List<String> renderTable(TableRegion table, int upper) {
    int width = table.rows().stream().mapToInt(List::size).max().orElse(1);
    String header = renderHeader(table.headerRows(), width);
    List<List<String>> body = table.bodyRows();
    List<String> bodyLines = body.stream().map(row -> renderRow(row, width)).toList();

    String whole = join(header, bodyLines);
    if (bodyLines.isEmpty() || TokenEstimator.estimate(whole) <= upper) {
      return List.of(whole);
    }

    List<String> parts = new ArrayList<>();
    List<String> current = new ArrayList<>();
    for (List<String> group : rowGroups(body, bodyLines)) {
      List<List<String>> pieces =
          fits(header, group, upper) ? List.of(group) : group.stream().map(List::of).toList();
      for (List<String> piece : pieces) {
        List<String> candidate = new ArrayList<>(current);
        candidate.addAll(piece);
        if (!current.isEmpty() && !fits(header, candidate, upper)) {
          parts.add(join(header, current));
          current = new ArrayList<>(piece);
        } else {
          current = candidate;
        }
      }
    }
    if (!current.isEmpty()) {
      parts.add(join(header, current));
    }
    return parts;
  }

  /**
   * Groups body rows: a label row (first cell only) opens a group that collects the detail rows
   * below it. Tables without label rows yield one group per row.
   */
  private List<List<String>> rowGroups(List<List<String>> body, List<String> bodyLines) {
    boolean grouped = body.stream().anyMatch(SemanticChunker::isLabelRow);
    List<List<String>> groups = new ArrayList<>();
    List<String> group = null;
    for (int i = 0; i < body.size(); i++) {
      if (!grouped || group == null || isLabelRow(body.get(i))) {
        group = new ArrayList<>();
        groups.add(group);
      }
      group.add(bodyLines.get(i));
    }
    return groups;
  }

  private static boolean isLabelRow(List<String> row) {
    if (row.isEmpty() || isBlank(row.get(0))) {
      return false;
    }
    return row.stream().skip(1).allMatch(SemanticChunker::isBlank);
  }

  private static boolean fits(String header, List<String> rows, int upper) {
    return TokenEstimator.estimate(join(header, rows)) <= upper;
  }

  private static String join(String header, List<String> rows) {
    return rows.isEmpty() ? header : header + "\n" + String.join("\n", rows);
  }

  private static String renderHeader(List<List<String>> headerRows, int width) {
    StringBuilder sb = new StringBuilder();
    for (List<String> row : headerRows) {
      sb.append(renderRow(row, width)).append('\n');
    }
    sb.append('|');
    for (int i = 0; i < width; i++) {
      sb.append(" --- |");
    }
    return sb.toString();
  }

  private static String renderRow(List<String> row, int width) {
    StringBuilder sb = new StringBuilder("|");
    for (int i = 0; i < width; i++) {
      String cell = i < row.size() ? row.get(i) : null;
      sb.append(' ').append(escape(cell)).append(" |");
    }
    return sb.toString();
  }

  private static String escape(String cell) {
    if (cell == null) {
      return "";
    }
    return cell.strip().replace("\r", " ").replace("\n", " ").replace("|", "\\|");
  }

  private static boolean isBlank(String cell) {
    return cell == null || cell.isBlank();
  }

  // ---- document walk ----

  /** Linear walk over one document; owns all mutable chunking state. */
  private final class Walk {

    private final List<Boundary> boundaries;
    private final ChunkingBounds bounds;
    private final List<Unit> units = new ArrayList<>();
    private final List<String> pendingIds = new ArrayList<>();
    private int cursor;
    private StatementType current = StatementType.UNCLASSIFIED;
    private boolean statementChangePending;

    private final StringBuilder narrative = new StringBuilder();
    private final List<String> narrativeIds = new ArrayList<>();
    private StatementType narrativeStatement;
    private boolean narrativeOpensWithChange;
    private int narrativePageStart;
    private int narrativePageEnd;

    Walk(List<Boundary> boundaries, ChunkingBounds bounds) {
      this.boundaries = boundaries;
      this.bounds = bounds;
    }

    void text(int page, TextSpan span) {
      List<Integer> starts = new ArrayList<>();
      starts.add(span.offset());
      for (int i = cursor; i < boundaries.size(); i++) {
        Boundary b = boundaries.get(i);
        if (b.page() > page || (b.page() == page && b.offset() >= span.endOffset())) {
          break;
        }
        if (b.page() == page && b.offset() > span.offset() && !starts.contains(b.offset())) {
          starts.add(b.offset());
        }
      }
      for (int i = 0; i < starts.size(); i++) {
        int start = starts.get(i);
        int end = i + 1 < starts.size() ? starts.get(i + 1) : span.endOffset();
        consumeThrough(page, start);
        appendNarrative(
            page, span.text().substring(start - span.offset(), end - span.offset()));
      }
    }

    void table(int page, TableRegion table, String tableKey) {
      consumeThrough(page, table.offset());
      flushNarrative();

      StatementType statement =
          current != StatementType.UNCLASSIFIED
              ? current
              : lexicon.classifyTable(table).orElse(StatementType.UNCLASSIFIED);
      List<String> headerCells = table.headerRows().stream().flatMap(List::stream).toList();
      List<FiscalPeriod> periods = periodParser.parseHeader(headerCells);

      List<String> parts = renderTable(table, bounds.upper());
      for (int i = 0; i < parts.size(); i++) {
        List<String> ids = new ArrayList<>();
        boolean opensWithChange = false;
        if (i == 0) {
          ids.addAll(pendingIds);
          pendingIds.clear();
          opensWithChange = statementChangePending;
          statementChangePending = false;
        }
        units.add(
            new Unit(
                parts.get(i),
                statement,
                page,
                page,
                ids,
                ChunkKind.TABULAR,
                Set.of(tableKey),
                true,
                true,
                opensWithChange,
                0,
                periods));
      }
      if (parts.size() > 1) {
        log.debug("Split table {} into {} row-group chunks", tableKey, parts.size());
      }
      consumeThrough(page, table.endOffset());
    }

    List<Unit> finish() {
      while (cursor < boundaries.size()) {
        apply(boundaries.get(cursor++));
      }
      flushNarrative();
      if (!pendingIds.isEmpty() && !units.isEmpty()) {
        Unit last = units.get(units.size() - 1);
        List<String> ids = new ArrayList<>(last.boundaryIds());
        ids.addAll(pendingIds);
        units.set(units.size() - 1, last.withBoundaryIds(ids));
        pendingIds.clear();
      }
      return units;
    }

    private void consumeThrough(int page, int offset) {
      while (cursor < boundaries.size() && boundaries.get(cursor).isAtOrBefore(page, offset)) {
        apply(boundaries.get(cursor++));
      }
    }

    private void apply(Boundary boundary) {
      if (boundary.kind().isClosing()) {
        flushNarrative();
      }
      if (boundary.kind() == BoundaryKind.STATEMENT_CHANGE) {
        current = boundary.statementType();
        statementChangePending = true;
      }
      pendingIds.add(boundary.id());
    }

    private void appendNarrative(int page, String text) {
      for (String line : text.split("\n")) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        boolean newLine = true;
        for (String sentence : SENTENCE_END.split(trimmed)) {
          if (sentence.isBlank()) {
            continue;
          }
          String separator = narrative.length() == 0 ? "" : (newLine ? "\n" : " ");
          int projected = narrative.length() + separator.length() + sentence.length();
          if (narrative.length() > 0 && TokenEstimator.estimate(projected) > bounds.upper()) {
            flushNarrative();
            separator = "";
          }
          if (narrative.length() == 0) {
            narrativeStatement = current;
            narrativePageStart = page;
            narrativeOpensWithChange = statementChangePending;
            statementChangePending = false;
          }
          narrativeIds.addAll(pendingIds);
          pendingIds.clear();
          narrative.append(separator).append(sentence);
          narrativePageEnd = page;
          newLine = false;
        }
      }
    }

    private void flushNarrative() {
      if (narrative.length() == 0) {
        return;
      }
      String content = narrative.toString();
      units.add(
          new Unit(
              content,
              narrativeStatement,
              narrativePageStart,
              narrativePageEnd,
              new ArrayList<>(narrativeIds),
              ChunkKind.NARRATIVE,
              Set.of(),
              false,
              false,
              narrativeOpensWithChange,
              0,
              periodParser.parse(content)));
      narrative.setLength(0);
      narrativeIds.clear();
      narrativeOpensWithChange = false;
    }
  }

  /** Chunk under construction, before ids are assigned. */
  private record Unit(
      String content,
      StatementType statement,
      int pageStart,
      int pageEnd,
      List<String> boundaryIds,
      ChunkKind kind,
      Set<String> tableKeys,
      boolean startsWithTable,
      boolean endsWithTable,
      boolean opensWithStatementChange,
      int tableEdges,
      List<FiscalPeriod> periods) {

    int tokens() {
      return TokenEstimator.estimate(content);
    }

    Unit withBoundaryIds(List<String> ids) {
      return new Unit(
          content,
          statement,
          pageStart,
          pageEnd,
          List.copyOf(ids),
          kind,
          tableKeys,
          startsWithTable,
          endsWithTable,
          opensWithStatementChange,
          tableEdges,
          periods);
    }
  }
}
