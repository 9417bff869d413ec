package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.domain.enums.BoundaryKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.Boundary;
import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import com.flamingo.ai.finqa.domain.model.ExtractedPage;
import com.flamingo.ai.finqa.domain.model.PageItem;
import com.flamingo.ai.finqa.domain.model.TableRegion;
import com.flamingo.ai.finqa.domain.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds structural transitions in an extracted financial report.
 *
 * <p>Every text line is checked against the {@link StatementLexicon}. A heading that names a
 * statement other than the one in effect opens a {@code STATEMENT_CHANGE}; other headings become
 * {@code SECTION_HEADING}s. Each table contributes a {@code TABLE_START} and a {@code TABLE_END}.
 * When two candidates share a position the one with the higher {@link BoundaryKind} precedence is
 * kept.
 *
 * <p>A document without any cue is reported as an extraction gap: it becomes one unclassified
 * section with a {@code PAGE_BREAK} at the top of every page after the first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionBoundaryDetector {

  private static final int MAX_HEADING_LENGTH = 100;
  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+\\S.*");
  private static final Pattern NUMBERED_HEADING =
      Pattern.compile("^(?i)(note|section|part)\\s+\\d+[a-z]?\\b.*");

  private final StatementLexicon lexicon;

  public BoundaryDetection detect(ExtractedDocument document) {
    List<Boundary> candidates = new ArrayList<>();
    StatementType current = StatementType.UNCLASSIFIED;

    for (ExtractedPage page : document.pages()) {
      for (PageItem item : page.orderedItems()) {
        if (item instanceof TableRegion table) {
          if (table.isEmpty()) {
            continue;
          }
          candidates.add(
              candidate(page.pageNumber(), table.offset(), BoundaryKind.TABLE_START, current));
          candidates.add(
              candidate(page.pageNumber(), table.endOffset(), BoundaryKind.TABLE_END, current));
        } else if (item instanceof TextSpan span) {
          current = scanLines(page.pageNumber(), span, current, candidates);
        }
      }
    }

    if (candidates.isEmpty()) {
      log.warn(
          "No structural cues in document {}, treating it as one unclassified section",
          document.documentId());
      return new BoundaryDetection(pageBreaks(document), true);
    }

    List<Boundary> boundaries = assignIds(document.documentId(), resolveCollisions(candidates));
    log.debug("Detected {} boundaries in document {}", boundaries.size(), document.documentId());
    return new BoundaryDetection(boundaries, false);
  }

  private StatementType scanLines(
      int pageNumber, TextSpan span, StatementType current, List<Boundary> candidates) {
    String text = span.text();
    int lineStart = 0;
    while (lineStart <= text.length()) {
      int lineEnd = text.indexOf('\n', lineStart);
      if (lineEnd < 0) {
        lineEnd = text.length();
      }
      String line = text.substring(lineStart, lineEnd);
      String trimmed = line.strip();
      if (!trimmed.isEmpty() && isHeadingLike(trimmed)) {
        int offset = span.offset() + lineStart + (line.length() - line.stripLeading().length());
        Optional<StatementType> named = lexicon.classifyHeading(headingText(trimmed));
        if (named.isPresent() && named.get() != current) {
          current = named.get();
          candidates.add(candidate(pageNumber, offset, BoundaryKind.STATEMENT_CHANGE, current));
        } else if (isSectionHeading(trimmed) || named.isPresent()) {
          candidates.add(candidate(pageNumber, offset, BoundaryKind.SECTION_HEADING, current));
        }
      }
      lineStart = lineEnd + 1;
    }
    return current;
  }

  /** Short lines that do not read as a sentence. */
  private boolean isHeadingLike(String line) {
    return line.length() <= MAX_HEADING_LENGTH && !line.endsWith(".") && !line.startsWith("|");
  }

  private boolean isSectionHeading(String line) {
    if (MARKDOWN_HEADING.matcher(line).matches() || NUMBERED_HEADING.matcher(line).matches()) {
      return true;
    }
    long letters = line.chars().filter(Character::isLetter).count();
    return letters >= 3
        && line.chars().filter(Character::isLetter).allMatch(Character::isUpperCase)
        && line.split("\\s+").length <= 12;
  }

  private static String headingText(String line) {
    return line.replaceFirst("^#+\\s*", "");
  }

  private static Boundary candidate(int page, int offset, BoundaryKind kind, StatementType type) {
    return new Boundary(null, page, offset, kind, type);
  }

  /** Sorts candidates and keeps one boundary per position, by kind precedence. */
  private List<Boundary> resolveCollisions(List<Boundary> candidates) {
    List<Boundary> sorted = new ArrayList<>(candidates);
    sorted.sort(Boundary.BY_POSITION);
    List<Boundary> resolved = new ArrayList<>();
    for (Boundary next : sorted) {
      if (!resolved.isEmpty() && resolved.get(resolved.size() - 1).samePosition(next)) {
        Boundary kept = resolved.get(resolved.size() - 1);
        if (next.kind().outranks(kept.kind())) {
          resolved.set(resolved.size() - 1, next);
        }
      } else {
        resolved.add(next);
      }
    }
    return resolved;
  }

  private List<Boundary> assignIds(String documentId, List<Boundary> boundaries) {
    List<Boundary> withIds = new ArrayList<>(boundaries.size());
    for (int i = 0; i < boundaries.size(); i++) {
      Boundary b = boundaries.get(i);
      withIds.add(
          new Boundary(
              boundaryId(documentId, i), b.page(), b.offset(), b.kind(), b.statementType()));
    }
    return withIds;
  }

  private List<Boundary> pageBreaks(ExtractedDocument document) {
    List<Boundary> breaks = new ArrayList<>();
    List<ExtractedPage> pages = document.pages();
    for (int i = 1; i < pages.size(); i++) {
      breaks.add(
          new Boundary(
              boundaryId(document.documentId(), breaks.size()),
              pages.get(i).pageNumber(),
              0,
              BoundaryKind.PAGE_BREAK,
              StatementType.UNCLASSIFIED));
    }
    return breaks;
  }

  private static String boundaryId(String documentId, int index) {
    return documentId + "-b" + index;
  }
}
