package com.flamingo.ai.finqa.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One page of merged extraction output. Immutable input to the ingestion pipeline.
 *
 * @param pageNumber 1-based page number
 * @param documentId owning document
 * @param spans text spans in reading order
 * @param tables table regions detected on the page
 */
public record ExtractedPage(
    int pageNumber, String documentId, List<TextSpan> spans, List<TableRegion> tables) {

  public ExtractedPage {
    spans = spans == null ? List.of() : List.copyOf(spans);
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  /** Spans and tables interleaved by offset. */
  public List<PageItem> orderedItems() {
    List<PageItem> items = new ArrayList<>(spans.size() + tables.size());
    items.addAll(spans);
    items.addAll(tables);
    items.sort(Comparator.comparingInt(PageItem::offset));
    return items;
  }
}
