package com.flamingo.ai.finqa.domain.model;

import java.util.List;

/**
 * A table detected by upstream extraction, as a row/column cell grid.
 *
 * @param offset character offset of the table within its page
 * @param length number of characters the table occupies on the page
 * @param rows cell grid, row-major; rows may be ragged
 * @param headerRowCount number of leading header rows; values below 1 are treated as 1
 * @param caption optional caption or title printed next to the table
 */
public record TableRegion(
    int offset, int length, List<List<String>> rows, int headerRowCount, String caption)
    implements PageItem {

  public TableRegion {
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    headerRowCount = Math.max(1, Math.min(headerRowCount, Math.max(1, rows.size())));
    length = Math.max(1, length);
  }

  @Override
  public int endOffset() {
    return offset + length;
  }

  public List<List<String>> headerRows() {
    return rows.subList(0, Math.min(headerRowCount, rows.size()));
  }

  public List<List<String>> bodyRows() {
    return rows.size() <= headerRowCount ? List.of() : rows.subList(headerRowCount, rows.size());
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
