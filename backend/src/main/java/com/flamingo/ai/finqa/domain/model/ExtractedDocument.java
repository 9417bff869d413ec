package com.flamingo.ai.finqa.domain.model;

import java.util.Comparator;
import java.util.List;

/**
 * A financial report as delivered by the extraction collaborator.
 *
 * @param documentId stable identifier; chunk ids derive from it
 * @param fileName original file name, used in citations
 * @param reportingPeriod fiscal period the report covers, or {@code null} when unknown
 * @param pages extracted pages; sorted by page number on construction
 */
public record ExtractedDocument(
    String documentId, String fileName, FiscalPeriod reportingPeriod, List<ExtractedPage> pages) {

  public ExtractedDocument {
    pages =
        pages == null
            ? List.of()
            : pages.stream().sorted(Comparator.comparingInt(ExtractedPage::pageNumber)).toList();
  }
}
