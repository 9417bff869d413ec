package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.IngestionStatus;

/**
 * Result of ingesting one document.
 *
 * @param documentId the ingested document
 * @param status indexed or failed
 * @param chunksIndexed number of chunks pushed to the index
 * @param extractionGap whether boundary detection found no structural cues
 * @param ingestionCount how many times this document has been ingested by this process
 * @param message failure message, or {@code null}
 */
public record IngestionResult(
    String documentId,
    IngestionStatus status,
    int chunksIndexed,
    boolean extractionGap,
    int ingestionCount,
    String message) {

  public static IngestionResult failed(String documentId, String message) {
    return new IngestionResult(documentId, IngestionStatus.FAILED, 0, false, 0, message);
  }
}
