package com.flamingo.ai.finqa.domain.model;

/**
 * Reference from an answer back to the chunk that supports it.
 *
 * @param chunkId supporting chunk
 * @param documentId document the chunk came from
 * @param pageStart first page of the chunk
 * @param pageEnd last page of the chunk
 */
public record Citation(String chunkId, String documentId, int pageStart, int pageEnd) {

  public static Citation of(Chunk chunk) {
    return new Citation(
        chunk.id(),
        chunk.documentId(),
        chunk.metadata().pageStart(),
        chunk.metadata().pageEnd());
  }

  /** e.g. {@code annual-2023, p. 4-5}. */
  public String describe() {
    String pages = pageStart == pageEnd ? "p. " + pageStart : "p. " + pageStart + "-" + pageEnd;
    return documentId + ", " + pages;
  }
}
