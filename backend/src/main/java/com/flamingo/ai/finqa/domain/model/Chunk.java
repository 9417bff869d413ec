package com.flamingo.ai.finqa.domain.model;

/**
 * Retrieval atom produced by ingestion. Immutable; replaced only by re-ingesting its document.
 *
 * @param id {@code <documentId>_<index>}
 * @param documentId source document
 * @param index position of the chunk within its document
 * @param content narrative text and/or Markdown pipe tables
 * @param metadata structural metadata
 * @param tokenCount estimated size in tokens
 */
public record Chunk(
    String id,
    String documentId,
    int index,
    String content,
    ChunkMetadata metadata,
    int tokenCount) {

  public static String idFor(String documentId, int index) {
    return documentId + "_" + index;
  }
}
