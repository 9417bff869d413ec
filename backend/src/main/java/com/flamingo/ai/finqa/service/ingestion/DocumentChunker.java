package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.domain.model.Boundary;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import java.util.List;

/**
 * Splits an {@link ExtractedDocument} into {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use, and must produce the same
 * chunks (ids included) for the same input.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the extracted document.
   *
   * @param document the extracted document
   * @param boundaries boundaries detected in the document, ordered by position
   * @param bounds target chunk size range in tokens
   * @return ordered list of chunks
   */
  List<Chunk> chunk(ExtractedDocument document, List<Boundary> boundaries, ChunkingBounds bounds);
}
