package com.flamingo.ai.finqa.service.retrieval;

import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import java.util.List;

/** Vector index holding chunks and their embeddings. */
public interface ChunkIndex {

  /**
   * Stores chunks with their embeddings. Chunks are keyed by id, so indexing a chunk again
   * replaces it.
   *
   * @param chunks chunks to store
   * @param embeddings one embedding per chunk, in the same order
   */
  void index(List<Chunk> chunks, List<List<Float>> embeddings);

  /** Removes every chunk of a document. */
  void deleteByDocumentId(String documentId);

  /**
   * Nearest-neighbour search restricted by metadata filters.
   *
   * @param queryEmbedding query vector
   * @param filters metadata constraints
   * @param topK maximum number of hits
   * @return hits ordered by descending similarity, scores in [0, 1]
   */
  List<ScoredChunk> search(List<Float> queryEmbedding, RetrievalFilters filters, int topK);
}
