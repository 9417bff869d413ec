package com.flamingo.ai.finqa.domain.model;

/**
 * One ranked retrieval hit. Created per query and discarded with it.
 *
 * @param chunkId id of the matching chunk
 * @param score similarity score in [0, 1]
 * @param appliedFilters filters the query ran with
 * @param chunk the matching chunk
 */
public record RetrievalCandidate(
    String chunkId, double score, RetrievalFilters appliedFilters, Chunk chunk) {}
