package com.flamingo.ai.finqa.service.retrieval;

import com.flamingo.ai.finqa.domain.model.Chunk;

/** A chunk returned by the index together with its similarity score. */
public record ScoredChunk(Chunk chunk, double score) {}
