package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.config.FinQaConfig;

/**
 * Target chunk size range in estimated tokens.
 *
 * @param lower chunks smaller than this are merged with a neighbour when allowed
 * @param upper narrative is split before exceeding this; tables above it are split by row groups
 */
public record ChunkingBounds(int lower, int upper) {

  public ChunkingBounds {
    if (lower < 1 || upper < lower) {
      throw new IllegalArgumentException(
          "Invalid chunking bounds [" + lower + ", " + upper + "]");
    }
  }

  public static ChunkingBounds from(FinQaConfig.Chunking chunking) {
    return new ChunkingBounds(chunking.getLowerTokens(), chunking.getUpperTokens());
  }
}
