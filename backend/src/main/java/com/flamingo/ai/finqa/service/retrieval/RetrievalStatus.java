package com.flamingo.ai.finqa.service.retrieval;

/** Outcome of a retrieval call. */
public enum RetrievalStatus {
  OK,
  /** No chunk passed the similarity floor and the filters. */
  EMPTY,
  /** The embedding model or the index stayed unavailable after retries. */
  UNAVAILABLE
}
