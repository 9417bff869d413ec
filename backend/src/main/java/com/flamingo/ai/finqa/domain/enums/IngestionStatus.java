package com.flamingo.ai.finqa.domain.enums;

/** Outcome of ingesting one document. */
public enum IngestionStatus {
  INDEXED,
  FAILED
}
