package com.flamingo.ai.finqa.domain.enums;

/** Shape of the content carried by a chunk. */
public enum ChunkKind {
  NARRATIVE,
  TABULAR,
  MIXED
}
