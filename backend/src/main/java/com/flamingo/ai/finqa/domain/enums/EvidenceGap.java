package com.flamingo.ai.finqa.domain.enums;

/** Recoverable failure categories that lower confidence instead of aborting a request. */
public enum EvidenceGap {
  EXTRACTION_GAP("no structural cues were detected in the source document"),
  RETRIEVAL_EMPTY("no sufficiently similar report passages were found"),
  AGENT_PARSE_FAILURE("the required figures or statements could not be read from the passages"),
  COLLABORATOR_UNAVAILABLE("a backing model or search service is unavailable"),
  TIMEOUT("the question timed out before this part was answered");

  private final String description;

  EvidenceGap(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
