package com.flamingo.ai.finqa.domain.enums;

/** Terminal status of a final answer. */
public enum AnswerStatus {
  /** Every partial answer met the confidence threshold. */
  COMPOSED,
  /** Returned with a low-confidence caveat: retries exhausted, timeout, or missing evidence. */
  DEGRADED
}
