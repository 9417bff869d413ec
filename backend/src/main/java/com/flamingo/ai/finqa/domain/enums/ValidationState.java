package com.flamingo.ai.finqa.domain.enums;

/** States of the per-question validation state machine. */
public enum ValidationState {
  GATHERING,
  VALIDATING,
  COMPOSED,
  DEGRADED;

  public boolean isTerminal() {
    return this == COMPOSED || this == DEGRADED;
  }
}
