package com.flamingo.ai.finqa.domain.enums;

/** Task category a question (or part of it) is routed to. */
public enum TaskCategory {
  CALCULATION(
      "Calculation",
      "Compute the requested financial ratio from line items of the financial statements."),
  TEMPORAL_COMPARISON(
      "Temporal comparison",
      "Compare the requested metric across fiscal periods and report the change."),
  RISK_EXTRACTION(
      "Risk extraction", "Extract the qualitative risk statements relevant to the question."),
  GENERAL("General lookup", "Answer the question from the most relevant report passages.");

  private final String displayName;
  private final String instruction;

  TaskCategory(String displayName, String instruction) {
    this.displayName = displayName;
    this.instruction = instruction;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Category-specific instruction attached to every sub-query of this category. */
  public String getInstruction() {
    return instruction;
  }
}
