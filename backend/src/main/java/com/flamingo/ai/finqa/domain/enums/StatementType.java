package com.flamingo.ai.finqa.domain.enums;

/** Financial statement (or report section) a piece of content belongs to. */
public enum StatementType {
  INCOME_STATEMENT("Income statement"),
  BALANCE_SHEET("Balance sheet"),
  CASH_FLOW("Cash flow statement"),
  NOTES("Notes to the financial statements"),
  RISK_MANAGEMENT("Risk management"),
  MANAGEMENT_COMMENTARY("Management commentary"),
  UNCLASSIFIED("Unclassified");

  private final String displayName;

  StatementType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
