package com.flamingo.ai.finqa.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Line items the agents know how to locate in statement tables.
 *
 * <p>Aliases are matched case-insensitively against question text and table row labels; longer
 * aliases are listed first so that "total operating income" wins over "operating income".
 */
public enum FinancialMetric {
  NET_INCOME(
      "net income",
      StatementType.INCOME_STATEMENT,
      List.of(
          "net income",
          "net profit",
          "profit for the year",
          "profit for the period",
          "net earnings",
          "profit attributable")),
  REVENUE(
      "revenue",
      StatementType.INCOME_STATEMENT,
      List.of("total operating income", "total revenue", "total income", "revenue", "net sales")),
  OPERATING_EXPENSES(
      "operating expenses",
      StatementType.INCOME_STATEMENT,
      List.of("total operating expenses", "operating expenses", "general and administrative")),
  NET_INTEREST_INCOME(
      "net interest income", StatementType.INCOME_STATEMENT, List.of("net interest income")),
  TOTAL_ASSETS("total assets", StatementType.BALANCE_SHEET, List.of("total assets")),
  TOTAL_LIABILITIES(
      "total liabilities", StatementType.BALANCE_SHEET, List.of("total liabilities")),
  TOTAL_EQUITY(
      "total equity",
      StatementType.BALANCE_SHEET,
      List.of(
          "total shareholders' equity",
          "total shareholders equity",
          "shareholders' equity",
          "shareholders equity",
          "total equity")),
  CURRENT_ASSETS(
      "current assets",
      StatementType.BALANCE_SHEET,
      List.of("total current assets", "current assets")),
  CURRENT_LIABILITIES(
      "current liabilities",
      StatementType.BALANCE_SHEET,
      List.of("total current liabilities", "current liabilities")),
  TOTAL_LOANS(
      "total loans",
      StatementType.BALANCE_SHEET,
      List.of("loans and advances", "total loans", "net loans")),
  TOTAL_DEPOSITS(
      "total deposits",
      StatementType.BALANCE_SHEET,
      List.of("customer deposits", "customers' deposits", "total deposits")),
  OPERATING_CASH_FLOW(
      "operating cash flow",
      StatementType.CASH_FLOW,
      List.of(
          "net cash from operating activities",
          "net cash generated from operating activities",
          "cash flows from operating activities",
          "operating cash flow"));

  private final String label;
  private final StatementType statementType;
  private final List<String> aliases;

  FinancialMetric(String label, StatementType statementType, List<String> aliases) {
    this.label = label;
    this.statementType = statementType;
    this.aliases = aliases;
  }

  public String getLabel() {
    return label;
  }

  /** Statement where this line item is normally reported. */
  public StatementType getStatementType() {
    return statementType;
  }

  public List<String> getAliases() {
    return aliases;
  }

  /** Whether the given text (question or row label) names this metric. */
  public boolean matches(String text) {
    if (text == null) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return aliases.stream().anyMatch(lower::contains);
  }

  /**
   * Finds the metric named in the text. When several match, the one whose alias appears first in
   * the text is returned.
   */
  public static Optional<FinancialMetric> detect(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    FinancialMetric best = null;
    int bestIndex = Integer.MAX_VALUE;
    for (FinancialMetric metric : values()) {
      for (String alias : metric.aliases) {
        int index = lower.indexOf(alias);
        if (index >= 0 && index < bestIndex) {
          best = metric;
          bestIndex = index;
        }
      }
    }
    return Optional.ofNullable(best);
  }
}
