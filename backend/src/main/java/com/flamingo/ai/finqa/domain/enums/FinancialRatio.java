package com.flamingo.ai.finqa.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Ratios the calculation agent can compute, with their plausibility range. */
public enum FinancialRatio {
  RETURN_ON_EQUITY(
      "Return on equity",
      FinancialMetric.NET_INCOME,
      FinancialMetric.TOTAL_EQUITY,
      true,
      -100,
      100,
      List.of("return on equity", "roe")),
  RETURN_ON_ASSETS(
      "Return on assets",
      FinancialMetric.NET_INCOME,
      FinancialMetric.TOTAL_ASSETS,
      true,
      -100,
      100,
      List.of("return on assets", "roa")),
  NET_PROFIT_MARGIN(
      "Net profit margin",
      FinancialMetric.NET_INCOME,
      FinancialMetric.REVENUE,
      true,
      -100,
      100,
      List.of("net profit margin", "profit margin", "net margin")),
  COST_TO_INCOME(
      "Cost-to-income ratio",
      FinancialMetric.OPERATING_EXPENSES,
      FinancialMetric.REVENUE,
      true,
      0,
      200,
      List.of("cost-to-income", "cost to income", "efficiency ratio")),
  LOAN_TO_DEPOSIT(
      "Loan-to-deposit ratio",
      FinancialMetric.TOTAL_LOANS,
      FinancialMetric.TOTAL_DEPOSITS,
      true,
      0,
      200,
      List.of("loan-to-deposit", "loan to deposit", "ldr")),
  CURRENT_RATIO(
      "Current ratio",
      FinancialMetric.CURRENT_ASSETS,
      FinancialMetric.CURRENT_LIABILITIES,
      false,
      0,
      50,
      List.of("current ratio", "liquidity ratio")),
  DEBT_TO_EQUITY(
      "Debt-to-equity ratio",
      FinancialMetric.TOTAL_LIABILITIES,
      FinancialMetric.TOTAL_EQUITY,
      false,
      0,
      100,
      List.of("debt-to-equity", "debt to equity", "leverage ratio"));

  private final String displayName;
  private final FinancialMetric numerator;
  private final FinancialMetric denominator;
  private final boolean percentage;
  private final double minPlausible;
  private final double maxPlausible;
  private final List<String> aliases;

  FinancialRatio(
      String displayName,
      FinancialMetric numerator,
      FinancialMetric denominator,
      boolean percentage,
      double minPlausible,
      double maxPlausible,
      List<String> aliases) {
    this.displayName = displayName;
    this.numerator = numerator;
    this.denominator = denominator;
    this.percentage = percentage;
    this.minPlausible = minPlausible;
    this.maxPlausible = maxPlausible;
    this.aliases = aliases;
  }

  public String getDisplayName() {
    return displayName;
  }

  public FinancialMetric getNumerator() {
    return numerator;
  }

  public FinancialMetric getDenominator() {
    return denominator;
  }

  /** Whether the ratio is reported as a percentage rather than a multiple. */
  public boolean isPercentage() {
    return percentage;
  }

  public boolean isPlausible(double value) {
    return value >= minPlausible && value <= maxPlausible;
  }

  /** Finds the ratio named in a question, matching whole words only. */
  public static Optional<FinancialRatio> detect(String question) {
    if (question == null) {
      return Optional.empty();
    }
    String lower = question.toLowerCase(Locale.ROOT);
    for (FinancialRatio ratio : values()) {
      for (String alias : ratio.aliases) {
        if (Pattern.compile("\\b" + Pattern.quote(alias) + "\\b").matcher(lower).find()) {
          return Optional.of(ratio);
        }
      }
    }
    return Optional.empty();
  }
}
