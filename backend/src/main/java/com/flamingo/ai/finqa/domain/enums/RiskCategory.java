package com.flamingo.ai.finqa.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Risk categories reported by financial institutions, with the keywords that signal them. */
public enum RiskCategory {
  CREDIT(
      "Credit risk",
      List.of(
          "credit risk",
          "credit quality",
          "default",
          "non-performing",
          "impairment",
          "expected credit loss",
          "counterparty")),
  MARKET(
      "Market risk",
      List.of(
          "market risk",
          "interest rate",
          "foreign exchange",
          "currency",
          "equity price",
          "commodity",
          "volatility")),
  OPERATIONAL(
      "Operational risk",
      List.of("operational risk", "cyber", "fraud", "system failure", "business continuity")),
  LIQUIDITY(
      "Liquidity risk",
      List.of("liquidity", "funding", "deposit outflow", "refinancing", "cash reserves")),
  STRATEGIC(
      "Strategic risk",
      List.of(
          "strategic risk",
          "competition",
          "competitive",
          "regulatory",
          "geopolitical",
          "economic slowdown",
          "reputation"));

  private final String displayName;
  private final List<String> keywords;

  RiskCategory(String displayName, List<String> keywords) {
    this.displayName = displayName;
    this.keywords = keywords;
  }

  public String getDisplayName() {
    return displayName;
  }

  public List<String> getKeywords() {
    return keywords;
  }

  /** First category, in declaration order, whose keywords appear in the sentence. */
  public static Optional<RiskCategory> classify(String sentence) {
    String lower = sentence.toLowerCase(Locale.ROOT);
    for (RiskCategory category : values()) {
      if (category.keywords.stream().anyMatch(lower::contains)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
