package com.flamingo.ai.finqa.service.routing;

import com.flamingo.ai.finqa.domain.enums.FinancialRatio;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Deterministic keyword rules mapping a question to task categories. Returns an empty set when no
 * rule fires; {@link TaskCategory#GENERAL} is never produced here.
 */
@Component
@RequiredArgsConstructor
public class KeywordTaskClassifier {

  private static final Pattern CALCULATION =
      wordPattern(
          List.of(
              "ratio",
              "ratios",
              "calculate",
              "calculation",
              "compute",
              "margin",
              "return on",
              "roe",
              "roa",
              "cost-to-income",
              "loan-to-deposit",
              "debt-to-equity"));

  private static final Pattern TEMPORAL =
      wordPattern(
          List.of(
              "yoy",
              "year-over-year",
              "year over year",
              "year-on-year",
              "compared to",
              "compared with",
              "compare",
              "versus",
              "vs",
              "change in",
              "changed",
              "growth",
              "grow",
              "grew",
              "trend",
              "increase",
              "increased",
              "decrease",
              "decreased"));

  private static final Pattern RISK =
      wordPattern(
          List.of(
              "risk",
              "risks",
              "uncertainty",
              "uncertainties",
              "exposure",
              "exposures",
              "challenge",
              "challenges",
              "threat",
              "threats",
              "headwinds"));

  private final FiscalPeriodParser periodParser;

  public Set<TaskCategory> classify(String question) {
    Set<TaskCategory> categories = EnumSet.noneOf(TaskCategory.class);
    if (question == null || question.isBlank()) {
      return categories;
    }
    if (CALCULATION.matcher(question).find() || FinancialRatio.detect(question).isPresent()) {
      categories.add(TaskCategory.CALCULATION);
    }
    // two distinct years imply a comparison even without a comparison keyword
    if (TEMPORAL.matcher(question).find() || periodParser.parseYears(question).size() > 1) {
      categories.add(TaskCategory.TEMPORAL_COMPARISON);
    }
    if (RISK.matcher(question).find()) {
      categories.add(TaskCategory.RISK_EXTRACTION);
    }
    return categories;
  }

  private static Pattern wordPattern(List<String> keywords) {
    String alternatives = String.join("|", keywords.stream().map(Pattern::quote).toList());
    return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
  }
}
