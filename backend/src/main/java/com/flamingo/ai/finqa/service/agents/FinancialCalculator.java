package com.flamingo.ai.finqa.service.agents;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/** Ratio, change and trend arithmetic used by the calculation and comparison agents. */
@Component
public class FinancialCalculator {

  /** Period-over-period changes beyond this many percent are treated as implausible. */
  public static final double MAX_PLAUSIBLE_CHANGE_PERCENT = 1000.0;

  /** Numerator over denominator, times 100 for percentage ratios; empty for a zero denominator. */
  public OptionalDouble ratio(double numerator, double denominator, boolean percentage) {
    if (denominator == 0.0) {
      return OptionalDouble.empty();
    }
    double ratio = numerator / denominator;
    return OptionalDouble.of(percentage ? ratio * 100.0 : ratio);
  }

  /** Change from {@code from} to {@code to} in percent of |from|; empty when {@code from} is 0. */
  public OptionalDouble percentageChange(double from, double to) {
    if (from == 0.0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((to - from) / Math.abs(from) * 100.0);
  }

  public boolean isPlausibleChange(double percentChange) {
    return Math.abs(percentChange) <= MAX_PLAUSIBLE_CHANGE_PERCENT;
  }

  /** Growth between consecutive values, oldest first. */
  public Trend trend(List<Double> values) {
    List<Double> growthRates = new ArrayList<>();
    for (int i = 1; i < values.size(); i++) {
      percentageChange(values.get(i - 1), values.get(i)).ifPresent(growthRates::add);
    }
    double average = growthRates.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    return new Trend(growthRates, average, direction(growthRates));
  }

  public static String format(double value) {
    return String.format(Locale.ROOT, "%,.2f", value);
  }

  private static String direction(List<Double> growthRates) {
    if (growthRates.isEmpty() || growthRates.stream().allMatch(rate -> rate == 0.0)) {
      return "stable";
    }
    if (growthRates.stream().allMatch(rate -> rate > 0.0)) {
      return "increasing";
    }
    if (growthRates.stream().allMatch(rate -> rate < 0.0)) {
      return "decreasing";
    }
    return "mixed";
  }

  /**
   * Multi-period trend.
   *
   * @param growthRates percentage growth between consecutive periods
   * @param averageGrowth mean of the growth rates
   * @param direction increasing, decreasing, stable or mixed
   */
  public record Trend(List<Double> growthRates, double averageGrowth, String direction) {}
}
