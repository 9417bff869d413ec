package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.Quarter;
import java.util.Comparator;

/**
 * A fiscal year, optionally narrowed to a quarter.
 *
 * @param year fiscal year, e.g. 2023
 * @param quarter quarter within the year, {@link Quarter#ANNUAL} for the full year
 */
public record FiscalPeriod(int year, Quarter quarter) implements Comparable<FiscalPeriod> {

  private static final Comparator<FiscalPeriod> ORDER =
      Comparator.comparingInt(FiscalPeriod::year)
          .thenComparingInt(p -> p.quarter().getSequence());

  public FiscalPeriod {
    quarter = quarter == null ? Quarter.ANNUAL : quarter;
  }

  public static FiscalPeriod annual(int year) {
    return new FiscalPeriod(year, Quarter.ANNUAL);
  }

  public boolean isAnnual() {
    return quarter == Quarter.ANNUAL;
  }

  /** Human-readable label: {@code FY2023} or {@code Q3 2023}. */
  public String label() {
    return isAnnual() ? "FY" + year : quarter.name() + " " + year;
  }

  @Override
  public int compareTo(FiscalPeriod other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return label();
  }
}
