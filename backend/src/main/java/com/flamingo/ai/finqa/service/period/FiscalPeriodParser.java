package com.flamingo.ai.finqa.service.period;

import com.flamingo.ai.finqa.domain.enums.Quarter;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds fiscal periods mentioned in free text or table headers.
 *
 * <p>Recognised forms: {@code Q3 2023}, {@code 2023 Q3}, {@code FY2023}, {@code FY 2023}, {@code
 * 2023 annual} and bare four-digit years between 1900 and 2099. Quarter mentions take precedence
 * over the bare year they contain.
 */
@Component
public class FiscalPeriodParser {

  private static final Pattern QUARTER_FIRST =
      Pattern.compile("\\bQ([1-4])\\s*(?:FY\\s*)?((?:19|20)\\d{2})\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern YEAR_FIRST =
      Pattern.compile("\\b((?:19|20)\\d{2})\\s*Q([1-4])\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern FISCAL_YEAR =
      Pattern.compile("\\bFY\\s*'?((?:19|20)\\d{2})\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern BARE_YEAR =
      Pattern.compile("(?<![\\d.,])((?:19|20)\\d{2})(?!\\d|[.,]\\d)");

  /** Distinct periods mentioned in the text, ascending. */
  public List<FiscalPeriod> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    TreeSet<FiscalPeriod> periods = new TreeSet<>();
    StringBuilder remainder = new StringBuilder(text);

    Matcher m = QUARTER_FIRST.matcher(text);
    while (m.find()) {
      periods.add(
          new FiscalPeriod(Integer.parseInt(m.group(2)), quarter(Integer.parseInt(m.group(1)))));
      blank(remainder, m.start(), m.end());
    }
    m = YEAR_FIRST.matcher(remainder.toString());
    while (m.find()) {
      periods.add(
          new FiscalPeriod(Integer.parseInt(m.group(1)), quarter(Integer.parseInt(m.group(2)))));
      blank(remainder, m.start(), m.end());
    }
    m = FISCAL_YEAR.matcher(remainder.toString());
    while (m.find()) {
      periods.add(FiscalPeriod.annual(Integer.parseInt(m.group(1))));
      blank(remainder, m.start(), m.end());
    }
    m = BARE_YEAR.matcher(remainder.toString());
    while (m.find()) {
      periods.add(FiscalPeriod.annual(Integer.parseInt(m.group(1))));
    }
    return new ArrayList<>(periods);
  }

  /** Distinct fiscal years mentioned in the text, ascending. */
  public List<Integer> parseYears(String text) {
    return parse(text).stream().map(FiscalPeriod::year).distinct().sorted().toList();
  }

  /** Periods named by table header cells such as {@code FY2023}, ascending. */
  public List<FiscalPeriod> parseHeader(List<String> headerCells) {
    List<FiscalPeriod> periods = new ArrayList<>();
    for (String cell : headerCells) {
      periods.addAll(parse(cell));
    }
    return periods.stream().distinct().sorted().toList();
  }

  private static Quarter quarter(int number) {
    return Quarter.values()[number - 1];
  }

  private static void blank(StringBuilder text, int start, int end) {
    for (int i = start; i < end; i++) {
      text.setCharAt(i, ' ');
    }
  }
}
