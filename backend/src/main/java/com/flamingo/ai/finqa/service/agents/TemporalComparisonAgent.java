package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.FinancialMetric;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.AgentParseException;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compares one line item across fiscal periods. Retrieves once per period, each retrieval
 * restricted to that period's fiscal year (widened by one year per retry), and reports the
 * absolute and percentage change. With more than two periods the growth trend is reported too.
 */
@Service
@Slf4j
public class TemporalComparisonAgent extends AbstractFinancialAgent {

  public TemporalComparisonAgent(
      RetrievalGateway retrievalGateway,
      TableValueExtractor valueExtractor,
      FinancialCalculator calculator,
      FinQaConfig config) {
    super(retrievalGateway, valueExtractor, calculator, config);
  }

  @Override
  public TaskCategory category() {
    return TaskCategory.TEMPORAL_COMPARISON;
  }

  @Override
  public PartialAnswer answer(SubQuery subQuery) {
    Optional<FinancialMetric> detected = FinancialMetric.detect(subQuery.question());
    if (detected.isEmpty()) {
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.AGENT_PARSE_FAILURE, "no supported line item is named");
    }
    if (subQuery.periods().size() < 2) {
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.AGENT_PARSE_FAILURE, "a comparison needs two fiscal periods");
    }
    FinancialMetric metric = detected.get();

    List<Hop> hops = new ArrayList<>();
    try {
      for (FiscalPeriod period : subQuery.periods()) {
        Hop hop = resolve(subQuery, metric, period, periodFilters(subQuery, metric, period));
        if (!hop.found()) {
          return insufficient(subQuery, hop);
        }
        hops.add(hop);
      }
    } catch (AgentParseException e) {
      log.debug("Temporal agent could not parse evidence: {}", e.getMessage());
      return PartialAnswer.insufficient(subQuery, EvidenceGap.AGENT_PARSE_FAILURE, e.getMessage());
    }
    return compose(subQuery, metric, hops);
  }

  private RetrievalFilters periodFilters(
      SubQuery subQuery, FinancialMetric metric, FiscalPeriod period) {
    int widen = subQuery.attempt();
    return hopFilters(subQuery, metric.getStatementType())
        .withFiscalYears(period.year() - widen, period.year() + widen);
  }

  private PartialAnswer compose(SubQuery subQuery, FinancialMetric metric, List<Hop> hops) {
    List<FiscalPeriod> periods = subQuery.periods();
    List<Double> values = hops.stream().map(hop -> hop.value().value()).toList();
    double first = values.get(0);
    double last = values.get(values.size() - 1);
    double change = last - first;
    OptionalDouble percent = calculator.percentageChange(first, last);
    boolean plausible = percent.isEmpty() || calculator.isPlausibleChange(percent.getAsDouble());

    StringBuilder text = new StringBuilder();
    text.append(
        String.format(
            "%s %s from %s (%s) to %s (%s), a change of %s",
            capitalize(metric.getLabel()),
            change > 0 ? "rose" : change < 0 ? "fell" : "was unchanged",
            FinancialCalculator.format(first),
            periods.get(0).label(),
            FinancialCalculator.format(last),
            periods.get(periods.size() - 1).label(),
            FinancialCalculator.format(change)));
    percent.ifPresent(p -> text.append(String.format(Locale.ROOT, " (%+.2f%%)", p)));
    text.append('.');

    if (values.size() > 2) {
      FinancialCalculator.Trend trend = calculator.trend(values);
      text.append(
          String.format(
              Locale.ROOT,
              " Across %d periods the trend is %s with average growth of %.2f%% (%s).",
              values.size(),
              trend.direction(),
              trend.averageGrowth(),
              trend.growthRates().stream()
                  .map(rate -> String.format(Locale.ROOT, "%+.2f%%", rate))
                  .collect(Collectors.joining(", "))));
    }

    double similarity = hops.stream().mapToDouble(Hop::score).min().orElse(0.0);
    double confidence = similarity * (plausible ? 1.0 : IMPLAUSIBLE_FACTOR);
    List<Chunk> sources = hops.stream().map(hop -> hop.value().source()).toList();
    return new PartialAnswer(
        subQuery.id(),
        category(),
        text.toString(),
        percent.isPresent() ? percent.getAsDouble() : change,
        citations(sources),
        confidence,
        null,
        plausible
            ? "compared " + values.size() + " periods"
            : "percentage change is outside the plausible range");
  }
}
