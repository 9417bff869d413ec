package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.FinancialMetric;
import com.flamingo.ai.finqa.domain.enums.FinancialRatio;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.AgentParseException;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes a financial ratio in two sequential retrieval hops: numerator first, then
 * denominator. The ratio is checked against its plausible range; an implausible value halves the
 * confidence.
 */
@Service
@Slf4j
public class CalculationAgent extends AbstractFinancialAgent {

  public CalculationAgent(
      RetrievalGateway retrievalGateway,
      TableValueExtractor valueExtractor,
      FinancialCalculator calculator,
      FinQaConfig config) {
    super(retrievalGateway, valueExtractor, calculator, config);
  }

  @Override
  public TaskCategory category() {
    return TaskCategory.CALCULATION;
  }

  @Override
  public PartialAnswer answer(SubQuery subQuery) {
    Optional<FinancialRatio> detected = FinancialRatio.detect(subQuery.question());
    if (detected.isEmpty()) {
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.AGENT_PARSE_FAILURE, "no supported ratio is named in the question");
    }
    FinancialRatio ratio = detected.get();
    List<FiscalPeriod> periods = subQuery.periods();
    FiscalPeriod period = periods.isEmpty() ? null : periods.get(periods.size() - 1);

    try {
      Hop numerator = hop(subQuery, ratio.getNumerator(), period);
      if (!numerator.found()) {
        return insufficient(subQuery, numerator);
      }
      Hop denominator = hop(subQuery, ratio.getDenominator(), period);
      if (!denominator.found()) {
        return insufficient(subQuery, denominator);
      }
      return compose(subQuery, ratio, period, numerator, denominator);
    } catch (AgentParseException e) {
      log.debug("Calculation agent could not parse evidence: {}", e.getMessage());
      return PartialAnswer.insufficient(subQuery, EvidenceGap.AGENT_PARSE_FAILURE, e.getMessage());
    }
  }

  private Hop hop(SubQuery subQuery, FinancialMetric metric, FiscalPeriod period) {
    return resolve(subQuery, metric, period, hopFilters(subQuery, metric.getStatementType()));
  }

  private PartialAnswer compose(
      SubQuery subQuery,
      FinancialRatio ratio,
      FiscalPeriod period,
      Hop numerator,
      Hop denominator) {
    double top = numerator.value().value();
    double bottom = denominator.value().value();
    OptionalDouble computed = calculator.ratio(top, bottom, ratio.isPercentage());
    if (computed.isEmpty()) {
      return PartialAnswer.insufficient(
          subQuery,
          EvidenceGap.AGENT_PARSE_FAILURE,
          capitalize(ratio.getDenominator().getLabel()) + " is zero");
    }
    double value = computed.getAsDouble();
    boolean plausible = ratio.isPlausible(value);
    double confidence =
        Math.min(numerator.score(), denominator.score()) * (plausible ? 1.0 : IMPLAUSIBLE_FACTOR);

    String formatted = FinancialCalculator.format(value) + (ratio.isPercentage() ? "%" : "x");
    String text =
        String.format(
            "%s%s: %s (%s %s / %s %s).",
            ratio.getDisplayName(),
            period != null ? " for " + period.label() : "",
            formatted,
            ratio.getNumerator().getLabel(),
            FinancialCalculator.format(top),
            ratio.getDenominator().getLabel(),
            FinancialCalculator.format(bottom));
    String explanation =
        plausible
            ? "computed from two statement line items"
            : "computed value " + formatted + " is outside the plausible range";
    if (!plausible) {
      log.warn("Implausible {} computed for sub-query {}: {}", ratio, subQuery.id(), formatted);
    }
    return new PartialAnswer(
        subQuery.id(),
        category(),
        text,
        value,
        citations(List.of(numerator.value().source(), denominator.value().source())),
        confidence,
        null,
        explanation);
  }
}
