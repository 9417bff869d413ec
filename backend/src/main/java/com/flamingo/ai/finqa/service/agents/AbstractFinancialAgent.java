package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.FinancialMetric;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.Citation;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.AgentParseException;
import com.flamingo.ai.finqa.exception.CallInterruptedException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import com.flamingo.ai.finqa.service.retrieval.RetrievalResult;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for agents that read figures from retrieved statement tables.
 *
 * <p>Provides hop-level retrieval: a first attempt is narrowed to the statement where the line
 * item is reported, retries run with the sub-query's (relaxed) filters only.
 */
public abstract class AbstractFinancialAgent implements SpecializedAgent {

  /** Confidence multiplier applied when a computed figure falls outside its plausible range. */
  protected static final double IMPLAUSIBLE_FACTOR = 0.5;

  protected final RetrievalGateway retrievalGateway;
  protected final TableValueExtractor valueExtractor;
  protected final FinancialCalculator calculator;
  protected final FinQaConfig config;

  protected AbstractFinancialAgent(
      RetrievalGateway retrievalGateway,
      TableValueExtractor valueExtractor,
      FinancialCalculator calculator,
      FinQaConfig config) {
    this.retrievalGateway = retrievalGateway;
    this.valueExtractor = valueExtractor;
    this.calculator = calculator;
    this.config = config;
  }

  /**
   * Retrieves passages for one line item and reads its value.
   *
   * @param subQuery the sub-query being answered
   * @param metric line item to read
   * @param period column to read, or {@code null} for the latest period
   * @param filters filters for this hop
   * @return the hop, missing when retrieval found nothing
   * @throws AgentParseException when passages were found but none holds a readable value
   * @throws CallInterruptedException when the sub-query was cancelled between hops
   */
  protected Hop resolve(
      SubQuery subQuery, FinancialMetric metric, FiscalPeriod period, RetrievalFilters filters) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CallInterruptedException(CollaboratorGuard.VECTOR_INDEX);
    }
    String query =
        metric.getLabel()
            + " "
            + metric.getStatementType().getDisplayName()
            + (period != null ? " " + period.label() : "");
    RetrievalResult result =
        retrievalGateway.search(query, filters, config.getRetrieval().getDefaultTopK());
    if (!result.hasCandidates()) {
      return Hop.missing(result.evidenceGap(), "no passages found for " + describe(metric, period));
    }
    for (RetrievalCandidate candidate : result.candidates()) {
      Optional<MetricValue> value = valueExtractor.find(candidate.chunk(), metric, period);
      if (value.isPresent()) {
        return new Hop(value.get(), candidate.score(), null, null);
      }
    }
    throw new AgentParseException(
        "could not read "
            + describe(metric, period)
            + " from "
            + result.candidates().size()
            + " retrieved passage(s) for sub-query "
            + subQuery.id());
  }

  /** First attempts are narrowed to the statement the line item belongs to. */
  protected RetrievalFilters hopFilters(SubQuery subQuery, StatementType statement) {
    RetrievalFilters filters = subQuery.filters();
    if (subQuery.isRetry() || !filters.statementTypes().isEmpty()) {
      return filters;
    }
    return filters.withStatementTypes(Set.of(statement));
  }

  protected static List<Citation> citations(List<Chunk> chunks) {
    return chunks.stream().distinct().map(Citation::of).toList();
  }

  protected static String describe(FinancialMetric metric, FiscalPeriod period) {
    return metric.getLabel() + (period != null ? " (" + period.label() + ")" : "");
  }

  protected static String capitalize(String text) {
    return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
  }

  protected static PartialAnswer insufficient(SubQuery subQuery, Hop hop) {
    return PartialAnswer.insufficient(subQuery, hop.gap(), hop.explanation());
  }

  /**
   * Outcome of one retrieval hop.
   *
   * @param value the value read, or {@code null} when missing
   * @param score similarity of the chunk the value was read from
   * @param gap why the hop failed, or {@code null}
   * @param explanation failure explanation, or {@code null}
   */
  protected record Hop(MetricValue value, double score, EvidenceGap gap, String explanation) {

    static Hop missing(EvidenceGap gap, String explanation) {
      return new Hop(null, 0.0, gap, explanation);
    }

    boolean found() {
      return value != null;
    }
  }
}
