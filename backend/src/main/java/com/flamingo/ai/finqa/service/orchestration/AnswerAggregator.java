package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.agent.AnswerSynthesisAgent;
import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.AggregationPolicy;
import com.flamingo.ai.finqa.domain.enums.AnswerStatus;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.model.Citation;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Combines validated partial answers into the {@link FinalAnswer}.
 *
 * <p>When two or more agents found evidence, the language model merges their findings into one
 * answer. Without it, or when it fails, the answer lists each agent's text under its category.
 * Caveats are appended either way.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnswerAggregator {

  static final String BELOW_THRESHOLD = "confidence stayed below the required threshold";

  private final AnswerSynthesisAgent synthesisAgent;
  private final CollaboratorGuard guard;
  private final FinQaConfig config;

  public FinalAnswer aggregate(
      String question, ValidationOutcome outcome, ValidationPolicy policy) {
    List<PartialAnswer> partials =
        outcome.outcomes().stream().map(SubQueryOutcome::partial).toList();

    Map<String, Citation> citations = new LinkedHashMap<>();
    for (PartialAnswer partial : partials) {
      partial.citations().forEach(c -> citations.putIfAbsent(c.chunkId(), c));
    }

    List<String> caveats =
        outcome.status() == AnswerStatus.DEGRADED ? caveats(outcome, policy) : List.of();

    return new FinalAnswer(
        compose(question, partials, caveats),
        confidence(partials, policy.aggregation()),
        new ArrayList<>(citations.values()),
        outcome.status(),
        outcome.retryCount(),
        caveats,
        partials);
  }

  private static double confidence(List<PartialAnswer> partials, AggregationPolicy aggregation) {
    if (partials.isEmpty()) {
      return 0.0;
    }
    if (aggregation == AggregationPolicy.WEIGHTED_AVERAGE) {
      double weighted = 0.0;
      double weights = 0.0;
      for (PartialAnswer partial : partials) {
        double weight = Math.max(1, partial.citations().size());
        weighted += partial.confidence() * weight;
        weights += weight;
      }
      return weighted / weights;
    }
    return partials.stream().mapToDouble(PartialAnswer::confidence).min().orElse(0.0);
  }

  private static List<String> caveats(ValidationOutcome outcome, ValidationPolicy policy) {
    Set<String> caveats = new LinkedHashSet<>();
    for (SubQueryOutcome o : outcome.outcomes()) {
      PartialAnswer partial = o.partial();
      if (partial.meets(policy.confidenceThreshold()) && !o.timedOut()) {
        continue;
      }
      EvidenceGap gap = o.timedOut() ? EvidenceGap.TIMEOUT : partial.gap();
      caveats.add(
          "Insufficient evidence for "
              + partial.category().getDisplayName().toLowerCase(Locale.ROOT)
              + ": "
              + (gap != null ? gap.getDescription() : BELOW_THRESHOLD));
    }
    return new ArrayList<>(caveats);
  }

  private String compose(String question, List<PartialAnswer> partials, List<String> caveats) {
    StringBuilder text = new StringBuilder(synthesize(question, partials).orElse(""));
    if (text.length() == 0) {
      text.append(sections(partials));
    }
    if (!caveats.isEmpty()) {
      text.append("\n\nCaveats:");
      caveats.forEach(caveat -> text.append("\n- ").append(caveat));
    }
    return text.toString();
  }

  private Optional<String> synthesize(String question, List<PartialAnswer> partials) {
    List<PartialAnswer> answered = partials.stream().filter(p -> p.gap() == null).toList();
    if (!config.getAgents().isSynthesizeAnswers() || answered.size() < 2) {
      return Optional.empty();
    }
    try {
      String merged =
          guard.call(
              CollaboratorGuard.LANGUAGE_MODEL,
              () -> synthesisAgent.synthesize(question, sections(answered)));
      if (merged == null || merged.isBlank()) {
        log.warn("Answer synthesis returned nothing, listing {} parts", answered.size());
        return Optional.empty();
      }
      return Optional.of(merged.strip());
    } catch (CollaboratorUnavailableException e) {
      log.warn(
          "Answer synthesis unavailable, listing {} parts: {}", answered.size(), e.getMessage());
      return Optional.empty();
    }
  }

  private static String sections(List<PartialAnswer> partials) {
    if (partials.size() == 1) {
      return partials.get(0).text();
    }
    StringBuilder text = new StringBuilder();
    for (PartialAnswer partial : partials) {
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append(partial.category().getDisplayName()).append(": ").append(partial.text());
    }
    return text.toString();
  }
}
