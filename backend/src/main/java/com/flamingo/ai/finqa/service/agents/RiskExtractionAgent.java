package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.agent.EvidenceDraftingAgent;
import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.ChunkKind;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.RiskCategory;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.Citation;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import com.flamingo.ai.finqa.service.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts qualitative risk statements from narrative passages, grouped by risk category, plus
 * the mitigation measures the report mentions. Optionally asks the language model for a short
 * summary on top of the extracted statements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskExtractionAgent implements SpecializedAgent {

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final List<String> MITIGATION_KEYWORDS =
      List.of(
          "mitigat",
          "hedg",
          "collateral",
          "diversif",
          "stress test",
          "risk appetite",
          "monitor",
          "limits");
  private static final int MAX_STATEMENTS_PER_CATEGORY = 3;
  private static final double SINGLE_STATEMENT_FACTOR = 0.8;

  private final RetrievalGateway retrievalGateway;
  private final EvidenceDraftingAgent draftingAgent;
  private final CollaboratorGuard guard;
  private final FinQaConfig config;

  @Override
  public TaskCategory category() {
    return TaskCategory.RISK_EXTRACTION;
  }

  @Override
  public PartialAnswer answer(SubQuery subQuery) {
    RetrievalFilters filters = subQuery.filters();
    if (!subQuery.isRetry() && filters.chunkKinds().isEmpty()) {
      filters = filters.withChunkKinds(Set.of(ChunkKind.NARRATIVE, ChunkKind.MIXED));
    }
    RetrievalResult result =
        retrievalGateway.search(
            subQuery.question(), filters, config.getRetrieval().getDefaultTopK());
    if (!result.hasCandidates()) {
      return PartialAnswer.insufficient(
          subQuery, result.evidenceGap(), "no narrative passages found on risk");
    }

    Optional<RiskCategory> focus = RiskCategory.classify(subQuery.question());
    Map<RiskCategory, Set<String>> statements = new EnumMap<>(RiskCategory.class);
    Set<String> mitigations = new LinkedHashSet<>();
    Map<Chunk, Double> supporting = new LinkedHashMap<>();

    for (RetrievalCandidate candidate : result.candidates()) {
      for (String sentence : sentences(candidate.chunk().content())) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        if (MITIGATION_KEYWORDS.stream().anyMatch(lower::contains)) {
          if (mitigations.add(sentence)) {
            supporting.putIfAbsent(candidate.chunk(), candidate.score());
          }
          continue;
        }
        Optional<RiskCategory> category = RiskCategory.classify(sentence);
        if (category.isEmpty() || (focus.isPresent() && focus.get() != category.get())) {
          continue;
        }
        Set<String> bucket =
            statements.computeIfAbsent(category.get(), c -> new LinkedHashSet<>());
        if (bucket.size() < MAX_STATEMENTS_PER_CATEGORY && bucket.add(sentence)) {
          supporting.putIfAbsent(candidate.chunk(), candidate.score());
        }
      }
    }

    if (statements.isEmpty()) {
      return PartialAnswer.insufficient(
          subQuery,
          EvidenceGap.AGENT_PARSE_FAILURE,
          "no risk statements found in " + result.candidates().size() + " passage(s)");
    }

    String extracted = render(statements, mitigations);
    int statementCount = statements.values().stream().mapToInt(Set::size).sum();
    double similarity =
        supporting.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    double confidence = similarity * (statementCount > 1 ? 1.0 : SINGLE_STATEMENT_FACTOR);
    List<Citation> citations = supporting.keySet().stream().map(Citation::of).toList();

    return new PartialAnswer(
        subQuery.id(),
        category(),
        summarize(subQuery, extracted),
        null,
        citations,
        confidence,
        null,
        "extracted " + statementCount + " statement(s) in " + statements.size() + " categories");
  }

  private String summarize(SubQuery subQuery, String extracted) {
    if (!config.getAgents().isDraftRiskSummaries()) {
      return extracted;
    }
    try {
      String summary =
          guard.call(
              CollaboratorGuard.LANGUAGE_MODEL,
              () ->
                  draftingAgent.draftAnswer(
                      subQuery.question(), subQuery.instruction(), extracted));
      if (summary == null || summary.isBlank()) {
        return extracted;
      }
      return summary.strip() + "\n\n" + extracted;
    } catch (CollaboratorUnavailableException e) {
      log.warn("Risk summary unavailable, returning extracted statements: {}", e.getMessage());
      return extracted;
    }
  }

  private static String render(Map<RiskCategory, Set<String>> statements, Set<String> mitigations) {
    StringBuilder sb = new StringBuilder();
    statements.forEach(
        (category, sentences) -> {
          sb.append(category.getDisplayName()).append(":\n");
          sentences.forEach(sentence -> sb.append("- ").append(sentence).append('\n'));
        });
    if (!mitigations.isEmpty()) {
      sb.append("Mitigation:\n");
      mitigations.stream()
          .limit(MAX_STATEMENTS_PER_CATEGORY)
          .forEach(sentence -> sb.append("- ").append(sentence).append('\n'));
    }
    return sb.toString().strip();
  }

  private static List<String> sentences(String content) {
    List<String> sentences = new ArrayList<>();
    for (String line : content.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("|")) {
        continue;
      }
      for (String sentence : SENTENCE_END.split(trimmed)) {
        if (!sentence.isBlank()) {
          sentences.add(sentence.strip());
        }
      }
    }
    return sentences;
  }
}
