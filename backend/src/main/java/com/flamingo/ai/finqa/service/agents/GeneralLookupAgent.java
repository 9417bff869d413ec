package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.agent.EvidenceDraftingAgent;
import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.Citation;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import com.flamingo.ai.finqa.service.retrieval.RetrievalGateway;
import com.flamingo.ai.finqa.service.retrieval.RetrievalResult;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default agent: drafts an answer from the best passages with the language model. When the model
 * is unavailable it falls back to quoting the best passage, at half the confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralLookupAgent implements SpecializedAgent {

  static final String INSUFFICIENT_MARKER = "INSUFFICIENT_EVIDENCE";
  private static final double EXTRACTIVE_FACTOR = 0.5;
  private static final int EXTRACTIVE_SENTENCES = 2;
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

  private final RetrievalGateway retrievalGateway;
  private final EvidenceDraftingAgent draftingAgent;
  private final CollaboratorGuard guard;
  private final FinQaConfig config;

  @Override
  public TaskCategory category() {
    return TaskCategory.GENERAL;
  }

  @Override
  public PartialAnswer answer(SubQuery subQuery) {
    RetrievalResult result =
        retrievalGateway.search(
            subQuery.question(), subQuery.filters(), config.getRetrieval().getDefaultTopK());
    if (!result.hasCandidates()) {
      return PartialAnswer.insufficient(
          subQuery, result.evidenceGap(), "no relevant passages found");
    }
    List<RetrievalCandidate> evidence =
        result.candidates().stream().limit(config.getAgents().getMaxEvidenceChunks()).toList();
    List<Citation> citations = evidence.stream().map(c -> Citation.of(c.chunk())).toList();
    RetrievalCandidate best = evidence.get(0);

    String draft;
    try {
      draft =
          guard.call(
              CollaboratorGuard.LANGUAGE_MODEL,
              () ->
                  draftingAgent.draftAnswer(
                      subQuery.question(), subQuery.instruction(), formatEvidence(evidence)));
    } catch (CollaboratorUnavailableException e) {
      log.warn("Drafting unavailable for sub-query {}, answering extractively", subQuery.id());
      return new PartialAnswer(
          subQuery.id(),
          category(),
          extract(best),
          null,
          List.of(Citation.of(best.chunk())),
          best.score() * EXTRACTIVE_FACTOR,
          EvidenceGap.COLLABORATOR_UNAVAILABLE,
          "language model unavailable; quoted the most similar passage");
    }

    if (draft == null || draft.isBlank() || draft.contains(INSUFFICIENT_MARKER)) {
      return PartialAnswer.insufficient(
          subQuery,
          EvidenceGap.AGENT_PARSE_FAILURE,
          "retrieved passages do not answer the question");
    }
    return new PartialAnswer(
        subQuery.id(),
        category(),
        draft.strip(),
        null,
        citations,
        best.score(),
        null,
        "drafted from " + evidence.size() + " passage(s)");
  }

  private static String formatEvidence(List<RetrievalCandidate> evidence) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < evidence.size(); i++) {
      RetrievalCandidate candidate = evidence.get(i);
      sb.append('[')
          .append(i + 1)
          .append("] (")
          .append(Citation.of(candidate.chunk()).describe())
          .append(")\n")
          .append(candidate.chunk().content())
          .append("\n\n");
    }
    return sb.toString().strip();
  }

  private static String extract(RetrievalCandidate candidate) {
    String[] sentences = SENTENCE_END.split(candidate.chunk().content().strip());
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < Math.min(EXTRACTIVE_SENTENCES, sentences.length); i++) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(sentences[i].strip());
    }
    return sb.toString();
  }
}
