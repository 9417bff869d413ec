package com.flamingo.ai.finqa.service.retrieval;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for semantic search over indexed chunks.
 *
 * <p>Embeds the query, asks the {@link ChunkIndex} for nearest neighbours and drops candidates
 * below the similarity floor or failing the filters. Never throws for collaborator failures: they
 * are reported as {@link RetrievalStatus#UNAVAILABLE}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalGateway {

  private final EmbeddingService embeddingService;
  private final ChunkIndex chunkIndex;
  private final CollaboratorGuard guard;
  private final FinQaConfig config;
  private final MeterRegistry meterRegistry;
  private final ReentrantLock collaboratorLock = new ReentrantLock();

  /** Ranked candidates only; empty on no match or collaborator failure. */
  public List<RetrievalCandidate> retrieve(String queryText, RetrievalFilters filters, int topK) {
    return search(queryText, filters, topK).candidates();
  }

  @Timed(value = "retrieval.search", description = "Time for a filtered semantic search")
  public RetrievalResult search(String queryText, RetrievalFilters filters, int topK) {
    RetrievalFilters applied = filters == null ? RetrievalFilters.none() : filters;
    if (queryText == null || queryText.isBlank()) {
      return RetrievalResult.empty(applied);
    }
    FinQaConfig.Retrieval settings = config.getRetrieval();
    int k = Math.max(1, Math.min(topK, settings.getMaxTopK()));

    List<ScoredChunk> hits;
    boolean serialize = settings.isSerializeCalls();
    if (serialize) {
      collaboratorLock.lock();
    }
    try {
      List<Float> embedding = embeddingService.embedQuery(queryText);
      hits =
          guard.call(
              CollaboratorGuard.VECTOR_INDEX, () -> chunkIndex.search(embedding, applied, k));
    } catch (CollaboratorUnavailableException e) {
      log.warn("Retrieval unavailable for query '{}': {}", abbreviate(queryText), e.getMessage());
      meterRegistry.counter("retrieval.unavailable").increment();
      return RetrievalResult.unavailable(applied);
    } finally {
      if (serialize) {
        collaboratorLock.unlock();
      }
    }

    double floor = settings.getSimilarityFloor();
    List<RetrievalCandidate> candidates =
        hits.stream()
            .filter(hit -> hit.score() >= floor)
            .filter(hit -> applied.matches(hit.chunk().documentId(), hit.chunk().metadata()))
            .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
            .limit(k)
            .map(hit -> new RetrievalCandidate(hit.chunk().id(), hit.score(), applied, hit.chunk()))
            .toList();

    log.debug(
        "Retrieved {} of {} hits for '{}' (topK={}, filters={})",
        candidates.size(),
        hits.size(),
        abbreviate(queryText),
        k,
        applied);
    if (candidates.isEmpty()) {
      meterRegistry.counter("retrieval.empty").increment();
      return RetrievalResult.empty(applied);
    }
    return new RetrievalResult(candidates, RetrievalStatus.OK, applied);
  }

  private static String abbreviate(String text) {
    return text.length() > 80 ? text.substring(0, 80) + "..." : text;
  }
}
