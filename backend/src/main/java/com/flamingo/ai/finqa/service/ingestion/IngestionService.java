package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.IngestionStatus;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.ChunkMetadata;
import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.IngestionResult;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.exception.DocumentIngestionException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import com.flamingo.ai.finqa.service.retrieval.ChunkIndex;
import com.flamingo.ai.finqa.service.retrieval.EmbeddingService;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Ingestion pipeline: detect boundaries, chunk, embed, and index.
 *
 * <p>Chunk ids are deterministic, and a document's previous chunks are deleted before its new ones
 * are indexed, so ingesting the same document twice leaves the index unchanged.
 */
@Service
@Slf4j
public class IngestionService {

  private final SectionBoundaryDetector boundaryDetector;
  private final DocumentChunker chunker;
  private final EmbeddingService embeddingService;
  private final ChunkIndex chunkIndex;
  private final CollaboratorGuard collaboratorGuard;
  private final FinQaConfig config;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;

  private final Map<String, AtomicInteger> ingestionCounts = new ConcurrentHashMap<>();

  public IngestionService(
      SectionBoundaryDetector boundaryDetector,
      DocumentChunker chunker,
      EmbeddingService embeddingService,
      ChunkIndex chunkIndex,
      CollaboratorGuard collaboratorGuard,
      FinQaConfig config,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry) {
    this.boundaryDetector = boundaryDetector;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.chunkIndex = chunkIndex;
    this.collaboratorGuard = collaboratorGuard;
    this.config = config;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Ingests one document.
   *
   * @param document the extracted document
   * @return the number of chunks indexed and whether structural cues were missing
   * @throws DocumentIngestionException if the document cannot be chunked, embedded or indexed
   */
  @Timed(value = "document.ingest", description = "Time to ingest one document")
  public IngestionResult ingest(ExtractedDocument document) {
    String documentId = document.documentId();
    if (documentId == null || documentId.isBlank()) {
      throw new DocumentIngestionException(String.valueOf(documentId), "Document id is required");
    }
    try {
      BoundaryDetection detection = boundaryDetector.detect(document);
      if (detection.extractionGap()) {
        log.warn("Document {} has no structural cues, falling back to page breaks", documentId);
        meterRegistry.counter("ingestion.extraction_gaps").increment();
      }
      List<Chunk> chunks =
          chunker.chunk(
              document, detection.boundaries(), ChunkingBounds.from(config.getChunking()));
      if (chunks.isEmpty()) {
        throw new DocumentIngestionException(documentId, "No content extracted from document");
      }
      log.info("Document {} split into {} chunks", documentId, chunks.size());

      List<String> texts = chunks.stream().map(IngestionService::enrichedText).toList();
      List<List<Float>> embeddings = embeddingService.embedTexts(texts);
      if (embeddings.size() != chunks.size()) {
        throw new DocumentIngestionException(
            documentId,
            String.format(
                "Embedding generation failed: expected %d embeddings, got %d",
                chunks.size(), embeddings.size()));
      }

      collaboratorGuard.run(
          CollaboratorGuard.VECTOR_INDEX,
          () -> {
            chunkIndex.deleteByDocumentId(documentId);
            chunkIndex.index(chunks, embeddings);
          });

      int count =
          ingestionCounts.computeIfAbsent(documentId, id -> new AtomicInteger()).incrementAndGet();
      meterRegistry.counter("ingestion.chunks").increment(chunks.size());
      log.info(
          "Indexed {} chunks for document {} (ingestion #{})", chunks.size(), documentId, count);
      return new IngestionResult(
          documentId,
          IngestionStatus.INDEXED,
          chunks.size(),
          detection.extractionGap(),
          count,
          null);
    } catch (DocumentIngestionException e) {
      throw e;
    } catch (CollaboratorUnavailableException e) {
      throw new DocumentIngestionException(documentId, e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new DocumentIngestionException(
          documentId, "Failed to ingest document: " + e.getMessage(), e);
    }
  }

  /**
   * Ingests several documents in parallel. A failing document, or one the executor has no room
   * for, yields a FAILED result and does not affect the others.
   */
  public List<IngestionResult> ingestAll(List<ExtractedDocument> documents) {
    List<CompletableFuture<IngestionResult>> futures = new ArrayList<>();
    for (ExtractedDocument document : documents) {
      try {
        futures.add(
            CompletableFuture.supplyAsync(() -> ingest(document), ingestionExecutor)
                .exceptionally(e -> failedResult(document, e)));
      } catch (RejectedExecutionException e) {
        futures.add(CompletableFuture.completedFuture(failedResult(document, e)));
      }
    }
    List<IngestionResult> results = futures.stream().map(CompletableFuture::join).toList();
    log.info(
        "Batch ingestion finished: {}",
        results.stream()
            .collect(Collectors.groupingBy(IngestionResult::status, Collectors.counting())));
    return results;
  }

  /** Number of successful ingestions of a document by this process. */
  public int ingestionCount(String documentId) {
    AtomicInteger count = ingestionCounts.get(documentId);
    return count == null ? 0 : count.get();
  }

  private IngestionResult failedResult(ExtractedDocument document, Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    String message = cause.getMessage();
    log.error("Failed to ingest document {}", document.documentId(), cause);
    meterRegistry.counter("ingestion.failures").increment();
    return IngestionResult.failed(document.documentId(), message);
  }

  /** Chunk text prefixed with its statement, periods and pages, used for embedding only. */
  @VisibleForTesting
  static String enrichedText(Chunk chunk) {
    ChunkMetadata metadata = chunk.metadata();
    StringBuilder header = new StringBuilder("[");
    header.append(metadata.statementType().getDisplayName());
    if (!metadata.fiscalPeriods().isEmpty()) {
      header
          .append(" | ")
          .append(
              metadata.fiscalPeriods().stream()
                  .map(FiscalPeriod::label)
                  .collect(Collectors.joining(", ")));
    }
    header.append(" | pages ").append(metadata.pageStart());
    if (metadata.pageEnd() != metadata.pageStart()) {
      header.append('-').append(metadata.pageEnd());
    }
    return header.append("]\n").append(chunk.content()).toString();
  }
}
