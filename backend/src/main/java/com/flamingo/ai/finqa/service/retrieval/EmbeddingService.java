package com.flamingo.ai.finqa.service.retrieval;

import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings through the configured {@link EmbeddingModel}. Calls go through the
 * {@link CollaboratorGuard}, so a persistently failing model surfaces as {@code
 * CollaboratorUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; financial tables tokenize densely
  private static final int MAX_CHARS_PER_EMBEDDING = 12000;

  private final EmbeddingModel embeddingModel;
  private final CollaboratorGuard guard;
  private final MeterRegistry meterRegistry;

  public List<Float> embedQuery(String text) {
    String input = truncate(text, 0);
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response =
          guard.call(CollaboratorGuard.EMBEDDING, () -> embeddingModel.embed(input));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<List<Embedding>> response =
          guard.call(CollaboratorGuard.EMBEDDING, () -> embeddingModel.embedAll(segments));
      List<Embedding> embeddings = response.content();
      if (embeddings.size() != texts.size()) {
        throw new IllegalStateException(
            String.format(
                "Embedding model returned %d vectors for %d texts",
                embeddings.size(), texts.size()));
      }
      meterRegistry.counter("embedding.batch.embedded").increment(texts.size());
      return embeddings.stream().map(EmbeddingService::toList).toList();
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private static String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(Embedding embedding) {
    float[] vector = embedding.vector();
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
