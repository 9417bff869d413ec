package com.flamingo.ai.finqa.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    FinQaConfig config = new FinQaConfig();
    config.getCollaborator().setMaxAttempts(2);
    config.getCollaborator().setInitialBackoff(Duration.ofMillis(1));
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    embeddingService =
        new EmbeddingService(
            embeddingModel, new CollaboratorGuard(config, meterRegistry), meterRegistry);
  }

  @Test
  @DisplayName("Should embed a query")
  void shouldEmbedQuery() {
    when(embeddingModel.embed("What was revenue in 2023?"))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    assertThat(embeddingService.embedQuery("What was revenue in 2023?"))
        .containsExactly(0.1f, 0.2f, 0.3f);
  }

  @Test
  @DisplayName("Should truncate very long text before embedding")
  void shouldTruncateLongText() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.5f})));

    embeddingService.embedQuery("a".repeat(20000));

    ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(text.capture());
    assertThat(text.getValue()).hasSize(12000);
  }

  @Test
  @DisplayName("Should embed a batch in one call, preserving order")
  @SuppressWarnings("unchecked")
  void shouldEmbedBatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {1f}), Embedding.from(new float[] {2f}))));

    List<List<Float>> vectors = embeddingService.embedTexts(List.of("first", "second"));

    assertThat(vectors).containsExactly(List.of(1f), List.of(2f));
    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(segments.capture());
    assertThat(segments.getValue())
        .extracting(TextSegment::text)
        .containsExactly("first", "second");
  }

  @Test
  @DisplayName("Should reject a batch response with the wrong number of vectors")
  void shouldRejectMismatchedBatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    assertThatThrownBy(() -> embeddingService.embedTexts(List.of("first", "second")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 vectors for 2 texts");
  }

  @Test
  @DisplayName("Should skip the model for an empty batch")
  void shouldSkipEmptyBatch() {
    assertThat(embeddingService.embedTexts(List.of())).isEmpty();
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("Should surface a persistently failing model as unavailable")
  void shouldSurfaceUnavailableModel() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("503"));

    assertThatThrownBy(() -> embeddingService.embedQuery("revenue"))
        .isInstanceOf(CollaboratorUnavailableException.class);
    verify(embeddingModel, times(2)).embed(anyString());
  }
}
