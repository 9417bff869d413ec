package com.flamingo.ai.finqa.service.retrieval;

import static com.flamingo.ai.finqa.ReportFixtures.narrativeChunk;
import static com.flamingo.ai.finqa.ReportFixtures.tableChunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.RetrievalCandidate;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalGateway Tests")
class RetrievalGatewayTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f);

  @Mock private EmbeddingService embeddingService;
  @Mock private ChunkIndex chunkIndex;

  private FinQaConfig config;
  private RetrievalGateway gateway;

  @BeforeEach
  void setUp() {
    config = new FinQaConfig();
    config.getCollaborator().setMaxAttempts(2);
    config.getCollaborator().setInitialBackoff(Duration.ofMillis(1));
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    gateway =
        new RetrievalGateway(
            embeddingService,
            chunkIndex,
            new CollaboratorGuard(config, meterRegistry),
            config,
            meterRegistry);
  }

  @Test
  @DisplayName("Should rank candidates by descending score and drop those below the floor")
  void shouldRankAndApplyFloor() {
    when(embeddingService.embedQuery("net income")).thenReturn(VECTOR);
    when(chunkIndex.search(eq(VECTOR), any(), eq(8)))
        .thenReturn(
            List.of(
                new ScoredChunk(narrativeChunk("ar_0", StatementType.NOTES, "a"), 0.5),
                new ScoredChunk(narrativeChunk("ar_1", StatementType.NOTES, "b"), 0.9),
                new ScoredChunk(narrativeChunk("ar_2", StatementType.NOTES, "c"), 0.2)));

    RetrievalResult result = gateway.search("net income", RetrievalFilters.none(), 8);

    assertThat(result.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(result.candidates())
        .extracting(RetrievalCandidate::chunkId)
        .containsExactly("ar_1", "ar_0");
  }

  @Test
  @DisplayName("Should enforce the filters on whatever the index returns")
  void shouldEnforceFilters() {
    RetrievalFilters filters =
        RetrievalFilters.none()
            .withFiscalYear(2023)
            .withStatementTypes(Set.of(StatementType.BALANCE_SHEET));
    when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
    when(chunkIndex.search(VECTOR, filters, 5))
        .thenReturn(
            List.of(
                new ScoredChunk(
                    tableChunk("ar_0", StatementType.BALANCE_SHEET, "x", FiscalPeriod.annual(2023)),
                    0.8),
                new ScoredChunk(
                    tableChunk("ar_1", StatementType.BALANCE_SHEET, "y", FiscalPeriod.annual(2021)),
                    0.9),
                new ScoredChunk(
                    tableChunk("ar_2", StatementType.CASH_FLOW, "z", FiscalPeriod.annual(2023)),
                    0.95)));

    List<RetrievalCandidate> candidates = gateway.retrieve("total equity", filters, 5);

    assertThat(candidates).extracting(RetrievalCandidate::chunkId).containsExactly("ar_0");
    assertThat(candidates.get(0).appliedFilters()).isEqualTo(filters);
  }

  @Test
  @DisplayName("Should clamp topK to the configured maximum")
  void shouldClampTopK() {
    when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
    when(chunkIndex.search(any(), any(), anyInt())).thenReturn(List.of());

    gateway.search("revenue", RetrievalFilters.none(), 500);
    gateway.search("revenue", RetrievalFilters.none(), 0);

    verify(chunkIndex).search(VECTOR, RetrievalFilters.none(), 20);
    verify(chunkIndex).search(VECTOR, RetrievalFilters.none(), 1);
  }

  @Test
  @DisplayName("Should report an empty result when nothing clears the floor")
  void shouldReportEmpty() {
    when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
    when(chunkIndex.search(any(), any(), anyInt()))
        .thenReturn(
            List.of(new ScoredChunk(narrativeChunk("ar_0", StatementType.NOTES, "a"), 0.1)));

    RetrievalResult result = gateway.search("revenue", RetrievalFilters.none(), 5);

    assertThat(result.status()).isEqualTo(RetrievalStatus.EMPTY);
    assertThat(result.evidenceGap()).isEqualTo(EvidenceGap.RETRIEVAL_EMPTY);
  }

  @Test
  @DisplayName("Should report the index as unavailable after retries instead of throwing")
  void shouldReportUnavailableIndex() {
    when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
    when(chunkIndex.search(any(), any(), anyInt())).thenThrow(new RuntimeException("timeout"));

    RetrievalResult result = gateway.search("revenue", RetrievalFilters.none(), 5);

    assertThat(result.isUnavailable()).isTrue();
    assertThat(result.evidenceGap()).isEqualTo(EvidenceGap.COLLABORATOR_UNAVAILABLE);
    verify(chunkIndex, times(2)).search(any(), any(), anyInt());
  }

  @Test
  @DisplayName("Should report an unavailable embedding model without querying the index")
  void shouldReportUnavailableEmbedding() {
    when(embeddingService.embedQuery(anyString()))
        .thenThrow(new CollaboratorUnavailableException("embedding", 2, null));

    RetrievalResult result = gateway.search("revenue", RetrievalFilters.none(), 5);

    assertThat(result.isUnavailable()).isTrue();
    verify(chunkIndex, never()).search(any(), any(), anyInt());
  }

  @Test
  @DisplayName("Should skip blank queries")
  void shouldSkipBlankQueries() {
    assertThat(gateway.search("  ", RetrievalFilters.none(), 5).status())
        .isEqualTo(RetrievalStatus.EMPTY);
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  @DisplayName("Should still answer when calls are serialized")
  void shouldSerializeCalls() {
    config.getRetrieval().setSerializeCalls(true);
    when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
    when(chunkIndex.search(any(), any(), anyInt()))
        .thenReturn(
            List.of(new ScoredChunk(narrativeChunk("ar_0", StatementType.NOTES, "a"), 0.7)));

    assertThat(gateway.retrieve("revenue", RetrievalFilters.none(), 5)).hasSize(1);
  }
}
