package com.flamingo.ai.finqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.finqa.domain.enums.ChunkKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import com.flamingo.ai.finqa.domain.model.Chunk;
import com.flamingo.ai.finqa.domain.model.ChunkMetadata;
import com.flamingo.ai.finqa.domain.model.FiscalPeriod;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.service.period.FiscalPeriodParser;
import com.flamingo.ai.finqa.service.retrieval.ChunkIndex;
import com.flamingo.ai.finqa.service.retrieval.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link ChunkIndex}.
 *
 * <p>Chunks are stored with their structural metadata as keyword and integer fields so that kNN
 * search on the {@code embedding} dense vector can be pre-filtered by fiscal year, statement
 * type, chunk kind and document. Cosine similarity scores come back normalised to [0, 1].
 */
@Service
@Slf4j
public class FinancialChunkIndexService implements ChunkIndex {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final FiscalPeriodParser periodParser;

  @Value("${finqa.elasticsearch.index-name:finqa-chunks}")
  private String indexName;

  @Value("${finqa.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public FinancialChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      FiscalPeriodParser periodParser) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.periodParser = periodParser;
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public FinancialChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      FiscalPeriodParser periodParser,
      String indexName,
      int vectorDimensions) {
    this(elasticsearchClient, meterRegistry, periodParser);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  public String getIndexName() {
    return indexName;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            indexName);
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(defineProperties())));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        addMissingFields();
      }
    } catch (IOException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> defineProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Filterable metadata must be keyword or numeric for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("statementType", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkKind", Property.of(p -> p.keyword(k -> k)));
    properties.put("fiscalYears", Property.of(p -> p.integer(i -> i)));
    properties.put("fiscalPeriods", Property.of(p -> p.keyword(k -> k)));
    properties.put("pageStart", Property.of(p -> p.integer(i -> i)));
    properties.put("pageEnd", Property.of(p -> p.integer(i -> i)));
    properties.put("sourceBoundaryIds", Property.of(p -> p.keyword(k -> k)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  /** Adds fields introduced since the index was created; existing fields are left untouched. */
  private void addMissingFields() throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(indexName));
    var indexMapping = response.get(indexName);
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();
    Map<String, Property> missing = new HashMap<>();
    defineProperties()
        .forEach(
            (field, property) -> {
              if (!actual.containsKey(field)) {
                missing.put(field, property);
              }
            });
    if (!missing.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(PutMappingRequest.of(p -> p.index(indexName).properties(missing)));
      log.info(
          "Added {} new field(s) to index '{}': {}", missing.size(), indexName, missing.keySet());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index chunks")
  public void index(List<Chunk> chunks, List<List<Float>> embeddings) {
    if (chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          "Got " + embeddings.size() + " embeddings for " + chunks.size() + " chunks");
    }
    if (chunks.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        FinancialChunkDocument document = toDocument(chunk, embeddings.get(i));
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(indexName).id(chunk.id()).document(document)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter("financial_chunk.index.errors").increment();
        throw new IllegalStateException(
            "Bulk indexing into " + indexName + " reported item failures");
      }
      log.debug("Indexed {} chunks to {}", chunks.size(), indexName);
      meterRegistry.counter("financial_chunk.indexed").increment(chunks.size());
    } catch (IOException e) {
      log.error("Failed to index chunks to {}: {}", indexName, e.getMessage(), e);
      throw new RuntimeException("Failed to index chunks", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete a document's chunks")
  public void deleteByDocumentId(String documentId) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(indexName)
                      .query(q -> q.term(t -> t.field("documentId").value(documentId)))
                      .refresh(true));
      elasticsearchClient.deleteByQuery(request);
      log.debug("Deleted chunks of document {} from {}", documentId, indexName);
      meterRegistry.counter("financial_chunk.deleted").increment();
    } catch (IOException e) {
      log.error("Failed to delete chunks of {} from {}: {}", documentId, indexName, e.getMessage());
      throw new RuntimeException("Failed to delete chunks", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for filtered vector search")
  public List<ScoredChunk> search(
      List<Float> queryEmbedding, RetrievalFilters filters, int topK) {
    List<Query> filterQueries = buildFilters(filters);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(Math.max(topK * 10, 50))
                                .filter(filterQueries))
                    .size(topK));
    try {
      SearchResponse<FinancialChunkDocument> response =
          elasticsearchClient.search(request, FinancialChunkDocument.class);
      List<ScoredChunk> results = new ArrayList<>();
      for (Hit<FinancialChunkDocument> hit : response.hits().hits()) {
        if (hit.source() != null && hit.score() != null) {
          results.add(new ScoredChunk(toChunk(hit.id(), hit.source()), hit.score()));
        }
      }
      log.debug("Vector search on {} returned {} hits (topK={})", indexName, results.size(), topK);
      meterRegistry.counter("financial_chunk.vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new RuntimeException("Vector search failed", e);
    }
  }

  @VisibleForTesting
  List<Query> buildFilters(RetrievalFilters filters) {
    List<Query> queries = new ArrayList<>();
    if (filters.hasFiscalRange()) {
      Integer from = filters.fiscalYearFrom();
      Integer to = filters.fiscalYearTo();
      queries.add(
          Query.of(
              q ->
                  q.range(
                      r ->
                          r.number(
                              n -> {
                                n.field("fiscalYears");
                                if (from != null) {
                                  n.gte(from.doubleValue());
                                }
                                if (to != null) {
                                  n.lte(to.doubleValue());
                                }
                                return n;
                              }))));
    }
    addTerms(queries, "statementType", filters.statementTypes().stream().map(Enum::name).toList());
    addTerms(queries, "chunkKind", filters.chunkKinds().stream().map(Enum::name).toList());
    addTerms(queries, "documentId", filters.documentIds());
    return queries;
  }

  private static void addTerms(List<Query> queries, String field, Collection<String> values) {
    if (values.isEmpty()) {
      return;
    }
    List<FieldValue> fieldValues = values.stream().sorted().map(FieldValue::of).toList();
    queries.add(Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues)))));
  }

  @VisibleForTesting
  static FinancialChunkDocument toDocument(Chunk chunk, List<Float> embedding) {
    ChunkMetadata metadata = chunk.metadata();
    return FinancialChunkDocument.builder()
        .documentId(chunk.documentId())
        .chunkIndex(chunk.index())
        .content(chunk.content())
        .statementType(metadata.statementType().name())
        .chunkKind(metadata.chunkKind().name())
        .fiscalYears(metadata.fiscalYears())
        .fiscalPeriods(metadata.fiscalPeriods().stream().map(FiscalPeriod::label).toList())
        .pageStart(metadata.pageStart())
        .pageEnd(metadata.pageEnd())
        .sourceBoundaryIds(metadata.sourceBoundaryIds())
        .tokenCount(chunk.tokenCount())
        .embedding(embedding)
        .build();
  }

  private Chunk toChunk(String id, FinancialChunkDocument document) {
    List<FiscalPeriod> periods = new ArrayList<>();
    if (document.getFiscalPeriods() != null) {
      for (String label : document.getFiscalPeriods()) {
        periods.addAll(periodParser.parse(label));
      }
    }
    ChunkMetadata metadata =
        new ChunkMetadata(
            periods.stream().distinct().sorted().toList(),
            enumValue(StatementType.class, document.getStatementType(), StatementType.UNCLASSIFIED),
            document.getPageStart(),
            document.getPageEnd(),
            document.getSourceBoundaryIds() != null ? document.getSourceBoundaryIds() : List.of(),
            enumValue(ChunkKind.class, document.getChunkKind(), ChunkKind.NARRATIVE));
    return new Chunk(
        id,
        document.getDocumentId(),
        document.getChunkIndex(),
        document.getContent(),
        metadata,
        document.getTokenCount());
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String name, E fallback) {
    return name == null ? fallback : Enum.valueOf(type, name);
  }
}
