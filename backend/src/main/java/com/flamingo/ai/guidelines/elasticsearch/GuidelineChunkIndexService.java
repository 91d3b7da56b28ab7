package com.flamingo.ai.guidelines.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for guideline chunks.
 *
 * <p>Serves both hybrid search streams (BM25 over chunk text and kNN over the chunk embedding) and
 * the structural lookups used by graph expansion. Every query is scoped to one document.
 */
@Service
@Slf4j
public class GuidelineChunkIndexService extends AbstractElasticsearchIndexService<GuidelineChunk> {

  @Value("${app.elasticsearch.indices.chunks:guideline-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public GuidelineChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public GuidelineChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // identifiers and labels must be keyword for exact filtering
    properties.put("docId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sectionId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sectionPath", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkType", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("entityMentions", Property.of(p -> p.keyword(k -> k)));
    properties.put("order", Property.of(p -> p.integer(i -> i)));
    properties.put("pageStart", Property.of(p -> p.integer(i -> i)));
    properties.put("pageEnd", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "text",
        Property.of(
            p ->
                p.text(
                    TextProperty.of(t -> t.analyzer(textAnalyzer).searchAnalyzer(textAnalyzer)))));
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

  @Override
  protected List<String> sourceExcludes() {
    return List.of("embedding");
  }

  @Override
  protected Map<String, Object> convertToDocument(GuidelineChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("docId", chunk.getDocId());
    document.put("sectionId", chunk.getSectionId());
    document.put("sectionPath", chunk.getSectionPath());
    document.put("order", chunk.getOrder());
    document.put("pageStart", chunk.getPageStart());
    document.put("pageEnd", chunk.getPageEnd());
    document.put("text", chunk.getText());
    document.put("chunkType", chunk.getChunkType().getValue());
    document.put("tokenCount", chunk.getTokenCount());
    document.put("chunkHash", chunk.getChunkHash());
    document.put("entityMentions", chunk.getEntityMentions());
    if (chunk.getEmbedding() != null && !chunk.getEmbedding().isEmpty()) {
      document.put("embedding", chunk.getEmbedding());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected GuidelineChunk convertFromDocument(Map<String, Object> source) {
    Object mentions = source.get("entityMentions");
    return GuidelineChunk.builder()
        .chunkId((String) source.get("id"))
        .docId((String) source.get("docId"))
        .sectionId((String) source.get("sectionId"))
        .sectionPath((String) source.get("sectionPath"))
        .order(intValue(source.get("order")))
        .pageStart(intValue(source.get("pageStart")))
        .pageEnd(intValue(source.get("pageEnd")))
        .text((String) source.get("text"))
        .chunkType(ChunkType.fromValue((String) source.get("chunkType")))
        .tokenCount(intValue(source.get("tokenCount")))
        .chunkHash((String) source.get("chunkHash"))
        .entityMentions(
            mentions instanceof Collection<?> values
                ? List.copyOf((Collection<String>) values)
                : List.of())
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(GuidelineChunk entity) {
    return entity.getChunkId();
  }

  @Override
  protected String getMetricPrefix() {
    return "guideline_chunk";
  }

  /**
   * BM25 search over chunk text within one document.
   *
   * @param docId the document scope
   * @param query the free-text query
   * @param filters additional restrictions, applied as filters
   * @param topK number of results
   * @return chunks ordered by BM25 score, score carried in {@code relevanceScore}
   */
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<GuidelineChunk> keywordSearch(
      String docId, String query, RetrievalFilters filters, int topK) {
    List<Query> scope = scopeFilters(docId, filters);
    log.debug("keywordSearch doc={} query='{}' topK={} filters={}", docId, query, topK, filters);
    Query keywordQuery =
        Query.of(
            q ->
                q.bool(
                    b -> b.filter(scope).must(m -> m.match(mt -> mt.field("text").query(query)))));
    return executeSearch(searchRequest(keywordQuery, topK), "keyword_search");
  }

  @SuppressWarnings("unused")
  private List<GuidelineChunk> keywordSearchFallback(
      String docId, String query, RetrievalFilters filters, int topK, Throwable t) {
    throw fallback("keyword_search", t);
  }

  /**
   * kNN search over chunk embeddings within one document.
   *
   * @param docId the document scope
   * @param queryEmbedding the query vector
   * @param filters additional restrictions, applied as kNN pre-filters
   * @param topK number of results
   * @return chunks ordered by similarity, score carried in {@code relevanceScore}
   */
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<GuidelineChunk> vectorSearch(
      String docId, List<Float> queryEmbedding, RetrievalFilters filters, int topK) {
    List<Query> scope = scopeFilters(docId, filters);
    log.debug(
        "vectorSearch doc={} topK={} dims={} filters={}",
        docId,
        topK,
        queryEmbedding.size(),
        filters);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(Math.max(topK * 2, 50))
                                .filter(scope))
                    .source(src -> src.filter(f -> f.excludes(sourceExcludes())))
                    .size(topK));
    return executeSearch(request, "vector_search");
  }

  @SuppressWarnings("unused")
  private List<GuidelineChunk> vectorSearchFallback(
      String docId, List<Float> queryEmbedding, RetrievalFilters filters, int topK, Throwable t) {
    throw fallback("vector_search", t);
  }

  /**
   * Chunks of the same section closest to a given ordinal, nearest first and lower ordinal first
   * on ties. The chunk at the center ordinal itself is included.
   */
  @Timed(value = "elasticsearch.section_neighbors", description = "Time for neighbour lookup")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "findSectionNeighborsFallback")
  public List<GuidelineChunk> findSectionNeighbors(
      String docId, String sectionPath, int centerOrder, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<Query> filters = new ArrayList<>();
    filters.add(criterionQuery("docId", docId));
    filters.add(criterionQuery("sectionPath", sectionPath));
    filters.add(
        Query.of(
            q ->
                q.range(
                    r ->
                        r.number(
                            n ->
                                n.field("order")
                                    .gte((double) (centerOrder - limit))
                                    .lte((double) (centerOrder + limit))))));
    Query query = Query.of(q -> q.bool(b -> b.filter(filters)));
    List<GuidelineChunk> window = executeSearch(searchRequest(query, 2 * limit + 1), "neighbors");
    return window.stream()
        .sorted(
            Comparator.comparingInt((GuidelineChunk c) -> Math.abs(c.getOrder() - centerOrder))
                .thenComparingInt(GuidelineChunk::getOrder))
        .limit(limit)
        .toList();
  }

  @SuppressWarnings("unused")
  private List<GuidelineChunk> findSectionNeighborsFallback(
      String docId, String sectionPath, int centerOrder, int limit, Throwable t) {
    throw fallback("neighbors", t);
  }

  /**
   * Chunks of a document whose entity mentions contain any of the given terms.
   *
   * @param excludeIds chunk ids left out of the result, so they never take up the limit
   */
  @Timed(value = "elasticsearch.entity_mentions", description = "Time for entity lookup")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "findByEntityMentionsFallback")
  public List<GuidelineChunk> findByEntityMentions(
      String docId, List<String> terms, Collection<String> excludeIds, int limit) {
    if (terms.isEmpty() || limit <= 0) {
      return List.of();
    }
    Query query = entityMentionsQuery(docId, terms, excludeIds);
    return executeSearch(searchRequest(query, limit), "entity_mentions");
  }

  @VisibleForTesting
  Query entityMentionsQuery(String docId, List<String> terms, Collection<String> excludeIds) {
    List<Query> filters =
        List.of(criterionQuery("docId", docId), criterionQuery("entityMentions", terms));
    List<String> excluded = List.copyOf(excludeIds);
    return Query.of(
        q ->
            q.bool(
                b -> {
                  b.filter(filters);
                  if (!excluded.isEmpty()) {
                    b.mustNot(m -> m.ids(i -> i.values(excluded)));
                  }
                  return b;
                }));
  }

  @SuppressWarnings("unused")
  private List<GuidelineChunk> findByEntityMentionsFallback(
      String docId, List<String> terms, Collection<String> excludeIds, int limit, Throwable t) {
    throw fallback("entity_mentions", t);
  }

  /** The chunk of a document carrying the given content hash, if one was stored. */
  public Optional<GuidelineChunk> findByHash(String docId, String chunkHash) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("docId", docId);
    criteria.put("chunkHash", chunkHash);
    return findBy(criteria, 1).stream().findFirst();
  }

  /** Loads chunks by id, dropping any that belong to another document. */
  public List<GuidelineChunk> findByIds(String docId, List<String> chunkIds) {
    return findByIds(chunkIds).stream().filter(c -> docId.equals(c.getDocId())).toList();
  }

  public long deleteByDocId(String docId) {
    return deleteBy(Map.of("docId", docId));
  }

  /** Document scope ANDed with the optional retrieval filters. */
  @VisibleForTesting
  List<Query> scopeFilters(String docId, RetrievalFilters filters) {
    List<Query> scope = new ArrayList<>();
    scope.add(criterionQuery("docId", docId));
    if (filters == null) {
      return scope;
    }
    if (filters.hasSectionPrefix()) {
      scope.add(
          Query.of(
              q -> q.prefix(p -> p.field("sectionPath").value(filters.sectionPrefix().trim()))));
    }
    if (!filters.chunkTypes().isEmpty()) {
      scope.add(
          criterionQuery(
              "chunkType", filters.chunkTypes().stream().map(ChunkType::getValue).toList()));
    }
    // page window overlap: chunk.pageStart <= window end and chunk.pageEnd >= window start
    if (filters.pageEnd() != null) {
      double windowEnd = filters.pageEnd();
      scope.add(
          Query.of(q -> q.range(r -> r.number(n -> n.field("pageStart").lte(windowEnd)))));
    }
    if (filters.pageStart() != null) {
      double windowStart = filters.pageStart();
      scope.add(
          Query.of(q -> q.range(r -> r.number(n -> n.field("pageEnd").gte(windowStart)))));
    }
    return scope;
  }
}
