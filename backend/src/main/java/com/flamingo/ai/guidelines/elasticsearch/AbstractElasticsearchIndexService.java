package com.flamingo.ai.guidelines.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.guidelines.exception.BackendUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
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

/**
 * Abstract base class for the knowledge base indices.
 *
 * <p>Provides index creation and mapping validation, bulk writes, real-time lookups by id,
 * criteria queries and deletion. Subclasses define the schema and the conversion between entities
 * and stored documents. Transport failures surface as {@link BackendUnavailableException}.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts an entity to the stored document map.
   *
   * @param entity the entity to convert
   * @return the Elasticsearch document map
   */
  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts a stored document map back to an entity. The map carries the document {@code _id}
   * under the key {@code id}.
   *
   * @param source the Elasticsearch document map
   * @return the entity
   */
  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /** Prefix for this index's Micrometer counters, e.g. {@code guideline_chunk}. */
  protected abstract String getMetricPrefix();

  /** Source fields left out of reads, such as large vectors. */
  protected List<String> sourceExcludes() {
    return List.of();
  }

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // undeclared fields are kept in _source but never mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Existing field types cannot be changed in place, so a mismatch fails fast and the index has
   * to be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexDocumentsFallback")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException e) {
      throw unavailable("index documents", e);
    }
    if (response.errors()) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      String firstError =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(item -> item.id() + ": " + item.error().reason())
              .findFirst()
              .orElse("unknown");
      log.warn("Bulk write to {} reported failures, first: {}", getIndexName(), firstError);
      throw new BackendUnavailableException(
          BackendUnavailableException.ELASTICSEARCH,
          "Bulk write to " + getIndexName() + " failed: " + firstError);
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  @SuppressWarnings("unused")
  private void indexDocumentsFallback(List<T> documents, Throwable t) {
    throw fallback("index", t);
  }

  /**
   * Indexes a single document.
   *
   * @param document the document to index
   */
  public void index(T document) {
    indexDocuments(List.of(document));
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  @Timed(value = "elasticsearch.find_by_ids", description = "Time to load documents by id")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "findByIdsFallback")
  public List<T> findByIds(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    MgetResponse<Map> response;
    try {
      response =
          elasticsearchClient.mget(
              m -> {
                m.index(getIndexName()).ids(ids);
                if (!sourceExcludes().isEmpty()) {
                  m.sourceExcludes(sourceExcludes());
                }
                return m;
              },
              Map.class);
    } catch (IOException e) {
      throw unavailable("load documents by id", e);
    }
    List<T> documents = new ArrayList<>();
    for (MultiGetResponseItem<Map> item : response.docs()) {
      if (!item.isResult()) {
        continue;
      }
      GetResult<Map> result = item.result();
      if (result.found() && result.source() != null) {
        Map<String, Object> source = result.source();
        source.put("id", result.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }

  @SuppressWarnings("unused")
  private List<T> findByIdsFallback(List<String> ids, Throwable t) {
    throw fallback("find_by_ids", t);
  }

  @Override
  @Timed(value = "elasticsearch.find_by", description = "Time for criteria queries")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "findByFallback")
  public List<T> findBy(Map<String, Object> criteria, int size) {
    Query query = buildCriteriaQuery(criteria);
    return executeSearch(searchRequest(query, size), "find_by");
  }

  @SuppressWarnings("unused")
  private List<T> findByFallback(Map<String, Object> criteria, int size, Throwable t) {
    throw fallback("find_by", t);
  }

  /**
   * Replaces the given fields of one stored document, leaving all other fields untouched.
   *
   * @param id the document ID
   * @param fields field values to write
   */
  @Timed(value = "elasticsearch.update", description = "Time to update document fields")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "updateFieldsFallback")
  @SuppressWarnings("rawtypes")
  public void updateFields(String id, Map<String, Object> fields) {
    UpdateRequest<Map, Map<String, Object>> request =
        UpdateRequest.of(u -> u.index(getIndexName()).id(id).doc(fields));
    try {
      elasticsearchClient.update(request, Map.class);
    } catch (IOException e) {
      throw unavailable("update document " + id, e);
    }
    meterRegistry.counter(getMetricPrefix() + ".updated").increment();
  }

  @SuppressWarnings("unused")
  private void updateFieldsFallback(String id, Map<String, Object> fields, Throwable t) {
    throw fallback("update", t);
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "deleteByFallback")
  public long deleteBy(Map<String, Object> criteria) {
    if (criteria.isEmpty()) {
      throw new IllegalArgumentException("deleteBy requires at least one criterion");
    }
    Query deleteQuery = buildCriteriaQuery(criteria);
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
    DeleteByQueryResponse response;
    try {
      response = elasticsearchClient.deleteByQuery(request);
    } catch (IOException e) {
      throw unavailable("delete documents", e);
    }
    long deleted = response.deleted() != null ? response.deleted() : 0L;
    log.info("Deleted {} documents from {} with criteria: {}", deleted, getIndexName(), criteria);
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
    return deleted;
  }

  @SuppressWarnings("unused")
  private long deleteByFallback(Map<String, Object> criteria, Throwable t) {
    throw fallback("delete_by", t);
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      throw unavailable("refresh index", e);
    }
  }

  /**
   * Builds a filter-only query requiring every criterion. Collection values become {@code terms}
   * queries, all other values {@code term} queries.
   */
  protected Query buildCriteriaQuery(Map<String, Object> criteria) {
    List<Query> filters = new ArrayList<>();
    for (Map.Entry<String, Object> entry : criteria.entrySet()) {
      filters.add(criterionQuery(entry.getKey(), entry.getValue()));
    }
    return Query.of(q -> q.bool(b -> b.filter(filters)));
  }

  /** Search request over this index honouring {@link #sourceExcludes()}. */
  protected SearchRequest searchRequest(Query query, int size) {
    return SearchRequest.of(
        s -> {
          s.index(getIndexName()).query(query).size(size);
          if (!sourceExcludes().isEmpty()) {
            s.source(src -> src.filter(f -> f.excludes(sourceExcludes())));
          }
          return s;
        });
  }

  protected static Query criterionQuery(String field, Object value) {
    if (value instanceof Collection<?> values) {
      List<FieldValue> fieldValues = values.stream().map(v -> toFieldValue(v)).toList();
      return Query.of(q -> q.terms(t -> t.field(field).terms(tv -> tv.value(fieldValues))));
    }
    return Query.of(q -> q.term(t -> t.field(field).value(toFieldValue(value))));
  }

  protected static FieldValue toFieldValue(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return FieldValue.of(((Number) value).longValue());
    }
    if (value instanceof Number n) {
      return FieldValue.of(n.doubleValue());
    }
    if (value instanceof Boolean b) {
      return FieldValue.of(b);
    }
    return FieldValue.of(String.valueOf(value));
  }

  /**
   * Executes a search against this index and maps the hits, carrying the hit score into entities
   * that implement {@link ScoredDocument}.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<T> executeSearch(SearchRequest request, String searchType) {
    SearchResponse<Map> response;
    try {
      response = elasticsearchClient.search(request, Map.class);
    } catch (IOException e) {
      throw unavailable(searchType, e);
    }
    List<Hit<Map>> hits = response.hits().hits();
    log.debug("[{}] index={} returned={}", searchType, getIndexName(), hits.size());
    meterRegistry.counter(getMetricPrefix() + "." + searchType).increment();
    return mapHitsToDocuments(hits);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata, not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  protected BackendUnavailableException unavailable(String operation, IOException e) {
    log.error("Failed to {} in {}: {}", operation, getIndexName(), e.getMessage(), e);
    return new BackendUnavailableException(
        BackendUnavailableException.ELASTICSEARCH,
        "Failed to " + operation + " in " + getIndexName(),
        e);
  }

  protected RuntimeException fallback(String operation, Throwable t) {
    meterRegistry.counter(getMetricPrefix() + "." + operation + ".fallback").increment();
    if (t instanceof BackendUnavailableException || t instanceof IllegalArgumentException) {
      return (RuntimeException) t;
    }
    log.warn("{} {} fallback triggered: {}", getIndexName(), operation, t.getMessage());
    return new BackendUnavailableException(
        BackendUnavailableException.ELASTICSEARCH,
        getIndexName() + " " + operation + " unavailable: " + t.getMessage(),
        t);
  }

  /** Marker interface for documents that carry a relevance score from search. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
