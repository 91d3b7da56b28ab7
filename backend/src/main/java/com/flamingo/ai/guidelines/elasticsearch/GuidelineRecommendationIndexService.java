package com.flamingo.ai.guidelines.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Index of recommendation statements and their supporting chunk ids. */
@Service
public class GuidelineRecommendationIndexService
    extends AbstractElasticsearchIndexService<GuidelineRecommendation> {

  @Value("${app.elasticsearch.indices.recommendations:guideline-recommendations}")
  private String indexName;

  @Autowired
  public GuidelineRecommendationIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public GuidelineRecommendationIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, String indexName) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("docId", Property.of(p -> p.keyword(k -> k)));
    properties.put("statement", Property.of(p -> p.text(t -> t)));
    properties.put("strength", Property.of(p -> p.keyword(k -> k)));
    properties.put("evidenceLevel", Property.of(p -> p.keyword(k -> k)));
    properties.put("population", Property.of(p -> p.text(t -> t)));
    properties.put("contraindications", Property.of(p -> p.text(t -> t)));
    properties.put("chunkIds", Property.of(p -> p.keyword(k -> k)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(GuidelineRecommendation recommendation) {
    Map<String, Object> map = new HashMap<>();
    map.put("docId", recommendation.getDocId());
    map.put("statement", recommendation.getStatement());
    map.put("strength", recommendation.getStrength());
    map.put("evidenceLevel", recommendation.getEvidenceLevel());
    map.put("population", recommendation.getPopulation());
    map.put("contraindications", recommendation.getContraindications());
    map.put("chunkIds", recommendation.getChunkIds());
    return map;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected GuidelineRecommendation convertFromDocument(Map<String, Object> source) {
    Object chunkIds = source.get("chunkIds");
    return GuidelineRecommendation.builder()
        .recommendationId((String) source.get("id"))
        .docId((String) source.get("docId"))
        .statement((String) source.get("statement"))
        .strength((String) source.get("strength"))
        .evidenceLevel((String) source.get("evidenceLevel"))
        .population((String) source.get("population"))
        .contraindications((String) source.get("contraindications"))
        .chunkIds(
            chunkIds instanceof Collection<?> ids
                ? new ArrayList<>((Collection<String>) ids)
                : new ArrayList<>())
        .build();
  }

  @Override
  protected String getDocumentId(GuidelineRecommendation entity) {
    return entity.getRecommendationId();
  }

  @Override
  protected String getMetricPrefix() {
    return "guideline_recommendation";
  }

  /**
   * Recommendations of a document supported by any of the given chunks.
   *
   * @param docId the document
   * @param chunkIds chunk ids to look for
   * @param limit maximum number of recommendations
   * @return matching recommendations
   */
  public List<GuidelineRecommendation> findSupportedByAny(
      String docId, List<String> chunkIds, int limit) {
    if (chunkIds.isEmpty() || limit <= 0) {
      return List.of();
    }
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("docId", docId);
    criteria.put("chunkIds", chunkIds);
    return findBy(criteria, limit);
  }

  public long deleteByDocId(String docId) {
    return deleteBy(Map.of("docId", docId));
  }
}
