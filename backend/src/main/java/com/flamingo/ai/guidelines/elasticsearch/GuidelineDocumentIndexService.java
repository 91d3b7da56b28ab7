package com.flamingo.ai.guidelines.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Index of ingested guideline documents, keyed by document identifier. */
@Service
public class GuidelineDocumentIndexService
    extends AbstractElasticsearchIndexService<GuidelineDocument> {

  @Value("${app.elasticsearch.indices.documents:guideline-documents}")
  private String indexName;

  @Autowired
  public GuidelineDocumentIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public GuidelineDocumentIndexService(
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
    properties.put("title", Property.of(p -> p.text(t -> t)));
    properties.put("year", Property.of(p -> p.integer(i -> i)));
    properties.put("specialty", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceUrl", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("contentHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("createdAt", Property.of(p -> p.date(d -> d)));
    properties.put("metadataJson", Property.of(p -> p.keyword(k -> k.index(false))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(GuidelineDocument document) {
    Map<String, Object> map = new HashMap<>();
    map.put("docId", document.getDocId());
    map.put("title", document.getTitle());
    map.put("year", document.getYear());
    map.put("specialty", document.getSpecialty());
    map.put("sourceUrl", document.getSourceUrl());
    map.put("contentHash", document.getContentHash());
    map.put(
        "createdAt", document.getCreatedAt() != null ? document.getCreatedAt().toString() : null);
    map.put("metadataJson", document.getMetadataJson());
    return map;
  }

  @Override
  protected GuidelineDocument convertFromDocument(Map<String, Object> source) {
    Object year = source.get("year");
    Object createdAt = source.get("createdAt");
    return GuidelineDocument.builder()
        .docId((String) source.get("docId"))
        .title((String) source.get("title"))
        .year(year instanceof Number n ? n.intValue() : null)
        .specialty((String) source.get("specialty"))
        .sourceUrl((String) source.get("sourceUrl"))
        .contentHash((String) source.get("contentHash"))
        .createdAt(createdAt != null ? Instant.parse(createdAt.toString()) : null)
        .metadataJson((String) source.get("metadataJson"))
        .build();
  }

  @Override
  protected String getDocumentId(GuidelineDocument entity) {
    return entity.getDocId();
  }

  @Override
  protected String getMetricPrefix() {
    return "guideline_document";
  }

  /**
   * Finds any document with the given content hash.
   *
   * @param contentHash SHA-256 of the document's page texts
   * @return the first match, if any
   */
  public Optional<GuidelineDocument> findByContentHash(String contentHash) {
    List<GuidelineDocument> matches = findBy(Map.of("contentHash", contentHash), 1);
    return matches.stream().findFirst();
  }

  public long deleteByDocId(String docId) {
    return deleteBy(Map.of("docId", docId));
  }
}
