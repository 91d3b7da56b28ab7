package com.flamingo.ai.guidelines.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Index of guideline sections. */
@Service
public class GuidelineSectionIndexService
    extends AbstractElasticsearchIndexService<GuidelineSection> {

  private static final int MAX_SECTIONS_PER_DOCUMENT = 2000;

  @Value("${app.elasticsearch.indices.sections:guideline-sections}")
  private String indexName;

  @Autowired
  public GuidelineSectionIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public GuidelineSectionIndexService(
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
    properties.put("path", Property.of(p -> p.keyword(k -> k)));
    properties.put("order", Property.of(p -> p.integer(i -> i)));
    properties.put("level", Property.of(p -> p.integer(i -> i)));
    properties.put("pageStart", Property.of(p -> p.integer(i -> i)));
    properties.put("pageEnd", Property.of(p -> p.integer(i -> i)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(GuidelineSection section) {
    Map<String, Object> map = new HashMap<>();
    map.put("docId", section.getDocId());
    map.put("path", section.getPath());
    map.put("order", section.getOrder());
    map.put("level", section.getLevel());
    map.put("pageStart", section.getPageStart());
    map.put("pageEnd", section.getPageEnd());
    return map;
  }

  @Override
  protected GuidelineSection convertFromDocument(Map<String, Object> source) {
    return GuidelineSection.builder()
        .sectionId((String) source.get("id"))
        .docId((String) source.get("docId"))
        .path((String) source.get("path"))
        .order(intValue(source.get("order")))
        .level(intValue(source.get("level")))
        .pageStart(intValue(source.get("pageStart")))
        .pageEnd(intValue(source.get("pageEnd")))
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(GuidelineSection entity) {
    return entity.getSectionId();
  }

  @Override
  protected String getMetricPrefix() {
    return "guideline_section";
  }

  /** Sections of one document in document order. */
  public List<GuidelineSection> findByDocId(String docId) {
    return findBy(Map.of("docId", docId), MAX_SECTIONS_PER_DOCUMENT).stream()
        .sorted(Comparator.comparingInt(GuidelineSection::getOrder))
        .toList();
  }

  public long deleteByDocId(String docId) {
    return deleteBy(Map.of("docId", docId));
  }
}
