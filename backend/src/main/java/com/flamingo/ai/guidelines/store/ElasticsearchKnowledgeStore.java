package com.flamingo.ai.guidelines.store;

import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineChunk;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineChunkIndexService;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocument;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocumentIndexService;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineRecommendation;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineRecommendationIndexService;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineSection;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineSectionIndexService;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link KnowledgeStore} backed by four Elasticsearch indices. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchKnowledgeStore implements KnowledgeStore {

  private final GuidelineDocumentIndexService documentIndex;
  private final GuidelineSectionIndexService sectionIndex;
  private final GuidelineChunkIndexService chunkIndex;
  private final GuidelineRecommendationIndexService recommendationIndex;

  // ---- writes ----

  @Override
  public String upsertDocument(GuidelineDocument document) {
    documentIndex.index(document);
    log.info("Upsert document doc_id={}", document.getDocId());
    return document.getDocId();
  }

  @Override
  public String upsertSection(GuidelineSection section) {
    sectionIndex.index(section);
    log.debug("Upsert section doc_id={} path={}", section.getDocId(), section.getPath());
    return section.getSectionId();
  }

  @Override
  public String upsertChunk(GuidelineChunk chunk) {
    Optional<GuidelineChunk> existing =
        chunkIndex.findByHash(chunk.getDocId(), chunk.getChunkHash());
    if (existing.isPresent()) {
      log.debug(
          "Chunk hash {} already stored for doc_id={} as {}",
          chunk.getChunkHash(),
          chunk.getDocId(),
          existing.get().getChunkId());
      return existing.get().getChunkId();
    }
    chunkIndex.index(chunk);
    log.debug("Upsert chunk doc_id={} chunk_id={}", chunk.getDocId(), chunk.getChunkId());
    return chunk.getChunkId();
  }

  @Override
  public void linkChunkToSection(String chunkId, String sectionId) {
    chunkIndex.updateFields(chunkId, Map.of("sectionId", sectionId));
  }

  @Override
  public void linkChunkToDocument(String chunkId, String docId) {
    chunkIndex.updateFields(chunkId, Map.of("docId", docId));
  }

  @Override
  public String upsertRecommendation(GuidelineRecommendation recommendation) {
    String id = recommendation.getRecommendationId();
    Set<String> chunkIds = new LinkedHashSet<>();
    recommendationIndex.findByIds(List.of(id)).forEach(r -> chunkIds.addAll(r.getChunkIds()));
    chunkIds.addAll(recommendation.getChunkIds());
    recommendation.setChunkIds(new ArrayList<>(chunkIds));
    recommendationIndex.index(recommendation);
    return id;
  }

  @Override
  public void linkRecommendationToChunk(String recommendationId, String chunkId) {
    List<GuidelineRecommendation> found = recommendationIndex.findByIds(List.of(recommendationId));
    if (found.isEmpty()) {
      log.warn("Cannot link unknown recommendation {} to chunk {}", recommendationId, chunkId);
      return;
    }
    GuidelineRecommendation recommendation = found.get(0);
    if (!recommendation.getChunkIds().contains(chunkId)) {
      recommendation.getChunkIds().add(chunkId);
      recommendationIndex.index(recommendation);
    }
  }

  @Override
  public void refresh() {
    documentIndex.refresh();
    sectionIndex.refresh();
    chunkIndex.refresh();
    recommendationIndex.refresh();
  }

  // ---- reads ----

  @Override
  public Optional<GuidelineDocument> findDocumentByContentHash(String contentHash) {
    return documentIndex.findByContentHash(contentHash);
  }

  @Override
  public List<ChunkRecord> keywordSearch(
      String docId, String query, RetrievalFilters filters, int limit) {
    return chunkIndex.keywordSearch(docId, query, filters, limit).stream()
        .map(c -> toRecord(c, RetrievalSource.LEXICAL, c.getRelevanceScore()))
        .toList();
  }

  @Override
  public List<ChunkRecord> vectorSearch(
      String docId, List<Float> queryEmbedding, RetrievalFilters filters, int limit) {
    return chunkIndex.vectorSearch(docId, queryEmbedding, filters, limit).stream()
        .map(c -> toRecord(c, RetrievalSource.VECTOR, c.getRelevanceScore()))
        .toList();
  }

  @Override
  public List<ChunkRecord> fetchByIds(String docId, List<String> chunkIds) {
    return toRecords(chunkIndex.findByIds(docId, chunkIds), RetrievalSource.FETCH);
  }

  @Override
  public List<ChunkRecord> fetchSectionNeighbors(
      String docId, String sectionPath, int centerOrder, int limit) {
    return toRecords(
        chunkIndex.findSectionNeighbors(docId, sectionPath, centerOrder, limit),
        RetrievalSource.STRUCTURAL);
  }

  @Override
  public List<ChunkRecord> fetchByEntityMentions(
      String docId, List<String> terms, Collection<String> excludeIds, int limit) {
    return toRecords(
        chunkIndex.findByEntityMentions(docId, terms, excludeIds, limit), RetrievalSource.ENTITY);
  }

  @Override
  public List<ChunkRecord> fetchRecommendationLinked(
      String docId, List<String> seedIds, Collection<String> excludeIds, int limit) {
    List<GuidelineRecommendation> recommendations =
        recommendationIndex.findSupportedByAny(docId, seedIds, limit);
    Set<String> linked = new LinkedHashSet<>();
    for (GuidelineRecommendation recommendation : recommendations) {
      linked.addAll(recommendation.getChunkIds());
    }
    linked.removeAll(excludeIds);
    List<String> ids = linked.stream().limit(limit).toList();
    return toRecords(chunkIndex.findByIds(docId, ids), RetrievalSource.RECOMMENDATION_LINKED);
  }

  // ---- deletes ----

  @Override
  public long deleteChunksByDocId(String docId) {
    long deleted = chunkIndex.deleteByDocId(docId);
    log.info("Deleted chunks doc_id={} count={}", docId, deleted);
    return deleted;
  }

  @Override
  public void deleteByDocId(String docId) {
    long recommendations = recommendationIndex.deleteByDocId(docId);
    long sections = sectionIndex.deleteByDocId(docId);
    long chunks = chunkIndex.deleteByDocId(docId);
    documentIndex.deleteByDocId(docId);
    log.info(
        "Deleted doc_id={} recommendations={} sections={} chunks={}",
        docId,
        recommendations,
        sections,
        chunks);
  }

  private static List<ChunkRecord> toRecords(List<GuidelineChunk> chunks, RetrievalSource source) {
    return chunks.stream().map(c -> toRecord(c, source, 0.0)).toList();
  }

  static ChunkRecord toRecord(GuidelineChunk chunk, RetrievalSource source, Double score) {
    return ChunkRecord.builder()
        .chunkId(chunk.getChunkId())
        .docId(chunk.getDocId())
        .sectionPath(chunk.getSectionPath())
        .order(chunk.getOrder())
        .pageStart(chunk.getPageStart())
        .pageEnd(chunk.getPageEnd())
        .text(chunk.getText())
        .chunkType(chunk.getChunkType())
        .tokenCount(chunk.getTokenCount())
        .entityMentions(chunk.getEntityMentions())
        .score(score != null ? score : 0.0)
        .source(source)
        .build();
  }
}
