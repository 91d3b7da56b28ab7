package com.flamingo.ai.guidelines.store;

import com.flamingo.ai.guidelines.elasticsearch.GuidelineChunk;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocument;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineRecommendation;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineSection;

/**
 * Write side of the knowledge base.
 *
 * <p>Every write replaces the whole stored record (last write wins); there are no multi-object
 * transactions. All methods throw {@link
 * com.flamingo.ai.guidelines.exception.BackendUnavailableException} when storage is unreachable.
 */
public interface KnowledgeWriter {

  /**
   * Stores a document record.
   *
   * @return the document identifier
   */
  String upsertDocument(GuidelineDocument document);

  /**
   * Stores a section record.
   *
   * @return the section identifier
   */
  String upsertSection(GuidelineSection section);

  /**
   * Stores a chunk unless a chunk with the same content hash already exists for its document.
   *
   * @return the identifier of the stored chunk, or of the existing chunk with the same hash
   */
  String upsertChunk(GuidelineChunk chunk);

  void linkChunkToSection(String chunkId, String sectionId);

  void linkChunkToDocument(String chunkId, String docId);

  /**
   * Stores a recommendation statement, keeping chunk links recorded by earlier writes.
   *
   * @return the recommendation identifier
   */
  String upsertRecommendation(GuidelineRecommendation recommendation);

  /** Adds a chunk to the recommendation's supporting set. Unknown recommendations are ignored. */
  void linkRecommendationToChunk(String recommendationId, String chunkId);

  /** Makes all writes so far visible to search. */
  void refresh();
}
