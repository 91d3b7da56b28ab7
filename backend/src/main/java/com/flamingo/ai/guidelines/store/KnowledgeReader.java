package com.flamingo.ai.guidelines.store;

import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocument;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the knowledge base. Every chunk query is scoped to a single document.
 *
 * <p>Records returned by the search methods carry the backend's raw relevance score; records
 * returned by the fetch methods carry a score of zero and the provenance of the lookup that found
 * them.
 */
public interface KnowledgeReader {

  Optional<GuidelineDocument> findDocumentByContentHash(String contentHash);

  /** Lexical stream of hybrid search. */
  List<ChunkRecord> keywordSearch(
      String docId, String query, RetrievalFilters filters, int limit);

  /** Vector stream of hybrid search. */
  List<ChunkRecord> vectorSearch(
      String docId, List<Float> queryEmbedding, RetrievalFilters filters, int limit);

  List<ChunkRecord> fetchByIds(String docId, List<String> chunkIds);

  /** Chunks of one section ranked by ordinal distance from {@code centerOrder}. */
  List<ChunkRecord> fetchSectionNeighbors(
      String docId, String sectionPath, int centerOrder, int limit);

  /**
   * Chunks whose entity mentions contain any of the terms. Excluded ids never count against
   * {@code limit}.
   */
  List<ChunkRecord> fetchByEntityMentions(
      String docId, List<String> terms, Collection<String> excludeIds, int limit);

  /**
   * Chunks supporting any recommendation that one of the seed chunks supports.
   *
   * @param docId the document
   * @param seedIds seed chunk ids
   * @param excludeIds chunk ids dropped before the limit applies, typically the seeds
   * @param limit maximum number of recommendations consulted and of chunks returned
   * @return the union of the supporting chunks
   */
  List<ChunkRecord> fetchRecommendationLinked(
      String docId, List<String> seedIds, Collection<String> excludeIds, int limit);
}
