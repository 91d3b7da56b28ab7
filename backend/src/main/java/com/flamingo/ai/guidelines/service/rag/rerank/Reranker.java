package com.flamingo.ai.guidelines.service.rag.rerank;

import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import java.util.List;

/** Reorders retrieval candidates by relevance to the query after hybrid fusion. */
public interface Reranker {

  /**
   * Reranks candidates and keeps the best ones.
   *
   * @param query the user query
   * @param candidates fused candidates, best first
   * @param topK number of records to keep
   * @return at most {@code topK} records with updated scores, sorted by score descending
   */
  List<ChunkRecord> rerank(String query, List<ChunkRecord> candidates, int topK);
}
