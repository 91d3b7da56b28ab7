package com.flamingo.ai.guidelines.service.rag.rerank;

import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.service.text.QueryTerms;
import io.micrometer.core.annotation.Timed;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Boosts candidates that share terms with the query and candidates holding recommendations or
 * algorithms.
 *
 * <p>New score = score + 0.05 per shared term + 0.2 for a prioritized chunk type. The sort is
 * stable, so equal scores keep their fused order.
 */
@Service
@Slf4j
public class TermOverlapReranker implements Reranker {

  static final double TERM_OVERLAP_WEIGHT = 0.05;
  static final double PRIORITIZED_TYPE_BOOST = 0.2;

  @Override
  @Timed(value = "rag.rerank", description = "Time for term overlap reranking")
  public List<ChunkRecord> rerank(String query, List<ChunkRecord> candidates, int topK) {
    Set<String> queryTerms = QueryTerms.of(query);
    List<ChunkRecord> reranked =
        candidates.stream()
            .map(c -> c.toBuilder().score(rescore(queryTerms, c)).build())
            .sorted(Comparator.comparingDouble(ChunkRecord::getScore).reversed())
            .limit(Math.max(0, topK))
            .toList();
    log.debug("Reranked {} candidates, kept {}", candidates.size(), reranked.size());
    return reranked;
  }

  private static double rescore(Set<String> queryTerms, ChunkRecord candidate) {
    double score = candidate.getScore();
    int shared = QueryTerms.overlap(queryTerms, QueryTerms.of(candidate.getText()));
    score += shared * TERM_OVERLAP_WEIGHT;
    if (candidate.getChunkType() != null && candidate.getChunkType().isPrioritized()) {
      score += PRIORITIZED_TYPE_BOOST;
    }
    return score;
  }
}
