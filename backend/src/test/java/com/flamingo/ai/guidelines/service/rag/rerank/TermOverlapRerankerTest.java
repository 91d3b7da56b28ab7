package com.flamingo.ai.guidelines.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TermOverlapRerankerTest {

  private final TermOverlapReranker reranker = new TermOverlapReranker();

  private static ChunkRecord candidate(String id, double score, ChunkType type, String text) {
    return ChunkRecord.builder()
        .chunkId(id)
        .docId("doc")
        .sectionPath("3 Treatment")
        .text(text)
        .chunkType(type)
        .score(score)
        .source(RetrievalSource.HYBRID)
        .build();
  }

  @Test
  @DisplayName("should lift recommendation chunks sharing query terms above closer raw matches")
  void shouldBoostOverlapAndRecommendations() {
    // Given
    List<ChunkRecord> candidates =
        List.of(
            candidate("epidemiology", 0.9, ChunkType.OTHER, "Epidemiology of chronic disease"),
            candidate(
                "recommendation",
                0.7,
                ChunkType.RECOMMENDATION,
                "An ACE inhibitor is recommended for CKD"),
            candidate("table", 0.8, ChunkType.TABLE, "ACE inhibitor dosing table"));

    // When
    List<ChunkRecord> reranked = reranker.rerank("ACE inhibitor dosing in CKD", candidates, 12);

    // Then
    assertThat(reranked)
        .extracting(ChunkRecord::getChunkId)
        .containsExactly("recommendation", "table", "epidemiology");
    assertThat(reranked.get(0).getScore()).isCloseTo(0.7 + 3 * 0.05 + 0.2, within(1e-9));
    assertThat(reranked.get(1).getScore()).isCloseTo(0.8 + 3 * 0.05, within(1e-9));
    assertThat(reranked.get(2).getScore()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  @DisplayName("should keep fused order for equal scores and truncate to topK")
  void shouldBeStableAndTruncate() {
    List<ChunkRecord> candidates =
        List.of(
            candidate("first", 0.5, ChunkType.OTHER, "unrelated"),
            candidate("second", 0.5, ChunkType.OTHER, "unrelated"),
            candidate("third", 0.5, ChunkType.OTHER, "unrelated"));

    List<ChunkRecord> reranked = reranker.rerank("query", candidates, 2);

    assertThat(reranked).extracting(ChunkRecord::getChunkId).containsExactly("first", "second");
  }

  @Test
  @DisplayName("should boost algorithms like recommendations")
  void shouldBoostAlgorithms() {
    List<ChunkRecord> reranked =
        reranker.rerank(
            "x", List.of(candidate("alg", 0.1, ChunkType.ALGORITHM, "flow chart")), 5);

    assertThat(reranked.get(0).getScore()).isCloseTo(0.3, within(1e-9));
  }

  @Test
  @DisplayName("should return empty list for no candidates")
  void shouldHandleEmptyCandidates() {
    assertThat(reranker.rerank("query", List.of(), 12)).isEmpty();
  }
}
