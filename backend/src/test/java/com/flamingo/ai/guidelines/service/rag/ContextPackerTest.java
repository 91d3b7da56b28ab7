package com.flamingo.ai.guidelines.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextPackerTest {

  private ContextPacker packer;

  @BeforeEach
  void setUp() {
    packer = new ContextPacker(new RagConfig());
  }

  private static ChunkRecord chunk(String id, String section, int page, double score) {
    return chunk(id, section, page, score, ChunkType.OTHER, "body of " + id);
  }

  private static ChunkRecord chunk(
      String id, String section, int page, double score, ChunkType type, String text) {
    return ChunkRecord.builder()
        .chunkId(id)
        .docId("doc")
        .sectionPath(section)
        .order(page * 10)
        .pageStart(page)
        .pageEnd(page)
        .text(text)
        .chunkType(type)
        .score(score)
        .source(RetrievalSource.HYBRID)
        .build();
  }

  /** {@code count} chunks in one section, scores descending from {@code topScore}. */
  private static List<ChunkRecord> section(String name, int count, int firstPage, double topScore) {
    List<ChunkRecord> chunks = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      chunks.add(chunk(name + "-" + i, name, firstPage + i, topScore - i * 0.01));
    }
    return chunks;
  }

  private static Map<String, Long> perSection(List<ChunkRecord> packed) {
    return packed.stream()
        .collect(Collectors.groupingBy(ChunkRecord::getSectionPath, Collectors.counting()));
  }

  @Nested
  @DisplayName("section balance")
  class SectionBalanceTests {

    @Test
    @DisplayName("should cap a dominant section at three chunks")
    void shouldCapDominantSection() {
      // Given 15 candidates over 5 sections, the best five all in S1
      List<ChunkRecord> pool = new ArrayList<>();
      pool.addAll(section("S1", 5, 1, 0.99));
      pool.addAll(section("S2", 3, 10, 0.90));
      pool.addAll(section("S3", 3, 20, 0.80));
      pool.addAll(section("S4", 2, 30, 0.70));
      pool.addAll(section("S5", 2, 40, 0.60));

      // When
      List<ChunkRecord> packed = packer.pack("query", pool, 8);

      // Then
      assertThat(packed).hasSize(8);
      assertThat(perSection(packed).values()).allSatisfy(n -> assertThat(n).isLessThanOrEqualTo(3));
      assertThat(packed)
          .extracting(ChunkRecord::getChunkId)
          .containsExactly("S1-0", "S1-1", "S1-2", "S2-0", "S2-1", "S2-2", "S3-0", "S3-1");
    }

    @Test
    @DisplayName("should let the last slot go over the cap")
    void shouldRelaxCapForLastSlot() {
      List<ChunkRecord> pool = new ArrayList<>();
      pool.addAll(section("S1", 5, 1, 0.99));
      pool.addAll(section("S2", 4, 10, 0.90));

      List<ChunkRecord> packed = packer.pack("query", pool, 7);

      assertThat(packed).hasSize(7);
      assertThat(perSection(packed)).containsEntry("S1", 3L).containsEntry("S2", 4L);
    }

    @Test
    @DisplayName("should backfill passed-over chunks up to the minimum")
    void shouldBackfillToMinimum() {
      List<ChunkRecord> pool = section("S1", 8, 1, 0.99);

      List<ChunkRecord> packed = packer.pack("query", pool, 6);

      assertThat(packed)
          .extracting(ChunkRecord::getChunkId)
          .containsExactly("S1-0", "S1-1", "S1-2", "S1-3", "S1-4", "S1-5");
    }
  }

  @Nested
  @DisplayName("ranking and output")
  class RankingTests {

    @Test
    @DisplayName("should drop chunks whose normalized text was already seen")
    void shouldDeduplicateText() {
      List<ChunkRecord> pool =
          List.of(
              chunk("a", "S1", 1, 0.9, ChunkType.OTHER, "Beta blockers  first"),
              chunk("b", "S2", 2, 0.8, ChunkType.OTHER, "beta BLOCKERS\nfirst"),
              chunk("c", "S3", 3, 0.7, ChunkType.OTHER, "Something else"));

      List<ChunkRecord> packed = packer.pack("query", pool, 6);

      assertThat(packed).extracting(ChunkRecord::getChunkId).containsExactly("a", "c");
      assertThat(packed)
          .extracting(c -> TextNormalizer.dedupKey(c.getText()))
          .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should prefer recommendations, then query overlap, then score")
    void shouldRankByTypeThenOverlapThenScore() {
      // Given seven high-scoring chunks and two weaker but better-typed or better-matching ones
      List<ChunkRecord> pool = new ArrayList<>();
      for (int i = 0; i < 7; i++) {
        pool.add(chunk("plain-" + i, "P" + i, i + 1, 0.9 - i * 0.01));
      }
      pool.add(chunk("rec", "R", 50, 0.1, ChunkType.RECOMMENDATION, "Follow this advice"));
      pool.add(chunk("match", "M", 60, 0.2, ChunkType.OTHER, "statin therapy intensity"));

      // When
      List<ChunkRecord> packed = packer.pack("statin therapy", pool, 6);

      // Then
      assertThat(packed)
          .extracting(ChunkRecord::getChunkId)
          .contains("rec", "match")
          .doesNotContain("plain-5", "plain-6");
    }

    @Test
    @DisplayName("should return chunks in page and ordinal order")
    void shouldOrderByPageAndOrdinal() {
      List<ChunkRecord> pool =
          List.of(
              chunk("late", "S1", 9, 0.9),
              chunk("early", "S2", 2, 0.5),
              chunk("middle", "S3", 5, 0.7));

      List<ChunkRecord> packed = packer.pack("query", pool, 6);

      assertThat(packed)
          .extracting(ChunkRecord::getChunkId)
          .containsExactly("early", "middle", "late");
      assertThat(packed)
          .isSortedAccordingTo(
              Comparator.comparingInt(ChunkRecord::getPageStart)
                  .thenComparingInt(ChunkRecord::getOrder));
    }
  }

  @Nested
  @DisplayName("target bounds")
  class BoundsTests {

    @Test
    @DisplayName("should clamp a large target to the maximum")
    void shouldClampToMaximum() {
      List<ChunkRecord> pool = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        pool.add(chunk("c" + i, "S" + i, i + 1, 1.0 - i * 0.01));
      }

      assertThat(packer.pack("query", pool, 100)).hasSize(12);
    }

    @Test
    @DisplayName("should clamp a small target to the minimum")
    void shouldClampToMinimum() {
      List<ChunkRecord> pool = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        pool.add(chunk("c" + i, "S" + i, i + 1, 1.0 - i * 0.01));
      }

      assertThat(packer.pack("query", pool, 1)).hasSize(6);
    }

    @Test
    @DisplayName("should return the whole pool when it is smaller than the minimum")
    void shouldReturnSmallPool() {
      List<ChunkRecord> pool = section("S1", 2, 1, 0.5);

      assertThat(packer.pack("query", pool, 8))
          .extracting(ChunkRecord::getChunkId)
          .containsExactlyInAnyOrderElementsOf(
              pool.stream().map(ChunkRecord::getChunkId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("should return empty list for empty pool")
    void shouldHandleEmptyPool() {
      assertThat(packer.pack("query", List.of(), 8)).isEmpty();
    }
  }
}
