package com.flamingo.ai.guidelines.service.rag;

import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.service.text.QueryTerms;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Final retrieval stage: selects a small, deduplicated, section-balanced context.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Clamp the target size to {@code [packed-min, packed-max]}
 *   <li>Drop chunks whose normalized text was already seen
 *   <li>Rank by type priority, then shared query terms, then score
 *   <li>Select greedily; a chunk whose section already has {@code per-section-cap} selected chunks
 *       is passed over while fewer than {@code target - 1} chunks are selected
 *   <li>Top up from the passed-over chunks when fewer than {@code packed-min} were selected
 *   <li>Return in reading order: page, then ordinal
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextPacker {

  private static final int PRIORITIZED_TYPE_RANK = 2;

  private final RagConfig ragConfig;

  private record Ranked(ChunkRecord record, int typeRank, int overlap) {}

  public List<ChunkRecord> pack(String query, List<ChunkRecord> pool, int targetN) {
    RagConfig.Packing packing = ragConfig.getPacking();
    int target = Math.max(packing.getPackedMin(), Math.min(packing.getPackedMax(), targetN));
    Set<String> queryTerms = QueryTerms.of(query);

    List<Ranked> ranked = new ArrayList<>();
    Set<String> seenText = new HashSet<>();
    for (ChunkRecord record : pool) {
      if (!seenText.add(TextNormalizer.dedupKey(record.getText()))) {
        continue;
      }
      int typeRank =
          record.getChunkType() != null && record.getChunkType().isPrioritized()
              ? PRIORITIZED_TYPE_RANK
              : 0;
      int overlap = QueryTerms.overlap(queryTerms, QueryTerms.of(record.getText()));
      ranked.add(new Ranked(record, typeRank, overlap));
    }
    ranked.sort(
        Comparator.comparingInt(Ranked::typeRank)
            .thenComparingInt(Ranked::overlap)
            .thenComparingDouble(r -> r.record().getScore())
            .reversed());

    List<ChunkRecord> packed = new ArrayList<>();
    List<ChunkRecord> passedOver = new ArrayList<>();
    Map<String, Integer> perSection = new HashMap<>();
    for (Ranked candidate : ranked) {
      if (packed.size() >= target) {
        break;
      }
      ChunkRecord record = candidate.record();
      int inSection = perSection.getOrDefault(record.getSectionPath(), 0);
      if (inSection >= packing.getPerSectionCap() && packed.size() < target - 1) {
        passedOver.add(record);
        continue;
      }
      packed.add(record);
      perSection.merge(record.getSectionPath(), 1, Integer::sum);
    }

    for (ChunkRecord record : passedOver) {
      if (packed.size() >= packing.getPackedMin()) {
        break;
      }
      packed.add(record);
    }

    packed.sort(
        Comparator.comparingInt(ChunkRecord::getPageStart).thenComparingInt(ChunkRecord::getOrder));
    log.debug(
        "Packed {} of {} pooled chunks (target {}, {} passed over)",
        packed.size(),
        pool.size(),
        target,
        passedOver.size());
    return packed;
  }
}
