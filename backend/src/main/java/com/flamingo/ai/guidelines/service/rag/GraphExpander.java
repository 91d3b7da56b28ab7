package com.flamingo.ai.guidelines.service.rag;

import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.domain.model.ExpandedChunk;
import com.flamingo.ai.guidelines.service.text.EntityTermExtractor;
import com.flamingo.ai.guidelines.store.KnowledgeReader;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Adds chunks related to the seeds through document structure, shared entities and shared
 * recommendations.
 *
 * <p>Sources run in that order and share one budget. A later source runs only while budget is left.
 * Seeds and chunks already added are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphExpander {

  static final int MAX_NEIGHBORS_PER_SEED = 3;

  private final KnowledgeReader reader;
  private final EntityTermExtractor entityTermExtractor;

  /** Collects new ids under a budget, skipping seeds and repeats. */
  private static final class Expansion {
    private final Set<String> seedIds;
    private final Set<String> taken = new HashSet<>();
    private final List<ExpandedChunk> added = new ArrayList<>();
    private int remaining;

    Expansion(Set<String> seedIds, int budget) {
      this.seedIds = seedIds;
      this.remaining = budget;
    }

    /** Seeds plus everything added so far; lookups must not spend their limit on these. */
    Set<String> excluded() {
      Set<String> excluded = new HashSet<>(seedIds);
      excluded.addAll(taken);
      return excluded;
    }

    /** Takes up to {@code max} new chunks while budget remains. */
    void offer(List<ChunkRecord> found, RetrievalSource source, int max) {
      int count = 0;
      for (ChunkRecord record : found) {
        if (remaining <= 0 || count >= max) {
          break;
        }
        String id = record.getChunkId();
        if (!seedIds.contains(id) && taken.add(id)) {
          added.add(new ExpandedChunk(id, source));
          remaining--;
          count++;
        }
      }
    }
  }

  /**
   * Expands the seed set.
   *
   * @param docId the document the seeds belong to
   * @param seedIds seed chunk ids, best first
   * @param budget maximum number of ids to add
   * @return added ids with their provenance, in source priority order
   */
  @Timed(value = "rag.expand", description = "Time for graph expansion")
  public List<ExpandedChunk> expand(String docId, List<String> seedIds, int budget) {
    if (budget <= 0 || seedIds.isEmpty()) {
      return List.of();
    }
    List<ChunkRecord> seeds = reader.fetchByIds(docId, seedIds);
    Expansion expansion = new Expansion(Set.copyOf(seedIds), budget);

    for (ChunkRecord seed : seeds) {
      if (expansion.remaining <= 0) {
        break;
      }
      int wanted = Math.min(MAX_NEIGHBORS_PER_SEED, expansion.remaining);
      // the seed itself is its own nearest neighbour
      List<ChunkRecord> neighbors =
          reader.fetchSectionNeighbors(docId, seed.getSectionPath(), seed.getOrder(), wanted + 1);
      expansion.offer(neighbors, RetrievalSource.STRUCTURAL, wanted);
    }

    if (expansion.remaining > 0) {
      List<String> terms = new ArrayList<>();
      for (ChunkRecord seed : seeds) {
        terms.addAll(entityTermExtractor.expansionTerms(seed.getText()));
      }
      if (!terms.isEmpty()) {
        List<ChunkRecord> byEntity =
            reader.fetchByEntityMentions(
                docId, terms, expansion.excluded(), expansion.remaining);
        expansion.offer(byEntity, RetrievalSource.ENTITY, Integer.MAX_VALUE);
      }
    }

    if (expansion.remaining > 0) {
      List<ChunkRecord> linked =
          reader.fetchRecommendationLinked(
              docId, seedIds, expansion.excluded(), expansion.remaining);
      expansion.offer(linked, RetrievalSource.RECOMMENDATION_LINKED, Integer.MAX_VALUE);
    }

    log.debug(
        "Expanded {} seeds of doc_id={} by {} chunks",
        seedIds.size(),
        docId,
        expansion.added.size());
    return List.copyOf(expansion.added);
  }
}
