package com.flamingo.ai.guidelines.service.rag;

import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import com.flamingo.ai.guidelines.store.KnowledgeReader;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * First retrieval stage: hybrid lexical and vector search inside one document.
 *
 * <p>Both streams run with the same filters. Each stream's scores are divided by that stream's best
 * score so they share the range {@code [0, 1]}; the streams are then merged by chunk id keeping the
 * higher score. A chunk found by both streams is tagged {@link RetrievalSource#HYBRID}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateRetriever {

  private final KnowledgeReader reader;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;

  /**
   * Retrieves fused candidates.
   *
   * @return at most {@code rag.retrieval.candidate-limit} records, best first; ties keep the order
   *     in which the chunks were first seen, lexical stream first
   */
  @Timed(value = "rag.candidates", description = "Time for hybrid candidate retrieval")
  public List<ChunkRecord> retrieve(String docId, String query, RetrievalFilters filters) {
    int limit = ragConfig.getRetrieval().getCandidateLimit();
    List<Float> queryEmbedding = embeddingService.embedText(query);

    List<ChunkRecord> lexical = reader.keywordSearch(docId, query, filters, limit);
    List<ChunkRecord> vector = reader.vectorSearch(docId, queryEmbedding, filters, limit);
    log.debug(
        "Hybrid streams doc_id={} lexical={} vector={}", docId, lexical.size(), vector.size());

    Map<String, ChunkRecord> fused = new LinkedHashMap<>();
    mergeInto(fused, normalize(lexical));
    mergeInto(fused, normalize(vector));

    List<ChunkRecord> ranked = new ArrayList<>(fused.values());
    ranked.sort(Comparator.comparingDouble(ChunkRecord::getScore).reversed());
    return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : ranked;
  }

  static List<ChunkRecord> normalize(List<ChunkRecord> stream) {
    double best = stream.stream().mapToDouble(ChunkRecord::getScore).max().orElse(0.0);
    return stream.stream()
        .map(r -> r.toBuilder().score(best > 0 ? r.getScore() / best : 0.0).build())
        .toList();
  }

  private static void mergeInto(Map<String, ChunkRecord> fused, List<ChunkRecord> stream) {
    for (ChunkRecord record : stream) {
      ChunkRecord seen = fused.get(record.getChunkId());
      if (seen == null) {
        fused.put(record.getChunkId(), record);
      } else if (seen.getSource() != record.getSource()) {
        fused.put(
            record.getChunkId(),
            seen.toBuilder()
                .score(Math.max(seen.getScore(), record.getScore()))
                .source(RetrievalSource.HYBRID)
                .build());
      }
    }
  }
}
