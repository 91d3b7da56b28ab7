package com.flamingo.ai.guidelines.service.rag;

import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.domain.model.ExpandedChunk;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import com.flamingo.ai.guidelines.service.observe.PipelineObserver;
import com.flamingo.ai.guidelines.service.observe.RetrievalStage;
import com.flamingo.ai.guidelines.service.rag.rerank.Reranker;
import com.flamingo.ai.guidelines.store.KnowledgeReader;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers a query against one document with a packed, reading-ordered context.
 *
 * <p>Pipeline: hybrid candidates, rerank, keep the best as seeds, expand the seeds through the
 * knowledge graph, fetch the expanded chunks, then pack seeds and expansions together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextRetrievalService {

  private final CandidateRetriever candidateRetriever;
  private final Reranker reranker;
  private final GraphExpander graphExpander;
  private final ContextPacker contextPacker;
  private final KnowledgeReader reader;
  private final PipelineObserver observer;
  private final RagConfig ragConfig;

  /**
   * Retrieves packed context.
   *
   * @param docId the document to search
   * @param query the user query
   * @param filters optional scope restrictions, {@code null} for none
   * @return between zero and {@code packed-max} records ordered by page and ordinal
   * @throws IllegalArgumentException if the document id or the query is blank
   * @throws com.flamingo.ai.guidelines.exception.BackendUnavailableException if storage or the
   *     embedding model fails
   */
  @Timed(value = "rag.retrieve", description = "Time for context retrieval")
  public List<ChunkRecord> retrieveContext(String docId, String query, RetrievalFilters filters) {
    if (docId == null || docId.isBlank()) {
      throw new IllegalArgumentException("Document id is required");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    RetrievalFilters scope = filters != null ? filters : RetrievalFilters.none();
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    log.info("Retrieve context doc_id={} query_len={}", docId, query.length());

    List<ChunkRecord> candidates = candidateRetriever.retrieve(docId, query, scope);
    observer.onRetrievalStage(docId, RetrievalStage.CANDIDATES, candidates.size());

    List<ChunkRecord> seeds = reranker.rerank(query, candidates, retrieval.getSeedLimit());
    observer.onRetrievalStage(docId, RetrievalStage.RERANKED, seeds.size());

    List<String> seedIds = seeds.stream().map(ChunkRecord::getChunkId).toList();
    List<ExpandedChunk> expanded =
        graphExpander.expand(docId, seedIds, retrieval.getExpansionBudget());
    List<ChunkRecord> expandedRecords = fetchExpanded(docId, expanded);
    observer.onRetrievalStage(docId, RetrievalStage.EXPANDED, expandedRecords.size());

    List<ChunkRecord> pool = new ArrayList<>(seeds);
    pool.addAll(expandedRecords);
    List<ChunkRecord> packed =
        contextPacker.pack(query, pool, ragConfig.getPacking().getPackedMax());
    observer.onRetrievalStage(docId, RetrievalStage.PACKED, packed.size());
    return packed;
  }

  /** Fetches expanded chunks in expansion order, tagged with the source that found them. */
  private List<ChunkRecord> fetchExpanded(String docId, List<ExpandedChunk> expanded) {
    if (expanded.isEmpty()) {
      return List.of();
    }
    Map<String, RetrievalSource> sources = new LinkedHashMap<>();
    expanded.forEach(e -> sources.put(e.chunkId(), e.source()));
    Map<String, ChunkRecord> byId = new LinkedHashMap<>();
    for (ChunkRecord record : reader.fetchByIds(docId, new ArrayList<>(sources.keySet()))) {
      byId.put(record.getChunkId(), record);
    }
    List<ChunkRecord> records = new ArrayList<>(byId.size());
    sources.forEach(
        (id, source) -> {
          ChunkRecord record = byId.get(id);
          if (record != null) {
            records.add(record.toBuilder().score(0.0).source(source).build());
          }
        });
    return records;
  }

  /**
   * Renders packed chunks as one prompt-ready string, one numbered source header per chunk.
   *
   * @return the rendered context, empty when there are no chunks
   */
  public String buildContext(List<ChunkRecord> chunks) {
    if (chunks.isEmpty()) {
      return "";
    }
    StringBuilder context = new StringBuilder();
    for (int i = 0; i < chunks.size(); i++) {
      ChunkRecord chunk = chunks.get(i);
      context.append(
          String.format(
              "[Source %d: %s, pages %d-%d, %s]\n",
              i + 1,
              chunk.getSectionPath(),
              chunk.getPageStart(),
              chunk.getPageEnd(),
              chunk.getChunkType() != null ? chunk.getChunkType().getValue() : "other"));
      context.append(chunk.getText()).append("\n\n");
    }
    return context.toString().trim();
  }
}
