package com.flamingo.ai.guidelines.domain.model;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Retrieval-time view of a chunk: the stored fields plus a relevance score and the retrieval path
 * that produced it. Never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRecord {

  private String chunkId;
  private String docId;
  private String sectionPath;
  private int order;
  private int pageStart;
  private int pageEnd;
  private String text;
  private ChunkType chunkType;
  private int tokenCount;
  @Builder.Default private List<String> entityMentions = List.of();
  private double score;
  private RetrievalSource source;
}
