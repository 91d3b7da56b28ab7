package com.flamingo.ai.guidelines.elasticsearch;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk of guideline text stored with its embedding.
 *
 * <p>{@code chunkHash} is unique within a document; {@code entityMentions} is used only to find
 * related chunks during expansion and is never shown to readers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidelineChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String chunkId;
  private String docId;
  private String sectionId;
  private String sectionPath;
  private int order;
  private int pageStart;
  private int pageEnd;
  private String text;
  private ChunkType chunkType;
  private int tokenCount;
  private String chunkHash;
  @Builder.Default private List<String> entityMentions = List.of();
  private List<Float> embedding;

  // set by search methods
  @Builder.Default private Double relevanceScore = 0.0;
}
