package com.flamingo.ai.guidelines.api.dto.response;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one packed chunk. Entity mentions stay internal. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String chunkId;
  private String sectionPath;
  private int order;
  private int pageStart;
  private int pageEnd;
  private ChunkType chunkType;
  private int tokenCount;
  private double score;
  private RetrievalSource source;
  private String text;

  public static ChunkResponse from(ChunkRecord record) {
    return ChunkResponse.builder()
        .chunkId(record.getChunkId())
        .sectionPath(record.getSectionPath())
        .order(record.getOrder())
        .pageStart(record.getPageStart())
        .pageEnd(record.getPageEnd())
        .chunkType(record.getChunkType())
        .tokenCount(record.getTokenCount())
        .score(record.getScore())
        .source(record.getSource())
        .text(record.getText())
        .build();
  }
}
