package com.flamingo.ai.guidelines.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for packed context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  private String docId;
  private int count;
  private List<ChunkResponse> chunks;
  private String context;
}
