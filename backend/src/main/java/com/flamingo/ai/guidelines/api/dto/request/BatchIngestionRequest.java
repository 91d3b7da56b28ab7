package com.flamingo.ai.guidelines.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a directory of PDFs described by a manifest. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestionRequest {

  @NotBlank(message = "inputDir is required")
  private String inputDir;

  @NotBlank(message = "manifestPath is required")
  private String manifestPath;

  /** Overrides {@code rag.ingestion.checkpoint-file} when set. */
  private String checkpointFile;
}
