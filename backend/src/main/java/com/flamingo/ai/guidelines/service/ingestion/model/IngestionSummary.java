package com.flamingo.ai.guidelines.service.ingestion.model;

import com.flamingo.ai.guidelines.domain.enums.IngestionStatus;
import lombok.Builder;

/**
 * Outcome of ingesting one document.
 *
 * @param docId the document identifier
 * @param status what happened
 * @param pages number of pages read
 * @param sections number of sections detected
 * @param chunks number of chunks produced
 * @param reusedChunks chunks whose content hash was already stored for the document
 * @param emptySections sections skipped because their pages had no text
 * @param avgTokens mean estimated tokens per chunk
 * @param runtimeSeconds wall time of the ingestion
 * @param message reason for a skip, if any
 */
@Builder
public record IngestionSummary(
    String docId,
    IngestionStatus status,
    int pages,
    int sections,
    int chunks,
    int reusedChunks,
    int emptySections,
    double avgTokens,
    double runtimeSeconds,
    String message) {

  public static IngestionSummary skipped(
      String docId, IngestionStatus status, int pages, double runtimeSeconds, String message) {
    return IngestionSummary.builder()
        .docId(docId)
        .status(status)
        .pages(pages)
        .runtimeSeconds(runtimeSeconds)
        .message(message)
        .build();
  }
}
