package com.flamingo.ai.guidelines.service.ingestion.model;

import java.util.Map;
import lombok.Builder;

/**
 * Descriptive metadata of a guideline, usually one manifest row.
 *
 * @param docId corpus-wide identifier, required
 * @param title display title; falls back to the source file name
 * @param year publication year, if known
 * @param specialty medical specialty, if known
 * @param sourceUrl where the guideline was published, if known
 * @param attributes the raw manifest row, kept for traceability
 */
@Builder
public record DocumentMetadata(
    String docId,
    String title,
    Integer year,
    String specialty,
    String sourceUrl,
    Map<String, Object> attributes) {

  public DocumentMetadata {
    attributes = attributes == null ? Map.of() : attributes;
  }
}
