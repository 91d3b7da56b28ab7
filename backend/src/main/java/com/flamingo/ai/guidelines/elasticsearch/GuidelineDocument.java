package com.flamingo.ai.guidelines.elasticsearch;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ingested guideline. The Elasticsearch {@code _id} is the corpus-wide document identifier.
 *
 * <p>{@code contentHash} is the SHA-256 of the page texts joined by newlines and is what duplicate
 * detection keys on. {@code metadataJson} keeps the raw manifest row for traceability.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidelineDocument {

  private String docId;
  private String title;
  private Integer year;
  private String specialty;
  private String sourceUrl;
  private String contentHash;
  private Instant createdAt;
  private String metadataJson;
}
