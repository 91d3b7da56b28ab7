package com.flamingo.ai.guidelines.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of ingesting a single document. */
public enum IngestionStatus {
  /** Sections and chunks were written. */
  INGESTED("ingested"),

  /** A document with the same content hash already exists; nothing was written. */
  SKIPPED_DUPLICATE("skipped_duplicate_document_hash"),

  /** The checkpoint file marks the document as already done. */
  SKIPPED_CHECKPOINT("skipped_checkpoint"),

  /** The manifest row or its source file could not be used. */
  SKIPPED_INVALID_INPUT("skipped_invalid_input");

  private final String value;

  IngestionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isSkipped() {
    return this != INGESTED;
  }
}
