package com.flamingo.ai.guidelines.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Provenance tag describing which retrieval path produced a chunk record. */
public enum RetrievalSource {
  LEXICAL("lexical"),
  VECTOR("vector"),

  /** Present in both the lexical and the vector stream. */
  HYBRID("hybrid"),

  /** Same-section neighbour of a seed chunk. */
  STRUCTURAL("structural"),

  /** Shares an entity mention with a seed chunk. */
  ENTITY("entity"),

  /** Supports the same recommendation as a seed chunk. */
  RECOMMENDATION_LINKED("recommendation-linked"),

  /** Loaded by id with no retrieval path attached yet. */
  FETCH("fetch");

  private final String value;

  RetrievalSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
