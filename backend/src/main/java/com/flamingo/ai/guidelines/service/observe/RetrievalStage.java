package com.flamingo.ai.guidelines.service.observe;

/** Steps of a context retrieval call, in execution order. */
public enum RetrievalStage {
  CANDIDATES,
  RERANKED,
  EXPANDED,
  PACKED
}
