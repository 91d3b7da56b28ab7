package com.flamingo.ai.guidelines.domain.model;

import com.flamingo.ai.guidelines.domain.enums.RetrievalSource;

/**
 * A chunk id added by graph expansion.
 *
 * @param chunkId the added chunk
 * @param source the expansion source that found it
 */
public record ExpandedChunk(String chunkId, RetrievalSource source) {}
