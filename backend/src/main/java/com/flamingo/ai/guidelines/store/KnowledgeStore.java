package com.flamingo.ai.guidelines.store;

/** The full storage capability set, implemented by a single backend adapter. */
public interface KnowledgeStore extends KnowledgeWriter, KnowledgeReader, KnowledgeEraser {}
