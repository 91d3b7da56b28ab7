package com.flamingo.ai.guidelines.store;

/** Deletion side of the knowledge base. */
public interface KnowledgeEraser {

  /**
   * Deletes the chunks of a document.
   *
   * @return number of deleted chunks
   */
  long deleteChunksByDocId(String docId);

  /** Deletes a document with its recommendations, sections and chunks. */
  void deleteByDocId(String docId);
}
