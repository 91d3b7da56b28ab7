package com.flamingo.ai.guidelines.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Operations shared by the document, section, chunk and recommendation indices.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /** Creates the index, or adds missing fields to an existing one. Runs once at startup. */
  void initIndex();

  /**
   * Indexes multiple documents in bulk, replacing any existing document with the same ID.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Loads documents by ID. Reads are real-time, so documents indexed moments ago are visible.
   *
   * @param ids the document IDs
   * @return the documents found, in request order; missing IDs are skipped
   */
  List<T> findByIds(List<ID> ids);

  /**
   * Finds documents whose fields match all given criteria.
   *
   * @param criteria key-value pairs; collection values match any element
   * @param size maximum number of documents to return
   * @return matching documents
   */
  List<T> findBy(Map<String, Object> criteria, int size);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   * @return number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  /** Makes every write so far visible to search; called once at the end of an ingestion. */
  void refresh();

  String getIndexName();
}
