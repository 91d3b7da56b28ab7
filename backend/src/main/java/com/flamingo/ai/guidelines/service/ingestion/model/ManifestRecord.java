package com.flamingo.ai.guidelines.service.ingestion.model;

import java.util.Map;

/**
 * One normalized manifest row.
 *
 * @param key the row's key: the file name for CSV and list manifests, the object key otherwise
 * @param filename explicit PDF file name, may be blank
 * @param metadata the document metadata read from the row; {@code docId} may be blank
 */
public record ManifestRecord(String key, String filename, DocumentMetadata metadata) {

  public String docId() {
    return metadata.docId() == null ? "" : metadata.docId();
  }

  /** Processing order key: the document id, or the manifest key when the id is blank. */
  public String sortKey() {
    return docId().isBlank() ? key : docId();
  }

  public Map<String, Object> attributes() {
    return metadata.attributes();
  }
}
