package com.flamingo.ai.guidelines.exception;

/**
 * Thrown when the storage backend or the embedding service cannot serve a call.
 *
 * <p>Fatal for the current ingestion or retrieval call. The pipeline does not retry; callers own
 * the retry policy.
 */
public class BackendUnavailableException extends RuntimeException {

  public static final String ELASTICSEARCH = "elasticsearch";
  public static final String EMBEDDING = "embedding";

  private final String backend;
  private final String userMessage;

  public BackendUnavailableException(String backend, String message) {
    super(message);
    this.backend = backend;
    this.userMessage = userMessageFor(backend);
  }

  public BackendUnavailableException(String backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
    this.userMessage = userMessageFor(backend);
  }

  private static String userMessageFor(String backend) {
    return EMBEDDING.equals(backend)
        ? "The embedding service is temporarily unavailable. Please try again."
        : "The knowledge base storage is temporarily unavailable. Please try again.";
  }

  public String getBackend() {
    return backend;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
