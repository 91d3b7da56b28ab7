package com.flamingo.ai.guidelines.exception;

/** Exception thrown when a source file or manifest cannot be read. */
public class IngestionException extends RuntimeException {

  private final String userMessage;

  public IngestionException(String message) {
    super(message);
    this.userMessage = message;
  }

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to read the source document. Please check the file and try again.";
  }

  public IngestionException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
