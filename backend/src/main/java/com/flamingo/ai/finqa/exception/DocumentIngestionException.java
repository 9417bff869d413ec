package com.flamingo.ai.finqa.exception;

/** Exception thrown when a document cannot be chunked, embedded or indexed. */
public class DocumentIngestionException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentIngestionException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to ingest document";
  }

  public DocumentIngestionException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to ingest document";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
