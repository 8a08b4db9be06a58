package com.flamingo.ai.kbanalytics.exception;

import java.util.UUID;

/** Exception thrown when a document exists but has not been embedded yet. */
public class EmbeddingNotFoundException extends RuntimeException {

  private final UUID documentId;

  public EmbeddingNotFoundException(UUID documentId) {
    super("No embedding stored for document: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
