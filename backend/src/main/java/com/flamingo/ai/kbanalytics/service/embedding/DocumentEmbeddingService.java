package com.flamingo.ai.kbanalytics.service.embedding;

import java.util.UUID;

/** Service interface for computing and storing document embeddings. */
public interface DocumentEmbeddingService {

  /**
   * Embeds the document's title and content and stores the vector, replacing any previous one.
   *
   * @param documentId the document ID
   * @return what was stored
   * @throws com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException if not found
   */
  EmbeddingResult embedDocument(UUID documentId);
}
