package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.List;
import java.util.UUID;

/** Service interface for "similar documents" queries. */
public interface SimilarDocumentService {

  /**
   * Finds documents similar to {@code documentId}, most similar first. The document itself is
   * never part of the result.
   *
   * @param limit maximum results, null for the configured default
   * @param minSimilarity inclusive lower bound, null for the configured default
   * @throws com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException if the document does
   *     not exist
   * @throws com.flamingo.ai.kbanalytics.exception.EmbeddingNotFoundException if it has no
   *     embedding
   */
  List<DocumentSimilarity> findSimilarDocuments(
      UUID documentId, Integer limit, Double minSimilarity);
}
