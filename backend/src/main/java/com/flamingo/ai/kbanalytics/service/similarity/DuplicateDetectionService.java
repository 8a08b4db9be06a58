package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.UUID;

/** Service interface for finding near-identical documents. */
public interface DuplicateDetectionService {

  /**
   * Compares every pair of embedded documents and reports those at or above {@code threshold}.
   *
   * @param threshold inclusive cosine similarity bound, null for the configured default
   * @param categoryId restricts the corpus to one category, null for all documents
   * @throws com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException if the threshold
   *     lies outside [0, 1]
   */
  DuplicateReport detectDuplicates(Double threshold, UUID categoryId);
}
