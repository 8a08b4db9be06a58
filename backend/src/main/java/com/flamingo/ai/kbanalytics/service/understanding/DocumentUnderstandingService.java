package com.flamingo.ai.kbanalytics.service.understanding;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import java.util.UUID;

/** Service interface for extracting and storing AI document understanding. */
public interface DocumentUnderstandingService {

  /**
   * Analyzes a document and stores its summary, topics, technologies and insights, replacing any
   * previous analysis.
   *
   * @throws com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException if not found
   * @throws com.flamingo.ai.kbanalytics.exception.ExternalServiceException if analysis fails
   */
  DocumentUnderstanding analyzeDocument(UUID documentId);
}
