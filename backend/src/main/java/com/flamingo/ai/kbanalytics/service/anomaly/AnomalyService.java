package com.flamingo.ai.kbanalytics.service.anomaly;

import java.util.List;
import java.util.UUID;

/** Service interface for anomaly detection. */
public interface AnomalyService {

  /**
   * Detects anomalous documents, strongest first.
   *
   * @param categoryId restricts the corpus to one category, or null for all documents
   * @return anomalies; empty when nothing clears the significance floor
   */
  List<AnomalyResult> detectAnomalies(UUID categoryId);
}
