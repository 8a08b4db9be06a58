package com.flamingo.ai.kbanalytics.service.anomaly;

import com.flamingo.ai.kbanalytics.domain.enums.AnomalyType;
import java.util.UUID;

/**
 * A document whose strongest deviation from the corpus cleared the significance floor.
 *
 * @param anomalyScore absolute z-score of that deviation
 */
public record AnomalyResult(
    UUID documentId,
    String title,
    double anomalyScore,
    AnomalyType anomalyType,
    String explanation) {}
