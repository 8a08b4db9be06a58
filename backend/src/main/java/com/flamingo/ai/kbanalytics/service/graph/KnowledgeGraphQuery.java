package com.flamingo.ai.kbanalytics.service.graph;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;

/**
 * Validated graph build parameters.
 *
 * @param threshold minimum cosine similarity for a similarity edge, in [0, 1]
 * @param maxEdges maximum similarity edges per document node, in (0, hard cap]
 * @param includePeople adds person nodes from the team expertise map
 */
public record KnowledgeGraphQuery(
    double threshold,
    int maxEdges,
    boolean includeTopics,
    boolean includeTechnologies,
    boolean includeInsights,
    boolean includePeople,
    int maxDocuments) {

  /**
   * Applies configured defaults to absent parameters and validates the result.
   *
   * @throws AnalyticsValidationException if a parameter is out of range
   */
  public static KnowledgeGraphQuery resolve(
      Double threshold,
      Integer maxEdges,
      Boolean includeTopics,
      Boolean includeTechnologies,
      Boolean includeInsights,
      Boolean includePeople,
      Integer maxDocuments,
      AnalyticsConfig.Graph config) {
    double resolvedThreshold = threshold != null ? threshold : config.getDefaultThreshold();
    int resolvedMaxEdges = maxEdges != null ? maxEdges : config.getDefaultMaxEdges();
    int resolvedMaxDocuments =
        maxDocuments != null ? maxDocuments : config.getDefaultMaxDocuments();

    if (Double.isNaN(resolvedThreshold) || resolvedThreshold < 0.0 || resolvedThreshold > 1.0) {
      throw new AnalyticsValidationException(
          "threshold must be between 0 and 1, got " + resolvedThreshold);
    }
    if (resolvedMaxEdges <= 0 || resolvedMaxEdges > config.getMaxEdgesHardCap()) {
      throw new AnalyticsValidationException(
          "maxEdges must be between 1 and "
              + config.getMaxEdgesHardCap()
              + ", got "
              + resolvedMaxEdges);
    }
    if (resolvedMaxDocuments < 1) {
      throw new AnalyticsValidationException(
          "maxDocuments must be at least 1, got " + resolvedMaxDocuments);
    }

    return new KnowledgeGraphQuery(
        resolvedThreshold,
        resolvedMaxEdges,
        includeTopics == null || includeTopics,
        includeTechnologies == null || includeTechnologies,
        includeInsights != null && includeInsights,
        includePeople != null && includePeople,
        resolvedMaxDocuments);
  }
}
