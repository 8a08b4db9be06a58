package com.flamingo.ai.kbanalytics.service.trend;

/** Service interface for trend analysis. */
public interface TrendService {

  /**
   * Analyzes topic, keyword and volume trends over the last {@code days} days.
   *
   * @param days window length, null for the configured default
   * @return trend analysis ending now
   * @throws com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException if {@code days} is
   *     out of range
   */
  TrendAnalysis getTrendAnalysis(Integer days);
}
