package com.flamingo.ai.kbanalytics.service.trend;

import java.time.LocalDateTime;
import java.util.List;

/** Topic, keyword and volume trends over one analysis window. */
public record TrendAnalysis(
    LocalDateTime periodStart,
    LocalDateTime periodEnd,
    TrendGranularity granularity,
    List<TrendingTopic> trendingTopics,
    List<TrendingKeyword> trendingKeywords,
    List<TimeSeriesPoint> documentVolume) {}
