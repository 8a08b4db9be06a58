package com.flamingo.ai.kbanalytics.service.trend;

import com.flamingo.ai.kbanalytics.domain.enums.TrendDirection;
import java.util.List;

/**
 * @param count documents mentioning the topic within the window
 * @param bucketCounts per-bucket document counts, oldest first
 */
public record TrendingTopic(
    String topic,
    long count,
    double growthRate,
    TrendDirection trendDirection,
    List<Long> bucketCounts) {}
