package com.flamingo.ai.kbanalytics.service.trend;

import com.flamingo.ai.kbanalytics.domain.enums.TrendDirection;

public record TrendingKeyword(
    String keyword, long count, double growthRate, TrendDirection trendDirection) {}
