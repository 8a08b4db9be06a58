package com.flamingo.ai.kbanalytics.service.trend;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of TrendService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendServiceImpl implements TrendService {

  private final CorpusService corpusService;
  private final TrendAnalyzer trendAnalyzer;
  private final AnalyticsConfig analyticsConfig;

  @Override
  @Timed(value = "trend.analyze", description = "Time to compute trend analysis")
  public TrendAnalysis getTrendAnalysis(Integer days) {
    AnalyticsConfig.Trend config = analyticsConfig.getTrend();
    int window = days != null ? days : config.getDefaultDays();
    if (window < 1 || window > config.getMaxDays()) {
      throw new AnalyticsValidationException(
          "days must be between 1 and " + config.getMaxDays() + ", got " + window);
    }

    LocalDateTime periodEnd = LocalDateTime.now();
    TrendAnalysis analysis =
        trendAnalyzer.analyze(
            corpusService.getProfilesCreatedSince(periodEnd.minusDays(window)), periodEnd, window);
    log.debug(
        "Trend analysis over {} days: {} topics, {} keywords",
        window,
        analysis.trendingTopics().size(),
        analysis.trendingKeywords().size());
    return analysis;
  }
}
