package com.flamingo.ai.kbanalytics.service.trend;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.TrendDirection;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.keyword.KeywordExtractor;
import com.flamingo.ai.kbanalytics.service.keyword.LabelNormalizer;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Buckets document creation times over a window and derives per-topic and per-keyword growth.
 *
 * <p>Growth rate is {@code (last - first) / max(first, 1)} over the bucket counts. Rates above
 * {@code analytics.trend.stable-band} are {@link TrendDirection#UP}, below its negation {@link
 * TrendDirection#DOWN}, anything in between {@link TrendDirection#STABLE}.
 *
 * <p>Buckets all have the full granularity width and end at {@code periodEnd}. When the window is
 * not a multiple of the width, the partial remainder at the start of the window is dropped so the
 * first and last buckets compare like with like.
 */
@Component
@RequiredArgsConstructor
public class TrendAnalyzer {

  private final KeywordExtractor keywordExtractor;
  private final AnalyticsConfig analyticsConfig;

  /**
   * Analyzes documents created in the bucketed part of {@code [periodEnd - days, periodEnd]};
   * others are ignored. The returned {@code periodStart} is the start of the first full bucket.
   *
   * @param days window length in days, at least 1
   */
  public TrendAnalysis analyze(List<DocumentProfile> documents, LocalDateTime periodEnd, int days) {
    TrendGranularity granularity = TrendGranularity.forWindow(days);
    int bucketCount = Math.max(days / granularity.getDays(), 1);
    LocalDateTime periodStart = periodEnd.minusDays((long) bucketCount * granularity.getDays());
    Duration bucketWidth = Duration.ofDays(granularity.getDays());

    long[] volume = new long[bucketCount];
    Map<String, long[]> topicBuckets = new HashMap<>();
    Map<String, String> topicSpelling = new HashMap<>();
    Map<String, long[]> keywordBuckets = new HashMap<>();

    for (DocumentProfile document : documents) {
      LocalDateTime createdAt = document.createdAt();
      if (createdAt == null || createdAt.isBefore(periodStart) || createdAt.isAfter(periodEnd)) {
        continue;
      }
      long offset = Duration.between(periodStart, createdAt).toMillis() / bucketWidth.toMillis();
      // periodEnd itself belongs to the last bucket
      int bucket = (int) Math.min(offset, bucketCount - 1);
      volume[bucket]++;

      for (String topic : distinctLabels(document.topics(), topicSpelling)) {
        topicBuckets.computeIfAbsent(topic, k -> new long[bucketCount])[bucket]++;
      }
      String text =
          document.displayTitle() + "\n" + (document.content() == null ? "" : document.content());
      for (String keyword : new LinkedHashSet<>(keywordExtractor.significantTerms(text))) {
        keywordBuckets.computeIfAbsent(keyword, k -> new long[bucketCount])[bucket]++;
      }
    }

    AnalyticsConfig.Trend config = analyticsConfig.getTrend();
    double band = config.getStableBand();

    List<TrendingTopic> topics =
        rank(topicBuckets, config.getTopTopics()).stream()
            .map(
                entry -> {
                  double growth = growthRate(entry.getValue());
                  return new TrendingTopic(
                      topicSpelling.get(entry.getKey()),
                      sum(entry.getValue()),
                      growth,
                      classify(growth, band),
                      boxed(entry.getValue()));
                })
            .toList();

    List<TrendingKeyword> keywords =
        rank(keywordBuckets, config.getTopKeywords()).stream()
            .map(
                entry -> {
                  double growth = growthRate(entry.getValue());
                  return new TrendingKeyword(
                      entry.getKey(), sum(entry.getValue()), growth, classify(growth, band));
                })
            .toList();

    List<TimeSeriesPoint> documentVolume = new ArrayList<>(bucketCount);
    for (int i = 0; i < bucketCount; i++) {
      documentVolume.add(
          new TimeSeriesPoint(periodStart.plusDays((long) i * granularity.getDays()), volume[i]));
    }

    return new TrendAnalysis(
        periodStart, periodEnd, granularity, topics, keywords, List.copyOf(documentVolume));
  }

  /**
   * {@code (last - first) / max(first, 1)}; 0 for fewer than two buckets.
   *
   * @param bucketCounts counts ordered oldest first
   */
  public static double growthRate(long[] bucketCounts) {
    if (bucketCounts.length < 2) {
      return 0.0;
    }
    long first = bucketCounts[0];
    long last = bucketCounts[bucketCounts.length - 1];
    return (double) (last - first) / Math.max(first, 1);
  }

  public static TrendDirection classify(double growthRate, double stableBand) {
    if (growthRate > stableBand) {
      return TrendDirection.UP;
    }
    if (growthRate < -stableBand) {
      return TrendDirection.DOWN;
    }
    return TrendDirection.STABLE;
  }

  /** Most frequent first, then fastest growing, then alphabetical. */
  private static List<Map.Entry<String, long[]>> rank(Map<String, long[]> buckets, int limit) {
    Function<Map.Entry<String, long[]>, Long> total = entry -> sum(entry.getValue());
    Function<Map.Entry<String, long[]>, Double> growth = entry -> growthRate(entry.getValue());
    return buckets.entrySet().stream()
        .sorted(
            Comparator.comparing(total, Comparator.reverseOrder())
                .thenComparing(growth, Comparator.reverseOrder())
                .thenComparing(Map.Entry::getKey))
        .limit(limit)
        .toList();
  }

  private static Set<String> distinctLabels(List<String> labels, Map<String, String> spelling) {
    Set<String> keys = new LinkedHashSet<>();
    for (String label : labels) {
      if (label == null || label.isBlank()) {
        continue;
      }
      String key = LabelNormalizer.normalize(label);
      if (key.isEmpty()) {
        continue;
      }
      spelling.putIfAbsent(key, label.trim());
      keys.add(key);
    }
    return keys;
  }

  private static long sum(long[] values) {
    long total = 0;
    for (long value : values) {
      total += value;
    }
    return total;
  }

  private static List<Long> boxed(long[] values) {
    List<Long> list = new ArrayList<>(values.length);
    for (long value : values) {
      list.add(value);
    }
    return List.copyOf(list);
  }
}
