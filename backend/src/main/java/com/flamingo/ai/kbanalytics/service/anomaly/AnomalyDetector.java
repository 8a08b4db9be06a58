package com.flamingo.ai.kbanalytics.service.anomaly;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.AnomalyType;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.keyword.KeywordExtractor;
import com.flamingo.ai.kbanalytics.service.keyword.LabelNormalizer;
import com.flamingo.ai.kbanalytics.service.vector.VectorMath;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores each document against corpus baselines and reports the single largest deviation.
 *
 * <p>Every signal is a z-score {@code (x - mean) / max(std, floor)} over the documents that have
 * the underlying feature:
 *
 * <ul>
 *   <li>content outlier: cosine distance to the centroid of all embedded documents
 *   <li>length: word count
 *   <li>topic mismatch: cosine distance to the centroid of documents sharing the primary topic
 *   <li>style: mean sentence length, mean word length and punctuation ratio, strongest of the three
 *   <li>temporal: creation time in days
 * </ul>
 *
 * <p>A document is reported only when its largest |z| exceeds {@code
 * analytics.anomaly.significance-floor}. Ties keep the type listed first above.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

  private static final double DISTANCE_STD_FLOOR = 0.01;
  private static final double WORD_LENGTH_STD_FLOOR = 0.1;
  private static final double PUNCTUATION_STD_FLOOR = 0.005;
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

  private final KeywordExtractor keywordExtractor;
  private final AnalyticsConfig analyticsConfig;

  public List<AnomalyResult> detect(List<DocumentProfile> documents) {
    AnalyticsConfig.Anomaly config = analyticsConfig.getAnomaly();
    if (documents.size() < config.getMinCorpusSize()) {
      log.debug("Skipping anomaly detection: only {} documents", documents.size());
      return List.of();
    }

    Map<UUID, Deviation> strongest = new LinkedHashMap<>();
    double stdFloor = config.getMinStdDev();

    scoreContentOutliers(documents, strongest);
    scoreLength(documents, stdFloor, strongest);
    scoreTopicMismatch(documents, strongest);
    scoreStyle(documents, stdFloor, strongest);
    scoreTemporal(documents, stdFloor, strongest);

    Map<UUID, DocumentProfile> byId = new HashMap<>();
    documents.forEach(document -> byId.put(document.documentId(), document));

    return strongest.entrySet().stream()
        .filter(entry -> Math.abs(entry.getValue().z()) > config.getSignificanceFloor())
        .map(
            entry -> {
              Deviation deviation = entry.getValue();
              return new AnomalyResult(
                  entry.getKey(),
                  byId.get(entry.getKey()).displayTitle(),
                  Math.abs(deviation.z()),
                  deviation.type(),
                  deviation.explanation());
            })
        .sorted(
            Comparator.comparingDouble(AnomalyResult::anomalyScore)
                .reversed()
                .thenComparing(result -> result.documentId().toString()))
        .limit(config.getMaxResults())
        .toList();
  }

  private void scoreLength(
      List<DocumentProfile> documents, double stdFloor, Map<UUID, Deviation> strongest) {
    Map<UUID, Double> wordCounts = new LinkedHashMap<>();
    documents.forEach(
        document ->
            wordCounts.put(
                document.documentId(),
                (double) keywordExtractor.tokenize(document.content()).size()));
    Baseline baseline = Baseline.of(wordCounts.values(), stdFloor);
    wordCounts.forEach(
        (id, words) ->
            offer(
                strongest,
                id,
                AnomalyType.LENGTH_ANOMALY,
                baseline.z(words),
                String.format(
                    Locale.ROOT,
                    "Document has %.0f words against a corpus mean of %.1f (z=%.2f)",
                    words,
                    baseline.mean(),
                    baseline.z(words))));
  }

  private void scoreContentOutliers(
      List<DocumentProfile> documents, Map<UUID, Deviation> strongest) {
    List<DocumentProfile> embedded =
        documents.stream().filter(DocumentProfile::hasEmbedding).toList();
    if (embedded.size() < analyticsConfig.getAnomaly().getMinCorpusSize()) {
      return;
    }
    float[] centroid = VectorMath.centroid(embedded.stream().map(DocumentProfile::vector).toList());
    Map<UUID, Double> distances = new LinkedHashMap<>();
    embedded.forEach(
        document ->
            distances.put(
                document.documentId(), VectorMath.cosineDistance(document.vector(), centroid)));
    Baseline baseline = Baseline.of(distances.values(), DISTANCE_STD_FLOOR);
    distances.forEach(
        (id, distance) ->
            offer(
                strongest,
                id,
                AnomalyType.CONTENT_OUTLIER,
                baseline.z(distance),
                String.format(
                    Locale.ROOT,
                    "Content is semantically distant from the rest of the corpus "
                        + "(distance %.3f, corpus mean %.3f, z=%.2f)",
                    distance,
                    baseline.mean(),
                    baseline.z(distance))));
  }

  private void scoreTopicMismatch(
      List<DocumentProfile> documents, Map<UUID, Deviation> strongest) {
    Map<String, List<DocumentProfile>> byTopic = new LinkedHashMap<>();
    for (DocumentProfile document : documents) {
      if (document.hasEmbedding() && document.primaryTopic() != null) {
        String key = LabelNormalizer.normalize(document.primaryTopic());
        if (key.isEmpty()) {
          continue;
        }
        byTopic.computeIfAbsent(key, k -> new ArrayList<>()).add(document);
      }
    }

    Map<UUID, Double> distances = new LinkedHashMap<>();
    Map<UUID, String> topics = new HashMap<>();
    for (List<DocumentProfile> group : byTopic.values()) {
      if (group.size() < 2) {
        continue;
      }
      float[] centroid = VectorMath.centroid(group.stream().map(DocumentProfile::vector).toList());
      for (DocumentProfile document : group) {
        distances.put(
            document.documentId(), VectorMath.cosineDistance(document.vector(), centroid));
        topics.put(document.documentId(), document.primaryTopic());
      }
    }
    if (distances.size() < analyticsConfig.getAnomaly().getMinCorpusSize()) {
      return;
    }

    Baseline baseline = Baseline.of(distances.values(), DISTANCE_STD_FLOOR);
    distances.forEach(
        (id, distance) ->
            offer(
                strongest,
                id,
                AnomalyType.TOPIC_MISMATCH,
                baseline.z(distance),
                String.format(
                    Locale.ROOT,
                    "Content does not match other documents on '%s' (distance %.3f, z=%.2f)",
                    topics.get(id),
                    distance,
                    baseline.z(distance))));
  }

  private void scoreStyle(
      List<DocumentProfile> documents, double stdFloor, Map<UUID, Deviation> strongest) {
    Map<UUID, double[]> features = new LinkedHashMap<>();
    for (DocumentProfile document : documents) {
      String content = document.content() == null ? "" : document.content();
      List<String> words = keywordExtractor.tokenize(content);
      if (words.isEmpty()) {
        continue;
      }
      long sentences = Math.max(1, SENTENCE_END.split(content.trim()).length);
      double meanSentenceLength = (double) words.size() / sentences;
      double meanWordLength = words.stream().mapToInt(String::length).average().orElse(0);
      long punctuation =
          content
              .chars()
              .filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c))
              .count();
      double punctuationRatio = (double) punctuation / Math.max(1, content.length());
      features.put(
          document.documentId(),
          new double[] {meanSentenceLength, meanWordLength, punctuationRatio});
    }
    if (features.size() < analyticsConfig.getAnomaly().getMinCorpusSize()) {
      return;
    }

    String[] names = {"sentence length", "word length", "punctuation ratio"};
    double[] floors = {stdFloor, WORD_LENGTH_STD_FLOOR, PUNCTUATION_STD_FLOOR};
    Baseline[] baselines = new Baseline[names.length];
    for (int f = 0; f < names.length; f++) {
      int feature = f;
      List<Double> column = features.values().stream().map(values -> values[feature]).toList();
      baselines[f] = Baseline.of(column, floors[f]);
    }

    features.forEach(
        (id, values) -> {
          int worst = 0;
          for (int f = 1; f < names.length; f++) {
            if (Math.abs(baselines[f].z(values[f])) > Math.abs(baselines[worst].z(values[worst]))) {
              worst = f;
            }
          }
          double z = baselines[worst].z(values[worst]);
          offer(
              strongest,
              id,
              AnomalyType.STYLE_DEVIATION,
              z,
              String.format(
                  Locale.ROOT,
                  "Writing style differs from the corpus: mean %s %.2f against %.2f (z=%.2f)",
                  names[worst],
                  values[worst],
                  baselines[worst].mean(),
                  z));
        });
  }

  private void scoreTemporal(
      List<DocumentProfile> documents, double stdFloor, Map<UUID, Deviation> strongest) {
    Map<UUID, Double> days = new LinkedHashMap<>();
    for (DocumentProfile document : documents) {
      if (document.createdAt() != null) {
        days.put(
            document.documentId(),
            document.createdAt().toEpochSecond(ZoneOffset.UTC) / 86_400.0);
      }
    }
    if (days.size() < analyticsConfig.getAnomaly().getMinCorpusSize()) {
      return;
    }
    Baseline baseline = Baseline.of(days.values(), stdFloor);
    days.forEach(
        (id, day) ->
            offer(
                strongest,
                id,
                AnomalyType.TEMPORAL_ANOMALY,
                baseline.z(day),
                String.format(
                    Locale.ROOT,
                    "Created %.1f days %s the corpus average (z=%.2f)",
                    Math.abs(day - baseline.mean()),
                    day >= baseline.mean() ? "after" : "before",
                    baseline.z(day))));
  }

  /** Keeps the deviation with the larger |z|; on a tie the earlier one stays. */
  private static void offer(
      Map<UUID, Deviation> strongest, UUID id, AnomalyType type, double z, String explanation) {
    Deviation current = strongest.get(id);
    if (current == null || Math.abs(z) > Math.abs(current.z())) {
      strongest.put(id, new Deviation(type, z, explanation));
    }
  }

  private record Deviation(AnomalyType type, double z, String explanation) {}

  /** Population mean and floored standard deviation of one feature. */
  private record Baseline(double mean, double std) {

    static Baseline of(Collection<Double> values, double stdFloor) {
      double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
      double variance =
          values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0.0);
      return new Baseline(mean, Math.max(Math.sqrt(variance), stdFloor));
    }

    double z(double value) {
      return (value - mean) / std;
    }
  }
}
