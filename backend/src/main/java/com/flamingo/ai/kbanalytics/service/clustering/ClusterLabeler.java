package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.keyword.KeywordExtractor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Names clusters after the labels their members share. Extracted topics and technologies are
 * preferred; members without any fall back to content keywords.
 */
@Component
@RequiredArgsConstructor
public class ClusterLabeler {

  private final KeywordExtractor keywordExtractor;
  private final AnalyticsConfig analyticsConfig;

  public ClusteringResult label(ClusteringResult result, Map<UUID, DocumentProfile> profiles) {
    int keywordCount = analyticsConfig.getClustering().getKeywordsPerCluster();
    List<DocumentCluster> labeled = new ArrayList<>(result.clusters().size());
    for (DocumentCluster cluster : result.clusters()) {
      List<DocumentProfile> members =
          cluster.memberDocumentIds().stream()
              .map(profiles::get)
              .filter(Objects::nonNull)
              .toList();
      List<String> keywords = keywordsFor(members, keywordCount);

      String name = "Cluster " + (cluster.id() + 1);
      if (!keywords.isEmpty()) {
        name += ": " + keywords.get(0);
      }
      String description =
          cluster.documentCount()
              + (cluster.documentCount() == 1 ? " document" : " documents")
              + (keywords.isEmpty() ? "" : " about " + String.join(", ", keywords));
      labeled.add(cluster.withLabels(name, description, keywords));
    }
    return result.withClusters(labeled);
  }

  private List<String> keywordsFor(List<DocumentProfile> members, int limit) {
    // Lowercase key -> first seen spelling, counted once per document
    Map<String, String> spelling = new LinkedHashMap<>();
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (DocumentProfile member : members) {
      List<String> labels = new ArrayList<>(member.topics());
      labels.addAll(member.technologies());
      labels.stream()
          .map(String::trim)
          .filter(label -> !label.isEmpty())
          .collect(
              Collectors.toMap(
                  label -> label.toLowerCase(Locale.ROOT), l -> l, (a, b) -> a, LinkedHashMap::new))
          .forEach(
              (key, label) -> {
                spelling.putIfAbsent(key, label);
                counts.merge(key, 1, Integer::sum);
              });
    }

    if (counts.isEmpty()) {
      String text =
          members.stream()
              .map(member -> member.displayTitle() + "\n" + nullToEmpty(member.content()))
              .collect(Collectors.joining("\n"));
      return keywordExtractor.extractKeywords(text, limit);
    }

    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(limit)
        .map(entry -> spelling.get(entry.getKey()))
        .toList();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
