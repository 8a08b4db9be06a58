package com.flamingo.ai.kbanalytics.service.expertise;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.service.keyword.LabelNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Folds authorship records into per-user, per-area document counts.
 *
 * <p>An area is a topic or technology. Areas are matched on their {@link LabelNormalizer} key, the
 * same key graph nodes use, and keep the first spelling seen. A document counts at most once per
 * (user, area) pair, however often the label repeats.
 */
@Component
@RequiredArgsConstructor
public class ExpertiseAggregator {

  private static final Comparator<ExpertiseEntry> STRONGEST_FIRST =
      Comparator.comparingLong(ExpertiseEntry::documentCount)
          .reversed()
          .thenComparing(ExpertiseEntry::topic);

  private final AnalyticsConfig analyticsConfig;

  public TeamExpertiseMap aggregate(List<AuthorshipRecord> records) {
    Map<String, String> spelling = new HashMap<>();
    Map<UUID, MemberAccumulator> members = new LinkedHashMap<>();

    for (AuthorshipRecord record : records) {
      if (record.userId() == null) {
        continue;
      }
      MemberAccumulator member =
          members.computeIfAbsent(record.userId(), id -> new MemberAccumulator(record));
      member.documents.add(record.documentId());
      addAreas(record.topics(), record.documentId(), member.topics, spelling);
      addAreas(record.technologies(), record.documentId(), member.technologies, spelling);
    }

    AnalyticsConfig.Expertise config = analyticsConfig.getExpertise();
    List<MemberExpertise> memberViews = new ArrayList<>();
    List<ExpertiseEntry> allEntries = new ArrayList<>();
    // Area key -> members covering it, in key order
    Map<String, List<MemberAccumulator>> coverage = new TreeMap<>();

    for (Map.Entry<UUID, MemberAccumulator> entry : members.entrySet()) {
      UUID userId = entry.getKey();
      MemberAccumulator member = entry.getValue();

      Map<String, Set<UUID>> areas = new HashMap<>();
      member.topics.forEach(
          (key, docs) -> areas.computeIfAbsent(key, k -> new HashSet<>()).addAll(docs));
      member.technologies.forEach(
          (key, docs) -> areas.computeIfAbsent(key, k -> new HashSet<>()).addAll(docs));

      List<ExpertiseEntry> entries =
          areas.entrySet().stream()
              .map(
                  area ->
                      new ExpertiseEntry(
                          userId, spelling.get(area.getKey()), area.getValue().size()))
              .sorted(STRONGEST_FIRST)
              .toList();
      allEntries.addAll(entries);
      areas
          .keySet()
          .forEach(key -> coverage.computeIfAbsent(key, k -> new ArrayList<>()).add(member));

      memberViews.add(
          new MemberExpertise(
              userId,
              member.username,
              member.email,
              entries.stream().limit(config.getMaxAreasPerMember()).toList(),
              member.documents.size(),
              topLabels(member.technologies, spelling, config.getTopTechnologies()),
              topLabels(member.topics, spelling, config.getTopTopics())));
    }

    memberViews.sort(
        Comparator.comparingLong(MemberExpertise::totalDocuments)
            .reversed()
            .thenComparing(member -> member.userId().toString()));
    allEntries.sort(
        Comparator.comparing((ExpertiseEntry e) -> e.userId().toString())
            .thenComparing(STRONGEST_FIRST));

    List<String> sharedAreas = new ArrayList<>();
    List<UniqueExpert> uniqueExperts = new ArrayList<>();
    coverage.forEach(
        (key, covering) -> {
          if (covering.size() > 1) {
            sharedAreas.add(spelling.get(key));
          } else {
            MemberAccumulator expert = covering.get(0);
            uniqueExperts.add(new UniqueExpert(spelling.get(key), expert.userId, expert.username));
          }
        });

    return new TeamExpertiseMap(
        List.copyOf(memberViews),
        List.copyOf(allEntries),
        List.copyOf(sharedAreas),
        List.copyOf(uniqueExperts));
  }

  private static void addAreas(
      List<String> labels,
      UUID documentId,
      Map<String, Set<UUID>> target,
      Map<String, String> spelling) {
    if (labels == null) {
      return;
    }
    for (String label : labels) {
      if (label == null || label.isBlank()) {
        continue;
      }
      String key = LabelNormalizer.normalize(label);
      if (key.isEmpty()) {
        continue;
      }
      spelling.putIfAbsent(key, label.trim());
      target.computeIfAbsent(key, k -> new HashSet<>()).add(documentId);
    }
  }

  private static List<String> topLabels(
      Map<String, Set<UUID>> areas, Map<String, String> spelling, int limit) {
    return areas.entrySet().stream()
        .sorted(
            Comparator.comparingInt((Map.Entry<String, Set<UUID>> e) -> e.getValue().size())
                .reversed()
                .thenComparing(Map.Entry::getKey))
        .limit(limit)
        .map(e -> spelling.get(e.getKey()))
        .toList();
  }

  private static final class MemberAccumulator {
    private final UUID userId;
    private final String username;
    private final String email;
    private final Set<UUID> documents = new HashSet<>();
    private final Map<String, Set<UUID>> topics = new HashMap<>();
    private final Map<String, Set<UUID>> technologies = new HashMap<>();

    private MemberAccumulator(AuthorshipRecord first) {
      this.userId = first.userId();
      this.username = first.username();
      this.email = first.email();
    }
  }
}
