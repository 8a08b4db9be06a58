package com.flamingo.ai.kbanalytics.service.similarity;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.DuplicateType;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of DuplicateDetectionService on top of the similarity index.
 *
 * <p>Each embedded document is ranked against the documents after it in id order, so every pair is
 * compared once. At most {@code analytics.similarity.duplicate-max-documents} documents are
 * compared, the most recently created first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateDetectionServiceImpl implements DuplicateDetectionService {

  private static final Comparator<DocumentDuplicate> MOST_SIMILAR_FIRST =
      Comparator.comparingDouble(DocumentDuplicate::similarity)
          .reversed()
          .thenComparing(duplicate -> duplicate.document1().documentId().toString())
          .thenComparing(duplicate -> duplicate.document2().documentId().toString());

  private final CorpusService corpusService;
  private final SimilarityIndex similarityIndex;
  private final AnalyticsConfig analyticsConfig;

  @Override
  @Timed(value = "similarity.duplicates", description = "Time to detect duplicate documents")
  public DuplicateReport detectDuplicates(Double threshold, UUID categoryId) {
    AnalyticsConfig.Similarity config = analyticsConfig.getSimilarity();
    double resolved = threshold != null ? threshold : config.getDuplicateThreshold();
    if (Double.isNaN(resolved) || resolved < 0.0 || resolved > 1.0) {
      throw new AnalyticsValidationException(
          "threshold must be between 0 and 1, got " + resolved);
    }

    List<DocumentProfile> documents =
        corpusService.getProfiles(categoryId).stream()
            .filter(DocumentProfile::hasEmbedding)
            .sorted(
                Comparator.comparing(
                        DocumentProfile::createdAt,
                        Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(profile -> profile.documentId().toString()))
            .limit(config.getDuplicateMaxDocuments())
            .sorted(Comparator.comparing(profile -> profile.documentId().toString()))
            .toList();

    Map<UUID, DocumentProfile> byId = new HashMap<>();
    documents.forEach(profile -> byId.put(profile.documentId(), profile));

    List<DocumentDuplicate> duplicates = new ArrayList<>();
    for (int i = 0; i < documents.size() - 1; i++) {
      DocumentProfile first = documents.get(i);
      List<EmbeddedDocument> later =
          documents.subList(i + 1, documents.size()).stream()
              .map(DocumentProfile::toEmbedded)
              .toList();
      for (SimilarityMatch match :
          similarityIndex.topSimilar(first.vector(), later, later.size(), resolved)) {
        DocumentProfile second = byId.get(match.documentId());
        duplicates.add(
            new DocumentDuplicate(
                describe(first),
                describe(second),
                match.similarity(),
                DuplicateType.classify(match.similarity(), sameAuthor(first, second))));
      }
    }
    duplicates.sort(MOST_SIMILAR_FIRST);

    double average =
        duplicates.stream().mapToDouble(DocumentDuplicate::similarity).average().orElse(0.0);
    log.debug(
        "Found {} duplicate pairs among {} documents (threshold={})",
        duplicates.size(),
        documents.size(),
        resolved);
    return new DuplicateReport(
        List.copyOf(duplicates),
        duplicates.size(),
        documents.size(),
        average,
        resolved,
        LocalDateTime.now());
  }

  /** Documents without a recorded author never count as written by the same person. */
  private static boolean sameAuthor(DocumentProfile first, DocumentProfile second) {
    return first.authorId() != null && first.authorId().equals(second.authorId());
  }

  private static DuplicateDocument describe(DocumentProfile profile) {
    return new DuplicateDocument(
        profile.documentId(),
        profile.displayTitle(),
        profile.authorId(),
        profile.authorName(),
        profile.createdAt());
  }
}
