package com.flamingo.ai.kbanalytics.service.similarity;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.exception.EmbeddingNotFoundException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.keyword.KeywordExtractor;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of SimilarDocumentService using the brute-force similarity index. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilarDocumentServiceImpl implements SimilarDocumentService {

  private static final int CONTENT_KEYWORDS = 20;

  private final CorpusService corpusService;
  private final SimilarityIndex similarityIndex;
  private final KeywordExtractor keywordExtractor;
  private final AnalyticsConfig analyticsConfig;

  @Override
  @Timed(value = "similarity.query", description = "Time to find similar documents")
  public List<DocumentSimilarity> findSimilarDocuments(
      UUID documentId, Integer limit, Double minSimilarity) {
    AnalyticsConfig.Similarity config = analyticsConfig.getSimilarity();
    int resolvedLimit = limit != null ? limit : config.getDefaultLimit();
    double resolvedMin = minSimilarity != null ? minSimilarity : config.getDefaultMinSimilarity();
    if (resolvedLimit < 1 || resolvedLimit > config.getMaxLimit()) {
      throw new AnalyticsValidationException(
          "limit must be between 1 and " + config.getMaxLimit() + ", got " + resolvedLimit);
    }
    if (Double.isNaN(resolvedMin) || resolvedMin < -1.0 || resolvedMin > 1.0) {
      throw new AnalyticsValidationException(
          "minSimilarity must be between -1 and 1, got " + resolvedMin);
    }

    DocumentProfile query = corpusService.getProfile(documentId);
    if (!query.hasEmbedding()) {
      throw new EmbeddingNotFoundException(documentId);
    }

    Map<UUID, DocumentProfile> candidates =
        corpusService.getProfiles(null).stream()
            .filter(DocumentProfile::hasEmbedding)
            .filter(profile -> !profile.documentId().equals(documentId))
            .collect(Collectors.toMap(DocumentProfile::documentId, Function.identity()));

    List<SimilarityMatch> matches =
        similarityIndex.topSimilar(
            query.vector(),
            candidates.values().stream().map(DocumentProfile::toEmbedded).toList(),
            resolvedLimit,
            resolvedMin);

    Set<String> queryKeywords = keywordsOf(query);
    List<DocumentSimilarity> results = new ArrayList<>(matches.size());
    for (SimilarityMatch match : matches) {
      DocumentProfile other = candidates.get(match.documentId());
      results.add(
          new DocumentSimilarity(
              other.documentId(),
              other.displayTitle(),
              match.similarity(),
              sharedKeywords(queryKeywords, keywordsOf(other), config.getSharedKeywordLimit())));
    }

    log.debug(
        "Found {} documents similar to {} (limit={}, minSimilarity={})",
        results.size(),
        documentId,
        resolvedLimit,
        resolvedMin);
    return results;
  }

  /** Extracted labels first, then the strongest content keywords, all lowercase. */
  private Set<String> keywordsOf(DocumentProfile profile) {
    Set<String> keywords = new LinkedHashSet<>();
    profile.topics().forEach(topic -> keywords.add(topic.trim().toLowerCase(Locale.ROOT)));
    profile.technologies().forEach(tech -> keywords.add(tech.trim().toLowerCase(Locale.ROOT)));
    keywords.addAll(
        keywordExtractor.extractKeywords(
            profile.displayTitle() + "\n" + (profile.content() == null ? "" : profile.content()),
            CONTENT_KEYWORDS));
    keywords.remove("");
    return keywords;
  }

  private static List<String> sharedKeywords(Set<String> mine, Set<String> theirs, int limit) {
    return mine.stream().filter(theirs::contains).limit(limit).toList();
  }
}
