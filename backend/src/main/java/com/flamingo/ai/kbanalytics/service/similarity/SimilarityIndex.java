package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.Collection;
import java.util.List;

/**
 * Ranks a corpus against a query vector.
 *
 * <p>Implementations must be a pure function of their arguments so that an approximate index can
 * replace the brute-force one without changing callers.
 */
public interface SimilarityIndex {

  /**
   * Returns at most {@code limit} corpus entries whose cosine similarity to {@code query} is at
   * least {@code minSimilarity}, ordered by similarity descending and then by document id
   * ascending. Fewer entries are returned when fewer qualify.
   */
  List<SimilarityMatch> topSimilar(
      float[] query, Collection<EmbeddedDocument> corpus, int limit, double minSimilarity);
}
