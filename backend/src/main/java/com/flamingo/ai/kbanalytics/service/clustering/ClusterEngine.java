package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import java.util.List;

/** Partitions a set of embedded documents into k clusters. */
public interface ClusterEngine {

  /**
   * Clusters {@code documents} into exactly {@code k} non-empty clusters.
   *
   * @throws com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException if {@code k <= 0}
   *     or {@code k} exceeds the number of documents
   * @throws com.flamingo.ai.kbanalytics.exception.DimensionMismatchException if the vectors differ
   *     in length
   */
  ClusteringResult cluster(
      List<EmbeddedDocument> documents,
      int k,
      ClusteringAlgorithm algorithm,
      ClusteringProgressListener listener);

  /**
   * Chooses a cluster count for {@code documents} when the caller did not ask for one.
   *
   * @return a count between 1 and the number of documents
   */
  int chooseClusterCount(List<EmbeddedDocument> documents);
}
