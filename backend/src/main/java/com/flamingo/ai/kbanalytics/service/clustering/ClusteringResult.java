package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import java.util.List;

/**
 * Outcome of a clustering run. {@code effectiveAlgorithm} differs from {@code requestedAlgorithm}
 * when the requested algorithm has no dedicated implementation.
 */
public record ClusteringResult(
    List<DocumentCluster> clusters,
    List<ClusterAssignment> assignments,
    ClusteringMetrics metrics,
    ClusteringAlgorithm requestedAlgorithm,
    ClusteringAlgorithm effectiveAlgorithm) {

  public ClusteringResult withClusters(List<DocumentCluster> labeledClusters) {
    return new ClusteringResult(
        List.copyOf(labeledClusters), assignments, metrics, requestedAlgorithm, effectiveAlgorithm);
  }
}
