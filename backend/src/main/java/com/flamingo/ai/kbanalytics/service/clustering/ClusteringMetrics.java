package com.flamingo.ai.kbanalytics.service.clustering;

/**
 * Quality metrics for a clustering run.
 *
 * @param silhouetteScore mean silhouette in [-1, 1]; 0.0 when fewer than two clusters exist or any
 *     cluster has fewer than two members
 * @param inertia sum of squared Euclidean distances from each document to its centroid
 */
public record ClusteringMetrics(
    double silhouetteScore,
    double inertia,
    int numClusters,
    int totalDocuments,
    int iterations,
    boolean converged) {}
