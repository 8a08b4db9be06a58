package com.flamingo.ai.kbanalytics.service.clustering;

import java.util.UUID;

/** Cluster membership of one document and its cosine similarity to the cluster centroid. */
public record ClusterAssignment(UUID documentId, int clusterId, double similarity) {}
