package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import java.util.UUID;

/**
 * Parameters of a clustering submission. Null fields take the configured defaults.
 *
 * @param categoryId restricts the corpus to one category, or null for all documents
 */
public record StartClusteringCommand(
    Integer numClusters, ClusteringAlgorithm algorithm, UUID categoryId, Integer minDocuments) {}
