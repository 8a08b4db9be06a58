package com.flamingo.ai.kbanalytics.service.clustering;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read-only view of a clustering job as returned to API callers. {@code numClusters} is absent
 * until the worker has chosen a count for jobs submitted without one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusteringJobSnapshot(
    UUID id,
    JobStatus status,
    ClusteringAlgorithm algorithm,
    Integer numClusters,
    int totalDocuments,
    int documentsProcessed,
    int progressPercent,
    LocalDateTime createdAt,
    LocalDateTime startedAt,
    LocalDateTime completedAt,
    String errorMessage) {}
