package com.flamingo.ai.kbanalytics.service.clustering;

import java.util.UUID;

/** Service interface for asynchronous document clustering. */
public interface ClusteringService {

  /**
   * Validates the request, snapshots the corpus and submits a job. Returns immediately.
   *
   * @param command clustering parameters
   * @return the job in {@code PENDING} status
   * @throws com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException for a bad cluster
   *     count or too few embedded documents
   */
  ClusteringJobSnapshot startClustering(StartClusteringCommand command);

  /**
   * Gets the current state of a job.
   *
   * @throws com.flamingo.ai.kbanalytics.exception.ClusteringJobNotFoundException if unknown
   */
  ClusteringJobSnapshot getJob(UUID jobId);

  /**
   * Gets the result of a completed job. Repeated calls return the same result.
   *
   * @throws com.flamingo.ai.kbanalytics.exception.ClusteringJobNotFoundException if unknown
   * @throws com.flamingo.ai.kbanalytics.exception.ClusteringResultNotReadyException if the job is
   *     not completed
   */
  ClusteringResult getResult(UUID jobId);
}
