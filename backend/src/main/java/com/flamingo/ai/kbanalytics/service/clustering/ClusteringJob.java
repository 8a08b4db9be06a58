package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Mutable state of one clustering job.
 *
 * <p>Only the worker running the job mutates it; any number of request threads may read it. All
 * transitions are synchronized and follow {@code PENDING -> RUNNING -> COMPLETED | FAILED}. A job
 * may also fail straight from {@code PENDING} when it never reaches a worker. Terminal jobs reject
 * every further transition.
 */
public class ClusteringJob {

  private final UUID id;
  private final ClusteringAlgorithm algorithm;
  private final int totalDocuments;
  private final LocalDateTime createdAt;

  private JobStatus status = JobStatus.PENDING;
  private Integer numClusters;
  private int documentsProcessed;
  private int progressPercent;
  private LocalDateTime startedAt;
  private LocalDateTime completedAt;
  private String errorMessage;
  private ClusteringResult result;

  /**
   * @param numClusters requested cluster count, or null to let the worker choose one
   */
  public ClusteringJob(
      UUID id, ClusteringAlgorithm algorithm, Integer numClusters, int totalDocuments) {
    this.id = id;
    this.algorithm = algorithm;
    this.numClusters = numClusters;
    this.totalDocuments = totalDocuments;
    this.createdAt = LocalDateTime.now();
  }

  public UUID getId() {
    return id;
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  public synchronized LocalDateTime getCompletedAt() {
    return completedAt;
  }

  public LocalDateTime getCreatedAt() {
    return createdAt;
  }

  public synchronized ClusteringResult getResult() {
    return result;
  }

  public synchronized String getErrorMessage() {
    return errorMessage;
  }

  public synchronized void start() {
    requireStatus(JobStatus.PENDING, "start");
    status = JobStatus.RUNNING;
    startedAt = LocalDateTime.now();
  }

  /** Sets the cluster count chosen by the worker for a job submitted without one. */
  public synchronized void resolveNumClusters(int k) {
    requireStatus(JobStatus.RUNNING, "resolve cluster count of");
    if (numClusters != null) {
      throw new IllegalStateException(
          "Clustering job " + id + " already has " + numClusters + " clusters");
    }
    numClusters = k;
  }

  /** Records progress; values lower than the current ones are ignored. */
  public synchronized void updateProgress(int percent, int processed) {
    requireStatus(JobStatus.RUNNING, "update progress of");
    progressPercent = Math.max(progressPercent, Math.min(percent, 99));
    documentsProcessed = Math.max(documentsProcessed, Math.min(processed, totalDocuments));
  }

  public synchronized void complete(ClusteringResult clusteringResult) {
    requireStatus(JobStatus.RUNNING, "complete");
    status = JobStatus.COMPLETED;
    result = clusteringResult;
    progressPercent = 100;
    documentsProcessed = totalDocuments;
    completedAt = LocalDateTime.now();
  }

  public synchronized void fail(String message) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Cannot fail clustering job " + id + " in status " + status);
    }
    status = JobStatus.FAILED;
    errorMessage = message;
    completedAt = LocalDateTime.now();
  }

  /** Consistent point-in-time copy for callers outside the worker. */
  public synchronized ClusteringJobSnapshot snapshot() {
    return new ClusteringJobSnapshot(
        id,
        status,
        algorithm,
        numClusters,
        totalDocuments,
        documentsProcessed,
        progressPercent,
        createdAt,
        startedAt,
        completedAt,
        errorMessage);
  }

  private void requireStatus(JobStatus expected, String action) {
    if (status != expected) {
      throw new IllegalStateException(
          "Cannot " + action + " clustering job " + id + " in status " + status);
    }
  }
}
