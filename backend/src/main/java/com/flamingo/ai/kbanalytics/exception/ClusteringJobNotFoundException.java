package com.flamingo.ai.kbanalytics.exception;

import java.util.UUID;

/** Exception thrown when a clustering job id is unknown or its retention has run out. */
public class ClusteringJobNotFoundException extends RuntimeException {

  private final UUID jobId;

  public ClusteringJobNotFoundException(UUID jobId) {
    super("Clustering job not found or expired: " + jobId);
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }
}
