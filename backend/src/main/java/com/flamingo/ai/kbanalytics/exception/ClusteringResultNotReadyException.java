package com.flamingo.ai.kbanalytics.exception;

import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import java.util.UUID;

/** Exception thrown when a result is requested for a job that has not completed. */
public class ClusteringResultNotReadyException extends RuntimeException {

  private final UUID jobId;
  private final JobStatus status;
  private final String userMessage;

  public ClusteringResultNotReadyException(UUID jobId, JobStatus status, String errorMessage) {
    super("Clustering job " + jobId + " has no result, status: " + status);
    this.jobId = jobId;
    this.status = status;
    this.userMessage =
        status == JobStatus.FAILED
            ? "Clustering job failed: " + errorMessage
            : "Clustering job is still " + status.wireName() + ". Poll the job and retry.";
  }

  public UUID getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
