package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a clustering job. */
public enum JobStatus {
  /** Job has been accepted but the worker has not picked it up yet. */
  PENDING,

  /** Worker is partitioning the corpus snapshot. */
  RUNNING,

  /** Result is available. Terminal. */
  COMPLETED,

  /** Worker failed; the error message is retained on the job. Terminal. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
