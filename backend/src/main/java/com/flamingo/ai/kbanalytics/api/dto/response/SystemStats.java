package com.flamingo.ai.kbanalytics.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for corpus and clustering job counters. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalDocuments;
  private long embeddedDocuments;
  private long runningJobs;
  private long pendingJobs;
  private long completedJobs;
  private long failedJobs;
  private LocalDateTime timestamp;
}
