package com.flamingo.ai.kbanalytics.service.health;

import com.flamingo.ai.kbanalytics.api.dto.response.SystemStats;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import com.flamingo.ai.kbanalytics.service.clustering.ClusteringJobRegistry;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final CorpusService corpusService;
  private final ClusteringJobRegistry jobRegistry;

  @Override
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    return SystemStats.builder()
        .totalDocuments(corpusService.countDocuments())
        .embeddedDocuments(corpusService.countEmbeddedDocuments())
        .pendingJobs(jobRegistry.countByStatus(JobStatus.PENDING))
        .runningJobs(jobRegistry.countByStatus(JobStatus.RUNNING))
        .completedJobs(jobRegistry.countByStatus(JobStatus.COMPLETED))
        .failedJobs(jobRegistry.countByStatus(JobStatus.FAILED))
        .timestamp(LocalDateTime.now())
        .build();
  }
}
