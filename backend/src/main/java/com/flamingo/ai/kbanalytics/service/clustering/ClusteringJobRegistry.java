package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import com.flamingo.ai.kbanalytics.exception.ClusteringJobNotFoundException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory store of clustering jobs keyed by job id.
 *
 * <p>Each job is written only by its worker; readers go through {@link ClusteringJob#snapshot()}.
 * A terminal job stays queryable for {@code analytics.clustering.job-retention} after it finished
 * and is purged on the next registration after that. Running and pending jobs are never purged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusteringJobRegistry {

  private final Map<UUID, ClusteringJob> jobs = new ConcurrentHashMap<>();
  private final AnalyticsConfig analyticsConfig;

  public void register(ClusteringJob job) {
    purgeExpired(LocalDateTime.now());
    jobs.put(job.getId(), job);
  }

  public Optional<ClusteringJob> find(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  public ClusteringJob get(UUID jobId) {
    return find(jobId).orElseThrow(() -> new ClusteringJobNotFoundException(jobId));
  }

  public long countByStatus(JobStatus status) {
    return jobs.values().stream().filter(job -> job.getStatus() == status).count();
  }

  public int size() {
    return jobs.size();
  }

  /** Removes terminal jobs that finished more than the retention period before {@code now}. */
  void purgeExpired(LocalDateTime now) {
    LocalDateTime cutoff = now.minus(analyticsConfig.getClustering().getJobRetention());
    List<ClusteringJob> expired =
        jobs.values().stream()
            .filter(job -> job.getStatus().isTerminal())
            .filter(job -> job.getCompletedAt().isBefore(cutoff))
            .toList();
    expired.forEach(job -> jobs.remove(job.getId()));
    if (!expired.isEmpty()) {
      log.debug("Purged {} expired clustering jobs", expired.size());
    }
  }
}
