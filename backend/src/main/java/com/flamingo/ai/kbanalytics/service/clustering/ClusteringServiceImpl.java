package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.exception.ClusteringResultNotReadyException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/** Implementation of ClusteringService backed by the in-memory job registry. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusteringServiceImpl implements ClusteringService {

  private final CorpusService corpusService;
  private final ClusteringJobRegistry jobRegistry;
  private final ClusteringWorker clusteringWorker;
  private final AnalyticsConfig analyticsConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "clustering.submit", description = "Time to validate and submit a clustering job")
  public ClusteringJobSnapshot startClustering(StartClusteringCommand command) {
    AnalyticsConfig.Clustering config = analyticsConfig.getClustering();
    Integer k = command.numClusters();
    int minDocuments =
        command.minDocuments() != null ? command.minDocuments() : config.getMinDocuments();
    ClusteringAlgorithm algorithm =
        command.algorithm() != null ? command.algorithm() : ClusteringAlgorithm.KMEANS;

    if (k != null && k <= 0) {
      throw new AnalyticsValidationException("Number of clusters must be positive, got " + k);
    }

    List<DocumentProfile> snapshot =
        corpusService.getProfiles(command.categoryId()).stream()
            .filter(DocumentProfile::hasEmbedding)
            .toList();

    if (snapshot.size() < Math.max(minDocuments, 1)) {
      throw new AnalyticsValidationException(
          "Insufficient documents to cluster: found "
              + snapshot.size()
              + " embedded documents, need at least "
              + minDocuments);
    }
    if (k != null && k > snapshot.size()) {
      throw new AnalyticsValidationException(
          "Number of clusters ("
              + k
              + ") exceeds the number of documents ("
              + snapshot.size()
              + ")");
    }

    if (!algorithm.isImplemented()) {
      meterRegistry
          .counter("clustering.algorithm.fallback", "requested", algorithm.getWireName())
          .increment();
    }

    ClusteringJob job = new ClusteringJob(UUID.randomUUID(), algorithm, k, snapshot.size());
    jobRegistry.register(job);
    log.info(
        "Submitted clustering job {}: k={}, algorithm={}, documents={}",
        job.getId(),
        k != null ? k : "auto",
        algorithm.getWireName(),
        snapshot.size());

    ClusteringJobSnapshot submitted = job.snapshot();
    try {
      clusteringWorker.runAsync(job, snapshot);
    } catch (TaskRejectedException e) {
      log.error("Clustering executor rejected job {}: {}", job.getId(), e.getMessage());
      job.fail("Clustering capacity exhausted, try again later");
      meterRegistry.counter("clustering.jobs", "status", "rejected").increment();
      return job.snapshot();
    }
    return submitted;
  }

  @Override
  public ClusteringJobSnapshot getJob(UUID jobId) {
    return jobRegistry.get(jobId).snapshot();
  }

  @Override
  public ClusteringResult getResult(UUID jobId) {
    ClusteringJob job = jobRegistry.get(jobId);
    ClusteringJobSnapshot state = job.snapshot();
    if (state.status() != JobStatus.COMPLETED) {
      throw new ClusteringResultNotReadyException(jobId, state.status(), state.errorMessage());
    }
    return job.getResult();
  }
}
