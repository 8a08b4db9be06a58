package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs clustering jobs on the clustering executor.
 *
 * <p>Failures never escape the worker thread: they move the job to {@code FAILED} with the error
 * message, and callers observe them by polling the job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusteringWorker {

  private final ClusterEngine clusterEngine;
  private final ClusterLabeler clusterLabeler;
  private final MeterRegistry meterRegistry;

  @Async("clusteringExecutor")
  public void runAsync(ClusteringJob job, List<DocumentProfile> snapshot) {
    run(job, snapshot);
  }

  /** Runs the job on the calling thread. */
  public void run(ClusteringJob job, List<DocumentProfile> snapshot) {
    long startTime = System.currentTimeMillis();
    job.start();
    ClusteringJobSnapshot state = job.snapshot();
    log.info(
        "Clustering job {} started: {} documents, k={}, algorithm={}",
        job.getId(),
        snapshot.size(),
        state.numClusters() != null ? state.numClusters() : "auto",
        state.algorithm().getWireName());

    try {
      Map<UUID, DocumentProfile> profiles = new LinkedHashMap<>();
      snapshot.forEach(profile -> profiles.put(profile.documentId(), profile));
      List<EmbeddedDocument> documents =
          snapshot.stream().map(DocumentProfile::toEmbedded).toList();

      int k;
      if (state.numClusters() != null) {
        k = state.numClusters();
      } else {
        k = clusterEngine.chooseClusterCount(documents);
        job.resolveNumClusters(k);
        log.info("Clustering job {} chose k={} by silhouette score", job.getId(), k);
      }

      ClusteringResult result =
          clusterEngine.cluster(documents, k, state.algorithm(), job::updateProgress);
      ClusteringResult labeled = clusterLabeler.label(result, profiles);

      job.complete(labeled);
      meterRegistry.counter("clustering.jobs", "status", "completed").increment();
      log.info(
          "Clustering job {} completed in {}ms: silhouette={}, inertia={}",
          job.getId(),
          System.currentTimeMillis() - startTime,
          String.format("%.4f", labeled.metrics().silhouetteScore()),
          String.format("%.4f", labeled.metrics().inertia()));
    } catch (RuntimeException e) {
      log.error("Clustering job {} failed: {}", job.getId(), e.getMessage(), e);
      job.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      meterRegistry.counter("clustering.jobs", "status", "failed").increment();
    }
  }
}
