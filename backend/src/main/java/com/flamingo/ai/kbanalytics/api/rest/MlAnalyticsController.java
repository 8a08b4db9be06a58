package com.flamingo.ai.kbanalytics.api.rest;

import com.flamingo.ai.kbanalytics.api.dto.request.StartClusteringRequest;
import com.flamingo.ai.kbanalytics.service.anomaly.AnomalyResult;
import com.flamingo.ai.kbanalytics.service.anomaly.AnomalyService;
import com.flamingo.ai.kbanalytics.service.clustering.ClusteringJobSnapshot;
import com.flamingo.ai.kbanalytics.service.clustering.ClusteringResult;
import com.flamingo.ai.kbanalytics.service.clustering.ClusteringService;
import com.flamingo.ai.kbanalytics.service.similarity.DocumentSimilarity;
import com.flamingo.ai.kbanalytics.service.similarity.DuplicateDetectionService;
import com.flamingo.ai.kbanalytics.service.similarity.DuplicateReport;
import com.flamingo.ai.kbanalytics.service.similarity.SimilarDocumentService;
import com.flamingo.ai.kbanalytics.service.trend.TrendAnalysis;
import com.flamingo.ai.kbanalytics.service.trend.TrendService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for clustering, similarity, duplicate, trend and anomaly analytics. */
@RestController
@RequestMapping("/api/ml")
@RequiredArgsConstructor
@Slf4j
public class MlAnalyticsController {

  private final ClusteringService clusteringService;
  private final SimilarDocumentService similarDocumentService;
  private final DuplicateDetectionService duplicateDetectionService;
  private final TrendService trendService;
  private final AnomalyService anomalyService;

  /**
   * Submits a clustering job. The job runs in the background; poll its status with the returned
   * id.
   *
   * @param request clustering parameters, may be omitted entirely
   * @return 202 Accepted with the pending job
   */
  @PostMapping("/clustering")
  public ResponseEntity<ClusteringJobSnapshot> startClustering(
      @Valid @RequestBody(required = false) StartClusteringRequest request) {
    StartClusteringRequest effective = request == null ? new StartClusteringRequest() : request;
    ClusteringJobSnapshot job = clusteringService.startClustering(effective.toCommand());
    log.info("Accepted clustering job {}", job.id());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
  }

  @GetMapping("/clustering/{jobId}")
  public ResponseEntity<ClusteringJobSnapshot> getClusteringJob(@PathVariable UUID jobId) {
    return ResponseEntity.ok(clusteringService.getJob(jobId));
  }

  /** Returns the result of a completed job, or 409 while it is still running or has failed. */
  @GetMapping("/clustering/{jobId}/result")
  public ResponseEntity<ClusteringResult> getClusteringResult(@PathVariable UUID jobId) {
    return ResponseEntity.ok(clusteringService.getResult(jobId));
  }

  @GetMapping("/documents/{documentId}/similar")
  public ResponseEntity<List<DocumentSimilarity>> getSimilarDocuments(
      @PathVariable UUID documentId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Double minSimilarity) {
    return ResponseEntity.ok(
        similarDocumentService.findSimilarDocuments(documentId, limit, minSimilarity));
  }

  /** Pairs of near-identical documents; {@code threshold} defaults to 0.8. */
  @GetMapping("/duplicates")
  public ResponseEntity<DuplicateReport> getDuplicates(
      @RequestParam(required = false) Double threshold,
      @RequestParam(required = false) UUID categoryId) {
    return ResponseEntity.ok(duplicateDetectionService.detectDuplicates(threshold, categoryId));
  }

  @GetMapping("/trends")
  public ResponseEntity<TrendAnalysis> getTrends(@RequestParam(required = false) Integer days) {
    return ResponseEntity.ok(trendService.getTrendAnalysis(days));
  }

  @GetMapping("/anomalies")
  public ResponseEntity<List<AnomalyResult>> getAnomalies(
      @RequestParam(required = false) UUID categoryId) {
    return ResponseEntity.ok(anomalyService.detectAnomalies(categoryId));
  }
}
