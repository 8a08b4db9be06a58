package com.flamingo.ai.kbanalytics.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.exception.ClusteringJobNotFoundException;
import com.flamingo.ai.kbanalytics.exception.ClusteringResultNotReadyException;
import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClusteringServiceImpl Tests")
class ClusteringServiceImplTest {

  @Mock private CorpusService corpusService;
  @Mock private ClusteringWorker clusteringWorker;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private ClusteringJobRegistry jobRegistry;
  private ClusteringServiceImpl clusteringService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    AnalyticsConfig config = new AnalyticsConfig();
    jobRegistry = new ClusteringJobRegistry(config);
    clusteringService =
        new ClusteringServiceImpl(
            corpusService, jobRegistry, clusteringWorker, config, meterRegistry);
  }

  @Test
  @DisplayName("Should register a pending job and hand it to the worker")
  void shouldSubmitPendingJob() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(6));

    ClusteringJobSnapshot snapshot =
        clusteringService.startClustering(
            new StartClusteringCommand(2, ClusteringAlgorithm.KMEANS, null, null));

    assertThat(snapshot.status()).isEqualTo(JobStatus.PENDING);
    assertThat(snapshot.numClusters()).isEqualTo(2);
    assertThat(snapshot.totalDocuments()).isEqualTo(6);
    assertThat(jobRegistry.find(snapshot.id())).isPresent();

    ArgumentCaptor<ClusteringJob> jobCaptor = ArgumentCaptor.forClass(ClusteringJob.class);
    verify(clusteringWorker).runAsync(jobCaptor.capture(), anyList());
    assertThat(jobCaptor.getValue().getId()).isEqualTo(snapshot.id());
  }

  @Test
  @DisplayName("Should cluster only embedded documents")
  void shouldSkipDocumentsWithoutEmbedding() {
    List<DocumentProfile> profiles = new ArrayList<>(embeddedProfiles(3));
    profiles.add(DocumentProfile.builder().documentId(UUID.randomUUID()).title("raw").build());
    when(corpusService.getProfiles(null)).thenReturn(profiles);

    ClusteringJobSnapshot snapshot =
        clusteringService.startClustering(new StartClusteringCommand(2, null, null, null));

    assertThat(snapshot.totalDocuments()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should leave the cluster count to the worker when none is requested")
  void shouldApplyDefaults() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(3));

    ClusteringJobSnapshot snapshot =
        clusteringService.startClustering(new StartClusteringCommand(null, null, null, null));

    assertThat(snapshot.status()).isEqualTo(JobStatus.PENDING);
    assertThat(snapshot.numClusters()).isNull();
    assertThat(snapshot.algorithm()).isEqualTo(ClusteringAlgorithm.KMEANS);
  }

  @Test
  @DisplayName("Should reject a corpus smaller than the minimum document count")
  void shouldRejectInsufficientDocuments() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(2));

    assertThatThrownBy(
            () -> clusteringService.startClustering(new StartClusteringCommand(2, null, null, 3)))
        .isInstanceOf(AnalyticsValidationException.class)
        .hasMessageContaining("Insufficient documents");
    assertThat(jobRegistry.size()).isZero();
    verify(clusteringWorker, never()).runAsync(any(), anyList());
  }

  @Test
  @DisplayName("Should reject more clusters than embedded documents")
  void shouldRejectTooManyClusters() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(4));

    assertThatThrownBy(
            () -> clusteringService.startClustering(new StartClusteringCommand(5, null, null, 1)))
        .isInstanceOf(AnalyticsValidationException.class);
  }

  @Test
  @DisplayName("Should reject a non-positive cluster count before loading the corpus")
  void shouldRejectNonPositiveClusterCount() {
    assertThatThrownBy(
            () ->
                clusteringService.startClustering(new StartClusteringCommand(0, null, null, null)))
        .isInstanceOf(AnalyticsValidationException.class);
    verify(corpusService, never()).getProfiles(any());
  }

  @Test
  @DisplayName("Should count requests for algorithms that fall back to k-means")
  void shouldCountAlgorithmFallback() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(4));

    ClusteringJobSnapshot snapshot =
        clusteringService.startClustering(
            new StartClusteringCommand(2, ClusteringAlgorithm.SPECTRAL, null, null));

    assertThat(snapshot.algorithm()).isEqualTo(ClusteringAlgorithm.SPECTRAL);
    verify(meterRegistry).counter("clustering.algorithm.fallback", "requested", "spectral");
    verify(counter).increment();
  }

  @Test
  @DisplayName("Should fail the job when the executor rejects it")
  void shouldFailRejectedJob() {
    when(corpusService.getProfiles(null)).thenReturn(embeddedProfiles(4));
    doThrow(new TaskRejectedException("queue full"))
        .when(clusteringWorker)
        .runAsync(any(), anyList());

    ClusteringJobSnapshot snapshot =
        clusteringService.startClustering(new StartClusteringCommand(2, null, null, null));

    assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
    assertThat(snapshot.errorMessage()).contains("capacity");
  }

  @Test
  @DisplayName("Should refuse the result of a job that has not completed")
  void shouldRefuseResultBeforeCompletion() {
    ClusteringJob job = new ClusteringJob(UUID.randomUUID(), ClusteringAlgorithm.KMEANS, 2, 4);
    jobRegistry.register(job);
    job.start();

    assertThatThrownBy(() -> clusteringService.getResult(job.getId()))
        .isInstanceOf(ClusteringResultNotReadyException.class)
        .satisfies(
            ex ->
                assertThat(((ClusteringResultNotReadyException) ex).getStatus())
                    .isEqualTo(JobStatus.RUNNING));
  }

  @Test
  @DisplayName("Should return the same result on repeated reads")
  void shouldReturnStableResult() {
    ClusteringJob job = new ClusteringJob(UUID.randomUUID(), ClusteringAlgorithm.KMEANS, 1, 1);
    jobRegistry.register(job);
    job.start();
    ClusteringResult result =
        new ClusteringResult(
            List.of(),
            List.of(),
            new ClusteringMetrics(0.0, 0.0, 1, 1, 1, true),
            ClusteringAlgorithm.KMEANS,
            ClusteringAlgorithm.KMEANS);
    job.complete(result);

    assertThat(clusteringService.getResult(job.getId())).isSameAs(result);
    assertThat(clusteringService.getResult(job.getId())).isSameAs(result);
  }

  @Test
  @DisplayName("Should report unknown jobs as not found")
  void shouldThrowForUnknownJob() {
    assertThatThrownBy(() -> clusteringService.getJob(UUID.randomUUID()))
        .isInstanceOf(ClusteringJobNotFoundException.class);
  }

  @Test
  @DisplayName("Should pass the category filter to the corpus")
  void shouldFilterByCategory() {
    UUID categoryId = UUID.randomUUID();
    when(corpusService.getProfiles(eq(categoryId))).thenReturn(embeddedProfiles(3));

    clusteringService.startClustering(new StartClusteringCommand(1, null, categoryId, null));

    verify(corpusService).getProfiles(categoryId);
  }

  private static List<DocumentProfile> embeddedProfiles(int count) {
    List<DocumentProfile> profiles = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      profiles.add(
          DocumentProfile.builder()
              .documentId(UUID.randomUUID())
              .title("Document " + i)
              .vector(new float[] {i + 1, 1})
              .build());
    }
    return profiles;
  }
}
