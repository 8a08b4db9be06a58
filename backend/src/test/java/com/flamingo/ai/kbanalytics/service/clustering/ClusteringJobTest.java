package com.flamingo.ai.kbanalytics.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.domain.enums.JobStatus;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClusteringJob Tests")
class ClusteringJobTest {

  private ClusteringJob job;

  @BeforeEach
  void setUp() {
    job = new ClusteringJob(UUID.randomUUID(), ClusteringAlgorithm.KMEANS, 3, 12);
  }

  @Test
  @DisplayName("Should start pending with no progress")
  void shouldStartPending() {
    ClusteringJobSnapshot snapshot = job.snapshot();

    assertThat(snapshot.status()).isEqualTo(JobStatus.PENDING);
    assertThat(snapshot.progressPercent()).isZero();
    assertThat(snapshot.startedAt()).isNull();
    assertThat(snapshot.completedAt()).isNull();
  }

  @Test
  @DisplayName("Should move through running to completed")
  void shouldCompleteHappyPath() {
    job.start();
    job.updateProgress(40, 6);
    job.complete(emptyResult());

    ClusteringJobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(snapshot.progressPercent()).isEqualTo(100);
    assertThat(snapshot.documentsProcessed()).isEqualTo(12);
    assertThat(snapshot.startedAt()).isNotNull();
    assertThat(snapshot.completedAt()).isNotNull();
    assertThat(job.getResult()).isNotNull();
  }

  @Test
  @DisplayName("Should never report progress going backwards or reaching 100 while running")
  void shouldKeepProgressMonotonic() {
    job.start();
    job.updateProgress(50, 6);
    job.updateProgress(30, 2);
    assertThat(job.snapshot().progressPercent()).isEqualTo(50);
    assertThat(job.snapshot().documentsProcessed()).isEqualTo(6);

    job.updateProgress(100, 40);
    assertThat(job.snapshot().progressPercent()).isEqualTo(99);
    assertThat(job.snapshot().documentsProcessed()).isEqualTo(12);
  }

  @Test
  @DisplayName("Should retain the error message when failing")
  void shouldRetainErrorMessage() {
    job.start();
    job.fail("boom");

    ClusteringJobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
    assertThat(snapshot.errorMessage()).isEqualTo("boom");
    assertThat(job.getResult()).isNull();
  }

  @Test
  @DisplayName("Should allow failing a job that never started")
  void shouldFailFromPending() {
    job.fail("rejected");

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
  }

  @Test
  @DisplayName("Should reject completing a job that is not running")
  void shouldRejectCompleteFromPending() {
    assertThatThrownBy(() -> job.complete(emptyResult()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject any transition out of a terminal status")
  void shouldRejectLeavingTerminalStatus() {
    job.start();
    job.complete(emptyResult());

    assertThatThrownBy(() -> job.start()).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> job.fail("late")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> job.updateProgress(10, 1)).isInstanceOf(IllegalStateException.class);
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  @DisplayName("Should reject starting twice")
  void shouldRejectDoubleStart() {
    job.start();

    assertThatThrownBy(() -> job.start()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should take the chosen cluster count once when none was requested")
  void shouldResolveClusterCountOnce() {
    ClusteringJob automatic =
        new ClusteringJob(UUID.randomUUID(), ClusteringAlgorithm.KMEANS, null, 12);
    assertThat(automatic.snapshot().numClusters()).isNull();

    automatic.start();
    automatic.resolveNumClusters(4);

    assertThat(automatic.snapshot().numClusters()).isEqualTo(4);
    assertThatThrownBy(() -> automatic.resolveNumClusters(5))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject choosing a cluster count when one was requested")
  void shouldRejectResolvingRequestedCount() {
    job.start();

    assertThatThrownBy(() -> job.resolveNumClusters(2)).isInstanceOf(IllegalStateException.class);
    assertThat(job.snapshot().numClusters()).isEqualTo(3);
  }

  private static ClusteringResult emptyResult() {
    return new ClusteringResult(
        List.of(),
        List.of(),
        new ClusteringMetrics(0.0, 0.0, 0, 0, 0, true),
        ClusteringAlgorithm.KMEANS,
        ClusteringAlgorithm.KMEANS);
  }
}
