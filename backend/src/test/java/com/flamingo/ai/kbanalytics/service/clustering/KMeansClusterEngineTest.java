package com.flamingo.ai.kbanalytics.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KMeansClusterEngine Tests")
class KMeansClusterEngineTest {

  private KMeansClusterEngine engine;

  @BeforeEach
  void setUp() {
    engine = new KMeansClusterEngine(new AnalyticsConfig());
  }

  @Test
  @DisplayName("Should separate three well-separated groups")
  void shouldSeparateThreeGroups() {
    List<EmbeddedDocument> documents = threeGroups();

    ClusteringResult result =
        engine.cluster(documents, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);

    Set<Set<UUID>> partition = new HashSet<>();
    result.clusters().forEach(cluster -> partition.add(Set.copyOf(cluster.memberDocumentIds())));
    assertThat(partition)
        .containsExactlyInAnyOrder(
            Set.of(id(1), id(2), id(3)), Set.of(id(4), id(5), id(6)), Set.of(id(7), id(8), id(9)));
    assertThat(result.metrics().silhouetteScore()).isGreaterThan(0.5);
    assertThat(result.metrics().converged()).isTrue();
  }

  @Test
  @DisplayName("Should assign every document to exactly one cluster")
  void shouldAssignEveryDocumentOnce() {
    List<EmbeddedDocument> documents = threeGroups();

    ClusteringResult result =
        engine.cluster(documents, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);

    assertThat(result.assignments()).hasSize(9);
    assertThat(result.assignments())
        .extracting(ClusterAssignment::documentId)
        .doesNotHaveDuplicates();
    int memberTotal = result.clusters().stream().mapToInt(DocumentCluster::documentCount).sum();
    assertThat(memberTotal).isEqualTo(9);
    assertThat(result.clusters())
        .allSatisfy(cluster -> assertThat(cluster.documentCount()).isPositive());
    for (ClusterAssignment assignment : result.assignments()) {
      DocumentCluster cluster = result.clusters().get(assignment.clusterId());
      assertThat(cluster.memberDocumentIds()).contains(assignment.documentId());
    }
  }

  @Test
  @DisplayName("Should produce the same partition regardless of input order")
  void shouldBeDeterministic() {
    List<EmbeddedDocument> documents = threeGroups();
    List<EmbeddedDocument> shuffled = new ArrayList<>(documents);
    Collections.reverse(shuffled);

    ClusteringResult first =
        engine.cluster(documents, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);
    ClusteringResult second =
        engine.cluster(shuffled, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);

    assertThat(second.assignments()).isEqualTo(first.assignments());
    assertThat(second.metrics().inertia()).isCloseTo(first.metrics().inertia(), within(1e-9));
  }

  @Test
  @DisplayName("Should report a silhouette of 0 for a single cluster")
  void shouldReportZeroSilhouetteForOneCluster() {
    ClusteringResult result =
        engine.cluster(
            threeGroups(), 1, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);

    assertThat(result.clusters()).hasSize(1);
    assertThat(result.metrics().silhouetteScore()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should report a silhouette of 0 when a cluster has a single member")
  void shouldReportZeroSilhouetteForSingletonCluster() {
    float[][] vectors = {{1, 0}, {0.9f, 0.1f}, {0, 1}};
    int[] assignment = {0, 0, 1};

    assertThat(KMeansClusterEngine.silhouetteScore(vectors, assignment, 2)).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should allow as many clusters as documents")
  void shouldAllowKEqualToN() {
    List<EmbeddedDocument> documents =
        List.of(doc(1, 1, 0, 0), doc(2, 0, 1, 0), doc(3, 0, 0, 1));

    ClusteringResult result =
        engine.cluster(documents, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE);

    assertThat(result.clusters())
        .allSatisfy(cluster -> assertThat(cluster.documentCount()).isEqualTo(1));
  }

  @Test
  @DisplayName("Should reject a non-positive cluster count")
  void shouldRejectNonPositiveK() {
    assertThatThrownBy(
            () ->
                engine.cluster(
                    threeGroups(), 0, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE))
        .isInstanceOf(AnalyticsValidationException.class);
  }

  @Test
  @DisplayName("Should reject more clusters than documents")
  void shouldRejectKGreaterThanN() {
    List<EmbeddedDocument> documents = List.of(doc(1, 1, 0, 0), doc(2, 0, 1, 0));

    assertThatThrownBy(
            () ->
                engine.cluster(
                    documents, 3, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE))
        .isInstanceOf(AnalyticsValidationException.class)
        .hasMessageContaining("exceeds");
  }

  @Test
  @DisplayName("Should run k-means for algorithms without an implementation")
  void shouldFallBackToKMeans() {
    ClusteringResult result =
        engine.cluster(
            threeGroups(), 3, ClusteringAlgorithm.DBSCAN, ClusteringProgressListener.NONE);

    assertThat(result.requestedAlgorithm()).isEqualTo(ClusteringAlgorithm.DBSCAN);
    assertThat(result.effectiveAlgorithm()).isEqualTo(ClusteringAlgorithm.KMEANS);
  }

  @Test
  @DisplayName("Should report non-decreasing progress below 100")
  void shouldReportMonotonicProgress() {
    List<Integer> percents = new ArrayList<>();

    engine.cluster(
        threeGroups(),
        3,
        ClusteringAlgorithm.KMEANS,
        (percent, processed) -> percents.add(percent));

    assertThat(percents).isNotEmpty().isSorted();
    assertThat(percents).allSatisfy(percent -> assertThat(percent).isBetween(0, 99));
  }

  @Test
  @DisplayName("Should choose the cluster count with the best silhouette")
  void shouldChooseClusterCountBySilhouette() {
    assertThat(engine.chooseClusterCount(threeGroups())).isEqualTo(3);
  }

  @Test
  @DisplayName("Should choose two clusters for corpora too small to compare counts")
  void shouldChooseTwoClustersForSmallCorpora() {
    assertThat(engine.chooseClusterCount(threeGroups().subList(0, 5))).isEqualTo(2);
    assertThat(engine.chooseClusterCount(threeGroups().subList(0, 3))).isEqualTo(2);
    assertThat(engine.chooseClusterCount(threeGroups().subList(0, 1))).isEqualTo(1);
  }

  @Test
  @DisplayName("Should not try more clusters than configured")
  void shouldCapCandidateClusterCounts() {
    AnalyticsConfig config = new AnalyticsConfig();
    config.getClustering().setMaxAutoClusters(2);

    int k = new KMeansClusterEngine(config).chooseClusterCount(threeGroups());

    assertThat(k).isEqualTo(2);
  }

  private static List<EmbeddedDocument> threeGroups() {
    return List.of(
        doc(1, 1.0f, 0.05f, 0.0f),
        doc(2, 0.95f, 0.0f, 0.1f),
        doc(3, 1.0f, 0.1f, 0.05f),
        doc(4, 0.0f, 1.0f, 0.05f),
        doc(5, 0.1f, 0.95f, 0.0f),
        doc(6, 0.05f, 1.0f, 0.1f),
        doc(7, 0.0f, 0.05f, 1.0f),
        doc(8, 0.1f, 0.0f, 0.95f),
        doc(9, 0.05f, 0.1f, 1.0f));
  }

  private static EmbeddedDocument doc(int n, float x, float y, float z) {
    return new EmbeddedDocument(id(n), new float[] {x, y, z});
  }

  private static UUID id(int n) {
    return UUID.fromString(String.format("00000000-0000-0000-0000-%012d", n));
  }
}
