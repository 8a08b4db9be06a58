package com.flamingo.ai.kbanalytics.service.clustering;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.exception.AnalyticsValidationException;
import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import com.flamingo.ai.kbanalytics.service.vector.VectorMath;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Deterministic k-means over cosine similarity.
 *
 * <p>Documents are first ordered by id. The first centroid is the first document; each further
 * centroid is the document whose best similarity to the already chosen centroids is lowest
 * (farthest-point seeding). Each iteration assigns every document to its most similar centroid
 * and recomputes centroids as member means, until no assignment changes or {@code
 * analytics.clustering.max-iterations} is reached. The same input therefore always yields the same
 * partition.
 *
 * <p>Algorithms without a dedicated implementation run this procedure and are reported with
 * {@link ClusteringAlgorithm#KMEANS} as the effective algorithm.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KMeansClusterEngine implements ClusterEngine {

  private static final int SEEDED_PERCENT = 10;
  private static final int ITERATION_PERCENT_SPAN = 80;
  private static final int METRICS_PERCENT = 95;
  private static final int MIN_AUTO_CLUSTERS = 2;

  private final AnalyticsConfig analyticsConfig;

  @Override
  public ClusteringResult cluster(
      List<EmbeddedDocument> documents,
      int k,
      ClusteringAlgorithm algorithm,
      ClusteringProgressListener listener) {
    int n = documents.size();
    if (k <= 0) {
      throw new AnalyticsValidationException("Number of clusters must be positive, got " + k);
    }
    if (k > n) {
      throw new AnalyticsValidationException(
          "Number of clusters (" + k + ") exceeds the number of documents (" + n + ")");
    }

    ClusteringAlgorithm requested = algorithm == null ? ClusteringAlgorithm.KMEANS : algorithm;
    if (!requested.isImplemented()) {
      log.warn(
          "Clustering algorithm '{}' is not implemented, running k-means instead",
          requested.getWireName());
    }

    List<EmbeddedDocument> ordered = new ArrayList<>(documents);
    ordered.sort(Comparator.comparing(document -> document.documentId().toString()));
    float[][] vectors = new float[n][];
    for (int i = 0; i < n; i++) {
      vectors[i] = ordered.get(i).vector();
    }

    float[][] centroids = seedCentroids(vectors, k);
    listener.onProgress(SEEDED_PERCENT, 0);

    int maxIterations = Math.max(1, analyticsConfig.getClustering().getMaxIterations());
    int[] assignment = new int[n];
    Arrays.fill(assignment, -1);
    int iterations = 0;
    boolean converged = false;

    while (iterations < maxIterations) {
      iterations++;
      boolean changed = assign(vectors, centroids, assignment);
      changed |= reseedEmptyClusters(vectors, centroids, assignment, k);
      centroids = recomputeCentroids(vectors, assignment, k);

      int percent = SEEDED_PERCENT + (iterations * ITERATION_PERCENT_SPAN) / maxIterations;
      listener.onProgress(percent, n);

      if (!changed) {
        converged = true;
        break;
      }
    }

    log.debug(
        "k-means finished: k={}, documents={}, iterations={}, converged={}",
        k,
        n,
        iterations,
        converged);

    ClusteringResult result =
        buildResult(ordered, vectors, centroids, assignment, k, iterations, converged, requested);
    listener.onProgress(METRICS_PERCENT, n);
    return result;
  }

  /**
   * Runs k-means for every k from 2 to {@code min(analytics.clustering.max-auto-clusters, n / 2)}
   * and keeps the k with the highest silhouette score, the smaller k on ties. When that range holds
   * at most one candidate the answer is 2, or n for fewer than two documents.
   */
  @Override
  public int chooseClusterCount(List<EmbeddedDocument> documents) {
    int n = documents.size();
    int maxK = Math.min(analyticsConfig.getClustering().getMaxAutoClusters(), n / 2);
    if (maxK <= MIN_AUTO_CLUSTERS) {
      return Math.min(MIN_AUTO_CLUSTERS, Math.max(n, 1));
    }

    int bestK = MIN_AUTO_CLUSTERS;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (int k = MIN_AUTO_CLUSTERS; k <= maxK; k++) {
      double score =
          cluster(documents, k, ClusteringAlgorithm.KMEANS, ClusteringProgressListener.NONE)
              .metrics()
              .silhouetteScore();
      log.debug("Candidate k={} scored silhouette {}", k, score);
      if (score > bestScore) {
        bestScore = score;
        bestK = k;
      }
    }
    return bestK;
  }

  private float[][] seedCentroids(float[][] vectors, int k) {
    float[][] centroids = new float[k][];
    boolean[] chosen = new boolean[vectors.length];
    // Best similarity of each document to any chosen centroid.
    double[] closest = new double[vectors.length];
    Arrays.fill(closest, Double.NEGATIVE_INFINITY);

    int next = 0;
    for (int c = 0; c < k; c++) {
      chosen[next] = true;
      centroids[c] = vectors[next].clone();

      int farthest = -1;
      double farthestSimilarity = Double.POSITIVE_INFINITY;
      for (int i = 0; i < vectors.length; i++) {
        if (chosen[i]) {
          continue;
        }
        closest[i] = Math.max(closest[i], VectorMath.cosineSimilarity(vectors[i], centroids[c]));
        if (closest[i] < farthestSimilarity) {
          farthestSimilarity = closest[i];
          farthest = i;
        }
      }
      next = farthest;
    }
    return centroids;
  }

  /** Assigns each document to its most similar centroid; returns whether anything moved. */
  private boolean assign(float[][] vectors, float[][] centroids, int[] assignment) {
    boolean changed = false;
    for (int i = 0; i < vectors.length; i++) {
      int best = 0;
      double bestSimilarity = Double.NEGATIVE_INFINITY;
      for (int c = 0; c < centroids.length; c++) {
        double similarity = VectorMath.cosineSimilarity(vectors[i], centroids[c]);
        if (similarity > bestSimilarity) {
          bestSimilarity = similarity;
          best = c;
        }
      }
      if (assignment[i] != best) {
        assignment[i] = best;
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Gives every empty cluster the document least similar to its own centroid, taken from a cluster
   * that keeps at least one member.
   */
  private boolean reseedEmptyClusters(
      float[][] vectors, float[][] centroids, int[] assignment, int k) {
    boolean changed = false;
    int[] sizes = clusterSizes(assignment, k);
    for (int c = 0; c < k; c++) {
      if (sizes[c] > 0) {
        continue;
      }
      int donor = -1;
      double lowestSimilarity = Double.POSITIVE_INFINITY;
      for (int i = 0; i < vectors.length; i++) {
        if (sizes[assignment[i]] < 2) {
          continue;
        }
        double similarity = VectorMath.cosineSimilarity(vectors[i], centroids[assignment[i]]);
        if (similarity < lowestSimilarity) {
          lowestSimilarity = similarity;
          donor = i;
        }
      }
      if (donor < 0) {
        throw new IllegalStateException("No document available to reseed empty cluster " + c);
      }
      log.debug("Reseeding empty cluster {} with document index {}", c, donor);
      sizes[assignment[donor]]--;
      assignment[donor] = c;
      sizes[c] = 1;
      changed = true;
    }
    return changed;
  }

  private float[][] recomputeCentroids(float[][] vectors, int[] assignment, int k) {
    List<List<float[]>> members = new ArrayList<>(k);
    for (int c = 0; c < k; c++) {
      members.add(new ArrayList<>());
    }
    for (int i = 0; i < vectors.length; i++) {
      members.get(assignment[i]).add(vectors[i]);
    }
    float[][] centroids = new float[k][];
    for (int c = 0; c < k; c++) {
      centroids[c] = VectorMath.centroid(members.get(c));
    }
    return centroids;
  }

  private ClusteringResult buildResult(
      List<EmbeddedDocument> ordered,
      float[][] vectors,
      float[][] centroids,
      int[] assignment,
      int k,
      int iterations,
      boolean converged,
      ClusteringAlgorithm requested) {
    List<List<UUID>> memberIds = new ArrayList<>(k);
    for (int c = 0; c < k; c++) {
      memberIds.add(new ArrayList<>());
    }

    List<ClusterAssignment> assignments = new ArrayList<>(ordered.size());
    double inertia = 0.0;
    for (int i = 0; i < ordered.size(); i++) {
      int c = assignment[i];
      UUID documentId = ordered.get(i).documentId();
      memberIds.get(c).add(documentId);
      assignments.add(
          new ClusterAssignment(
              documentId, c, VectorMath.cosineSimilarity(vectors[i], centroids[c])));
      inertia += VectorMath.squaredEuclideanDistance(vectors[i], centroids[c]);
    }

    List<DocumentCluster> clusters = new ArrayList<>(k);
    for (int c = 0; c < k; c++) {
      List<UUID> members = List.copyOf(memberIds.get(c));
      clusters.add(
          new DocumentCluster(
              c, "Cluster " + (c + 1), null, centroids[c], members.size(), members, List.of()));
    }

    double silhouette = silhouetteScore(vectors, assignment, k);
    ClusteringMetrics metrics =
        new ClusteringMetrics(silhouette, inertia, k, ordered.size(), iterations, converged);
    return new ClusteringResult(
        List.copyOf(clusters),
        List.copyOf(assignments),
        metrics,
        requested,
        ClusteringAlgorithm.KMEANS);
  }

  /**
   * Mean silhouette using cosine distance. Returns 0.0 when there are fewer than two clusters or
   * any cluster has fewer than two members.
   */
  static double silhouetteScore(float[][] vectors, int[] assignment, int k) {
    if (k < 2) {
      return 0.0;
    }
    int[] sizes = clusterSizes(assignment, k);
    for (int size : sizes) {
      if (size < 2) {
        return 0.0;
      }
    }

    double total = 0.0;
    for (int i = 0; i < vectors.length; i++) {
      double[] distanceSums = new double[k];
      for (int j = 0; j < vectors.length; j++) {
        if (i != j) {
          distanceSums[assignment[j]] += VectorMath.cosineDistance(vectors[i], vectors[j]);
        }
      }
      int own = assignment[i];
      double a = distanceSums[own] / (sizes[own] - 1);
      double b = Double.POSITIVE_INFINITY;
      for (int c = 0; c < k; c++) {
        if (c != own) {
          b = Math.min(b, distanceSums[c] / sizes[c]);
        }
      }
      double denominator = Math.max(a, b);
      total += denominator == 0.0 ? 0.0 : (b - a) / denominator;
    }
    return total / vectors.length;
  }

  private static int[] clusterSizes(int[] assignment, int k) {
    int[] sizes = new int[k];
    for (int c : assignment) {
      if (c >= 0) {
        sizes[c]++;
      }
    }
    return sizes;
  }
}
