package com.flamingo.ai.kbanalytics.service.vector;

import com.flamingo.ai.kbanalytics.exception.DimensionMismatchException;
import com.flamingo.ai.kbanalytics.exception.EmptyInputException;
import java.util.List;

/**
 * Numeric primitives over embedding vectors.
 *
 * <p>All operations accumulate in double precision and never modify their inputs.
 */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity between two vectors of equal length.
   *
   * @return a value in [-1, 1], or 0 when either vector has zero magnitude
   * @throws DimensionMismatchException if the vectors differ in length
   */
  public static double cosineSimilarity(float[] a, float[] b) {
    requireSameDimension(a, b);
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    // Rounding can push parallel vectors marginally past 1.
    return Math.max(-1.0, Math.min(1.0, similarity));
  }

  /** {@code 1 - cosineSimilarity(a, b)}, in [0, 2]. */
  public static double cosineDistance(float[] a, float[] b) {
    return 1.0 - cosineSimilarity(a, b);
  }

  public static double squaredEuclideanDistance(float[] a, float[] b) {
    requireSameDimension(a, b);
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double diff = (double) a[i] - b[i];
      sum += diff * diff;
    }
    return sum;
  }

  /**
   * Arithmetic mean per dimension.
   *
   * @throws EmptyInputException if {@code vectors} is empty
   * @throws DimensionMismatchException if the vectors differ in length
   */
  public static float[] centroid(List<float[]> vectors) {
    if (vectors == null || vectors.isEmpty()) {
      throw new EmptyInputException("Cannot compute the centroid of an empty vector set");
    }
    int dimension = vectors.get(0).length;
    double[] sums = new double[dimension];
    for (float[] vector : vectors) {
      if (vector.length != dimension) {
        throw new DimensionMismatchException(dimension, vector.length);
      }
      for (int i = 0; i < dimension; i++) {
        sums[i] += vector[i];
      }
    }
    float[] mean = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      mean[i] = (float) (sums[i] / vectors.size());
    }
    return mean;
  }

  private static void requireSameDimension(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new DimensionMismatchException(a.length, b.length);
    }
  }
}
