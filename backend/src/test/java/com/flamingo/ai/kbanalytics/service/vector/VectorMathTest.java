package com.flamingo.ai.kbanalytics.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.kbanalytics.exception.DimensionMismatchException;
import com.flamingo.ai.kbanalytics.exception.EmptyInputException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VectorMath Tests")
class VectorMathTest {

  @Nested
  @DisplayName("cosineSimilarity")
  class CosineSimilarity {

    @Test
    @DisplayName("Should be symmetric")
    void shouldBeSymmetric() {
      float[] a = {0.3f, -1.2f, 4.0f};
      float[] b = {2.5f, 0.7f, -0.1f};

      assertThat(VectorMath.cosineSimilarity(a, b))
          .isEqualTo(VectorMath.cosineSimilarity(b, a));
    }

    @Test
    @DisplayName("Should return 1 for a vector with itself")
    void shouldReturnOneForSelf() {
      float[] a = {0.1f, 0.2f, 0.3f, 0.4f};

      assertThat(VectorMath.cosineSimilarity(a, a)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should return -1 for opposite vectors and 0 for orthogonal ones")
    void shouldHandleOppositeAndOrthogonal() {
      assertThat(VectorMath.cosineSimilarity(new float[] {1, 0}, new float[] {-1, 0}))
          .isCloseTo(-1.0, within(1e-9));
      assertThat(VectorMath.cosineSimilarity(new float[] {1, 0}, new float[] {0, 1}))
          .isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should return 0 when either vector has zero magnitude")
    void shouldReturnZeroForZeroVector() {
      assertThat(VectorMath.cosineSimilarity(new float[] {0, 0, 0}, new float[] {1, 2, 3}))
          .isEqualTo(0.0);
      assertThat(VectorMath.cosineSimilarity(new float[] {1, 2, 3}, new float[] {0, 0, 0}))
          .isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should stay within [-1, 1] for parallel vectors of different scale")
    void shouldStayInRange() {
      float[] a = {0.1f, 0.1f, 0.1f};
      float[] b = {1000f, 1000f, 1000f};

      assertThat(VectorMath.cosineSimilarity(a, b)).isBetween(-1.0, 1.0);
    }

    @Test
    @DisplayName("Should reject vectors of different length")
    void shouldRejectDimensionMismatch() {
      assertThatThrownBy(
              () -> VectorMath.cosineSimilarity(new float[] {1, 2}, new float[] {1, 2, 3}))
          .isInstanceOf(DimensionMismatchException.class)
          .satisfies(
              ex -> {
                DimensionMismatchException mismatch = (DimensionMismatchException) ex;
                assertThat(mismatch.getExpected()).isEqualTo(2);
                assertThat(mismatch.getActual()).isEqualTo(3);
              });
    }
  }

  @Nested
  @DisplayName("centroid")
  class Centroid {

    @Test
    @DisplayName("Should compute the per-dimension mean")
    void shouldComputeMean() {
      float[] centroid =
          VectorMath.centroid(List.of(new float[] {1, 2}, new float[] {3, 4}, new float[] {5, 9}));

      assertThat(centroid).containsExactly(3f, 5f);
    }

    @Test
    @DisplayName("Should not modify its inputs")
    void shouldNotModifyInputs() {
      float[] a = {1, 1};
      float[] b = {3, 3};

      VectorMath.centroid(List.of(a, b));

      assertThat(a).containsExactly(1f, 1f);
      assertThat(b).containsExactly(3f, 3f);
    }

    @Test
    @DisplayName("Should fail on an empty set")
    void shouldFailOnEmptySet() {
      assertThatThrownBy(() -> VectorMath.centroid(List.of()))
          .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Should fail on mixed dimensions")
    void shouldFailOnMixedDimensions() {
      assertThatThrownBy(
              () -> VectorMath.centroid(List.of(new float[] {1, 2}, new float[] {1, 2, 3})))
          .isInstanceOf(DimensionMismatchException.class);
    }
  }

  @Test
  @DisplayName("Distances should be consistent with similarity")
  void distancesShouldBeConsistent() {
    float[] a = {3, 0};
    float[] b = {0, 4};

    assertThat(VectorMath.cosineDistance(a, b)).isCloseTo(1.0, within(1e-9));
    assertThat(VectorMath.squaredEuclideanDistance(a, b)).isCloseTo(25.0, within(1e-9));
  }
}
