package com.flamingo.ai.messagesearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorMath Tests")
class VectorMathTest {

  @Test
  @DisplayName("Identical vectors should have similarity one")
  void identicalVectorsShouldScoreOne() {
    float[] v = {0.6f, 0.8f, 0f};

    assertThat(VectorMath.cosineSimilarity(v, v)).isCloseTo(1.0f, within(1e-6f));
  }

  @Test
  @DisplayName("Orthogonal vectors should have similarity zero")
  void orthogonalVectorsShouldScoreZero() {
    assertThat(VectorMath.cosineSimilarity(new float[] {1f, 0f}, new float[] {0f, 1f})).isZero();
  }

  @Test
  @DisplayName("Similarity should be symmetric")
  void similarityShouldBeSymmetric() {
    float[] a = {0.2f, 0.5f, 0.1f, 0.7f};
    float[] b = {0.9f, 0.1f, 0.4f, 0.0f};

    assertThat(VectorMath.cosineSimilarity(a, b)).isEqualTo(VectorMath.cosineSimilarity(b, a));
  }

  @Test
  @DisplayName("Negative similarity should be clamped to zero")
  void negativeSimilarityShouldBeClamped() {
    assertThat(VectorMath.cosineSimilarity(new float[] {1f, 0f}, new float[] {-1f, 0f})).isZero();
  }

  @Test
  @DisplayName("Zero vector should have similarity zero with anything")
  void zeroVectorShouldScoreZero() {
    assertThat(VectorMath.cosineSimilarity(new float[3], new float[] {1f, 2f, 3f})).isZero();
    assertThat(VectorMath.cosineSimilarity(new float[3], new float[3])).isZero();
  }

  @Test
  @DisplayName("Should reject vectors of different length")
  void shouldRejectDimensionMismatch() {
    assertThatThrownBy(() -> VectorMath.cosineSimilarity(new float[2], new float[3]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("2 != 3");
  }

  @Test
  @DisplayName("Should compute norm and detect zero vectors")
  void shouldComputeNormAndDetectZero() {
    assertThat(VectorMath.l2Norm(new float[] {3f, 4f})).isCloseTo(5.0, within(1e-9));
    assertThat(VectorMath.isZero(new float[4])).isTrue();
    assertThat(VectorMath.isZero(new float[] {0f, 0f, 1e-9f})).isFalse();
  }
}
