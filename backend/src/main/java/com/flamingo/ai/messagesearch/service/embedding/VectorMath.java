package com.flamingo.ai.messagesearch.service.embedding;

/** Vector helpers shared by embedding generation and similarity search. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors of equal length, clamped to {@code [0, 1]}.
   *
   * <p>Returns 0 when either vector has zero norm.
   *
   * @throws IllegalArgumentException if the vectors differ in length
   */
  public static float cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vectors must have the same dimension: " + a.length + " != " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    double denominator = Math.sqrt(normA) * Math.sqrt(normB);
    if (denominator == 0.0) {
      return 0f;
    }
    double similarity = dot / denominator;
    return (float) Math.max(0.0, Math.min(1.0, similarity));
  }

  public static double l2Norm(float[] vector) {
    double sum = 0.0;
    for (float v : vector) {
      sum += (double) v * v;
    }
    return Math.sqrt(sum);
  }

  public static boolean isZero(float[] vector) {
    for (float v : vector) {
      if (v != 0f) {
        return false;
      }
    }
    return true;
  }
}
