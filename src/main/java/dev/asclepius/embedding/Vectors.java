package dev.asclepius.embedding;

import java.util.List;
import java.util.StringJoiner;

/**
 * Pure static helpers for embedding vectors: magnitude checks and conversion between
 * LangChain4j relevance scores and cosine similarity.
 *
 * <p>A vector whose magnitude is below {@link #DEGENERATE_MAGNITUDE} is treated as a failed
 * embedding. It is never a valid search candidate, because cosine against a near-zero vector is
 * undefined and stores report it as NaN or as a spurious high score.
 */
public final class Vectors {

  /** Magnitude below which a vector counts as "no usable vector". */
  public static final double DEGENERATE_MAGNITUDE = 1e-6;

  private Vectors() {}

  public static double magnitude(float[] vector) {
    double sum = 0.0;
    for (float v : vector) {
      sum += (double) v * v;
    }
    return Math.sqrt(sum);
  }

  public static boolean isDegenerate(float[] vector) {
    return vector.length == 0 || magnitude(vector) < DEGENERATE_MAGNITUDE;
  }

  /**
   * Converts a LangChain4j relevance score ({@code (cosine + 1) / 2}) back to cosine similarity.
   */
  public static double relevanceToCosine(double relevance) {
    return 2.0 * relevance - 1.0;
  }

  /** Inverse of {@link #relevanceToCosine(double)}. */
  public static double cosineToRelevance(double cosine) {
    return (cosine + 1.0) / 2.0;
  }

  public static float[] toArray(List<? extends Number> values) {
    float[] vector = new float[values.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = values.get(i).floatValue();
    }
    return vector;
  }

  /** Renders a vector as a pgvector literal, e.g. {@code [0.1,0.2,0.3]}. */
  public static String toPgVectorLiteral(float[] vector) {
    StringJoiner joiner = new StringJoiner(",", "[", "]");
    for (float v : vector) {
      joiner.add(Float.toString(v));
    }
    return joiner.toString();
  }
}
