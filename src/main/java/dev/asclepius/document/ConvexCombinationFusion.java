package dev.asclepius.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility re-ranking full-text candidates with vector similarity using Convex
 * Combination.
 *
 * <p>Applies min-max normalisation to each score family independently, then combines them using a
 * weighted formula: {@code combined = alpha * normVector + (1 - alpha) * normLexical}.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
final class ConvexCombinationFusion {

  private ConvexCombinationFusion() {}

  /**
   * Re-ranks lexical candidates.
   *
   * <ol>
   *   <li>Min-max normalise lexical scores to [0, 1] (if max == min, all normalise to 1.0)
   *   <li>Min-max normalise the available cosine scores the same way
   *   <li>Candidates without a usable stored vector get 0.0 for the vector part
   *   <li>Sort by combined score descending; ties keep the lexical order
   * </ol>
   *
   * @param candidates full-text candidates in lexical rank order
   * @param cosineByEmbeddingId cosine similarity per embedding id, for candidates that have one
   * @param alpha weight for vector scores (0.0 = lexical only, 1.0 = vector only)
   * @return scored candidates, best first
   */
  static List<Scored> fuse(
      List<LexicalCandidate> candidates, Map<String, Double> cosineByEmbeddingId, double alpha) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    double lexMin = candidates.stream().mapToDouble(LexicalCandidate::lexicalScore).min().orElse(0);
    double lexMax = candidates.stream().mapToDouble(LexicalCandidate::lexicalScore).max().orElse(0);
    double vecMin = cosineByEmbeddingId.values().stream().mapToDouble(d -> d).min().orElse(0);
    double vecMax = cosineByEmbeddingId.values().stream().mapToDouble(d -> d).max().orElse(0);

    List<Scored> scored = new ArrayList<>(candidates.size());
    for (LexicalCandidate candidate : candidates) {
      double lexical = normalise(candidate.lexicalScore(), lexMin, lexMax);
      Double cosine = cosineByEmbeddingId.get(candidate.embeddingId());
      double vector = cosine != null ? normalise(cosine, vecMin, vecMax) : 0.0;
      double combined = alpha * vector + (1.0 - alpha) * lexical;
      scored.add(new Scored(candidate, combined, cosine));
    }

    // List.sort is stable, so equal scores keep the lexical order
    scored.sort(Comparator.comparingDouble(Scored::combinedScore).reversed());
    return scored;
  }

  /**
   * Min-max normalises a score to [0, 1]. If max == min (all scores identical), returns 1.0.
   */
  private static double normalise(double score, double min, double max) {
    if (max == min) {
      return 1.0;
    }
    return (score - min) / (max - min);
  }

  /** A candidate with its combined score and, when available, its cosine similarity. */
  record Scored(LexicalCandidate candidate, double combinedScore, Double cosine) {}
}
