package dev.asclepius.fusion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure static utility combining ranked lists from independent sources with Reciprocal Rank Fusion.
 *
 * <p>Each appearance of an item at rank {@code r} contributes {@code 1 / (k + r)}; contributions
 * are summed across lists and an absent item contributes nothing. Only ranks matter, so sources
 * whose raw scores live on incomparable scales can be combined.
 *
 * <p>Output order is total: score descending, then item id ascending. The same input always yields
 * the same output. Input lists are read, never re-sorted.
 */
public final class ReciprocalRankFusion {

  /** Default smoothing constant, as in the original RRF paper. */
  public static final int DEFAULT_K = 60;

  private ReciprocalRankFusion() {}

  /**
   * Fuses ranked lists.
   *
   * @param rankedLists one list per source; each must hold unique item ids
   * @param k smoothing constant, must be positive
   * @return fused results, highest score first
   * @throws IllegalArgumentException if {@code k < 1} or a list repeats an item id
   */
  public static List<FusedResult> fuse(List<List<RankedResult>> rankedLists, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be positive, got: " + k);
    }
    Map<String, Accumulator> byItem = new LinkedHashMap<>();

    for (List<RankedResult> list : rankedLists) {
      Set<String> seen = new HashSet<>();
      for (RankedResult result : list) {
        if (!seen.add(result.itemId())) {
          throw new IllegalArgumentException(
              "Duplicate item id in ranked list from "
                  + result.source().value()
                  + ": "
                  + result.itemId());
        }
        double contribution = 1.0 / (k + result.rank());
        byItem
            .computeIfAbsent(result.itemId(), Accumulator::new)
            .add(
                new SourceContribution(
                    result.source(), result.rank(), result.rawScore(), contribution));
      }
    }

    return byItem.values().stream()
        .map(Accumulator::toFusedResult)
        .sorted(
            Comparator.comparingDouble(FusedResult::rrfScore)
                .reversed()
                .thenComparing(FusedResult::itemId))
        .toList();
  }

  /** Fuses with {@link #DEFAULT_K}. */
  public static List<FusedResult> fuse(List<List<RankedResult>> rankedLists) {
    return fuse(rankedLists, DEFAULT_K);
  }

  private static final class Accumulator {
    private final String itemId;
    private final List<SourceContribution> contributions = new ArrayList<>();
    private double score;

    Accumulator(String itemId) {
      this.itemId = itemId;
    }

    void add(SourceContribution contribution) {
      contributions.add(contribution);
      score += contribution.contribution();
    }

    FusedResult toFusedResult() {
      return new FusedResult(itemId, score, contributions);
    }
  }
}
