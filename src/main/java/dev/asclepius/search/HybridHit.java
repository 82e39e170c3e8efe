package dev.asclepius.search;

import dev.asclepius.fusion.SourceContribution;
import java.util.List;

/**
 * One fused result of a hybrid search.
 *
 * @param itemId reconciled item id (document id, patient id or {@code image:<id>})
 * @param rrfScore fused Reciprocal Rank Fusion score
 * @param contributingSources per-source rank, raw score and contribution
 * @param summary short human-readable description taken from the best-ranked source
 */
public record HybridHit(
    String itemId, double rrfScore, List<SourceContribution> contributingSources, String summary) {

  public HybridHit {
    contributingSources = List.copyOf(contributingSources);
  }
}
