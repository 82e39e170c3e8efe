package dev.asclepius.fusion;

import java.util.List;

/**
 * An item of the fused ranking together with its per-source provenance.
 *
 * @param itemId the reconciled item identifier
 * @param rrfScore sum of the contributions of every list the item appeared in
 * @param contributingSources one entry per list the item appeared in, in input-list order
 */
public record FusedResult(
    String itemId, double rrfScore, List<SourceContribution> contributingSources) {

  public FusedResult {
    contributingSources = List.copyOf(contributingSources);
  }
}
