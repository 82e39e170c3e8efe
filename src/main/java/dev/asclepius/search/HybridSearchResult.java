package dev.asclepius.search;

import dev.asclepius.config.SearchProperties.ReconciliationKey;
import dev.asclepius.failure.Capability;
import dev.asclepius.fusion.RetrievalSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a hybrid search.
 *
 * @param hits fused ranking, best first
 * @param reconciliationKey how items were aligned across sources
 * @param sourceCounts number of reconciled items each available source contributed
 * @param unavailable capabilities that could not be queried
 * @param notes remarks about degraded sources
 */
public record HybridSearchResult(
    List<HybridHit> hits,
    ReconciliationKey reconciliationKey,
    Map<RetrievalSource, Integer> sourceCounts,
    List<Capability> unavailable,
    List<String> notes) {

  public HybridSearchResult {
    hits = List.copyOf(hits);
    sourceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(sourceCounts));
    unavailable = List.copyOf(unavailable);
    notes = List.copyOf(notes);
  }
}
