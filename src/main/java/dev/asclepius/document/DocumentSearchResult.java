package dev.asclepius.document;

import java.util.List;

/**
 * Outcome of a document search.
 *
 * @param hits ranked documents, best first
 * @param degraded {@code true} when semantic re-ranking was skipped
 * @param notes human-readable remarks, e.g. which capability was unavailable
 */
public record DocumentSearchResult(List<DocumentHit> hits, boolean degraded, List<String> notes) {

  public DocumentSearchResult {
    hits = List.copyOf(hits);
    notes = List.copyOf(notes);
  }
}
