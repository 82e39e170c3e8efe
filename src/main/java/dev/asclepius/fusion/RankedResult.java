package dev.asclepius.fusion;

/**
 * One entry of a single source's ranked list, as fed to {@link ReciprocalRankFusion}.
 *
 * @param itemId the reconciled item identifier shared across sources
 * @param source the retrieval source that produced the entry
 * @param rank 1-based position in that source's list
 * @param rawScore the source's own score, kept for provenance only
 */
public record RankedResult(String itemId, RetrievalSource source, int rank, double rawScore) {

  public RankedResult {
    if (itemId == null || itemId.isBlank()) {
      throw new IllegalArgumentException("itemId must not be blank");
    }
    if (source == null) {
      throw new IllegalArgumentException("source must not be null");
    }
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be positive, got: " + rank);
    }
  }
}
