package dev.asclepius.fusion;

/**
 * How much one source added to a fused score.
 *
 * @param source the contributing source
 * @param rank the item's rank in that source's list
 * @param rawScore the source's own score
 * @param contribution {@code 1 / (k + rank)}
 */
public record SourceContribution(
    RetrievalSource source, int rank, double rawScore, double contribution) {}
