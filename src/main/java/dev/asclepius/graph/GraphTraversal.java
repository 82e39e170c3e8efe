package dev.asclepius.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pure static breadth-first expansion over a {@link GraphSource}.
 *
 * <p>The traversal is iterative and level by level: one {@link GraphSource#edgesTouching} call per
 * hop, edges followed in both directions. An entity is marked visited before it joins the next
 * frontier, so cycles and self-loops terminate and every entity is scored exactly once, at its
 * shortest distance from a seed.
 *
 * <p>When several same-length paths reach an entity, the one with the higher cumulative
 * confidence wins. Remaining ties go to the lexicographically smaller predecessor id, then the
 * smaller relation type, then the forward direction.
 *
 * <p>Path confidence is {@code seed.confidence * product(edge.confidence * reached.confidence)}
 * and the ranking score is {@code pathConfidence / (1 + hops)}.
 */
public final class GraphTraversal {

  /** Hard upper bound on expansion depth. */
  public static final int MAX_HOPS = 3;

  private static final Comparator<Candidate> BEST_CANDIDATE_FIRST =
      Comparator.comparingDouble(Candidate::pathConfidence)
          .reversed()
          .thenComparing(Candidate::fromEntityId)
          .thenComparing(c -> c.edge().relationType())
          .thenComparing(c -> !c.forward());

  /** Ordering of results: score desc, then cumulative confidence desc, then entity id asc. */
  public static final Comparator<TraversalHit> RANKING =
      Comparator.comparingDouble(TraversalHit::score)
          .reversed()
          .thenComparing(Comparator.comparingDouble(TraversalHit::pathConfidence).reversed())
          .thenComparing(hit -> hit.entity().id());

  private GraphTraversal() {}

  /**
   * Expands from {@code seeds} up to {@code maxHops} edges away.
   *
   * @param source graph access
   * @param seeds starting entities (duplicates are ignored)
   * @param maxHops expansion depth, 0 returns the seeds only
   * @return hits ordered by {@link #RANKING}, and the edges examined between reached entities
   */
  public static TraversalResult traverse(
      GraphSource source, List<ClinicalEntity> seeds, int maxHops) {
    if (maxHops < 0 || maxHops > MAX_HOPS) {
      throw new IllegalArgumentException(
          "maxHops must be between 0 and " + MAX_HOPS + ", got: " + maxHops);
    }

    Map<String, PathState> reached = new HashMap<>();
    Set<String> visited = new HashSet<>();
    List<String> frontier = new ArrayList<>();
    for (ClinicalEntity seed : seeds) {
      if (visited.add(seed.id())) {
        reached.put(seed.id(), new PathState(seed, 0, seed.confidence(), List.of()));
        frontier.add(seed.id());
      }
    }

    Set<EntityRelationship> examined = new LinkedHashSet<>();
    for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
      Set<String> frontierIds = new HashSet<>(frontier);
      List<EntityRelationship> edges = source.edgesTouching(frontier);
      examined.addAll(edges);

      List<RawStep> steps = new ArrayList<>();
      Set<String> unseen = new HashSet<>();
      for (EntityRelationship edge : edges) {
        if (frontierIds.contains(edge.sourceEntityId())
            && !visited.contains(edge.targetEntityId())) {
          steps.add(new RawStep(edge.sourceEntityId(), edge.targetEntityId(), edge, true));
          unseen.add(edge.targetEntityId());
        }
        if (frontierIds.contains(edge.targetEntityId())
            && !visited.contains(edge.sourceEntityId())) {
          steps.add(new RawStep(edge.targetEntityId(), edge.sourceEntityId(), edge, false));
          unseen.add(edge.sourceEntityId());
        }
      }
      if (steps.isEmpty()) {
        break;
      }

      Map<String, ClinicalEntity> entities = source.entities(unseen);
      // TreeMap keeps the next frontier in id order so repeated runs issue identical queries
      Map<String, Candidate> bestByTarget = new TreeMap<>();
      for (RawStep step : steps) {
        ClinicalEntity target = entities.get(step.toEntityId());
        if (target == null) {
          continue;
        }
        PathState from = reached.get(step.fromEntityId());
        double confidence =
            from.pathConfidence() * step.edge().effectiveConfidence() * target.confidence();
        Candidate candidate =
            new Candidate(target, step.fromEntityId(), step.edge(), step.forward(), confidence);
        bestByTarget.merge(
            target.id(),
            candidate,
            (current, challenger) ->
                BEST_CANDIDATE_FIRST.compare(challenger, current) < 0 ? challenger : current);
      }

      List<String> next = new ArrayList<>();
      for (Candidate winner : bestByTarget.values()) {
        String id = winner.entity().id();
        visited.add(id);
        PathState from = reached.get(winner.fromEntityId());
        List<PathStep> path = new ArrayList<>(from.path());
        path.add(
            new PathStep(
                winner.fromEntityId(),
                id,
                winner.edge().relationType(),
                winner.forward(),
                winner.edge().effectiveConfidence()));
        reached.put(id, new PathState(winner.entity(), hop, winner.pathConfidence(), path));
        next.add(id);
      }
      frontier = next;
    }

    List<TraversalHit> hits =
        reached.values().stream().map(PathState::toHit).sorted(RANKING).toList();
    List<EntityRelationship> edges =
        examined.stream()
            .filter(
                e -> visited.contains(e.sourceEntityId()) && visited.contains(e.targetEntityId()))
            .sorted(
                Comparator.comparing(EntityRelationship::sourceEntityId)
                    .thenComparing(EntityRelationship::targetEntityId)
                    .thenComparing(EntityRelationship::relationType))
            .toList();
    return new TraversalResult(hits, edges);
  }

  private record RawStep(
      String fromEntityId, String toEntityId, EntityRelationship edge, boolean forward) {}

  private record Candidate(
      ClinicalEntity entity,
      String fromEntityId,
      EntityRelationship edge,
      boolean forward,
      double pathConfidence) {}

  private record PathState(
      ClinicalEntity entity, int hops, double pathConfidence, List<PathStep> path) {

    TraversalHit toHit() {
      return new TraversalHit(entity, hops, pathConfidence, pathConfidence / (1 + hops), path);
    }
  }
}
