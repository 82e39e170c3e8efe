package dev.asclepius.graph;

import dev.asclepius.failure.Capability;
import dev.asclepius.failure.StoreFailures;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Entity search, relationship exploration and statistics over the clinical knowledge graph.
 *
 * <p>Seed entities are matched by keyword and then expanded breadth-first with {@link
 * GraphTraversal}. Missing graph tables surface as {@link
 * dev.asclepius.failure.CapabilityUnavailableException} from {@link KnowledgeGraphRepository};
 * connectivity failures are retried and then reported as {@link
 * dev.asclepius.failure.StoreUnavailableException}.
 */
@Service
public class KnowledgeGraphSearchService {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphSearchService.class);

  /** Upper bound on seeds pulled before expansion. */
  static final int MAX_SEEDS = 50;

  static final List<String> CONFIDENCE_BUCKETS =
      List.of("[0.0,0.5)", "[0.5,0.7)", "[0.7,0.9)", "[0.9,1.0]");

  private final KnowledgeGraphRepository repository;

  public KnowledgeGraphSearchService(KnowledgeGraphRepository repository) {
    this.repository = repository;
  }

  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public List<TraversalHit> search(GraphSearchRequest request) {
    List<String> keywords = keywords(request.term());
    if (keywords.isEmpty()) {
      // nothing to match, but a missing graph must still be reported
      repository.requireProvisioned();
      return List.of();
    }
    List<ClinicalEntity> seeds = repository.findByKeywords(keywords, MAX_SEEDS);
    log.debug("Graph search '{}': {} seed entities", request.term(), seeds.size());
    if (seeds.isEmpty()) {
      return List.of();
    }
    TraversalResult result = GraphTraversal.traverse(repository, seeds, request.maxHops());
    return result.hits().stream().limit(request.limit()).toList();
  }

  @Recover
  List<TraversalHit> recoverSearch(RuntimeException e, GraphSearchRequest request) {
    throw StoreFailures.afterRetries(Capability.KNOWLEDGE_GRAPH, e);
  }

  /**
   * Explores the neighbourhood of one entity.
   *
   * @param entityIdOrText an entity id or an exact (case-insensitive) surface form
   * @param maxHops expansion depth in [1, 3]
   * @return the neighbourhood, or empty when no entity matches
   */
  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public Optional<EntityNeighbourhood> relationships(String entityIdOrText, int maxHops) {
    if (entityIdOrText == null || entityIdOrText.isBlank()) {
      throw new IllegalArgumentException("Entity must not be blank");
    }
    if (maxHops < 1 || maxHops > GraphTraversal.MAX_HOPS) {
      throw new IllegalArgumentException(
          "max_hops must be between 1 and " + GraphTraversal.MAX_HOPS + ", got: " + maxHops);
    }
    List<ClinicalEntity> matches = repository.findByIdOrText(entityIdOrText.strip());
    if (matches.isEmpty()) {
      return Optional.empty();
    }
    ClinicalEntity root = matches.get(0);
    TraversalResult result = GraphTraversal.traverse(repository, List.of(root), maxHops);
    List<TraversalHit> connected =
        result.hits().stream().filter(hit -> !hit.entity().id().equals(root.id())).toList();
    return Optional.of(new EntityNeighbourhood(root, connected, result.edges()));
  }

  @Recover
  Optional<EntityNeighbourhood> recoverRelationships(
      RuntimeException e, String entityIdOrText, int maxHops) {
    throw StoreFailures.afterRetries(Capability.KNOWLEDGE_GRAPH, e);
  }

  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public EntityStatistics statistics() {
    Map<String, Long> byType = new LinkedHashMap<>();
    repository
        .countEntitiesByType()
        .forEach(
            (label, count) -> byType.merge(EntityType.fromLabel(label).value(), count, Long::sum));

    Map<String, Long> buckets = new LinkedHashMap<>();
    CONFIDENCE_BUCKETS.forEach(bucket -> buckets.put(bucket, 0L));
    buckets.putAll(repository.countEntitiesByConfidenceBucket());

    return new EntityStatistics(
        repository.countEntities(),
        repository.countRelationships(),
        byType,
        buckets,
        repository.countRelationshipsByType());
  }

  @Recover
  EntityStatistics recoverStatistics(RuntimeException e) {
    throw StoreFailures.afterRetries(Capability.KNOWLEDGE_GRAPH, e);
  }

  /** Lower-case alphanumeric tokens of at least two characters, de-duplicated in order. */
  static List<String> keywords(String term) {
    return Arrays.stream(term.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+"))
        .filter(token -> token.length() >= 2)
        .distinct()
        .toList();
  }
}
