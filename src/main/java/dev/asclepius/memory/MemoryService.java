package dev.asclepius.memory;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.embedding.Vectors;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.asclepius.failure.StoreFailures;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Persistent semantic memory for the agent: corrections, preferences and facts learned across
 * sessions.
 *
 * <p>Memories are embedded at write time and recalled by cosine similarity above the configured
 * floor ({@code asclepius.memory.min-similarity}). Equal similarities are returned most recent
 * first. This is the only component that writes during a request.
 */
@Service
public class MemoryService {

  private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

  static final String KIND = "kind";
  static final String CREATED_AT = "created_at";
  static final String REVISED_AT = "revised_at";

  /** Extra rows fetched so that ties at the cut-off can be ordered by recency. */
  static final int RECALL_OVER_FETCH = 10;

  static final int MAX_RECALL_LIMIT = 50;

  static final int RECENT_ENTRIES = 5;

  private static final Comparator<RecalledMemory> MOST_SIMILAR_THEN_NEWEST =
      Comparator.comparingDouble(RecalledMemory::similarity)
          .reversed()
          .thenComparing(
              RecalledMemory::createdAt,
              Comparator.<Instant>nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(RecalledMemory::id);

  private final EmbeddingStore<TextSegment> memoryEmbeddingStore;
  private final MemoryRecordRepository repository;
  private final TextEmbedder textEmbedder;
  private final MemoryProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public MemoryService(
      @Qualifier("memoryEmbeddingStore") EmbeddingStore<TextSegment> memoryEmbeddingStore,
      MemoryRecordRepository repository,
      TextEmbedder textEmbedder,
      MemoryProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.memoryEmbeddingStore = memoryEmbeddingStore;
    this.repository = repository;
    this.textEmbedder = textEmbedder;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Stores a memory. Duplicates are allowed.
   *
   * @return the new memory id
   * @throws CapabilityUnavailableException if the text embedding provider is down
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
  public String remember(String content, MemoryKind kind) {
    String text = validContent(content);
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null");
    }
    Embedding embedding = textEmbedder.embedPassage(text);
    Metadata metadata = new Metadata().put(KIND, kind.value()).put(CREATED_AT, clock.millis());
    TextSegment segment = TextSegment.from(text, metadata);
    String id =
        StoreFailures.translated(
            "memory remember", () -> memoryEmbeddingStore.add(embedding, segment));
    log.info("Stored {} memory {}", kind.value(), id);
    return id;
  }

  @Recover
  String recoverRemember(RuntimeException e, String content, MemoryKind kind) {
    throw StoreFailures.afterRetries(Capability.MEMORY_STORE, e);
  }

  /**
   * Returns the memories most similar to {@code query} whose cosine similarity reaches the
   * configured floor, best first.
   *
   * @param kind optional kind filter
   * @throws CapabilityUnavailableException if the text embedding provider is down
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
  public List<RecalledMemory> recall(String query, int limit, @Nullable MemoryKind kind) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1 || limit > MAX_RECALL_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and " + MAX_RECALL_LIMIT + ", got: " + limit);
    }
    Embedding queryEmbedding = textEmbedder.embedQuery(query);

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(limit + RECALL_OVER_FETCH)
            .minScore(Vectors.cosineToRelevance(properties.getMinSimilarity()));
    if (kind != null) {
      builder.filter(metadataKey(KIND).isEqualTo(kind.value()));
    }

    EmbeddingSearchRequest searchRequest = builder.build();
    List<EmbeddingMatch<TextSegment>> matches =
        StoreFailures.translated(
            "memory recall", () -> memoryEmbeddingStore.search(searchRequest).matches());
    return matches.stream()
        .filter(match -> match.score() != null && !match.score().isNaN())
        .map(this::toRecalled)
        .filter(memory -> memory.similarity() >= properties.getMinSimilarity())
        .sorted(MOST_SIMILAR_THEN_NEWEST)
        .limit(limit)
        .toList();
  }

  @Recover
  List<RecalledMemory> recoverRecall(
      RuntimeException e, String query, int limit, @Nullable MemoryKind kind) {
    throw StoreFailures.afterRetries(Capability.MEMORY_STORE, e);
  }

  /**
   * Recall used before the first model decision of a question. Never fails: an unavailable
   * embedding provider or store yields no memories.
   */
  public List<RecalledMemory> autoRecall(String question) {
    if (properties.getAutoRecallLimit() == 0 || question == null || question.isBlank()) {
      return List.of();
    }
    try {
      return recall(question, properties.getAutoRecallLimit(), null);
    } catch (RuntimeException e) {
      log.warn("Auto-recall skipped: {}", e.getMessage());
      return List.of();
    }
  }

  /**
   * Deletes a memory.
   *
   * @return {@code true} if the memory existed
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
  public boolean forget(String memoryId) {
    UUID id = parseId(memoryId);
    if (!repository.existsById(id)) {
      return false;
    }
    StoreFailures.translatedRun(
        "memory forget", () -> memoryEmbeddingStore.remove(id.toString()));
    log.info("Forgot memory {}", id);
    return true;
  }

  @Recover
  boolean recoverForget(RuntimeException e, String memoryId) {
    throw StoreFailures.afterRetries(Capability.MEMORY_STORE, e);
  }

  /**
   * Replaces a memory's content, re-embedding it. The id, kind and creation time are kept.
   *
   * @return {@code true} if the memory existed
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
  public boolean revise(String memoryId, String content) {
    UUID id = parseId(memoryId);
    String text = validContent(content);
    Optional<MemoryRecord> existing = repository.findById(id);
    if (existing.isEmpty()) {
      return false;
    }
    JsonNode stored = readMetadata(existing.get().getMetadata());
    Metadata metadata =
        new Metadata()
            .put(KIND, stored.path(KIND).asText(MemoryKind.FACT.value()))
            .put(CREATED_AT, stored.path(CREATED_AT).asLong(clock.millis()))
            .put(REVISED_AT, clock.millis());

    Embedding embedding = textEmbedder.embedPassage(text);
    TextSegment segment = TextSegment.from(text, metadata);
    // addAll upserts on the id, so the old content stays until the new row is written.
    StoreFailures.translatedRun(
        "memory revise",
        () ->
            memoryEmbeddingStore.addAll(
                List.of(id.toString()), List.of(embedding), List.of(segment)));
    log.info("Revised memory {}", id);
    return true;
  }

  @Recover
  boolean recoverRevise(RuntimeException e, String memoryId, String content) {
    throw StoreFailures.afterRetries(Capability.MEMORY_STORE, e);
  }

  public MemoryStatistics statistics() {
    Map<String, Long> byKind = new LinkedHashMap<>();
    long total = 0;
    for (Object[] row : repository.countGroupedByKind()) {
      long count = ((Number) row[1]).longValue();
      byKind.put((String) row[0], count);
      total += count;
    }
    List<MemoryStatistics.Entry> recent =
        repository.findMostRecent(RECENT_ENTRIES).stream()
            .map(
                row ->
                    new MemoryStatistics.Entry(
                        (String) row[0],
                        (String) row[1],
                        row[2] != null ? (String) row[2] : "unknown",
                        epochMillis(row[3])))
            .toList();
    return new MemoryStatistics(total, byKind, recent);
  }

  private RecalledMemory toRecalled(EmbeddingMatch<TextSegment> match) {
    Metadata metadata = match.embedded().metadata();
    Long createdAt = metadata.getLong(CREATED_AT);
    String kind = metadata.getString(KIND);
    return new RecalledMemory(
        match.embeddingId(),
        match.embedded().text(),
        kind != null ? MemoryKind.fromValue(kind) : MemoryKind.FACT,
        Vectors.relevanceToCosine(match.score()),
        createdAt != null ? Instant.ofEpochMilli(createdAt) : null);
  }

  private String validContent(String content) {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Memory content must not be blank");
    }
    String text = content.strip();
    if (text.length() > properties.getMaxContentLength()) {
      throw new IllegalArgumentException(
          "Memory content exceeds " + properties.getMaxContentLength() + " characters");
    }
    return text;
  }

  private JsonNode readMetadata(@Nullable String metadata) {
    if (metadata == null || metadata.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(metadata);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable memory metadata: {}", e.getOriginalMessage());
      return objectMapper.createObjectNode();
    }
  }

  private static @Nullable Instant epochMillis(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    return Instant.ofEpochMilli(new BigDecimal(value.toString()).longValue());
  }

  private static UUID parseId(String memoryId) {
    if (memoryId == null || memoryId.isBlank()) {
      throw new IllegalArgumentException("memory_id must not be blank");
    }
    try {
      return UUID.fromString(memoryId.strip());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("memory_id is not a valid id: " + memoryId, e);
    }
  }
}
