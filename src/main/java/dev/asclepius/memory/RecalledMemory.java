package dev.asclepius.memory;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A memory returned by recall.
 *
 * @param id memory identifier
 * @param content stored text
 * @param kind memory kind
 * @param similarity cosine similarity to the recall query
 * @param createdAt when the memory was first written, if recorded
 */
public record RecalledMemory(
    String id, String content, MemoryKind kind, double similarity, @Nullable Instant createdAt) {}
