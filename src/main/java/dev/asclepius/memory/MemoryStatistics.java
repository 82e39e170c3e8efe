package dev.asclepius.memory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Aggregate view of the memory store.
 *
 * @param total number of memories
 * @param byKind count per kind value
 * @param mostRecent latest memories, newest first
 */
public record MemoryStatistics(long total, Map<String, Long> byKind, List<Entry> mostRecent) {

  /** Short description of one stored memory. */
  public record Entry(String id, String content, String kind, @Nullable Instant createdAt) {}
}
