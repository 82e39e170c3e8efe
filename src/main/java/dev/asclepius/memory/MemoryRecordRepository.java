package dev.asclepius.memory;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link MemoryRecord} rows. */
public interface MemoryRecordRepository extends JpaRepository<MemoryRecord, UUID> {

  /**
   * Counts memories grouped by kind.
   *
   * @return list of [kind, count] pairs
   */
  @Query(
      value =
          """
            SELECT COALESCE(metadata->>'kind', 'unknown') AS kind, COUNT(*) AS cnt
            FROM agent_memories
            GROUP BY metadata->>'kind'
            ORDER BY 1
            """,
      nativeQuery = true)
  List<Object[]> countGroupedByKind();

  /**
   * Most recently written memories.
   *
   * @return up to {@code limit} rows of [embedding_id, text, kind, created_at epoch millis]
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text), text, metadata->>'kind', metadata->>'created_at'
            FROM agent_memories
            ORDER BY CAST(metadata->>'created_at' AS bigint) DESC NULLS LAST, embedding_id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> findMostRecent(@Param("limit") int limit);
}
