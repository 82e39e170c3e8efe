package dev.asclepius.graph;

import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the knowledge graph tables {@code kg_entities} and {@code kg_relationships}.
 *
 * <p>Those tables are written by the external entity-extraction pipeline and are not part of the
 * Flyway schema. When they do not exist (PostgreSQL SQLSTATE {@code 42P01}) every method fails
 * with {@link CapabilityUnavailableException} for {@link Capability#KNOWLEDGE_GRAPH}; an absent
 * graph is never reported as an empty one.
 */
@Repository
public class KnowledgeGraphRepository implements GraphSource {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphRepository.class);

  static final String UNDEFINED_TABLE = "42P01";

  private static final RowMapper<ClinicalEntity> ENTITY_MAPPER =
      (rs, rowNum) ->
          new ClinicalEntity(
              rs.getString("entity_id"),
              rs.getString("entity_text"),
              EntityType.fromLabel(rs.getString("entity_type")),
              rs.getDouble("confidence"),
              rs.getString("document_id"));

  private static final RowMapper<EntityRelationship> RELATIONSHIP_MAPPER =
      (rs, rowNum) ->
          new EntityRelationship(
              rs.getString("source_entity_id"),
              rs.getString("target_entity_id"),
              rs.getString("relationship_type"),
              nullableDouble(rs, "confidence"));

  private final NamedParameterJdbcTemplate jdbc;

  public KnowledgeGraphRepository(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  /**
   * Entities whose surface form contains any of the keywords (case-insensitive), highest
   * confidence first.
   */
  public List<ClinicalEntity> findByKeywords(List<String> keywords, int limit) {
    if (keywords.isEmpty()) {
      return List.of();
    }
    MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
    List<String> clauses = new ArrayList<>();
    for (int i = 0; i < keywords.size(); i++) {
      clauses.add("LOWER(entity_text) LIKE :kw" + i);
      params.addValue("kw" + i, "%" + escapeLike(keywords.get(i).toLowerCase()) + "%");
    }
    String sql =
        """
        SELECT entity_id, entity_text, entity_type, confidence, document_id
        FROM kg_entities
        WHERE %s
        ORDER BY confidence DESC, entity_id ASC
        LIMIT :limit
        """
            .formatted(String.join(" OR ", clauses));
    return guarded(() -> jdbc.query(sql, params, ENTITY_MAPPER));
  }

  /** Exact id match first, then a case-insensitive exact surface-form match. */
  public List<ClinicalEntity> findByIdOrText(String idOrText) {
    String sql =
        """
        SELECT entity_id, entity_text, entity_type, confidence, document_id
        FROM kg_entities
        WHERE entity_id = :value OR LOWER(entity_text) = LOWER(:value)
        ORDER BY CASE WHEN entity_id = :value THEN 0 ELSE 1 END, confidence DESC, entity_id ASC
        """;
    return guarded(
        () -> jdbc.query(sql, new MapSqlParameterSource("value", idOrText), ENTITY_MAPPER));
  }

  @Override
  public Map<String, ClinicalEntity> entities(Collection<String> entityIds) {
    if (entityIds.isEmpty()) {
      return Map.of();
    }
    String sql =
        """
        SELECT entity_id, entity_text, entity_type, confidence, document_id
        FROM kg_entities
        WHERE entity_id IN (:ids)
        """;
    List<ClinicalEntity> rows =
        guarded(
            () -> jdbc.query(sql, new MapSqlParameterSource("ids", entityIds), ENTITY_MAPPER));
    Map<String, ClinicalEntity> byId = new LinkedHashMap<>();
    for (ClinicalEntity entity : rows) {
      byId.put(entity.id(), entity);
    }
    return byId;
  }

  @Override
  public List<EntityRelationship> edgesTouching(Collection<String> entityIds) {
    if (entityIds.isEmpty()) {
      return List.of();
    }
    String sql =
        """
        SELECT source_entity_id, target_entity_id, relationship_type, confidence
        FROM kg_relationships
        WHERE source_entity_id IN (:ids) OR target_entity_id IN (:ids)
        """;
    return guarded(
        () -> jdbc.query(sql, new MapSqlParameterSource("ids", entityIds), RELATIONSHIP_MAPPER));
  }

  /**
   * Touches {@code kg_entities} without reading rows.
   *
   * @throws CapabilityUnavailableException if the graph tables are not provisioned
   */
  public void requireProvisioned() {
    guarded(() -> jdbc.getJdbcTemplate().queryForList("SELECT 1 FROM kg_entities LIMIT 0"));
  }

  public long countEntities() {
    return guarded(() -> count("SELECT COUNT(*) FROM kg_entities"));
  }

  public long countRelationships() {
    return guarded(() -> count("SELECT COUNT(*) FROM kg_relationships"));
  }

  /** Entity counts keyed by stored type label. */
  public Map<String, Long> countEntitiesByType() {
    return guarded(
        () ->
            groupedCounts(
                "SELECT entity_type AS label, COUNT(*) AS cnt FROM kg_entities"
                    + " GROUP BY entity_type ORDER BY entity_type"));
  }

  /** Relationship counts keyed by relationship type. */
  public Map<String, Long> countRelationshipsByType() {
    return guarded(
        () ->
            groupedCounts(
                "SELECT relationship_type AS label, COUNT(*) AS cnt FROM kg_relationships"
                    + " GROUP BY relationship_type ORDER BY relationship_type"));
  }

  /** Entity counts per confidence bucket, keyed by bucket label. */
  public Map<String, Long> countEntitiesByConfidenceBucket() {
    String sql =
        """
        SELECT CASE
                 WHEN confidence IS NULL THEN 'unknown'
                 WHEN confidence < 0.5 THEN '[0.0,0.5)'
                 WHEN confidence < 0.7 THEN '[0.5,0.7)'
                 WHEN confidence < 0.9 THEN '[0.7,0.9)'
                 ELSE '[0.9,1.0]'
               END AS label,
               COUNT(*) AS cnt
        FROM kg_entities
        GROUP BY 1
        ORDER BY 1
        """;
    return guarded(() -> groupedCounts(sql));
  }

  private long count(String sql) {
    Long value = jdbc.getJdbcTemplate().queryForObject(sql, Long.class);
    return value != null ? value : 0L;
  }

  private Map<String, Long> groupedCounts(String sql) {
    Map<String, Long> counts = new LinkedHashMap<>();
    RowCallbackHandler collect = rs -> counts.put(rs.getString("label"), rs.getLong("cnt"));
    jdbc.getJdbcTemplate().query(sql, collect);
    return counts;
  }

  private <T> T guarded(Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      if (isUndefinedTable(e)) {
        log.warn(
            "Knowledge graph tables are not provisioned: {}",
            e.getMostSpecificCause().getMessage());
        throw new CapabilityUnavailableException(
            Capability.KNOWLEDGE_GRAPH, "Knowledge graph tables are not provisioned", e);
      }
      throw e;
    }
  }

  static boolean isUndefinedTable(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql && UNDEFINED_TABLE.equals(sql.getSQLState())) {
        return true;
      }
    }
    return false;
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
