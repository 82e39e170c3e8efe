package dev.asclepius.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.asclepius.BaseIntegrationTest;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class KnowledgeGraphSearchServiceIT extends BaseIntegrationTest {

  @Autowired KnowledgeGraphSearchService graphSearchService;

  @Autowired KnowledgeGraphRepository repository;

  @Autowired JdbcTemplate jdbcTemplate;

  @Autowired DataSource dataSource;

  @BeforeEach
  void dropGraphTables() {
    jdbcTemplate.execute("DROP TABLE IF EXISTS kg_relationships");
    jdbcTemplate.execute("DROP TABLE IF EXISTS kg_entities");
  }

  private void provisionGraph() {
    new ResourceDatabasePopulator(new ClassPathResource("graph-schema.sql")).execute(dataSource);
    entity("E1", "fever", "SYMPTOM", 0.95, "D1");
    entity("E2", "pneumonia", "CONDITION", 0.9, "D1");
    entity("E3", "amoxicillin", "MEDICATION", 0.85, "D2");
    entity("E4", "chest", "BODY_PART", 0.4, null);
    edge("E2", "E1", "CAUSES", 0.8);
    edge("E3", "E2", "TREATS", null);
    edge("E2", "E4", "LOCATED_IN", 0.6);
  }

  private void entity(String id, String text, String type, Double confidence, String documentId) {
    jdbcTemplate.update(
        "INSERT INTO kg_entities VALUES (?, ?, ?, ?, ?)", id, text, type, confidence, documentId);
  }

  private void edge(String source, String target, String type, Double confidence) {
    jdbcTemplate.update(
        "INSERT INTO kg_relationships VALUES (?, ?, ?, ?)", source, target, type, confidence);
  }

  @Test
  void missing_graph_tables_are_reported_as_unavailable_not_empty() {
    assertThatThrownBy(() -> graphSearchService.search(new GraphSearchRequest("fever")))
        .isInstanceOfSatisfying(
            CapabilityUnavailableException.class,
            e -> assertThat(e.getCapability()).isEqualTo(Capability.KNOWLEDGE_GRAPH));
    assertThatThrownBy(() -> graphSearchService.statistics())
        .isInstanceOf(CapabilityUnavailableException.class);
  }

  @Test
  void keyword_search_expands_to_neighbours() {
    provisionGraph();

    List<TraversalHit> hits = graphSearchService.search(new GraphSearchRequest("fever", 1, 10));

    assertThat(hits).extracting(hit -> hit.entity().id()).startsWith("E1").contains("E2");
    assertThat(hits).extracting(hit -> hit.entity().id()).doesNotContain("E3");
    assertThat(hits.get(0).hops()).isZero();
  }

  @Test
  void relationships_are_explored_in_both_directions() {
    provisionGraph();

    Optional<EntityNeighbourhood> neighbourhood = graphSearchService.relationships("Pneumonia", 1);

    assertThat(neighbourhood).isPresent();
    assertThat(neighbourhood.get().root().id()).isEqualTo("E2");
    assertThat(neighbourhood.get().connected())
        .extracting(hit -> hit.entity().id())
        .containsExactlyInAnyOrder("E1", "E3", "E4");
  }

  @Test
  void unknown_entity_has_no_neighbourhood() {
    provisionGraph();

    assertThat(graphSearchService.relationships("E404", 2)).isEmpty();
  }

  @Test
  void statistics_count_by_type_and_confidence() {
    provisionGraph();
    entity("E5", "sputum", "SYMPTOM", null, "D2");

    EntityStatistics statistics = graphSearchService.statistics();

    assertThat(statistics.totalEntities()).isEqualTo(5);
    assertThat(statistics.totalRelationships()).isEqualTo(3);
    assertThat(statistics.entitiesByType())
        .containsEntry("symptom", 2L)
        .containsEntry("body_part", 1L);
    assertThat(statistics.entitiesByConfidence())
        .containsEntry("[0.0,0.5)", 1L)
        .containsEntry("[0.5,0.7)", 0L)
        .containsEntry("[0.7,0.9)", 1L)
        .containsEntry("[0.9,1.0]", 2L)
        .containsEntry("unknown", 1L);
    assertThat(statistics.relationshipsByType()).containsEntry("TREATS", 1L);
  }

  @Test
  void like_wildcards_in_keywords_are_literal() {
    provisionGraph();

    assertThat(repository.findByKeywords(List.of("%"), 10)).isEmpty();
  }
}
