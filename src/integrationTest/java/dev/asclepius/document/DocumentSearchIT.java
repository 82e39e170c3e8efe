package dev.asclepius.document;

import static org.assertj.core.api.Assertions.assertThat;

import dev.asclepius.BaseIntegrationTest;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class DocumentSearchIT extends BaseIntegrationTest {

  @Autowired DocumentIndexer documentIndexer;

  @Autowired DocumentSearchService documentSearchService;

  static final String FEVER_NOTE =
      "Patient presents with high fever and chills for three days. Temperature 39.4 C.";
  static final String COUGH_NOTE =
      "Persistent productive cough with fever overnight. Chest x-ray ordered.";
  static final String FRACTURE_NOTE =
      "Fall from ladder. Closed fracture of the left radius, cast applied.";

  @BeforeEach
  void seedDocuments() {
    documentIndexer.index("D1", "p1", LocalDate.of(2024, 1, 10), "DocumentReference", FEVER_NOTE);
    documentIndexer.index(
        "D2", "p2", LocalDate.of(2024, 3, 5), "DocumentReference", fhir(COUGH_NOTE));
    documentIndexer.index("D3", "p1", LocalDate.of(2024, 6, 1), "DocumentReference", FRACTURE_NOTE);
  }

  private static String fhir(String note) {
    String hex = HexFormat.of().formatHex(note.getBytes(StandardCharsets.UTF_8));
    return "{\"resourceType\":\"DocumentReference\",\"content\":[{\"attachment\":{\"data\":\""
        + hex
        + "\"}}]}";
  }

  @Test
  void full_text_candidates_are_reranked_semantically() {
    DocumentSearchResult result = documentSearchService.search(new DocumentSearchRequest("fever"));

    assertThat(result.degraded()).isFalse();
    assertThat(result.notes()).isEmpty();
    assertThat(result.hits())
        .extracting(DocumentHit::documentId)
        .containsExactlyInAnyOrder("D1", "D2");
    assertThat(result.hits())
        .allSatisfy(
            hit -> {
              assertThat(hit.vectorScore()).isNotNull();
              assertThat(hit.score()).isBetween(0.0, 1.0);
            });
  }

  @Test
  void decoded_fhir_note_is_searchable_and_previewed() {
    DocumentSearchResult result =
        documentSearchService.search(new DocumentSearchRequest("productive cough"));

    assertThat(result.hits()).extracting(DocumentHit::documentId).containsExactly("D2");
    assertThat(result.hits().get(0).preview()).startsWith("Persistent productive cough");
  }

  @Test
  void patient_and_date_filters_are_applied() {
    DocumentSearchResult byPatient =
        documentSearchService.search(new DocumentSearchRequest("fever", 10, "p2", null, null));
    DocumentSearchResult byDate =
        documentSearchService.search(
            new DocumentSearchRequest(
                "fever", 10, null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)));

    assertThat(byPatient.hits()).extracting(DocumentHit::documentId).containsExactly("D2");
    assertThat(byDate.hits()).extracting(DocumentHit::documentId).containsExactly("D1");
  }

  @Test
  void no_lexical_match_returns_no_hits() {
    assertThat(documentSearchService.search(new DocumentSearchRequest("appendectomy")).hits())
        .isEmpty();
  }

  @Test
  void details_return_full_text_and_metadata() {
    Optional<DocumentDetails> details = documentSearchService.details("D3");

    assertThat(details).isPresent();
    assertThat(details.get().text()).isEqualTo(FRACTURE_NOTE);
    assertThat(details.get().metadata()).containsEntry("patient_id", "p1");
    assertThat(documentSearchService.details("D404")).isEmpty();
  }

  @Test
  void patient_ids_are_resolved_per_document() {
    Map<String, String> patients = documentSearchService.patientIds(List.of("D1", "D2", "D404"));

    assertThat(patients).containsOnly(Map.entry("D1", "p1"), Map.entry("D2", "p2"));
  }
}
