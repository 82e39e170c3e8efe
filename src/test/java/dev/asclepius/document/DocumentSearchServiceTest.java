package dev.asclepius.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.config.SearchProperties;
import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentSearchServiceTest {

  private static final Embedding QUERY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  @Mock ClinicalDocumentRepository repository;

  @Mock TextEmbedder textEmbedder;

  DocumentSearchService service;

  @BeforeEach
  void setUp() {
    SearchProperties props = new SearchProperties();
    props.setAlpha(0.7);
    props.setRerankCandidates(30);
    ObjectMapper objectMapper = new ObjectMapper();
    service =
        new DocumentSearchService(
            repository, textEmbedder, new FhirNoteDecoder(objectMapper), props, objectMapper);
  }

  private static Object[] row(String embeddingId, String documentId, String text, float rank) {
    return new Object[] {
      embeddingId, documentId, "p1", "2024-01-15", "DocumentReference", text, rank
    };
  }

  private static Object[] cosine(String embeddingId, double cosine) {
    return new Object[] {embeddingId, cosine};
  }

  private void givenLexicalRows(Object[]... rows) {
    given(repository.lexicalSearch(eq("fever"), isNull(), isNull(), isNull(), eq(30)))
        .willReturn(List.of(rows));
  }

  @Test
  void vector_similarity_re_ranks_lexical_candidates() {
    givenLexicalRows(row("e1", "D1", "fever noted", 0.5f), row("e2", "D2", "febrile", 0.3f));
    given(textEmbedder.embedQuery("fever")).willReturn(QUERY_EMBEDDING);
    given(repository.vectorSimilarities(any(), any()))
        .willReturn(List.of(cosine("e1", 0.1), cosine("e2", 0.9)));

    DocumentSearchResult result = service.search(new DocumentSearchRequest("fever"));

    assertThat(result.degraded()).isFalse();
    assertThat(result.notes()).isEmpty();
    assertThat(result.hits()).extracting(DocumentHit::documentId).containsExactly("D2", "D1");
    assertThat(result.hits().get(0).vectorScore()).isEqualTo(0.9);
    assertThat(result.hits().get(0).lexicalScore()).isEqualTo(0.3f);
    assertThat(result.hits().get(0).patientId()).isEqualTo("p1");
  }

  @Test
  void rows_of_the_same_document_collapse_to_the_best_ranked_one() {
    givenLexicalRows(
        row("e1", "D1", "first chunk", 0.9f),
        row("e2", "D1", "second chunk", 0.8f),
        row("e3", "D2", "other", 0.1f));
    given(textEmbedder.embedQuery("fever")).willReturn(QUERY_EMBEDDING);
    given(repository.vectorSimilarities(any(), any())).willReturn(List.of());

    DocumentSearchResult result = service.search(new DocumentSearchRequest("fever"));

    assertThat(result.hits()).extracting(DocumentHit::documentId).containsExactly("D1", "D2");
    assertThat(result.hits().get(0).preview()).isEqualTo("first chunk");
  }

  @Test
  void unavailable_embedding_degrades_to_lexical_order() {
    givenLexicalRows(row("e1", "D1", "fever noted", 0.5f), row("e2", "D2", "febrile", 0.3f));
    given(textEmbedder.embedQuery("fever"))
        .willThrow(new CapabilityUnavailableException(Capability.TEXT_EMBEDDING, "down"));

    DocumentSearchResult result = service.search(new DocumentSearchRequest("fever"));

    assertThat(result.degraded()).isTrue();
    assertThat(result.notes())
        .containsExactly(
            "text_embedding unavailable; results are in lexical order without semantic"
                + " re-ranking");
    assertThat(result.hits()).extracting(DocumentHit::documentId).containsExactly("D1", "D2");
    assertThat(result.hits()).allSatisfy(hit -> assertThat(hit.vectorScore()).isNull());
    verify(repository, never()).vectorSimilarities(any(), any());
  }

  @Test
  void degraded_result_still_honours_limit() {
    given(repository.lexicalSearch(eq("fever"), isNull(), isNull(), isNull(), eq(30)))
        .willReturn(
            List.of(
                row("e1", "D1", "a", 0.5f),
                row("e2", "D2", "b", 0.4f),
                row("e3", "D3", "c", 0.3f)));
    given(textEmbedder.embedQuery("fever"))
        .willThrow(new CapabilityUnavailableException(Capability.TEXT_EMBEDDING, "down"));

    DocumentSearchResult result = service.search(new DocumentSearchRequest("fever", 2));

    assertThat(result.hits()).hasSize(2);
  }

  @Test
  void no_lexical_candidates_skips_embedding() {
    givenLexicalRows();

    DocumentSearchResult result = service.search(new DocumentSearchRequest("fever"));

    assertThat(result.hits()).isEmpty();
    assertThat(result.degraded()).isFalse();
    verifyNoInteractions(textEmbedder);
  }

  @Test
  void filters_are_passed_to_the_lexical_query() {
    given(repository.lexicalSearch(any(), any(), any(), any(), anyInt())).willReturn(List.of());

    service.search(
        new DocumentSearchRequest(
            "fever", 50, "p1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 29)));

    verify(repository).lexicalSearch("fever", "p1", "2024-01-01", "2024-02-29", 50);
  }

  @Test
  void preview_decodes_fhir_notes_and_truncates() {
    String note = "word ".repeat(100);
    String resource =
        "{\"resourceType\":\"DocumentReference\",\"content\":[{\"attachment\":{\"data\":\""
            + HexFormat.of().formatHex(note.getBytes(StandardCharsets.UTF_8))
            + "\"}}]}";
    givenLexicalRows(row("e1", "D1", resource, 0.5f));
    given(textEmbedder.embedQuery("fever")).willReturn(QUERY_EMBEDDING);
    given(repository.vectorSimilarities(any(), any())).willReturn(List.of());

    String preview = service.search(new DocumentSearchRequest("fever")).hits().get(0).preview();

    assertThat(preview).startsWith("word word").endsWith("...");
    assertThat(preview).hasSize(DocumentSearchService.PREVIEW_CHARS + 3);
  }

  @Test
  void preview_collapses_whitespace() {
    assertThat(DocumentSearchService.preview("  fever\n\n  and   cough "))
        .isEqualTo("fever and cough");
  }

  @Test
  void details_return_decoded_text_and_metadata() {
    ClinicalDocument doc = mock(ClinicalDocument.class);
    given(doc.getText()).willReturn("plain note");
    given(doc.getMetadata()).willReturn("{\"document_id\":\"D1\",\"patient_id\":\"p1\"}");
    given(repository.findByDocumentId("D1")).willReturn(Optional.of(doc));

    Optional<DocumentDetails> details = service.details(" D1 ");

    assertThat(details).isPresent();
    assertThat(details.get().documentId()).isEqualTo("D1");
    assertThat(details.get().text()).isEqualTo("plain note");
    assertThat(details.get().metadata()).containsEntry("patient_id", "p1");
  }

  @Test
  void details_of_unknown_document_are_empty() {
    given(repository.findByDocumentId("D9")).willReturn(Optional.empty());

    assertThat(service.details("D9")).isEmpty();
  }

  @Test
  void details_reject_blank_id() {
    assertThatThrownBy(() -> service.details(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void patient_ids_keep_first_mapping_per_document() {
    given(repository.findPatientIds(any()))
        .willReturn(
            List.of(
                new Object[] {"D1", "p1"}, new Object[] {"D2", "p2"}, new Object[] {"D1", "p9"}));

    assertThat(service.patientIds(List.of("D1", "D2", "D3")))
        .containsOnly(entry("D1", "p1"), entry("D2", "p2"));
  }

  @Test
  void patient_ids_of_nothing_skip_the_store() {
    assertThat(service.patientIds(List.of())).isEmpty();
    verifyNoInteractions(repository);
  }
}
