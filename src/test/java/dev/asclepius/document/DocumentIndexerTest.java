package dev.asclepius.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentIndexerTest {

  private static final Embedding VECTOR = Embedding.from(new float[] {0.6f, 0.8f, 0.0f});

  @Mock TextEmbedder textEmbedder;

  private InMemoryEmbeddingStore<TextSegment> store;
  private DocumentIndexer indexer;

  @BeforeEach
  void setUp() {
    store = new InMemoryEmbeddingStore<>();
    indexer = new DocumentIndexer(store, textEmbedder, new FhirNoteDecoder(new ObjectMapper()));
  }

  private TextSegment onlyStoredSegment() {
    List<EmbeddingMatch<TextSegment>> matches =
        store
            .search(EmbeddingSearchRequest.builder().queryEmbedding(VECTOR).maxResults(5).build())
            .matches();
    assertThat(matches).hasSize(1);
    return matches.get(0).embedded();
  }

  @Test
  void stores_text_with_metadata() {
    String note = "Chest pain radiating to the left arm.";
    given(textEmbedder.embedPassage(note)).willReturn(VECTOR);

    String id = indexer.index("D7", "p3", LocalDate.of(2024, 3, 2), "DocumentReference", note);

    assertThat(id).isNotBlank();
    TextSegment segment = onlyStoredSegment();
    assertThat(segment.text()).isEqualTo(note);
    assertThat(segment.metadata().getString("document_id")).isEqualTo("D7");
    assertThat(segment.metadata().getString("patient_id")).isEqualTo("p3");
    assertThat(segment.metadata().getString("recorded_at")).isEqualTo("2024-03-02");
    assertThat(segment.metadata().getString("resource_type")).isEqualTo("DocumentReference");
  }

  @Test
  void fhir_payload_is_indexed_as_its_decoded_note() {
    String note = "Follow-up visit, fever resolved.";
    String hex = HexFormat.of().formatHex(note.getBytes(StandardCharsets.UTF_8));
    String resource =
        "{\"resourceType\":\"DocumentReference\","
            + "\"content\":[{\"attachment\":{\"data\":\""
            + hex
            + "\"}}]}";
    given(textEmbedder.embedPassage(note)).willReturn(VECTOR);

    indexer.index("D8", null, null, null, resource);

    TextSegment segment = onlyStoredSegment();
    assertThat(segment.text()).isEqualTo(note);
    assertThat(segment.metadata().getString("patient_id")).isNull();
  }

  @Test
  void blank_content_is_rejected_before_embedding() {
    assertThatThrownBy(() -> indexer.index("D1", null, null, null, " "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> indexer.index("", null, null, null, "text"))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(textEmbedder);
  }

  @Test
  void nothing_is_stored_when_embedding_is_unavailable() {
    given(textEmbedder.embedPassage("note"))
        .willThrow(new CapabilityUnavailableException(Capability.TEXT_EMBEDDING, "down"));

    assertThatThrownBy(() -> indexer.index("D1", null, null, null, "note"))
        .isInstanceOf(CapabilityUnavailableException.class);
    assertThat(
            store
                .search(
                    EmbeddingSearchRequest.builder().queryEmbedding(VECTOR).maxResults(5).build())
                .matches())
        .isEmpty();
  }
}
