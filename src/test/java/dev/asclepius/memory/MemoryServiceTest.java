package dev.asclepius.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class MemoryServiceTest {

  private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T2 = Instant.parse("2024-05-02T10:00:00Z");

  private static final Embedding QUERY = Embedding.from(new float[] {1f, 0f, 0f});

  @Mock TextEmbedder textEmbedder;

  @Mock MemoryRecordRepository repository;

  InMemoryEmbeddingStore<TextSegment> store;
  MemoryProperties properties;
  MemoryService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryEmbeddingStore<>();
    properties = new MemoryProperties();
    service = serviceAt(T1);
  }

  private MemoryService serviceAt(Instant now) {
    return new MemoryService(
        store,
        repository,
        textEmbedder,
        properties,
        new ObjectMapper(),
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private void givenPassage(String content, float... vector) {
    given(textEmbedder.embedPassage(content)).willReturn(Embedding.from(vector));
  }

  @Test
  void recall_returns_stored_memory_with_kind_and_timestamp() {
    givenPassage("p1000 patients are synthetic", 1f, 0f, 0f);
    given(textEmbedder.embedQuery("are these real patients?")).willReturn(QUERY);

    String id = service.remember("  p1000 patients are synthetic  ", MemoryKind.CORRECTION);
    List<RecalledMemory> recalled = service.recall("are these real patients?", 5, null);

    assertThat(recalled).hasSize(1);
    RecalledMemory memory = recalled.get(0);
    assertThat(memory.id()).isEqualTo(id);
    assertThat(memory.content()).isEqualTo("p1000 patients are synthetic");
    assertThat(memory.kind()).isEqualTo(MemoryKind.CORRECTION);
    assertThat(memory.similarity()).isCloseTo(1.0, within(1e-6));
    assertThat(memory.createdAt()).isEqualTo(T1);
  }

  @Test
  void recall_drops_memories_below_similarity_floor() {
    givenPassage("close", 0.8f, 0.6f, 0f);
    givenPassage("unrelated", 0f, 1f, 0f);
    given(textEmbedder.embedQuery("q")).willReturn(QUERY);
    service.remember("close", MemoryKind.FACT);
    service.remember("unrelated", MemoryKind.FACT);

    List<RecalledMemory> recalled = service.recall("q", 5, null);

    assertThat(recalled).extracting(RecalledMemory::content).containsExactly("close");
    assertThat(recalled.get(0).similarity()).isCloseTo(0.8, within(1e-5));
  }

  @Test
  void equal_similarity_returns_most_recent_first() {
    givenPassage("older", 1f, 0f, 0f);
    givenPassage("newer", 1f, 0f, 0f);
    given(textEmbedder.embedQuery("q")).willReturn(QUERY);
    serviceAt(T1).remember("older", MemoryKind.FACT);
    serviceAt(T2).remember("newer", MemoryKind.FACT);

    List<RecalledMemory> recalled = service.recall("q", 5, null);

    assertThat(recalled).extracting(RecalledMemory::content).containsExactly("newer", "older");
  }

  @Test
  void recall_honours_limit_and_kind_filter() {
    givenPassage("a fact", 1f, 0f, 0f);
    givenPassage("a preference", 0.9f, 0.1f, 0f);
    givenPassage("another fact", 0.8f, 0.2f, 0f);
    given(textEmbedder.embedQuery("q")).willReturn(QUERY);
    service.remember("a fact", MemoryKind.FACT);
    service.remember("a preference", MemoryKind.PREFERENCE);
    service.remember("another fact", MemoryKind.FACT);

    assertThat(service.recall("q", 1, null))
        .extracting(RecalledMemory::content)
        .containsExactly("a fact");
    assertThat(service.recall("q", 5, MemoryKind.PREFERENCE))
        .extracting(RecalledMemory::content)
        .containsExactly("a preference");
  }

  @Test
  void recall_rejects_invalid_arguments() {
    assertThatThrownBy(() -> service.recall(" ", 5, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.recall("q", 0, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.recall("q", 51, null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(textEmbedder);
  }

  @Test
  void remember_rejects_blank_and_oversized_content() {
    properties.setMaxContentLength(10);

    assertThatThrownBy(() -> service.remember("   ", MemoryKind.FACT))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.remember("x".repeat(11), MemoryKind.FACT))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("10");
    assertThatThrownBy(() -> service.remember("ok", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void remember_propagates_unavailable_embedding() {
    given(textEmbedder.embedPassage("note"))
        .willThrow(new CapabilityUnavailableException(Capability.TEXT_EMBEDDING, "down"));

    assertThatThrownBy(() -> service.remember("note", MemoryKind.FACT))
        .isInstanceOf(CapabilityUnavailableException.class);
  }

  @Test
  void auto_recall_never_fails() {
    given(textEmbedder.embedQuery("question"))
        .willThrow(new CapabilityUnavailableException(Capability.TEXT_EMBEDDING, "down"));

    assertThat(service.autoRecall("question")).isEmpty();
  }

  @Test
  void auto_recall_is_disabled_by_zero_limit() {
    properties.setAutoRecallLimit(0);

    assertThat(service.autoRecall("question")).isEmpty();
    verifyNoInteractions(textEmbedder);
  }

  @Test
  void auto_recall_uses_configured_limit() {
    properties.setAutoRecallLimit(1);
    givenPassage("first", 1f, 0f, 0f);
    givenPassage("second", 0.9f, 0.1f, 0f);
    given(textEmbedder.embedQuery("question")).willReturn(QUERY);
    service.remember("first", MemoryKind.FACT);
    service.remember("second", MemoryKind.FACT);

    assertThat(service.autoRecall("question")).hasSize(1);
  }

  @Test
  void forget_removes_existing_memory() {
    givenPassage("note", 1f, 0f, 0f);
    given(textEmbedder.embedQuery("q")).willReturn(QUERY);
    String id = service.remember("note", MemoryKind.FACT);
    given(repository.existsById(UUID.fromString(id))).willReturn(true);

    assertThat(service.forget(id)).isTrue();
    assertThat(service.recall("q", 5, null)).isEmpty();
  }

  @Test
  void forget_unknown_memory_returns_false() {
    UUID id = UUID.randomUUID();
    given(repository.existsById(id)).willReturn(false);

    assertThat(service.forget(id.toString())).isFalse();
  }

  @Test
  void forget_rejects_malformed_id() {
    assertThatThrownBy(() -> service.forget("not-a-uuid"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not-a-uuid");
  }

  private void storedRecord(UUID id, String metadata) {
    MemoryRecord record = mock(MemoryRecord.class);
    given(record.getMetadata()).willReturn(metadata);
    given(repository.findById(id)).willReturn(Optional.of(record));
  }

  @Test
  @SuppressWarnings("unchecked")
  void revise_upserts_under_the_same_id_keeping_kind_and_creation_time() {
    EmbeddingStore<TextSegment> upsertingStore = mock(EmbeddingStore.class);
    UUID id = UUID.randomUUID();
    storedRecord(id, "{\"kind\":\"correction\",\"created_at\":" + T1.toEpochMilli() + "}");
    givenPassage("new wording", 1f, 0f, 0f);
    MemoryService revising =
        new MemoryService(
            upsertingStore,
            repository,
            textEmbedder,
            properties,
            new ObjectMapper(),
            Clock.fixed(T2, ZoneOffset.UTC));

    assertThat(revising.revise(id.toString(), "new wording")).isTrue();

    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(upsertingStore).addAll(eq(List.of(id.toString())), anyList(), segments.capture());
    verify(upsertingStore, never()).remove(anyString());
    TextSegment segment = segments.getValue().get(0);
    assertThat(segment.text()).isEqualTo("new wording");
    assertThat(segment.metadata().getString(MemoryService.KIND)).isEqualTo("correction");
    assertThat(segment.metadata().getLong(MemoryService.CREATED_AT)).isEqualTo(T1.toEpochMilli());
    assertThat(segment.metadata().getLong(MemoryService.REVISED_AT)).isEqualTo(T2.toEpochMilli());
  }

  @Test
  @SuppressWarnings("unchecked")
  void failed_revise_leaves_the_original_memory_in_place() {
    EmbeddingStore<TextSegment> failingStore = mock(EmbeddingStore.class);
    UUID id = UUID.randomUUID();
    storedRecord(id, "{\"kind\":\"fact\"}");
    givenPassage("new wording", 1f, 0f, 0f);
    willThrow(new RuntimeException(new SQLTransientConnectionException("connection reset")))
        .given(failingStore)
        .addAll(anyList(), anyList(), anyList());
    MemoryService revising =
        new MemoryService(
            failingStore,
            repository,
            textEmbedder,
            properties,
            new ObjectMapper(),
            Clock.fixed(T2, ZoneOffset.UTC));

    assertThatThrownBy(() -> revising.revise(id.toString(), "new wording"))
        .isInstanceOf(DataAccessResourceFailureException.class);
    verify(failingStore, never()).remove(anyString());
    verify(failingStore, never()).removeAll(anyCollection());
  }

  @Test
  void revise_unknown_memory_returns_false() {
    UUID id = UUID.randomUUID();
    given(repository.findById(id)).willReturn(Optional.empty());

    assertThat(service.revise(id.toString(), "text")).isFalse();
    verifyNoInteractions(textEmbedder);
  }

  @Test
  void statistics_count_by_kind_and_list_recent_entries() {
    given(repository.countGroupedByKind())
        .willReturn(List.of(new Object[] {"fact", 2L}, new Object[] {"correction", 1L}));
    given(repository.findMostRecent(MemoryService.RECENT_ENTRIES))
        .willReturn(
            List.of(
                new Object[] {"id-1", "newest", "correction", String.valueOf(T2.toEpochMilli())},
                new Object[] {"id-2", "untyped", null, null}));

    MemoryStatistics stats = service.statistics();

    assertThat(stats.total()).isEqualTo(3);
    assertThat(stats.byKind()).containsExactly(entry("fact", 2L), entry("correction", 1L));
    assertThat(stats.mostRecent()).hasSize(2);
    assertThat(stats.mostRecent().get(0).createdAt()).isEqualTo(T2);
    assertThat(stats.mostRecent().get(1).kind()).isEqualTo("unknown");
    assertThat(stats.mostRecent().get(1).createdAt()).isNull();
  }
}
