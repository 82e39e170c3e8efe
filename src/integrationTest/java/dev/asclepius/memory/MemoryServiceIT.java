package dev.asclepius.memory;

import static org.assertj.core.api.Assertions.assertThat;

import dev.asclepius.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MemoryServiceIT extends BaseIntegrationTest {

  @Autowired MemoryService memoryService;

  @Test
  void remembered_correction_is_recalled_by_meaning() {
    String id =
        memoryService.remember(
            "Patient IDs starting with p1000 are synthetic test data", MemoryKind.CORRECTION);
    memoryService.remember("Prefer metric units when reporting lab values", MemoryKind.PREFERENCE);

    List<RecalledMemory> recalled = memoryService.recall("are these real patients?", 5, null);

    assertThat(recalled).isNotEmpty();
    assertThat(recalled.get(0).id()).isEqualTo(id);
    assertThat(recalled.get(0).kind()).isEqualTo(MemoryKind.CORRECTION);
    assertThat(recalled.get(0).similarity()).isGreaterThanOrEqualTo(0.3);
    assertThat(recalled.get(0).createdAt()).isNotNull();
  }

  @Test
  void kind_filter_is_applied_in_the_store() {
    memoryService.remember("Patient IDs starting with p1000 are synthetic", MemoryKind.CORRECTION);

    assertThat(memoryService.recall("synthetic patient ids", 5, MemoryKind.PREFERENCE)).isEmpty();
    assertThat(memoryService.recall("synthetic patient ids", 5, MemoryKind.CORRECTION))
        .hasSize(1);
  }

  @Test
  void forgotten_memory_is_no_longer_recalled() {
    String id = memoryService.remember("Lab reference ranges are adult ranges", MemoryKind.FACT);

    assertThat(memoryService.forget(id)).isTrue();
    assertThat(memoryService.forget(id)).isFalse();
    assertThat(memoryService.recall("lab reference ranges", 5, null)).isEmpty();
  }

  @Test
  void revised_memory_keeps_its_identity() {
    String id = memoryService.remember("Dr. Smith is the attending", MemoryKind.FACT);

    assertThat(memoryService.revise(id, "Dr. Jones is the attending cardiologist")).isTrue();

    List<RecalledMemory> recalled =
        memoryService.recall("who is the attending cardiologist", 5, null);
    assertThat(recalled)
        .singleElement()
        .satisfies(
            memory -> {
              assertThat(memory.id()).isEqualTo(id);
              assertThat(memory.content()).isEqualTo("Dr. Jones is the attending cardiologist");
              assertThat(memory.kind()).isEqualTo(MemoryKind.FACT);
            });
  }

  @Test
  void statistics_count_per_kind() {
    memoryService.remember("Use ISO dates", MemoryKind.PREFERENCE);
    memoryService.remember("Ward 4 closed in 2023", MemoryKind.FACT);
    memoryService.remember("Ward 5 opened in 2024", MemoryKind.FACT);

    MemoryStatistics statistics = memoryService.statistics();

    assertThat(statistics.total()).isEqualTo(3);
    assertThat(statistics.byKind()).containsEntry("fact", 2L).containsEntry("preference", 1L);
    assertThat(statistics.mostRecent()).hasSize(3);
  }
}
