package dev.asclepius.search;

import dev.asclepius.config.SearchProperties;
import dev.asclepius.config.SearchProperties.ReconciliationKey;
import dev.asclepius.document.DocumentHit;
import dev.asclepius.document.DocumentSearchRequest;
import dev.asclepius.document.DocumentSearchResult;
import dev.asclepius.document.DocumentSearchService;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.asclepius.failure.StoreUnavailableException;
import dev.asclepius.fusion.FusedResult;
import dev.asclepius.fusion.RankedResult;
import dev.asclepius.fusion.ReciprocalRankFusion;
import dev.asclepius.fusion.RetrievalSource;
import dev.asclepius.graph.GraphSearchRequest;
import dev.asclepius.graph.KnowledgeGraphSearchService;
import dev.asclepius.graph.TraversalHit;
import dev.asclepius.image.ImageHit;
import dev.asclepius.image.ImageSearchRequest;
import dev.asclepius.image.ImageSearchService;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Queries documents, the knowledge graph and images for one question and fuses their rankings
 * with {@link ReciprocalRankFusion}.
 *
 * <p>Each source's hits are first mapped to a shared item id ({@link ReconciliationKey}): under
 * {@code DOCUMENT} a graph entity counts for the document it was extracted from and an image for
 * its linked document ({@code image:<id>} when unlinked); under {@code PATIENT} everything is
 * grouped by patient. Within a source only the first occurrence of an item is kept and ranks are
 * renumbered, so every list handed to fusion has unique ids and ranks 1..n.
 *
 * <p>A source whose capability is unavailable is skipped and reported; the others still fuse.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  /** Hits requested from each source before reconciliation. */
  static final int CANDIDATES_PER_SOURCE = 30;

  private final DocumentSearchService documentSearchService;
  private final KnowledgeGraphSearchService graphSearchService;
  private final ImageSearchService imageSearchService;
  private final SearchProperties searchProperties;

  public HybridSearchService(
      DocumentSearchService documentSearchService,
      KnowledgeGraphSearchService graphSearchService,
      ImageSearchService imageSearchService,
      SearchProperties searchProperties) {
    this.documentSearchService = documentSearchService;
    this.graphSearchService = graphSearchService;
    this.imageSearchService = imageSearchService;
    this.searchProperties = searchProperties;
  }

  public HybridSearchResult search(HybridSearchRequest request) {
    ReconciliationKey key = searchProperties.getReconciliationKey();
    int perSource = Math.max(request.limit(), CANDIDATES_PER_SOURCE);
    Outcome outcome = new Outcome();
    Map<String, String> summaries = new HashMap<>();

    List<RankedResult> documents =
        outcome.collect(
            RetrievalSource.DOCUMENT,
            () -> documentList(request, perSource, key, summaries, outcome));
    List<RankedResult> graph =
        outcome.collect(
            RetrievalSource.KNOWLEDGE_GRAPH,
            () -> graphList(request, key, summaries));
    List<RankedResult> images =
        outcome.collect(
            RetrievalSource.IMAGE,
            () -> imageList(request, perSource, key, summaries));

    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(List.of(documents, graph, images), searchProperties.getRrfK());
    List<HybridHit> hits =
        fused.stream()
            .limit(request.limit())
            .map(
                f ->
                    new HybridHit(
                        f.itemId(),
                        f.rrfScore(),
                        f.contributingSources(),
                        summaries.getOrDefault(f.itemId(), f.itemId())))
            .toList();
    log.debug(
        "Hybrid search '{}': {} fused items, counts={}, unavailable={}",
        request.query(),
        fused.size(),
        outcome.counts,
        outcome.unavailable);
    return new HybridSearchResult(
        hits, key, outcome.counts, new ArrayList<>(outcome.unavailable), outcome.notes);
  }

  private List<RankedResult> documentList(
      HybridSearchRequest request,
      int perSource,
      ReconciliationKey key,
      Map<String, String> summaries,
      Outcome outcome) {
    int limit = Math.min(perSource, DocumentSearchRequest.MAX_LIMIT);
    DocumentSearchResult result =
        documentSearchService.search(
            new DocumentSearchRequest(request.query(), limit, request.patientId(), null, null));
    if (result.degraded()) {
      outcome.notes.addAll(result.notes());
    }
    List<Keyed> keyed = new ArrayList<>();
    for (DocumentHit hit : result.hits()) {
      String itemId =
          key == ReconciliationKey.PATIENT && hit.patientId() != null
              ? hit.patientId()
              : hit.documentId();
      keyed.add(
          new Keyed(itemId, hit.score(), "Document " + hit.documentId() + ": " + hit.preview()));
    }
    return reconcile(RetrievalSource.DOCUMENT, keyed, summaries);
  }

  private List<RankedResult> graphList(
      HybridSearchRequest request, ReconciliationKey key, Map<String, String> summaries) {
    List<TraversalHit> hits =
        graphSearchService.search(
            new GraphSearchRequest(
                request.query(),
                searchProperties.getHybridGraphHops(),
                GraphSearchRequest.MAX_LIMIT));
    List<TraversalHit> linked =
        hits.stream().filter(hit -> hit.entity().sourceDocumentId() != null).toList();
    Map<String, String> patients = Map.of();
    if (key == ReconciliationKey.PATIENT || request.patientId() != null) {
      Set<String> documentIds = new LinkedHashSet<>();
      linked.forEach(hit -> documentIds.add(hit.entity().sourceDocumentId()));
      patients = documentSearchService.patientIds(documentIds);
    }

    List<Keyed> keyed = new ArrayList<>();
    for (TraversalHit hit : linked) {
      String documentId = Objects.requireNonNull(hit.entity().sourceDocumentId());
      String patientId = patients.get(documentId);
      if (request.patientId() != null && !request.patientId().equals(patientId)) {
        continue;
      }
      String itemId =
          key == ReconciliationKey.PATIENT && patientId != null ? patientId : documentId;
      keyed.add(
          new Keyed(
              itemId,
              hit.score(),
              "Entity '" + hit.entity().text() + "' (" + hit.entity().type().value() + ")"));
    }
    return reconcile(RetrievalSource.KNOWLEDGE_GRAPH, keyed, summaries);
  }

  private List<RankedResult> imageList(
      HybridSearchRequest request,
      int perSource,
      ReconciliationKey key,
      Map<String, String> summaries) {
    int limit = Math.min(perSource, ImageSearchRequest.MAX_LIMIT);
    List<ImageHit> hits =
        imageSearchService.search(
            new ImageSearchRequest(request.query(), null, null, null, 0.0, limit));
    List<Keyed> keyed = new ArrayList<>();
    for (ImageHit hit : hits) {
      if (request.patientId() != null && !request.patientId().equals(hit.patientId())) {
        continue;
      }
      String view = hit.viewPosition() != null ? " (" + hit.viewPosition() + ")" : "";
      keyed.add(
          new Keyed(imageItemId(hit, key), hit.similarity(), "Image " + hit.imageId() + view));
    }
    return reconcile(RetrievalSource.IMAGE, keyed, summaries);
  }

  static String imageItemId(ImageHit hit, ReconciliationKey key) {
    @Nullable String linked = key == ReconciliationKey.PATIENT ? hit.patientId() : hit.documentId();
    return linked != null ? linked : "image:" + hit.imageId();
  }

  /**
   * Keeps the first occurrence of each item id and renumbers ranks from 1, preserving order.
   */
  static List<RankedResult> reconcile(
      RetrievalSource source, List<Keyed> keyed, Map<String, String> summaries) {
    Map<String, Keyed> firstByItem = new LinkedHashMap<>();
    for (Keyed entry : keyed) {
      firstByItem.putIfAbsent(entry.itemId(), entry);
    }
    List<RankedResult> ranked = new ArrayList<>(firstByItem.size());
    int rank = 1;
    for (Keyed entry : firstByItem.values()) {
      ranked.add(new RankedResult(entry.itemId(), source, rank++, entry.rawScore()));
      summaries.putIfAbsent(entry.itemId(), entry.summary());
    }
    return ranked;
  }

  /** A source hit mapped to its reconciled item id. */
  record Keyed(String itemId, double rawScore, String summary) {}

  /** Per-request bookkeeping of source availability. */
  private static final class Outcome {
    private final Map<RetrievalSource, Integer> counts = new EnumMap<>(RetrievalSource.class);
    private final Set<Capability> unavailable = new LinkedHashSet<>();
    private final List<String> notes = new ArrayList<>();

    List<RankedResult> collect(RetrievalSource source, Supplier<List<RankedResult>> query) {
      try {
        List<RankedResult> ranked = query.get();
        counts.put(source, ranked.size());
        return ranked;
      } catch (CapabilityUnavailableException e) {
        log.warn("Hybrid search skipping {}: {}", source.value(), e.getMessage());
        unavailable.add(e.getCapability());
        notes.add(source.value() + " skipped: " + e.getMessage());
      } catch (StoreUnavailableException e) {
        log.warn("Hybrid search skipping {}: {}", source.value(), e.getMessage());
        unavailable.add(e.getCapability());
        notes.add(source.value() + " skipped: " + e.getMessage());
      }
      return List.of();
    }
  }
}
