package dev.asclepius.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.asclepius.document.DocumentDetails;
import dev.asclepius.document.DocumentSearchRequest;
import dev.asclepius.document.DocumentSearchResult;
import dev.asclepius.document.DocumentSearchService;
import dev.asclepius.embedding.Vectors;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.asclepius.failure.StoreUnavailableException;
import dev.asclepius.graph.EntityNeighbourhood;
import dev.asclepius.graph.GraphSearchRequest;
import dev.asclepius.graph.KnowledgeGraphSearchService;
import dev.asclepius.graph.TraversalHit;
import dev.asclepius.image.ImageHit;
import dev.asclepius.image.ImageSearchRequest;
import dev.asclepius.image.ImageSearchService;
import dev.asclepius.memory.MemoryKind;
import dev.asclepius.memory.MemoryService;
import dev.asclepius.memory.RecalledMemory;
import dev.asclepius.search.HybridSearchRequest;
import dev.asclepius.search.HybridSearchResult;
import dev.asclepius.search.HybridSearchService;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * Retrieval primitives exposed as tools, over MCP and to the in-process agent loop.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link ToolConfig}. Tool
 * methods never throw: every exception becomes a {@link ToolResult} with status {@code
 * capability_unavailable} (missing or unreachable backing capability) or {@code error} (invalid
 * input, store down, unexpected failure).
 *
 * <p>Parameter names are snake_case because Spring AI derives the tool input schema from them.
 */
@Service
public class ClinicalToolService {

  private static final Logger log = LoggerFactory.getLogger(ClinicalToolService.class);

  public static final String SEARCH_DOCUMENTS = "search_documents";
  public static final String GET_DOCUMENT_DETAILS = "get_document_details";
  public static final String SEARCH_KNOWLEDGE_GRAPH = "search_knowledge_graph";
  public static final String GET_ENTITY_RELATIONSHIPS = "get_entity_relationships";
  public static final String GET_ENTITY_STATISTICS = "get_entity_statistics";
  public static final String SEARCH_IMAGES = "search_images";
  public static final String HYBRID_SEARCH = "hybrid_search";
  public static final String REMEMBER = "remember";
  public static final String RECALL = "recall";
  public static final String FORGET = "forget";
  public static final String GET_MEMORY_STATISTICS = "get_memory_statistics";

  static final int DEFAULT_RELATIONSHIP_HOPS = 2;
  static final int DEFAULT_RECALL_LIMIT = 5;

  private final DocumentSearchService documentSearchService;
  private final KnowledgeGraphSearchService graphSearchService;
  private final ImageSearchService imageSearchService;
  private final HybridSearchService hybridSearchService;
  private final MemoryService memoryService;
  private final ObjectMapper payloadMapper;

  public ClinicalToolService(
      DocumentSearchService documentSearchService,
      KnowledgeGraphSearchService graphSearchService,
      ImageSearchService imageSearchService,
      HybridSearchService hybridSearchService,
      MemoryService memoryService,
      ObjectMapper objectMapper) {
    this.documentSearchService = documentSearchService;
    this.graphSearchService = graphSearchService;
    this.imageSearchService = imageSearchService;
    this.hybridSearchService = hybridSearchService;
    this.memoryService = memoryService;
    this.payloadMapper =
        objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
  }

  @Tool(
      name = SEARCH_DOCUMENTS,
      description =
          "Full-text search over clinical documents (FHIR notes), re-ranked semantically when "
              + "the embedding model is available. Returns ranked documents with scores and a "
              + "degraded flag when semantic re-ranking was skipped.")
  public ToolResult searchDocuments(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Restrict to one patient id", required = false)
          @Nullable String patient_id,
      @ToolParam(description = "Earliest recorded date, inclusive (yyyy-MM-dd)", required = false)
          @Nullable String recorded_from,
      @ToolParam(description = "Latest recorded date, inclusive (yyyy-MM-dd)", required = false)
          @Nullable String recorded_to,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer limit) {
    return execute(
        SEARCH_DOCUMENTS,
        () -> {
          DocumentSearchResult result =
              documentSearchService.search(
                  new DocumentSearchRequest(
                      requireText(query, "query"),
                      orDefault(limit, DocumentSearchRequest.DEFAULT_LIMIT),
                      patient_id,
                      parseDate(recorded_from, "recorded_from"),
                      parseDate(recorded_to, "recorded_to")));
          ObjectNode data = payloadMapper.createObjectNode();
          data.put("query", query);
          data.put("degraded", result.degraded());
          data.put("count", result.hits().size());
          data.set("documents", payloadMapper.valueToTree(result.hits()));
          return ToolResult.ok(SEARCH_DOCUMENTS, data, result.notes());
        });
  }

  @Tool(
      name = GET_DOCUMENT_DETAILS,
      description = "Full decoded text and metadata of one clinical document.")
  public ToolResult getDocumentDetails(
      @ToolParam(description = "Document id as returned by search_documents")
          @Nullable String document_id) {
    return execute(
        GET_DOCUMENT_DETAILS,
        () -> {
          Optional<DocumentDetails> details =
              documentSearchService.details(requireText(document_id, "document_id"));
          if (details.isEmpty()) {
            return ToolResult.error(
                GET_DOCUMENT_DETAILS, "not_found", "No document with id " + document_id);
          }
          return ToolResult.ok(GET_DOCUMENT_DETAILS, payloadMapper.valueToTree(details.get()));
        });
  }

  @Tool(
      name = SEARCH_KNOWLEDGE_GRAPH,
      description =
          "Find medical entities (symptoms, conditions, medications, procedures, body parts) "
              + "matching the query and expand to related entities. Every result carries the "
              + "path from the matched entity.")
  public ToolResult searchKnowledgeGraph(
      @ToolParam(description = "Search terms") @Nullable String query,
      @ToolParam(description = "Relationship hops to expand (0-3, default 1)", required = false)
          @Nullable Integer max_hops,
      @ToolParam(description = "Maximum number of entities (1-50, default 10)", required = false)
          @Nullable Integer limit) {
    return execute(
        SEARCH_KNOWLEDGE_GRAPH,
        () -> {
          List<TraversalHit> hits =
              graphSearchService.search(
                  new GraphSearchRequest(
                      requireText(query, "query"),
                      orDefault(max_hops, GraphSearchRequest.DEFAULT_MAX_HOPS),
                      orDefault(limit, GraphSearchRequest.DEFAULT_LIMIT)));
          ObjectNode data = payloadMapper.createObjectNode();
          data.put("query", query);
          data.put("count", hits.size());
          data.set("entities", payloadMapper.valueToTree(hits));
          return ToolResult.ok(SEARCH_KNOWLEDGE_GRAPH, data);
        });
  }

  @Tool(
      name = GET_ENTITY_RELATIONSHIPS,
      description =
          "Explore the knowledge graph around one entity: connected entities and the "
              + "relationships between them.")
  public ToolResult getEntityRelationships(
      @ToolParam(description = "Entity id or exact entity text") @Nullable String entity,
      @ToolParam(description = "Relationship hops to expand (1-3, default 2)", required = false)
          @Nullable Integer max_hops) {
    return execute(
        GET_ENTITY_RELATIONSHIPS,
        () -> {
          Optional<EntityNeighbourhood> neighbourhood =
              graphSearchService.relationships(
                  requireText(entity, "entity"), orDefault(max_hops, DEFAULT_RELATIONSHIP_HOPS));
          if (neighbourhood.isEmpty()) {
            ObjectNode data = payloadMapper.createObjectNode();
            data.put("entity", entity);
            data.put("found", false);
            return ToolResult.ok(
                GET_ENTITY_RELATIONSHIPS, data, List.of("No entity matches '" + entity + "'"));
          }
          ObjectNode data = payloadMapper.valueToTree(neighbourhood.get());
          data.put("found", true);
          return ToolResult.ok(GET_ENTITY_RELATIONSHIPS, data);
        });
  }

  @Tool(
      name = GET_ENTITY_STATISTICS,
      description =
          "Knowledge graph statistics: entity and relationship totals, counts per entity "
              + "type, per confidence bucket and per relationship type.")
  public ToolResult getEntityStatistics() {
    return execute(
        GET_ENTITY_STATISTICS,
        () ->
            ToolResult.ok(
                GET_ENTITY_STATISTICS, payloadMapper.valueToTree(graphSearchService.statistics())));
  }

  @Tool(
      name = SEARCH_IMAGES,
      description =
          "Find medical images (e.g. chest X-rays) similar to a text description or to a "
              + "query embedding. Results carry cosine similarity and a strong/moderate/weak band.")
  public ToolResult searchImages(
      @ToolParam(description = "Text description of the image sought", required = false)
          @Nullable String query,
      @ToolParam(description = "Query embedding, instead of text", required = false)
          @Nullable List<Double> embedding,
      @ToolParam(description = "Restrict to one subject id", required = false)
          @Nullable String subject_id,
      @ToolParam(description = "Restrict to a view position: PA, AP or LATERAL", required = false)
          @Nullable String view_position,
      @ToolParam(description = "Minimum cosine similarity (-1 to 1, default 0)", required = false)
          @Nullable Double min_similarity,
      @ToolParam(description = "Maximum number of images (1-50, default 10)", required = false)
          @Nullable Integer limit) {
    return execute(
        SEARCH_IMAGES,
        () -> {
          float[] vector =
              embedding != null && !embedding.isEmpty() ? Vectors.toArray(embedding) : null;
          List<ImageHit> hits =
              imageSearchService.search(
                  new ImageSearchRequest(
                      vector != null ? null : query,
                      vector,
                      subject_id,
                      view_position,
                      min_similarity != null ? min_similarity : 0.0,
                      orDefault(limit, ImageSearchRequest.DEFAULT_LIMIT)));
          ObjectNode data = payloadMapper.createObjectNode();
          if (vector == null) {
            data.put("query", query);
          }
          data.put("count", hits.size());
          data.set("images", payloadMapper.valueToTree(hits));
          return ToolResult.ok(SEARCH_IMAGES, data);
        });
  }

  @Tool(
      name = HYBRID_SEARCH,
      description =
          "Search documents, the knowledge graph and images at once and fuse the rankings with "
              + "Reciprocal Rank Fusion. Returns per-source provenance and which sources were "
              + "unavailable.")
  public ToolResult hybridSearch(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Restrict to one patient id", required = false)
          @Nullable String patient_id,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer limit) {
    return execute(
        HYBRID_SEARCH,
        () -> {
          HybridSearchResult result =
              hybridSearchService.search(
                  new HybridSearchRequest(
                      requireText(query, "query"),
                      patient_id,
                      orDefault(limit, HybridSearchRequest.DEFAULT_LIMIT)));
          Map<String, Integer> counts = new LinkedHashMap<>();
          result.sourceCounts().forEach((source, count) -> counts.put(source.value(), count));

          ObjectNode data = payloadMapper.createObjectNode();
          data.put("query", query);
          data.put("reconciliation_key", result.reconciliationKey().name());
          data.set("results", payloadMapper.valueToTree(result.hits()));
          data.set("source_counts", payloadMapper.valueToTree(counts));
          data.set("unavailable_sources", payloadMapper.valueToTree(result.unavailable()));
          return ToolResult.ok(HYBRID_SEARCH, data, result.notes());
        });
  }

  @Tool(
      name = REMEMBER,
      description =
          "Store a memory for future sessions: a correction, a user preference or a fact.")
  public ToolResult remember(
      @ToolParam(description = "What to remember") @Nullable String content,
      @ToolParam(description = "One of: correction, preference, fact") @Nullable String kind) {
    return execute(
        REMEMBER,
        () -> {
          String id =
              memoryService.remember(
                  requireText(content, "content"), MemoryKind.fromValue(requireText(kind, "kind")));
          ObjectNode data = payloadMapper.createObjectNode();
          data.put("memory_id", id);
          data.put("kind", MemoryKind.fromValue(kind).value());
          return ToolResult.ok(REMEMBER, data);
        });
  }

  @Tool(
      name = RECALL,
      description =
          "Recall stored memories semantically similar to the query, most similar first.")
  public ToolResult recall(
      @ToolParam(description = "What to look for") @Nullable String query,
      @ToolParam(description = "Maximum number of memories (1-50, default 5)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Only this kind: correction, preference or fact", required = false)
          @Nullable String kind) {
    return execute(
        RECALL,
        () -> {
          List<RecalledMemory> memories =
              memoryService.recall(
                  requireText(query, "query"),
                  orDefault(limit, DEFAULT_RECALL_LIMIT),
                  MemoryKind.parseFilter(kind));
          ObjectNode data = payloadMapper.createObjectNode();
          data.put("query", query);
          data.put("count", memories.size());
          data.set("memories", payloadMapper.valueToTree(memories));
          return ToolResult.ok(RECALL, data);
        });
  }

  @Tool(name = FORGET, description = "Delete a stored memory by id.")
  public ToolResult forget(
      @ToolParam(description = "Memory id as returned by remember or recall")
          @Nullable String memory_id) {
    return execute(
        FORGET,
        () -> {
          boolean removed = memoryService.forget(requireText(memory_id, "memory_id"));
          ObjectNode data = payloadMapper.createObjectNode();
          data.put("memory_id", memory_id);
          data.put("removed", removed);
          return ToolResult.ok(FORGET, data);
        });
  }

  @Tool(
      name = GET_MEMORY_STATISTICS,
      description = "Memory store statistics: total, count per kind and the latest memories.")
  public ToolResult getMemoryStatistics() {
    return execute(
        GET_MEMORY_STATISTICS,
        () ->
            ToolResult.ok(
                GET_MEMORY_STATISTICS, payloadMapper.valueToTree(memoryService.statistics())));
  }

  /** Runs a tool body and maps every failure to a structured result. */
  private ToolResult execute(String tool, Supplier<ToolResult> body) {
    try {
      return body.get();
    } catch (CapabilityUnavailableException e) {
      log.warn("Tool {}: {} unavailable: {}", tool, e.getCapability().value(), e.getMessage());
      return ToolResult.unavailable(tool, e.getCapability(), e.getMessage());
    } catch (IllegalArgumentException e) {
      return ToolResult.error(tool, ToolResult.INVALID_INPUT, e.getMessage());
    } catch (StoreUnavailableException e) {
      log.warn("Tool {}: store unavailable: {}", tool, e.getMessage());
      return ToolResult.error(tool, ToolResult.STORE_UNAVAILABLE, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Tool {} failed", tool, e);
      return ToolResult.error(
          tool, ToolResult.INTERNAL_ERROR, "Unexpected failure: " + e.getMessage());
    }
  }

  private static String requireText(@Nullable String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }

  private static int orDefault(@Nullable Integer value, int defaultValue) {
    return value != null ? value : defaultValue;
  }

  private static @Nullable LocalDate parseDate(@Nullable String value, String name) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.strip());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          name + " must be a date in yyyy-MM-dd format: " + value, e);
    }
  }
}
