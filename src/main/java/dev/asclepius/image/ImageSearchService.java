package dev.asclepius.image;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.asclepius.embedding.MultimodalEmbeddingClient;
import dev.asclepius.embedding.Vectors;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.StoreFailures;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Similarity search over medical image embeddings.
 *
 * <p>Pipeline: resolve the query vector (multimodal embedding of the text, or the caller's vector)
 * -> over-fetch from the image store with subject / view filters -> drop stored vectors with
 * near-zero magnitude and NaN scores -> apply the cosine floor -> top {@code limit}.
 *
 * <p>Text queries need the multimodal service; when it is down the search fails with {@link
 * dev.asclepius.failure.CapabilityUnavailableException}. Vector queries never touch it.
 */
@Service
public class ImageSearchService {

  private static final Logger log = LoggerFactory.getLogger(ImageSearchService.class);

  /** Minimum number of rows fetched before local filtering. */
  static final int MIN_OVER_FETCH = 30;

  static final int OVER_FETCH_FACTOR = 3;

  private final EmbeddingStore<TextSegment> imageEmbeddingStore;
  private final MultimodalEmbeddingClient multimodalClient;

  public ImageSearchService(
      @Qualifier("imageEmbeddingStore") EmbeddingStore<TextSegment> imageEmbeddingStore,
      MultimodalEmbeddingClient multimodalClient) {
    this.imageEmbeddingStore = imageEmbeddingStore;
    this.multimodalClient = multimodalClient;
  }

  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public List<ImageHit> search(ImageSearchRequest request) {
    float[] queryVector = queryVector(request);

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(queryVector))
            .maxResults(Math.max(MIN_OVER_FETCH, request.limit() * OVER_FETCH_FACTOR))
            .minScore(0.0);
    Filter filter = buildFilter(request);
    if (filter != null) {
      builder.filter(filter);
    }

    EmbeddingSearchRequest searchRequest = builder.build();
    List<EmbeddingMatch<TextSegment>> matches =
        StoreFailures.translated(
            "image search", () -> imageEmbeddingStore.search(searchRequest).matches());
    List<ImageHit> hits = new ArrayList<>();
    int degenerate = 0;
    for (EmbeddingMatch<TextSegment> match : matches) {
      if (match.score() == null || match.score().isNaN() || isDegenerate(match.embedding())) {
        degenerate++;
        continue;
      }
      double similarity = Vectors.relevanceToCosine(match.score());
      if (similarity < request.minSimilarity()) {
        continue;
      }
      hits.add(toHit(match, similarity));
      if (hits.size() == request.limit()) {
        break;
      }
    }
    if (degenerate > 0) {
      log.debug("Image search skipped {} candidates without a usable vector", degenerate);
    }
    return hits;
  }

  @Recover
  List<ImageHit> recoverSearch(RuntimeException e, ImageSearchRequest request) {
    throw StoreFailures.afterRetries(Capability.IMAGE_STORE, e);
  }

  /** Stores an image embedding with its linkage metadata. */
  public String index(ImageRecord image) {
    if (image.embedding().length != multimodalClient.dimension()) {
      throw new IllegalArgumentException(
          "Image embedding has "
              + image.embedding().length
              + " dimensions, expected "
              + multimodalClient.dimension());
    }
    Metadata metadata =
        new Metadata().put("image_id", image.imageId()).put("subject_id", image.subjectId());
    putIfPresent(metadata, "study_id", image.studyId());
    putIfPresent(
        metadata,
        "view_position",
        image.viewPosition() != null ? image.viewPosition().toUpperCase(Locale.ROOT) : null);
    putIfPresent(metadata, "image_path", image.imagePath());
    putIfPresent(metadata, "document_id", image.documentId());
    putIfPresent(metadata, "patient_id", image.patientId());
    TextSegment segment = TextSegment.from(image.imageId(), metadata);
    return StoreFailures.translated(
        "image index", () -> imageEmbeddingStore.add(Embedding.from(image.embedding()), segment));
  }

  private float[] queryVector(ImageSearchRequest request) {
    if (request.vector() != null) {
      if (request.vector().length != multimodalClient.dimension()) {
        throw new IllegalArgumentException(
            "Query embedding has "
                + request.vector().length
                + " dimensions, expected "
                + multimodalClient.dimension());
      }
      return request.vector();
    }
    return multimodalClient.embedText(request.text());
  }

  @Nullable Filter buildFilter(ImageSearchRequest request) {
    List<Filter> filters = new ArrayList<>();
    if (request.subjectId() != null) {
      filters.add(metadataKey("subject_id").isEqualTo(request.subjectId()));
    }
    if (request.viewPosition() != null) {
      filters.add(
          metadataKey("view_position").isEqualTo(request.viewPosition().toUpperCase(Locale.ROOT)));
    }
    return filters.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }

  private static boolean isDegenerate(@Nullable Embedding embedding) {
    return embedding == null || Vectors.isDegenerate(embedding.vector());
  }

  private static ImageHit toHit(EmbeddingMatch<TextSegment> match, double similarity) {
    Metadata metadata = match.embedded().metadata();
    String imageId = metadata.getString("image_id");
    return new ImageHit(
        imageId != null ? imageId : match.embeddingId(),
        metadata.getString("subject_id"),
        metadata.getString("study_id"),
        metadata.getString("view_position"),
        metadata.getString("image_path"),
        metadata.getString("document_id"),
        metadata.getString("patient_id"),
        similarity,
        SimilarityBand.of(similarity));
  }

  private static void putIfPresent(Metadata metadata, String key, @Nullable String value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }
}
