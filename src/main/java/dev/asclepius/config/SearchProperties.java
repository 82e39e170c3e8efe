package dev.asclepius.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the retrieval and fusion pipeline.
 *
 * <p>Properties are bound from {@code asclepius.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code alpha} - weight for vector scores when re-ranking document candidates (0.0 =
 *       lexical only, 1.0 = vector only; default 0.7)
 *   <li>{@code rerank-candidates} - number of full-text candidates fetched before re-ranking
 *       (default 30, bounded [10, 100])
 *   <li>{@code rrf-k} - Reciprocal Rank Fusion constant (default 60)
 *   <li>{@code reconciliation-key} - item identity used to align results across sources in hybrid
 *       search: {@code DOCUMENT} or {@code PATIENT} (default DOCUMENT)
 *   <li>{@code hybrid-graph-hops} - graph expansion depth used by hybrid search (default 1,
 *       bounded [0, 3])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "asclepius.search")
public class SearchProperties {

  /** Item identity shared across sources during fusion. */
  public enum ReconciliationKey {
    DOCUMENT,
    PATIENT
  }

  private double alpha = 0.7;
  private int rerankCandidates = 30;
  private int rrfK = 60;
  private ReconciliationKey reconciliationKey = ReconciliationKey.DOCUMENT;
  private int hybridGraphHops = 1;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalStateException(
          "asclepius.search.alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (rerankCandidates < 10 || rerankCandidates > 100) {
      throw new IllegalStateException(
          "asclepius.search.rerank-candidates must be in [10, 100], got: " + rerankCandidates);
    }
    if (rrfK < 1) {
      throw new IllegalStateException("asclepius.search.rrf-k must be positive, got: " + rrfK);
    }
    if (reconciliationKey == null) {
      throw new IllegalStateException("asclepius.search.reconciliation-key must be set");
    }
    if (hybridGraphHops < 0 || hybridGraphHops > 3) {
      throw new IllegalStateException(
          "asclepius.search.hybrid-graph-hops must be in [0, 3], got: " + hybridGraphHops);
    }
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public int getRerankCandidates() {
    return rerankCandidates;
  }

  public void setRerankCandidates(int rerankCandidates) {
    this.rerankCandidates = rerankCandidates;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public ReconciliationKey getReconciliationKey() {
    return reconciliationKey;
  }

  public void setReconciliationKey(ReconciliationKey reconciliationKey) {
    this.reconciliationKey = reconciliationKey;
  }

  public int getHybridGraphHops() {
    return hybridGraphHops;
  }

  public void setHybridGraphHops(int hybridGraphHops) {
    this.hybridGraphHops = hybridGraphHops;
  }
}
