package dev.asclepius.memory;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the agent memory store, bound from {@code asclepius.memory.*}.
 *
 * <ul>
 *   <li>{@code min-similarity} - cosine floor for recalled memories (default 0.3)
 *   <li>{@code auto-recall-limit} - memories injected before the first model decision (default 3)
 *   <li>{@code max-content-length} - longest accepted memory text in characters (default 2000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "asclepius.memory")
public class MemoryProperties {

  private double minSimilarity = 0.3;
  private int autoRecallLimit = 3;
  private int maxContentLength = 2000;

  @PostConstruct
  void validate() {
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalStateException(
          "asclepius.memory.min-similarity must be in [-1.0, 1.0], got: " + minSimilarity);
    }
    if (autoRecallLimit < 0 || autoRecallLimit > 20) {
      throw new IllegalStateException(
          "asclepius.memory.auto-recall-limit must be in [0, 20], got: " + autoRecallLimit);
    }
    if (maxContentLength < 1) {
      throw new IllegalStateException(
          "asclepius.memory.max-content-length must be positive, got: " + maxContentLength);
    }
  }

  public double getMinSimilarity() {
    return minSimilarity;
  }

  public void setMinSimilarity(double minSimilarity) {
    this.minSimilarity = minSimilarity;
  }

  public int getAutoRecallLimit() {
    return autoRecallLimit;
  }

  public void setAutoRecallLimit(int autoRecallLimit) {
    this.autoRecallLimit = autoRecallLimit;
  }

  public int getMaxContentLength() {
    return maxContentLength;
  }

  public void setMaxContentLength(int maxContentLength) {
    this.maxContentLength = maxContentLength;
  }
}
