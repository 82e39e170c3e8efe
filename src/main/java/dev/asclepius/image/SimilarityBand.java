package dev.asclepius.image;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse reading of a cosine similarity for presentation. */
public enum SimilarityBand {
  STRONG("strong"),
  MODERATE("moderate"),
  WEAK("weak");

  static final double STRONG_THRESHOLD = 0.7;
  static final double MODERATE_THRESHOLD = 0.5;

  private final String value;

  SimilarityBand(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static SimilarityBand of(double similarity) {
    if (similarity >= STRONG_THRESHOLD) {
      return STRONG;
    }
    if (similarity >= MODERATE_THRESHOLD) {
      return MODERATE;
    }
    return WEAK;
  }
}
