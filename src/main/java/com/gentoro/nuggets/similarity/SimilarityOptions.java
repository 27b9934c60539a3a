package com.gentoro.nuggets.similarity;

/** Per-position weights of the word-similarity scorer. */
public record SimilarityOptions(
    double exactMatchScore,
    double substringMatchScore,
    double levenshteinMultiplier,
    double levenshteinThreshold) {

  private static final SimilarityOptions DEFAULTS = new SimilarityOptions(1.0, 0.8, 0.7, 0.6);

  public static SimilarityOptions defaults() {
    return DEFAULTS;
  }

  /** Defaults with a different substring score. */
  public static SimilarityOptions substringOnly(double substringMatchScore) {
    return new SimilarityOptions(
        DEFAULTS.exactMatchScore,
        substringMatchScore,
        DEFAULTS.levenshteinMultiplier,
        DEFAULTS.levenshteinThreshold);
  }
}
