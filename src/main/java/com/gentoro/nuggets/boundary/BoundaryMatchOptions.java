package com.gentoro.nuggets.boundary;

/**
 * Anchor and validation settings.
 *
 * @param tolerance minimum similarity accepted by the fuzzy validation tier
 * @param maxStartWords words taken for the start anchor of prose
 * @param maxEndWords words taken for the end anchor of prose
 * @param minConfidenceThreshold validation score below which a nugget is tagged unverified
 */
public record BoundaryMatchOptions(
    double tolerance, int maxStartWords, int maxEndWords, double minConfidenceThreshold) {

  private static final BoundaryMatchOptions DEFAULTS = new BoundaryMatchOptions(0.8, 5, 5, 0.8);

  public BoundaryMatchOptions {
    if (tolerance < 0.0 || tolerance > 1.0) {
      throw new IllegalArgumentException("tolerance must be within [0, 1]: " + tolerance);
    }
    if (minConfidenceThreshold < 0.0 || minConfidenceThreshold > 1.0) {
      throw new IllegalArgumentException(
          "minConfidenceThreshold must be within [0, 1]: " + minConfidenceThreshold);
    }
    if (maxStartWords < 1 || maxEndWords < 1) {
      throw new IllegalArgumentException(
          "word counts must be positive: start=%d, end=%d".formatted(maxStartWords, maxEndWords));
    }
  }

  public static BoundaryMatchOptions defaults() {
    return DEFAULTS;
  }
}
