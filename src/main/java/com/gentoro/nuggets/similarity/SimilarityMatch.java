package com.gentoro.nuggets.similarity;

/** Outcome of a nearest-vector lookup. {@code index} is {@code -1} when nothing matched. */
public record SimilarityMatch(int index, double similarity, boolean found) {
  public static final SimilarityMatch NONE = new SimilarityMatch(-1, 0.0, false);
}
