package com.gentoro.nuggets.boundary;

/** Start and end anchors of a passage. */
public record AnchorPair(String startAnchor, String endAnchor) {
  public static final AnchorPair EMPTY = new AnchorPair("", "");

  public boolean isDistinct() {
    return !startAnchor.isEmpty() && !endAnchor.isEmpty() && !startAnchor.equals(endAnchor);
  }
}
