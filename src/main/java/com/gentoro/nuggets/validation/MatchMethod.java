package com.gentoro.nuggets.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a passage was located in the source text, strongest first. */
public enum MatchMethod {
  EXACT("exact", 1.0),
  CASE_INSENSITIVE("case_insensitive", 0.95),
  FUZZY("fuzzy", 0.8),
  PARTIAL_PREFIX("partial_prefix", 0.6),
  UNVERIFIED("unverified", 0.0);

  private final String wireName;
  private final double score;

  MatchMethod(String wireName, double score) {
    this.wireName = wireName;
    this.score = score;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Fixed validation score awarded by this tier. */
  public double score() {
    return score;
  }
}
