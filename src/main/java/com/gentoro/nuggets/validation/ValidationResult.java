package com.gentoro.nuggets.validation;

/** Validation score in {@code [0, 1]} and the tier that produced it. */
public record ValidationResult(double score, MatchMethod method) {
  public static final ValidationResult NOT_FOUND = of(MatchMethod.UNVERIFIED);

  public static ValidationResult of(MatchMethod method) {
    return new ValidationResult(method.score(), method);
  }

  public boolean isValidated(double minConfidenceThreshold) {
    return score >= minConfidenceThreshold;
  }
}
