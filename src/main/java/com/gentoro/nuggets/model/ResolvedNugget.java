package com.gentoro.nuggets.model;

import com.gentoro.nuggets.validation.MatchMethod;
import java.util.Objects;

/**
 * A candidate located in the source text. {@code startAnchor} and {@code endAnchor} are distinct
 * literal strings used to find the passage again; both are empty only for blank content.
 */
public record ResolvedNugget(
    NuggetType type,
    String fullContent,
    String startAnchor,
    String endAnchor,
    double confidence,
    double validationScore,
    MatchMethod matchMethod) {

  public ResolvedNugget {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(fullContent, "fullContent");
    Objects.requireNonNull(startAnchor, "startAnchor");
    Objects.requireNonNull(endAnchor, "endAnchor");
    Objects.requireNonNull(matchMethod, "matchMethod");
  }

  public boolean isValidated() {
    return matchMethod != MatchMethod.UNVERIFIED;
  }
}
