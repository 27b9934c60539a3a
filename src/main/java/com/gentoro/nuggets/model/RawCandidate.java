package com.gentoro.nuggets.model;

import java.util.Objects;

/** Unverified passage proposed by a provider. */
public record RawCandidate(NuggetType type, String fullContent, double confidence) {
  public RawCandidate {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(fullContent, "fullContent");
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
    }
  }
}
