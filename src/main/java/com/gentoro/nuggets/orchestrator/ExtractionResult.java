package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.model.ResolvedNugget;
import java.util.List;

/**
 * Resolved nuggets of one extraction plus aggregate metadata.
 *
 * @param averageValidationScore mean validation score over all nuggets, 0 when there are none
 * @param attempts provider calls made; 0 when served from the cache
 */
public record ExtractionResult(
    List<ResolvedNugget> nuggets,
    int totalCount,
    int validatedCount,
    double averageValidationScore,
    long elapsedMs,
    String providerId,
    int attempts,
    boolean fromCache) {

  public ExtractionResult {
    nuggets = List.copyOf(nuggets);
  }

  static ExtractionResult of(
      List<ResolvedNugget> nuggets,
      long elapsedMs,
      String providerId,
      int attempts,
      boolean fromCache) {
    int validated = 0;
    double total = 0.0;
    for (ResolvedNugget n : nuggets) {
      if (n.isValidated()) validated++;
      total += n.validationScore();
    }
    double average = nuggets.isEmpty() ? 0.0 : total / nuggets.size();
    return new ExtractionResult(
        nuggets, nuggets.size(), validated, average, elapsedMs, providerId, attempts, fromCache);
  }
}
