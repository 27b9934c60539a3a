package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.model.ResolvedNugget;
import java.util.List;

/**
 * Consensus nuggets of several extraction runs. Each nugget's confidence is the share of
 * successful runs that proposed it.
 *
 * @param duplicatesRemoved candidates merged into another group's nugget
 * @param attempts provider calls made across all runs
 */
public record EnsembleResult(
    List<ConsensusNugget> nuggets,
    int totalRuns,
    int successfulRuns,
    int duplicatesRemoved,
    ConsensusBuilder.Method similarityMethod,
    int validatedCount,
    int attempts,
    long elapsedMs) {

  /** A resolved nugget with the support it received. */
  public record ConsensusNugget(ResolvedNugget nugget, int runsSupporting, double cohesion) {}

  public EnsembleResult {
    nuggets = List.copyOf(nuggets);
  }
}
