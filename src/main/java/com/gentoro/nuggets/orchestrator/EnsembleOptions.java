package com.gentoro.nuggets.orchestrator;

import org.apache.commons.configuration2.Configuration;

/**
 * Settings of a consensus extraction: how many independent runs to make and when two proposed
 * nuggets count as the same one.
 *
 * @param runs extractions to run; each one has its own retry budget
 * @param embeddingThreshold minimum cosine similarity of two embedded nuggets in one group
 * @param wordOverlapThreshold minimum word overlap when embeddings are disabled or fail
 * @param useEmbeddings whether to group by embeddings when an embedder is available
 */
public record EnsembleOptions(
    int runs, double embeddingThreshold, double wordOverlapThreshold, boolean useEmbeddings) {

  public static final int DEFAULT_RUNS = 3;
  public static final double DEFAULT_THRESHOLD = 0.8;

  public EnsembleOptions {
    if (runs < 1) {
      throw new IllegalArgumentException("runs must be positive: " + runs);
    }
    if (embeddingThreshold < 0.0 || embeddingThreshold > 1.0) {
      throw new IllegalArgumentException(
          "embeddingThreshold must be within [0, 1]: " + embeddingThreshold);
    }
    if (wordOverlapThreshold < 0.0 || wordOverlapThreshold > 1.0) {
      throw new IllegalArgumentException(
          "wordOverlapThreshold must be within [0, 1]: " + wordOverlapThreshold);
    }
  }

  public static EnsembleOptions defaults() {
    return new EnsembleOptions(DEFAULT_RUNS, DEFAULT_THRESHOLD, DEFAULT_THRESHOLD, true);
  }

  /** Reads the {@code extraction.ensemble.*} keys; missing keys keep their defaults. */
  public static EnsembleOptions fromConfiguration(Configuration cfg) {
    EnsembleOptions d = defaults();
    return new EnsembleOptions(
        cfg.getInt("extraction.ensemble.runs", d.runs()),
        cfg.getDouble("extraction.ensemble.embedding-threshold", d.embeddingThreshold()),
        cfg.getDouble("extraction.ensemble.word-overlap-threshold", d.wordOverlapThreshold()),
        cfg.getBoolean("extraction.ensemble.use-embeddings", d.useEmbeddings()));
  }

  public EnsembleOptions withRuns(int newRuns) {
    return new EnsembleOptions(newRuns, embeddingThreshold, wordOverlapThreshold, useEmbeddings);
  }
}
