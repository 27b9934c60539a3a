package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.ErrorCategory;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with jitter: {@code base * 2^(attempt - 1)} plus up to {@code jitterRatio}
 * of that value. Rate-limit failures use their own, larger base.
 */
public final class RetryPolicy {
  private final int maxAttempts;
  private final long baseDelayMillis;
  private final long rateLimitBaseDelayMillis;
  private final double jitterRatio;
  private final Random random;

  public RetryPolicy(
      int maxAttempts,
      long baseDelayMillis,
      long rateLimitBaseDelayMillis,
      double jitterRatio,
      Random random) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    if (baseDelayMillis < 0 || rateLimitBaseDelayMillis < 0) {
      throw new IllegalArgumentException("delays must not be negative");
    }
    if (rateLimitBaseDelayMillis <= baseDelayMillis) {
      throw new IllegalArgumentException(
          "rateLimitBaseDelayMillis (%d) must exceed baseDelayMillis (%d)"
              .formatted(rateLimitBaseDelayMillis, baseDelayMillis));
    }
    if (jitterRatio < 0.0 || jitterRatio > 1.0) {
      throw new IllegalArgumentException("jitterRatio must be within [0, 1]: " + jitterRatio);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMillis = baseDelayMillis;
    this.rateLimitBaseDelayMillis = rateLimitBaseDelayMillis;
    this.jitterRatio = jitterRatio;
    this.random = Objects.requireNonNull(random, "random");
  }

  public static RetryPolicy from(ExtractionOptions options, Random random) {
    return new RetryPolicy(
        options.maxAttempts(),
        options.baseDelayMillis(),
        options.rateLimitBaseDelayMillis(),
        options.jitterRatio(),
        random);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public boolean hasAttemptsLeft(int attemptsMade) {
    return attemptsMade < maxAttempts;
  }

  /** Delay before retrying after failed attempt number {@code attempt} (1-based). */
  public long delayMillis(int attempt, ErrorCategory category) {
    long base = category == ErrorCategory.RATE_LIMIT ? rateLimitBaseDelayMillis : baseDelayMillis;
    long backoff = base * (1L << Math.min(Math.max(attempt - 1, 0), 20));
    long jitter;
    synchronized (random) {
      jitter = (long) (random.nextDouble() * jitterRatio * backoff);
    }
    return backoff + jitter;
  }
}
