package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.ExtractionCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned cancellation signal with an optional deadline. Cancelling wakes up any thread
 * waiting in {@link #await(long)}, so a pending backoff ends immediately.
 */
public final class CancellationToken {
  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final Instant deadline;
  private final Clock clock;
  private volatile String reason;

  private CancellationToken(Instant deadline, Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  /** A token that is only cancelled explicitly. */
  public static CancellationToken create() {
    return new CancellationToken(null, Clock.systemUTC());
  }

  public static CancellationToken withTimeout(Duration timeout) {
    return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
  }

  public static CancellationToken withDeadline(Instant deadline, Clock clock) {
    return new CancellationToken(
        Objects.requireNonNull(deadline, "deadline"), Objects.requireNonNull(clock, "clock"));
  }

  public void cancel() {
    cancel("Extraction cancelled by caller");
  }

  public void cancel(String reason) {
    if (this.reason == null) {
      this.reason = reason;
    }
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0 || deadlinePassed();
  }

  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new ExtractionCancelledException(reason());
    }
  }

  public String reason() {
    if (cancelled.getCount() == 0 && reason != null) return reason;
    return deadlinePassed() ? "Extraction deadline exceeded" : "Extraction cancelled";
  }

  /** Milliseconds until the deadline, {@link Long#MAX_VALUE} without one. */
  public long remainingMillis() {
    if (deadline == null) return Long.MAX_VALUE;
    return Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
  }

  /**
   * Waits up to {@code millis} or until cancelled, whichever comes first.
   *
   * @return true when the token is cancelled
   */
  public boolean await(long millis) throws InterruptedException {
    long wait = Math.min(Math.max(0L, millis), remainingMillis());
    if (wait > 0) {
      cancelled.await(wait, TimeUnit.MILLISECONDS);
    }
    return isCancelled();
  }

  private boolean deadlinePassed() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }
}
