package com.gentoro.nuggets.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nuggets.exception.ErrorCategory;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  /** Random that always draws the same value. */
  private static Random fixed(double value) {
    return new Random() {
      @Override
      public double nextDouble() {
        return value;
      }
    };
  }

  @Test
  void delaysDoublePerAttempt() {
    RetryPolicy policy = new RetryPolicy(5, 1000, 2000, 0.1, fixed(0.0));
    assertEquals(1000, policy.delayMillis(1, ErrorCategory.TRANSIENT));
    assertEquals(2000, policy.delayMillis(2, ErrorCategory.TRANSIENT));
    assertEquals(4000, policy.delayMillis(3, ErrorCategory.SERVER_ERROR));
  }

  @Test
  void jitterIsBoundedByRatio() {
    RetryPolicy policy = new RetryPolicy(5, 1000, 2000, 0.1, fixed(0.999));
    assertEquals(1099, policy.delayMillis(1, ErrorCategory.TRANSIENT));
  }

  @Test
  @DisplayName("rate-limit delays exceed transient delays at every attempt")
  void rateLimitUsesLargerBase() {
    RetryPolicy worst = new RetryPolicy(5, 1000, 2000, 0.1, fixed(0.999));
    RetryPolicy best = new RetryPolicy(5, 1000, 2000, 0.1, fixed(0.0));
    for (int attempt = 1; attempt <= 5; attempt++) {
      assertTrue(
          best.delayMillis(attempt, ErrorCategory.RATE_LIMIT)
              > worst.delayMillis(attempt, ErrorCategory.TRANSIENT));
    }
  }

  @Test
  void attemptsLeft() {
    RetryPolicy policy = new RetryPolicy(3, 1, 2, 0, new Random(7));
    assertTrue(policy.hasAttemptsLeft(2));
    assertFalse(policy.hasAttemptsLeft(3));
  }

  @Test
  void buildsFromOptions() {
    ExtractionOptions options = ExtractionOptions.builder().maxAttempts(4).build();
    assertEquals(4, RetryPolicy.from(options, new Random(1)).maxAttempts());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 2, 0, new Random()));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -1, 2, 0, new Random()));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 1, 2, 2, new Random()));
  }

  @Test
  @DisplayName("the rate-limit base must be strictly larger than the normal base")
  void rateLimitBaseMustExceedBase() {
    assertThrows(
        IllegalArgumentException.class, () -> new RetryPolicy(3, 1000, 1000, 0, new Random()));
    assertThrows(
        IllegalArgumentException.class, () -> new RetryPolicy(3, 2000, 1000, 0, new Random()));
  }
}
