package com.gentoro.nuggets.exception;

/**
 * Classification attached to every provider failure. Drives the retry/fallback decision of the
 * extraction orchestrator and the message shown to the caller.
 */
public enum ErrorCategory {
  /** The provider response violates the expected payload contract. Integration bug. */
  STRUCTURAL(false, false),
  /** Missing or invalid credentials, or an invalid request. */
  AUTH_CONFIG(false, false),
  /** The provider throttled the request. */
  RATE_LIMIT(true, true),
  /** Connectivity problem or timeout. */
  TRANSIENT(true, false),
  /** Upstream 5xx failure. */
  SERVER_ERROR(true, true),
  /** Nothing matched; handled like a transient failure that may justify a fallback. */
  UNKNOWN(true, true);

  private final boolean retryable;
  private final boolean fallbackEligible;

  ErrorCategory(boolean retryable, boolean fallbackEligible) {
    this.retryable = retryable;
    this.fallbackEligible = fallbackEligible;
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** Whether switching to another configured provider is worth trying immediately. */
  public boolean isFallbackEligible() {
    return fallbackEligible;
  }
}
