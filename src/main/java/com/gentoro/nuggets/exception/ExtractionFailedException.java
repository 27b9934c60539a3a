package com.gentoro.nuggets.exception;

import java.util.Map;
import java.util.Objects;

/**
 * Raised once the retry and fallback policy is exhausted, or immediately for non-retryable
 * failures. Carries the last classified provider error and a message meant for end users.
 */
public class ExtractionFailedException extends NuggetsException {
  private final ProviderException lastError;
  private final String userMessage;
  private final int attempts;

  public ExtractionFailedException(ProviderException lastError, String userMessage, int attempts) {
    super(
        NuggetsErrorCode.EXTRACTION_FAILED,
        "Extraction failed after %d attempt(s): %s".formatted(attempts, lastError.getMessage()),
        Map.of(
            "provider", lastError.getProviderId(),
            "category", lastError.getCategory(),
            "attempts", attempts),
        lastError);
    this.lastError = Objects.requireNonNull(lastError, "lastError");
    this.userMessage = Objects.requireNonNull(userMessage, "userMessage");
    this.attempts = attempts;
  }

  public ProviderException getLastError() {
    return lastError;
  }

  public ErrorCategory getCategory() {
    return lastError.getCategory();
  }

  public String getUserMessage() {
    return userMessage;
  }

  public int getAttempts() {
    return attempts;
  }
}
