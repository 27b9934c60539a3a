package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.ProviderException;

/** Progress of one extraction call: attempts made, provider in use and the latest failure. */
public record RetryState(int attempt, String currentProviderId, ProviderException lastError) {

  static RetryState start(String providerId) {
    return new RetryState(0, providerId, null);
  }

  RetryState nextAttempt() {
    return new RetryState(attempt + 1, currentProviderId, lastError);
  }

  RetryState failed(ProviderException error) {
    return new RetryState(attempt, currentProviderId, error);
  }

  RetryState switchedTo(String providerId) {
    return new RetryState(attempt, providerId, lastError);
  }
}
