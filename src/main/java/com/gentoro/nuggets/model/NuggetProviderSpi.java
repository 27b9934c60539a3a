package com.gentoro.nuggets.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable LLM backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.gentoro.nuggets.model.NuggetProviderSpi}. The factory selects one by
 * matching the configured {@code provider} value to {@link #providerId()}.
 */
public interface NuggetProviderSpi {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured provider.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.openai.*})
   * @throws com.gentoro.nuggets.exception.ConfigException when required keys are missing
   */
  NuggetProvider create(Configuration subConfiguration);
}
