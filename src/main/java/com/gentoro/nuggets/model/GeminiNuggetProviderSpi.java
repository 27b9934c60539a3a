package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ConfigException;
import com.google.genai.Client;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for Google Gemini-based {@link NuggetProvider} implementations. */
public final class GeminiNuggetProviderSpi implements NuggetProviderSpi {
  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public NuggetProvider create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.gemini.apiKey in configuration");
    }
    Client client = Client.builder().apiKey(apiKey).build();
    return new GeminiNuggetProvider(client, subConfiguration);
  }
}
