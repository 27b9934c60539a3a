package com.gentoro.nuggets.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.gentoro.nuggets.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for Anthropic-based {@link NuggetProvider} implementations. */
public final class AnthropicNuggetProviderSpi implements NuggetProviderSpi {
  @Override
  public String providerId() {
    return "anthropic";
  }

  @Override
  public NuggetProvider create(Configuration configuration) {
    String apiKey = configuration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.anthropic.apiKey in configuration");
    }
    AnthropicClient client = AnthropicOkHttpClient.builder().apiKey(apiKey).build();
    return new AnthropicNuggetProvider(client, configuration);
  }
}
