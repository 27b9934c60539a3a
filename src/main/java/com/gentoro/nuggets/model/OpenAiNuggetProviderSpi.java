package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * SPI provider for OpenAI-compatible backends. A {@code baseUrl} key points the client at
 * compatible gateways such as OpenRouter.
 */
public final class OpenAiNuggetProviderSpi implements NuggetProviderSpi {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public NuggetProvider create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.openai.apiKey in configuration");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("baseUrl");
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    return new OpenAiNuggetProvider(
        subConfiguration.getString("id", providerId()), client, subConfiguration);
  }
}
