package com.gentoro.nuggets.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.errors.AnthropicServiceException;
import com.anthropic.models.messages.ContentBlock;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.prompt.ExtractionPrompt;
import org.apache.commons.configuration2.Configuration;

/** Anthropic implementation using the anthropic-java SDK (Messages API). */
public class AnthropicNuggetProvider extends AbstractNuggetProvider {
  static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";

  private final AnthropicClient anthropicClient;

  public AnthropicNuggetProvider(AnthropicClient anthropicClient, Configuration configuration) {
    super("anthropic", configuration);
    this.anthropicClient = anthropicClient;
  }

  @Override
  protected String runCompletion(ExtractionPrompt.Rendered prompt, double temperature) {
    MessageCreateParams params =
        MessageCreateParams.builder()
            .model(modelName(DEFAULT_MODEL))
            .maxTokens(configuration.getLong("options.max-tokens", 8192L))
            .system(prompt.system())
            .addUserMessage(prompt.user())
            .temperature(temperature)
            .build();

    Message message = anthropicClient.messages().create(params);
    StringBuilder text = new StringBuilder();
    for (ContentBlock block : message.content()) {
      if (block.isText()) {
        text.append(block.asText().text());
      }
    }
    return text.toString().trim();
  }

  @Override
  protected int statusCodeOf(Throwable error) {
    AnthropicServiceException e = ExceptionUtil.findCause(error, AnthropicServiceException.class);
    return e == null ? 0 : e.statusCode();
  }
}
