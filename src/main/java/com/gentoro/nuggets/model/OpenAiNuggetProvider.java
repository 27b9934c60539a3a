package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.prompt.ExtractionPrompt;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import org.apache.commons.configuration2.Configuration;

/** OpenAI implementation using the openai-java SDK (Chat Completions API). */
public class OpenAiNuggetProvider extends AbstractNuggetProvider {
  static final String DEFAULT_MODEL = "gpt-4.1-mini";

  private final OpenAIClient openAIClient;

  public OpenAiNuggetProvider(
      String providerId, OpenAIClient openAIClient, Configuration configuration) {
    super(providerId, configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  protected String runCompletion(ExtractionPrompt.Rendered prompt, double temperature) {
    ChatCompletionCreateParams params =
        ChatCompletionCreateParams.builder()
            .model(modelName(DEFAULT_MODEL))
            .addSystemMessage(prompt.system())
            .addUserMessage(prompt.user())
            .temperature(temperature)
            .build();

    ChatCompletion completion = openAIClient.chat().completions().create(params);
    if (completion.choices().isEmpty()) {
      throw ProviderException.structural(providerId(), "OpenAI returned no choices");
    }
    return completion.choices().get(0).message().content().map(String::trim).orElse("");
  }

  @Override
  protected int statusCodeOf(Throwable error) {
    OpenAIServiceException e = ExceptionUtil.findCause(error, OpenAIServiceException.class);
    return e == null ? 0 : e.statusCode();
  }
}
