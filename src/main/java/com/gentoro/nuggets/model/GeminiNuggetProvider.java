package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.prompt.ExtractionPrompt;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** Google Gemini implementation using the google-genai SDK. */
public class GeminiNuggetProvider extends AbstractNuggetProvider {
  static final String DEFAULT_MODEL = "gemini-2.5-flash";

  private final Client geminiClient;

  public GeminiNuggetProvider(Client geminiClient, Configuration configuration) {
    super("gemini", configuration);
    this.geminiClient = geminiClient;
  }

  @Override
  protected String runCompletion(ExtractionPrompt.Rendered prompt, double temperature) {
    GenerateContentConfig config =
        GenerateContentConfig.builder()
            .temperature((float) temperature)
            .candidateCount(1)
            .responseMimeType("application/json")
            .systemInstruction(
                Content.builder().role("user").parts(List.of(Part.fromText(prompt.system()))).build())
            .build();

    String modelName = modelName(DEFAULT_MODEL);
    GenerateContentResponse response =
        geminiClient.models.generateContent(modelName, prompt.user(), config);
    String text = response.text();
    return text == null ? "" : text.trim();
  }

  @Override
  protected int statusCodeOf(Throwable error) {
    ApiException e = ExceptionUtil.findCause(error, ApiException.class);
    return e == null ? 0 : e.code();
  }
}
