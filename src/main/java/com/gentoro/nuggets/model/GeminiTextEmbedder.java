package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.orchestrator.ErrorClassifier;
import com.gentoro.nuggets.similarity.TextEmbedder;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/** Embeddings from the Gemini embedding model, used to group consensus candidates. */
public class GeminiTextEmbedder implements TextEmbedder {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(GeminiTextEmbedder.class);

  static final String PROVIDER_ID = "gemini";
  static final String DEFAULT_MODEL = "gemini-embedding-001";

  private final Client geminiClient;
  private final String model;

  public GeminiTextEmbedder(Client geminiClient, String model) {
    this.geminiClient = Objects.requireNonNull(geminiClient, "geminiClient");
    this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
  }

  /**
   * An embedder for {@code llm.gemini.apiKey}, or empty when no key is configured. The model is
   * read from {@code extraction.ensemble.embedding-model}.
   */
  public static Optional<TextEmbedder> fromConfiguration(Configuration configuration) {
    String apiKey = configuration.getString("llm.gemini.apiKey", null);
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      log.debug("No Gemini API key configured; consensus grouping uses word overlap");
      return Optional.empty();
    }
    Client client = Client.builder().apiKey(apiKey).build();
    return Optional.of(
        new GeminiTextEmbedder(
            client, configuration.getString("extraction.ensemble.embedding-model", DEFAULT_MODEL)));
  }

  @Override
  public List<double[]> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    long start = System.currentTimeMillis();
    EmbedContentResponse response;
    try {
      response = geminiClient.models.embedContent(model, texts, null);
    } catch (RuntimeException e) {
      ApiException api = ExceptionUtil.findCause(e, ApiException.class);
      throw ErrorClassifier.toProviderException(PROVIDER_ID, api == null ? 0 : api.code(), e);
    }

    List<ContentEmbedding> embeddings = response.embeddings().orElse(List.of());
    if (embeddings.size() != texts.size()) {
      throw ProviderException.structural(
          PROVIDER_ID,
          "Expected %d embeddings, got %d".formatted(texts.size(), embeddings.size()));
    }
    List<double[]> out = new ArrayList<>(embeddings.size());
    for (ContentEmbedding embedding : embeddings) {
      List<Float> values = embedding.values().orElse(List.of());
      double[] vector = new double[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = values.get(i);
      }
      out.add(vector);
    }
    log.debug(
        "Embedded {} text(s) with {} in {} ms",
        texts.size(),
        model,
        System.currentTimeMillis() - start);
    return out;
  }
}
