package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.orchestrator.ErrorClassifier;
import com.gentoro.nuggets.prompt.ExtractionPrompt;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Common plumbing for SDK-backed providers: prompt rendering, response parsing, timing and
 * translation of SDK exceptions into classified {@link ProviderException}s.
 *
 * <p>Subclasses implement {@link #runCompletion(ExtractionPrompt.Rendered, double)} with a single
 * call to their SDK and {@link #statusCodeOf(Throwable)} to expose the upstream status code.
 */
public abstract class AbstractNuggetProvider implements NuggetProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(AbstractNuggetProvider.class);

  protected final Configuration configuration;
  private final String providerId;
  private final ExtractionPrompt prompt;

  protected AbstractNuggetProvider(String providerId, Configuration configuration) {
    this(providerId, configuration, ExtractionPrompt.defaultPrompt());
  }

  protected AbstractNuggetProvider(
      String providerId, Configuration configuration, ExtractionPrompt prompt) {
    this.providerId = Objects.requireNonNull(providerId, "providerId");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.prompt = Objects.requireNonNull(prompt, "prompt");
  }

  @Override
  public String providerId() {
    return providerId;
  }

  /** Model name from {@code model}, or the provider default. */
  protected String modelName(String defaultModel) {
    return configuration.getString("model", defaultModel);
  }

  @Override
  public final List<RawCandidate> extract(
      String content, String instructions, double temperature, Set<NuggetType> types) {
    long start = System.currentTimeMillis();
    ExtractionPrompt.Rendered rendered = prompt.render(instructions, types, content);
    log.trace("[{}] system prompt:\n{}", providerId, rendered.system());
    try {
      String raw = runCompletion(rendered, temperature);
      log.trace("[{}] raw response:\n{}", providerId, raw);
      List<RawCandidate> candidates = NuggetResponseParser.parse(raw, providerId);
      log.info(
          "[Extraction] - {}: {} candidate(s) in {} ms",
          providerId,
          candidates.size(),
          System.currentTimeMillis() - start);
      return candidates;
    } catch (ProviderException e) {
      throw e;
    } catch (RuntimeException e) {
      ProviderException pe = ErrorClassifier.toProviderException(providerId, statusCodeOf(e), e);
      log.debug(
          "[{}] call failed after {} ms: {} ({})",
          providerId,
          System.currentTimeMillis() - start,
          pe.getMessage(),
          pe.getCategory());
      throw pe;
    }
  }

  /** Sends the rendered prompt and returns the raw text of the model's answer. */
  protected abstract String runCompletion(ExtractionPrompt.Rendered prompt, double temperature);

  /** HTTP status carried by an SDK exception, {@code 0} when unknown. */
  protected int statusCodeOf(Throwable error) {
    return 0;
  }
}
