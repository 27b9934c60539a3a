package com.gentoro.nuggets.model;

import com.gentoro.nuggets.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates {@link NuggetProvider} instances from the {@code llm.*} configuration namespace.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   llm.profiles = gemini, openai
 *   llm.gemini.provider = gemini
 *   llm.gemini.apiKey = ${env:GEMINI_API_KEY}
 * </pre>
 */
public final class NuggetProviderFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(NuggetProviderFactory.class);

  private NuggetProviderFactory() {}

  /**
   * Creates one provider per profile listed under {@code llm.profiles}. Profiles whose API key is
   * blank are skipped so a partially configured environment still works.
   */
  public static List<NuggetProvider> createConfigured(Configuration configuration) {
    List<NuggetProvider> out = new ArrayList<>();
    for (String profile : configuration.getList(String.class, "llm.profiles", List.of())) {
      String ns = profile.trim();
      if (ns.isEmpty()) continue;
      Configuration sub = configuration.subset("llm." + ns);
      String apiKey = sub.getString("apiKey", "");
      if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
        log.info("Skipping llm profile '{}': no API key configured", ns);
        continue;
      }
      out.add(create(sub));
    }
    if (out.isEmpty()) {
      throw new ConfigException(
          "No usable llm profile configured; set llm.profiles and the matching API keys");
    }
    return out;
  }

  /** Creates a provider from a profile subset; {@code provider} selects the implementation. */
  public static NuggetProvider create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider in configuration");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);

    for (NuggetProviderSpi spi : ServiceLoader.load(NuggetProviderSpi.class)) {
      if (id.equals(spi.providerId())) {
        return spi.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + id);
  }
}
