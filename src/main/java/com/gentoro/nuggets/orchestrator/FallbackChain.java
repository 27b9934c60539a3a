package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.ConfigException;
import com.gentoro.nuggets.model.NuggetProvider;
import com.gentoro.nuggets.model.NuggetProviderFactory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Ordered providers to try. The preferred provider comes first, the others follow the default
 * preference order; providers not named in that order keep their relative position at the end.
 */
public final class FallbackChain {
  public static final List<String> DEFAULT_PREFERENCE =
      List.of("gemini", "openai", "anthropic", "openrouter");

  private final List<NuggetProvider> providers;

  private FallbackChain(List<NuggetProvider> providers) {
    if (providers.isEmpty()) {
      throw new ConfigException("At least one provider is required");
    }
    this.providers = List.copyOf(providers);
  }

  public static FallbackChain of(List<NuggetProvider> providers) {
    return of(providers, null);
  }

  public static FallbackChain of(List<NuggetProvider> providers, String preferredProviderId) {
    List<NuggetProvider> ordered = new ArrayList<>(providers);
    ordered.sort(Comparator.comparingInt(p -> rank(p.providerId(), preferredProviderId)));
    return new FallbackChain(ordered);
  }

  /** Providers from {@code llm.profiles}, ordered with {@code llm.preferred} first. */
  public static FallbackChain fromConfiguration(Configuration configuration) {
    return of(
        NuggetProviderFactory.createConfigured(configuration),
        configuration.getString("llm.preferred", null));
  }

  public NuggetProvider primary() {
    return providers.get(0);
  }

  /** The provider after {@code currentProviderId}, if any. */
  public Optional<NuggetProvider> next(String currentProviderId) {
    for (int i = 0; i < providers.size() - 1; i++) {
      if (providers.get(i).providerId().equals(currentProviderId)) {
        return Optional.of(providers.get(i + 1));
      }
    }
    return Optional.empty();
  }

  public List<NuggetProvider> providers() {
    return providers;
  }

  public int size() {
    return providers.size();
  }

  private static int rank(String providerId, String preferred) {
    if (providerId.equals(preferred)) return -1;
    int idx = DEFAULT_PREFERENCE.indexOf(providerId);
    return idx < 0 ? DEFAULT_PREFERENCE.size() : idx;
  }
}
