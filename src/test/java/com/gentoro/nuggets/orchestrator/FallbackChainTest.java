package com.gentoro.nuggets.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nuggets.exception.ConfigException;
import com.gentoro.nuggets.model.NuggetProvider;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.model.RawCandidate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FallbackChainTest {

  private static NuggetProvider provider(String id) {
    return new NuggetProvider() {
      @Override
      public String providerId() {
        return id;
      }

      @Override
      public List<RawCandidate> extract(
          String content, String prompt, double temperature, Set<NuggetType> types) {
        return List.of();
      }
    };
  }

  private static List<String> ids(FallbackChain chain) {
    return chain.providers().stream().map(NuggetProvider::providerId).toList();
  }

  @Test
  void followsDefaultPreferenceOrder() {
    FallbackChain chain =
        FallbackChain.of(
            List.of(
                provider("custom"),
                provider("anthropic"),
                provider("openrouter"),
                provider("gemini"),
                provider("openai")));
    assertEquals(List.of("gemini", "openai", "anthropic", "openrouter", "custom"), ids(chain));
    assertEquals("gemini", chain.primary().providerId());
    assertEquals(5, chain.size());
  }

  @Test
  void preferredProviderGoesFirst() {
    FallbackChain chain =
        FallbackChain.of(
            List.of(provider("gemini"), provider("openai"), provider("anthropic")), "anthropic");
    assertEquals(List.of("anthropic", "gemini", "openai"), ids(chain));
  }

  @Test
  void nextWalksTheChain() {
    FallbackChain chain = FallbackChain.of(List.of(provider("gemini"), provider("openai")));
    assertEquals("openai", chain.next("gemini").map(NuggetProvider::providerId).orElseThrow());
    assertEquals(Optional.empty(), chain.next("openai"));
    assertEquals(Optional.empty(), chain.next("unknown"));
  }

  @Test
  void emptyChainIsAConfigurationError() {
    assertThrows(ConfigException.class, () -> FallbackChain.of(List.of()));
  }
}
