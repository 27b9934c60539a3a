package com.gentoro.nuggets.orchestrator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.gentoro.nuggets.cache.ResponseCache;
import com.gentoro.nuggets.exception.ErrorCategory;
import com.gentoro.nuggets.exception.ExtractionCancelledException;
import com.gentoro.nuggets.exception.ExtractionFailedException;
import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.exception.ValidationException;
import com.gentoro.nuggets.model.NuggetProvider;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.model.RawCandidate;
import com.gentoro.nuggets.validation.MatchMethod;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExtractionOrchestratorTest {
  private static final String SOURCE =
      "Spaced repetition is a learning technique that schedules reviews of material at"
          + " increasing intervals. Anki is a free flashcard tool built on this idea.";

  private static final List<RawCandidate> GOOD =
      List.of(
          new RawCandidate(NuggetType.EXPLANATION, "a learning technique that schedules", 0.9),
          new RawCandidate(NuggetType.ANALOGY, "Memory behaves like a leaky bucket", 0.6));

  /** Provider that plays back a fixed sequence of outcomes; the last one repeats. */
  private static final class ScriptedProvider implements NuggetProvider {
    private final String id;
    private final List<Object> outcomes;
    final AtomicInteger calls = new AtomicInteger();
    final List<String> contents = new CopyOnWriteArrayList<>();
    final List<String> instructions = new CopyOnWriteArrayList<>();

    ScriptedProvider(String id, Object... outcomes) {
      this.id = id;
      this.outcomes = Arrays.asList(outcomes);
    }

    @Override
    public String providerId() {
      return id;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<RawCandidate> extract(
        String content, String prompt, double temperature, Set<NuggetType> types) {
      int n = calls.getAndIncrement();
      contents.add(content);
      instructions.add(prompt);
      Object outcome = outcomes.get(Math.min(n, outcomes.size() - 1));
      if (outcome instanceof ProviderException e) {
        throw e;
      }
      return (List<RawCandidate>) outcome;
    }
  }

  /** Random whose jitter draw is always one half. */
  private static final class HalfRandom extends Random {
    @Override
    public double nextDouble() {
      return 0.5;
    }
  }

  @Mock private NuggetProvider mockProvider;

  private final List<Long> sleeps = new CopyOnWriteArrayList<>();
  private final Sleeper recordingSleeper = (delay, token) -> sleeps.add(delay);
  private final ExtractionOptions noCache = ExtractionOptions.builder().useCache(false).build();
  private ScheduledExecutorService scheduler;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private ExtractionOrchestrator orchestrator(NuggetProvider... providers) {
    return orchestrator(null, recordingSleeper, providers);
  }

  private ExtractionOrchestrator orchestrator(
      ResponseCache cache, Sleeper sleeper, NuggetProvider... providers) {
    return new ExtractionOrchestrator(
        FallbackChain.of(List.of(providers)), cache, sleeper, new HalfRandom());
  }

  private static ProviderException error(String providerId, ErrorCategory category) {
    int status =
        switch (category) {
          case RATE_LIMIT -> 429;
          case SERVER_ERROR -> 503;
          case AUTH_CONFIG -> 401;
          default -> 0;
        };
    return new ProviderException(providerId, status, category, category + " from " + providerId);
  }

  @Test
  @DisplayName("a successful call resolves and aggregates every candidate")
  void successOnFirstAttempt() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);

    ExtractionResult result =
        orchestrator(gemini).extractValidated(SOURCE, "Find nuggets", noCache);

    assertEquals(2, result.totalCount());
    assertEquals(1, result.validatedCount());
    assertEquals(0.5, result.averageValidationScore(), 1e-9);
    assertEquals("gemini", result.providerId());
    assertEquals(1, result.attempts());
    assertFalse(result.fromCache());
    assertEquals(MatchMethod.EXACT, result.nuggets().get(0).matchMethod());
    assertEquals(MatchMethod.UNVERIFIED, result.nuggets().get(1).matchMethod());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void structuralFailureIsNotRetried() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", ProviderException.structural("gemini", "not JSON"));
    ScriptedProvider openai = new ScriptedProvider("openai", GOOD);

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () -> orchestrator(gemini, openai).extractValidated(SOURCE, "p", noCache));

    assertEquals(ErrorCategory.STRUCTURAL, e.getCategory());
    assertEquals(1, e.getAttempts());
    assertEquals(1, gemini.calls.get());
    assertEquals(0, openai.calls.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void authFailureIsReportedImmediately() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.AUTH_CONFIG));
    ScriptedProvider openai = new ScriptedProvider("openai", GOOD);

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () -> orchestrator(gemini, openai).extractValidated(SOURCE, "p", noCache));

    assertEquals(ErrorCategory.AUTH_CONFIG, e.getCategory());
    assertTrue(e.getUserMessage().contains("Invalid or missing API key for gemini"));
    assertEquals(0, openai.calls.get());
  }

  @Test
  @DisplayName("transient failures back off exponentially on the same provider")
  void transientFailuresBackOff() {
    ScriptedProvider gemini =
        new ScriptedProvider(
            "gemini",
            error("gemini", ErrorCategory.TRANSIENT),
            error("gemini", ErrorCategory.TRANSIENT),
            GOOD);
    ScriptedProvider openai = new ScriptedProvider("openai", GOOD);

    ExtractionResult result = orchestrator(gemini, openai).extractValidated(SOURCE, "p", noCache);

    assertEquals(3, result.attempts());
    assertEquals("gemini", result.providerId());
    // base 1000 and 2000 plus half of the 10% jitter
    assertEquals(List.of(1050L, 2100L), sleeps);
    assertEquals(0, openai.calls.get());
  }

  @Test
  void rateLimitWaitsLongerThanTransient() {
    ScriptedProvider limited =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.RATE_LIMIT), GOOD);
    orchestrator(limited).extractValidated(SOURCE, "p", noCache);
    long rateLimitDelay = sleeps.get(0);

    sleeps.clear();
    ScriptedProvider flaky =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.TRANSIENT), GOOD);
    orchestrator(flaky).extractValidated(SOURCE, "p", noCache);
    long transientDelay = sleeps.get(0);

    assertEquals(2100L, rateLimitDelay);
    assertEquals(1050L, transientDelay);
    assertTrue(rateLimitDelay > transientDelay);
  }

  @Test
  @DisplayName("the attempt cap surfaces the last classified error")
  void attemptCapSurfacesLastError() {
    ScriptedProvider gemini =
        new ScriptedProvider(
            "gemini",
            error("gemini", ErrorCategory.TRANSIENT),
            error("gemini", ErrorCategory.TRANSIENT),
            error("gemini", ErrorCategory.RATE_LIMIT));

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () -> orchestrator(gemini).extractValidated(SOURCE, "p", noCache));

    assertEquals(ErrorCategory.RATE_LIMIT, e.getCategory());
    assertEquals(3, e.getAttempts());
    assertEquals(3, gemini.calls.get());
    assertEquals(2, sleeps.size());
    assertTrue(e.getUserMessage().startsWith("Rate limit reached for gemini"));
  }

  @Test
  void serverErrorSwitchesToFallbackWithoutWaiting() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.SERVER_ERROR));
    ScriptedProvider openai = new ScriptedProvider("openai", GOOD);

    ExtractionResult result = orchestrator(openai, gemini).extractValidated(SOURCE, "p", noCache);

    assertEquals("openai", result.providerId());
    assertEquals(2, result.attempts());
    assertEquals(1, gemini.calls.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void fallbacksCountTowardTheAttemptCap() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.RATE_LIMIT));
    ScriptedProvider openai =
        new ScriptedProvider("openai", error("openai", ErrorCategory.SERVER_ERROR));
    ScriptedProvider anthropic = new ScriptedProvider("anthropic", GOOD);
    ExtractionOptions twoAttempts = noCache.toBuilder().maxAttempts(2).build();

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () ->
                orchestrator(gemini, openai, anthropic)
                    .extractValidated(SOURCE, "p", twoAttempts));

    assertEquals("openai", e.getLastError().getProviderId());
    assertEquals(2, e.getAttempts());
    assertEquals(0, anthropic.calls.get());
  }

  @Test
  void cancellationDuringBackoffStopsTheLoop() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.TRANSIENT), GOOD);
    Sleeper cancelling = (delay, token) -> token.cancel("user closed the page");
    CancellationToken token = CancellationToken.create();

    ExtractionCancelledException e =
        assertThrows(
            ExtractionCancelledException.class,
            () ->
                orchestrator(null, cancelling, gemini)
                    .extractValidated(SOURCE, "p", noCache, token));

    assertEquals("user closed the page", e.getMessage());
    assertEquals(1, gemini.calls.get());
  }

  @Test
  @DisplayName("cancelling wakes up a long backoff right away")
  void cancellationInterruptsRealBackoff() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.TRANSIENT), GOOD);
    ExtractionOptions slow =
        noCache.toBuilder().baseDelayMillis(60_000L).rateLimitBaseDelayMillis(120_000L).build();
    CancellationToken token = CancellationToken.create();
    scheduler.schedule(() -> token.cancel(), 100, TimeUnit.MILLISECONDS);

    assertTimeoutPreemptively(
        Duration.ofSeconds(10),
        () ->
            assertThrows(
                ExtractionCancelledException.class,
                () ->
                    orchestrator(null, Sleeper.SYSTEM, gemini)
                        .extractValidated(SOURCE, "p", slow, token)));
    assertEquals(1, gemini.calls.get());
  }

  @Test
  void cancellationAbortsInFlightCall() {
    NuggetProvider hanging =
        new NuggetProvider() {
          @Override
          public String providerId() {
            return "gemini";
          }

          @Override
          public List<RawCandidate> extract(
              String content, String prompt, double temperature, Set<NuggetType> types) {
            try {
              Thread.sleep(60_000L);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              throw new IllegalStateException("interrupted", e);
            }
            return GOOD;
          }
        };
    CancellationToken token = CancellationToken.create();
    scheduler.schedule(() -> token.cancel(), 100, TimeUnit.MILLISECONDS);

    assertTimeoutPreemptively(
        Duration.ofSeconds(10),
        () ->
            assertThrows(
                ExtractionCancelledException.class,
                () -> orchestrator(hanging).extractValidated(SOURCE, "p", noCache, token)));
  }

  /** Provider that blocks until released, reporting each call that has started. */
  private static final class BlockingProvider implements NuggetProvider {
    private final CountDownLatch started;
    private final CountDownLatch release;

    BlockingProvider(CountDownLatch started, CountDownLatch release) {
      this.started = started;
      this.release = release;
    }

    @Override
    public String providerId() {
      return "gemini";
    }

    @Override
    public List<RawCandidate> extract(
        String content, String prompt, double temperature, Set<NuggetType> types) {
      started.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted", e);
      }
      return GOOD;
    }
  }

  @Test
  @DisplayName("cancellation still aborts the call when many other calls are in flight")
  void cancellationAbortsCallUnderLoad() throws Exception {
    int busy = Math.max(4, Runtime.getRuntime().availableProcessors()) + 2;
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(busy);
    ExecutorService callers = Executors.newFixedThreadPool(busy);
    try {
      for (int i = 0; i < busy; i++) {
        BlockingProvider provider = new BlockingProvider(started, release);
        callers.submit(() -> orchestrator(provider).extractValidated(SOURCE, "p", noCache));
      }
      assertTrue(started.await(10, TimeUnit.SECONDS));

      BlockingProvider last = new BlockingProvider(new CountDownLatch(1), release);
      CancellationToken token = CancellationToken.create();
      scheduler.schedule(() -> token.cancel(), 100, TimeUnit.MILLISECONDS);

      assertTimeoutPreemptively(
          Duration.ofSeconds(5),
          () ->
              assertThrows(
                  ExtractionCancelledException.class,
                  () -> orchestrator(last).extractValidated(SOURCE, "p", noCache, token)));
    } finally {
      release.countDown();
      callers.shutdownNow();
    }
  }

  @Test
  void cancellationDuringASuccessfulCallDiscardsTheResult() {
    CancellationToken token = CancellationToken.create();
    AtomicInteger calls = new AtomicInteger();
    NuggetProvider cancelling =
        new NuggetProvider() {
          @Override
          public String providerId() {
            return "gemini";
          }

          @Override
          public List<RawCandidate> extract(
              String content, String prompt, double temperature, Set<NuggetType> types) {
            calls.incrementAndGet();
            token.cancel("user closed the page");
            return GOOD;
          }
        };
    ResponseCache cache = new ResponseCache();
    ExtractionOptions cached = ExtractionOptions.defaults();

    assertThrows(
        ExtractionCancelledException.class,
        () ->
            orchestrator(cache, recordingSleeper, cancelling)
                .extractValidated(SOURCE, "p", cached, token));
    assertEquals(1, calls.get());
    assertEquals(0, cache.size());
  }

  @Test
  void alreadyCancelledTokenMakesNoCall() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    CancellationToken token = CancellationToken.create();
    token.cancel();

    assertThrows(
        ExtractionCancelledException.class,
        () -> orchestrator(gemini).extractValidated(SOURCE, "p", noCache, token));
    assertEquals(0, gemini.calls.get());
  }

  @Test
  void expiredDeadlineCancels() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);

    ExtractionCancelledException e =
        assertThrows(
            ExtractionCancelledException.class,
            () -> orchestrator(gemini).extractValidated(SOURCE, "p", noCache, token));
    assertEquals("Extraction deadline exceeded", e.getMessage());
  }

  @Test
  @DisplayName("a repeated request is served from the cache without a provider call")
  void repeatedRequestHitsCache() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    ExtractionOrchestrator o = orchestrator(new ResponseCache(), recordingSleeper, gemini);
    ExtractionOptions cached = ExtractionOptions.defaults();

    ExtractionResult first = o.extractValidated(SOURCE, "p", cached);
    ExtractionResult second = o.extractValidated(SOURCE, "p", cached);

    assertFalse(first.fromCache());
    assertTrue(second.fromCache());
    assertEquals(0, second.attempts());
    assertEquals("gemini", second.providerId());
    assertEquals(first.nuggets(), second.nuggets());
    assertEquals(1, gemini.calls.get());
  }

  @Test
  void blankContentIsRejected() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    assertThrows(
        ValidationException.class,
        () -> orchestrator(gemini).extractValidated("   ", "p", noCache));
    assertEquals(0, gemini.calls.get());
  }

  @Test
  @DisplayName("long content is truncated for the provider but validated in full")
  void truncatesPayloadButValidatesAgainstFullContent() {
    List<RawCandidate> tail =
        List.of(new RawCandidate(NuggetType.TOOL, "Anki is a free flashcard tool", 0.8));
    ScriptedProvider gemini = new ScriptedProvider("gemini", tail);
    ExtractionOptions shortPayload = noCache.toBuilder().maxContentLength(110).build();

    ExtractionResult result = orchestrator(gemini).extractValidated(SOURCE, "p", shortPayload);

    assertEquals(
        "Spaced repetition is a learning technique that schedules reviews of material at"
            + " increasing intervals.",
        gemini.contents.get(0));
    assertEquals(MatchMethod.EXACT, result.nuggets().get(0).matchMethod());
  }

  @Test
  void promptPlaceholdersAreApplied() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    ExtractionOptions chef = noCache.toBuilder().persona("chef").sourceLabel("recipe blog").build();

    orchestrator(gemini)
        .extractValidated(SOURCE, "You are a {{ persona }} reading a {{ source }}.", chef);

    assertEquals("You are a chef reading a recipe blog.", gemini.instructions.get(0));
  }

  @Test
  void mockedProviderRecoversAfterServerError() {
    when(mockProvider.providerId()).thenReturn("anthropic");
    when(mockProvider.extract(anyString(), anyString(), anyDouble(), anySet()))
        .thenThrow(error("anthropic", ErrorCategory.SERVER_ERROR))
        .thenReturn(new ArrayList<>(GOOD));

    ExtractionResult result =
        orchestrator(mockProvider).extractValidated(SOURCE, "Find nuggets", noCache);

    assertEquals(2, result.attempts());
    assertEquals("anthropic", result.providerId());
    assertEquals(List.of(1050L), sleeps);
    verify(mockProvider, times(2)).extract(anyString(), anyString(), anyDouble(), anySet());
  }

  private static final List<RawCandidate> EXPLANATION_ONLY =
      List.of(new RawCandidate(NuggetType.EXPLANATION, "a learning technique that schedules", 0.8));

  @Test
  @DisplayName("consensus confidence is the share of successful runs proposing a nugget")
  void consensusKeepsAgreedNuggets() {
    ScriptedProvider gemini =
        new ScriptedProvider(
            "gemini", GOOD, EXPLANATION_ONLY, error("gemini", ErrorCategory.STRUCTURAL));

    EnsembleResult result =
        orchestrator(gemini)
            .extractConsensus(
                SOURCE,
                "Find nuggets",
                noCache,
                EnsembleOptions.defaults(),
                CancellationToken.create());

    assertEquals(3, result.totalRuns());
    assertEquals(2, result.successfulRuns());
    assertEquals(3, result.attempts());
    assertEquals(1, result.duplicatesRemoved());
    assertEquals(ConsensusBuilder.Method.WORD_OVERLAP, result.similarityMethod());
    assertEquals(2, result.nuggets().size());

    EnsembleResult.ConsensusNugget agreed = result.nuggets().get(0);
    assertEquals(NuggetType.EXPLANATION, agreed.nugget().type());
    assertEquals(2, agreed.runsSupporting());
    assertEquals(1.0, agreed.nugget().confidence(), 1e-9);
    assertTrue(agreed.nugget().isValidated());

    EnsembleResult.ConsensusNugget single = result.nuggets().get(1);
    assertEquals(NuggetType.ANALOGY, single.nugget().type());
    assertEquals(0.5, single.nugget().confidence(), 1e-9);
    assertFalse(single.nugget().isValidated());
    assertEquals(1, result.validatedCount());
  }

  @Test
  void consensusFailsWhenEveryRunFails() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.STRUCTURAL));

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () ->
                orchestrator(gemini)
                    .extractConsensus(
                        SOURCE,
                        "Find nuggets",
                        noCache,
                        EnsembleOptions.defaults(),
                        CancellationToken.create()));

    assertEquals(ErrorCategory.STRUCTURAL, e.getCategory());
    assertEquals(3, gemini.calls.get());
  }

  @Test
  void consensusStopsOnAuthFailure() {
    ScriptedProvider gemini =
        new ScriptedProvider("gemini", error("gemini", ErrorCategory.AUTH_CONFIG), GOOD);

    ExtractionFailedException e =
        assertThrows(
            ExtractionFailedException.class,
            () ->
                orchestrator(gemini)
                    .extractConsensus(
                        SOURCE,
                        "Find nuggets",
                        noCache,
                        EnsembleOptions.defaults(),
                        CancellationToken.create()));

    assertEquals(ErrorCategory.AUTH_CONFIG, e.getCategory());
    assertEquals(1, gemini.calls.get());
  }

  @Test
  void consensusGroupsByEmbeddingWhenAvailable() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    AtomicInteger embedCalls = new AtomicInteger();
    ExtractionOrchestrator orchestrator =
        new ExtractionOrchestrator(
            FallbackChain.of(List.of(gemini)),
            null,
            recordingSleeper,
            new HalfRandom(),
            texts -> {
              embedCalls.incrementAndGet();
              List<double[]> vectors = new ArrayList<>();
              for (int i = 0; i < texts.size(); i++) {
                vectors.add(new double[] {1.0, 0.0});
              }
              return vectors;
            });

    EnsembleResult result =
        orchestrator.extractConsensus(
            SOURCE,
            "Find nuggets",
            noCache,
            EnsembleOptions.defaults().withRuns(2),
            CancellationToken.create());

    assertEquals(ConsensusBuilder.Method.EMBEDDING, result.similarityMethod());
    assertEquals(2, result.nuggets().size());
    assertEquals(2, result.duplicatesRemoved());
    assertEquals(2, embedCalls.get());
    for (EnsembleResult.ConsensusNugget n : result.nuggets()) {
      assertEquals(2, n.runsSupporting());
      assertEquals(1.0, n.nugget().confidence(), 1e-9);
    }
  }

  @Test
  void cancelledTokenStopsConsensusBeforeAnyRun() {
    ScriptedProvider gemini = new ScriptedProvider("gemini", GOOD);
    CancellationToken token = CancellationToken.create();
    token.cancel();

    assertThrows(
        ExtractionCancelledException.class,
        () ->
            orchestrator(gemini)
                .extractConsensus(
                    SOURCE, "Find nuggets", noCache, EnsembleOptions.defaults(), token));
    assertEquals(0, gemini.calls.get());
  }
}
