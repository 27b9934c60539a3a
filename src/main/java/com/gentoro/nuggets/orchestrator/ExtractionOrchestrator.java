package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.boundary.BoundaryResolver;
import com.gentoro.nuggets.cache.ResponseCache;
import com.gentoro.nuggets.exception.ErrorCategory;
import com.gentoro.nuggets.exception.ExtractionCancelledException;
import com.gentoro.nuggets.exception.ExtractionFailedException;
import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.exception.ValidationException;
import com.gentoro.nuggets.model.NuggetProvider;
import com.gentoro.nuggets.model.RawCandidate;
import com.gentoro.nuggets.model.ResolvedNugget;
import com.gentoro.nuggets.prompt.ExtractionPrompt;
import com.gentoro.nuggets.similarity.TextEmbedder;
import com.gentoro.nuggets.text.ContentTruncator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one extraction: calls the provider chain, retries with backoff or switches to a fallback
 * on failure, then validates and anchors every returned candidate.
 *
 * <p>Structural and configuration failures end the call immediately. Rate-limit and server
 * failures move to the next provider when there is one; otherwise, like transient failures, they
 * are retried after an exponential backoff with jitter. The total number of provider calls never
 * exceeds {@link ExtractionOptions#maxAttempts()}; when it is reached the last classified error is
 * surfaced. The provider call and the backoff both stop as soon as the {@link CancellationToken}
 * is cancelled.
 *
 * <p>{@link #extractConsensus} repeats the extraction several times and keeps what the runs agree
 * on, see {@link ConsensusBuilder}.
 */
public class ExtractionOrchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(ExtractionOrchestrator.class);

  // Provider calls run here so the caller thread can watch the cancellation token. Unbounded: a
  // call must never fall back to running on the caller, where nothing could observe the token.
  private static final ExecutorService PROVIDER_EXEC =
      Executors.newCachedThreadPool(
          r -> {
            Thread t = new Thread(r, "nugget-provider-call");
            t.setDaemon(true);
            return t;
          });

  static final long CANCELLATION_POLL_MILLIS = 50L;

  private final FallbackChain chain;
  private final ResponseCache cache;
  private final Sleeper sleeper;
  private final Random random;
  private final TextEmbedder embedder;

  public ExtractionOrchestrator(FallbackChain chain, ResponseCache cache) {
    this(chain, cache, null);
  }

  public ExtractionOrchestrator(FallbackChain chain, ResponseCache cache, TextEmbedder embedder) {
    this(chain, cache, Sleeper.SYSTEM, new Random(), embedder);
  }

  public ExtractionOrchestrator(
      FallbackChain chain, ResponseCache cache, Sleeper sleeper, Random random) {
    this(chain, cache, sleeper, random, null);
  }

  /**
   * @param cache response cache, or {@code null} to disable caching
   * @param embedder embeddings for consensus grouping, or {@code null} to group by word overlap
   */
  public ExtractionOrchestrator(
      FallbackChain chain,
      ResponseCache cache,
      Sleeper sleeper,
      Random random,
      TextEmbedder embedder) {
    this.chain = Objects.requireNonNull(chain, "chain");
    this.cache = cache;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.random = Objects.requireNonNull(random, "random");
    this.embedder = embedder;
  }

  public ExtractionResult extractValidated(
      String content, String prompt, ExtractionOptions options) {
    return extractValidated(content, prompt, options, CancellationToken.create());
  }

  /**
   * @throws ExtractionFailedException when the retry and fallback policy is exhausted or the
   *     failure is not retryable
   * @throws ExtractionCancelledException when {@code token} is cancelled before completion
   */
  public ExtractionResult extractValidated(
      String content, String prompt, ExtractionOptions options, CancellationToken token) {
    if (content == null || content.isBlank()) {
      throw new ValidationException("Content to analyze must not be empty");
    }
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(token, "token");
    long start = System.currentTimeMillis();
    token.throwIfCancelled();

    String payload = ContentTruncator.truncate(content, options.maxContentLength());
    if (payload.length() < content.length()) {
      log.info("Content truncated from {} to {} chars", content.length(), payload.length());
    }
    String instructions =
        ExtractionPrompt.applyPlaceholders(prompt, options.persona(), options.sourceLabel());
    BoundaryResolver resolver = new BoundaryResolver(options.boundary());

    String cacheKey =
        cache != null && options.useCache()
            ? ResponseCache.key(payload, instructions, options.types())
            : null;
    if (cacheKey != null) {
      Optional<ResponseCache.Entry> hit = cache.get(cacheKey);
      if (hit.isPresent()) {
        List<ResolvedNugget> nuggets = resolver.resolveAll(hit.get().candidates(), content);
        ExtractionResult result =
            ExtractionResult.of(
                nuggets, System.currentTimeMillis() - start, hit.get().providerId(), 0, true);
        log.info("Served {} nugget(s) from cache", result.totalCount());
        return result;
      }
    }

    Fetched fetched = fetch(payload, instructions, options, token);
    if (cacheKey != null) {
      cache.put(cacheKey, fetched.candidates(), fetched.providerId());
    }
    List<ResolvedNugget> nuggets = resolver.resolveAll(fetched.candidates(), content);
    ExtractionResult result =
        ExtractionResult.of(
            nuggets,
            System.currentTimeMillis() - start,
            fetched.providerId(),
            fetched.attempts(),
            false);
    log.info(
        "Extracted {} nugget(s) ({} validated, avg score {}) via {} in {} ms, {} attempt(s)",
        result.totalCount(),
        result.validatedCount(),
        String.format("%.2f", result.averageValidationScore()),
        result.providerId(),
        result.elapsedMs(),
        result.attempts());
    return result;
  }

  /**
   * Runs {@link EnsembleOptions#runs()} independent extractions and keeps the nuggets they agree
   * on. A failed run is skipped; the call fails only when every run fails, with the last failure.
   * The response cache is not used.
   *
   * @throws ExtractionFailedException when no run succeeds
   * @throws ExtractionCancelledException when {@code token} is cancelled before completion
   */
  public EnsembleResult extractConsensus(
      String content,
      String prompt,
      ExtractionOptions options,
      EnsembleOptions ensemble,
      CancellationToken token) {
    if (content == null || content.isBlank()) {
      throw new ValidationException("Content to analyze must not be empty");
    }
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(ensemble, "ensemble");
    Objects.requireNonNull(token, "token");
    long start = System.currentTimeMillis();
    token.throwIfCancelled();

    String payload = ContentTruncator.truncate(content, options.maxContentLength());
    String instructions =
        ExtractionPrompt.applyPlaceholders(prompt, options.persona(), options.sourceLabel());

    List<List<RawCandidate>> runs = new ArrayList<>();
    int attempts = 0;
    ExtractionFailedException lastFailure = null;
    for (int run = 1; run <= ensemble.runs(); run++) {
      try {
        Fetched fetched = fetch(payload, instructions, options, token);
        runs.add(fetched.candidates());
        attempts += fetched.attempts();
      } catch (ExtractionFailedException e) {
        if (e.getCategory() == ErrorCategory.AUTH_CONFIG) {
          throw e;
        }
        attempts += e.getAttempts();
        lastFailure = e;
        log.warn("Ensemble run {}/{} failed: {}", run, ensemble.runs(), e.getUserMessage());
      }
    }
    if (runs.isEmpty()) {
      throw lastFailure;
    }

    ConsensusBuilder.Consensus consensus = new ConsensusBuilder(embedder, ensemble).build(runs);
    BoundaryResolver resolver = new BoundaryResolver(options.boundary());
    List<EnsembleResult.ConsensusNugget> nuggets = new ArrayList<>();
    int validated = 0;
    for (ConsensusBuilder.Group group : consensus.groups()) {
      RawCandidate representative = group.representative();
      double support = Math.min(1.0, (double) group.runsSupporting() / runs.size());
      ResolvedNugget nugget =
          resolver.resolve(
              new RawCandidate(representative.type(), representative.fullContent(), support),
              content);
      if (nugget.isValidated()) validated++;
      nuggets.add(
          new EnsembleResult.ConsensusNugget(nugget, group.runsSupporting(), group.cohesion()));
    }

    EnsembleResult result =
        new EnsembleResult(
            nuggets,
            ensemble.runs(),
            runs.size(),
            consensus.duplicatesRemoved(),
            consensus.method(),
            validated,
            attempts,
            System.currentTimeMillis() - start);
    log.info(
        "Consensus of {}/{} run(s): {} nugget(s), {} duplicate(s) merged by {} in {} ms",
        result.successfulRuns(),
        result.totalRuns(),
        nuggets.size(),
        result.duplicatesRemoved(),
        result.similarityMethod(),
        result.elapsedMs());
    return result;
  }

  private record Fetched(List<RawCandidate> candidates, String providerId, int attempts) {}

  /** One provider round trip under the retry and fallback policy. */
  private Fetched fetch(
      String payload, String instructions, ExtractionOptions options, CancellationToken token) {
    RetryPolicy policy = RetryPolicy.from(options, random);
    NuggetProvider provider = chain.primary();
    RetryState state = RetryState.start(provider.providerId());

    while (true) {
      token.throwIfCancelled();
      state = state.nextAttempt();
      try {
        List<RawCandidate> candidates = call(provider, payload, instructions, options, token);
        token.throwIfCancelled();
        return new Fetched(candidates, provider.providerId(), state.attempt());
      } catch (ProviderException e) {
        state = state.failed(e);
        ErrorCategory category = e.getCategory();

        if (!category.isRetryable()) {
          throw fail(state);
        }
        if (!policy.hasAttemptsLeft(state.attempt())) {
          throw fail(state);
        }

        Optional<NuggetProvider> fallback =
            category.isFallbackEligible() ? chain.next(provider.providerId()) : Optional.empty();
        if (fallback.isPresent()) {
          log.warn(
              "{} failed with {} ({}); switching to {}",
              provider.providerId(),
              category,
              e.getMessage(),
              fallback.get().providerId());
          provider = fallback.get();
          state = state.switchedTo(provider.providerId());
          continue;
        }

        long delay = policy.delayMillis(state.attempt(), category);
        log.warn(
            "{} failed with {} on attempt {}/{} ({}); retrying in {} ms",
            provider.providerId(),
            category,
            state.attempt(),
            policy.maxAttempts(),
            e.getMessage(),
            delay);
        backoff(delay, token);
      }
    }
  }

  private List<RawCandidate> call(
      NuggetProvider provider,
      String payload,
      String instructions,
      ExtractionOptions options,
      CancellationToken token) {
    Future<List<RawCandidate>> future =
        PROVIDER_EXEC.submit(
            () ->
                provider.extract(payload, instructions, options.temperature(), options.types()));
    try {
      while (true) {
        try {
          return future.get(CANCELLATION_POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
          if (token.isCancelled()) {
            future.cancel(true);
            log.info("Cancelled in-flight call to {}: {}", provider.providerId(), token.reason());
            throw new ExtractionCancelledException(token.reason());
          }
        }
      }
    } catch (ExecutionException ee) {
      Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
      if (cause instanceof ExtractionCancelledException ce) {
        throw ce;
      }
      throw ErrorClassifier.toProviderException(provider.providerId(), 0, cause);
    } catch (InterruptedException ie) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExtractionCancelledException("Interrupted while waiting for provider", ie);
    }
  }

  private void backoff(long delayMillis, CancellationToken token) {
    try {
      sleeper.sleep(delayMillis, token);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ExtractionCancelledException("Interrupted during retry backoff", ie);
    }
    token.throwIfCancelled();
  }

  private ExtractionFailedException fail(RetryState state) {
    ProviderException last = state.lastError();
    String userMessage = ErrorClassifier.userMessage(last);
    log.error(
        "Extraction failed after {} attempt(s) on {}: {} ({})",
        state.attempt(),
        state.currentProviderId(),
        last.getMessage(),
        last.getCategory());
    return new ExtractionFailedException(last, userMessage, state.attempt());
  }
}
