package com.gentoro.nuggets;

import com.gentoro.nuggets.cache.ResponseCache;
import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.exception.ExtractionCancelledException;
import com.gentoro.nuggets.exception.ExtractionFailedException;
import com.gentoro.nuggets.exception.NuggetsErrorCode;
import com.gentoro.nuggets.exception.NuggetsException;
import com.gentoro.nuggets.exception.ValidationException;
import com.gentoro.nuggets.logging.LoggingService;
import com.gentoro.nuggets.model.GeminiTextEmbedder;
import com.gentoro.nuggets.orchestrator.CancellationToken;
import com.gentoro.nuggets.orchestrator.EnsembleOptions;
import com.gentoro.nuggets.orchestrator.EnsembleResult;
import com.gentoro.nuggets.orchestrator.ExtractionOptions;
import com.gentoro.nuggets.orchestrator.ExtractionOrchestrator;
import com.gentoro.nuggets.orchestrator.ExtractionResult;
import com.gentoro.nuggets.orchestrator.FallbackChain;
import com.gentoro.nuggets.similarity.TextEmbedder;
import com.gentoro.nuggets.utility.JacksonUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Command line entry point: runs one extraction over a text file and prints the result as JSON.
 *
 * <pre>
 *   --input &lt;file&gt;          text to analyze (required)
 *   --prompt &lt;file|text&gt;    extraction instructions, defaults to extraction.default-prompt
 *   --types tool,media,...  restrict the nugget types
 *   --timeout-seconds &lt;n&gt;   abort the extraction after n seconds
 *   --runs &lt;n&gt;              consensus of n runs, see extraction.ensemble.*
 *   --config-file &lt;loc&gt;     classpath:application.yaml by default
 * </pre>
 */
public class GoldenNuggets {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GoldenNuggets.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILED = 2;

  private final StartupParameters parameters;
  private final PrintStream out;
  private final PrintStream err;

  GoldenNuggets(StartupParameters parameters, PrintStream out, PrintStream err) {
    this.parameters = parameters;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int code;
    try {
      code = new GoldenNuggets(new StartupParameters(args), System.out, System.err).run();
    } catch (ValidationException e) {
      System.err.println(e.getMessage());
      code = EXIT_USAGE;
    } catch (Exception e) {
      log.error("Golden nuggets failed to start", e);
      code = EXIT_FAILED;
    }
    System.exit(code);
  }

  int run() {
    if (parameters.isParameterPresent("help")) {
      printUsage();
      return EXIT_OK;
    }
    Configuration config = new ConfigurationProvider(parameters.configFile()).config();
    LoggingService.applyConfiguration(config);

    try {
      String content = readInput(parameters.getParameter("input"));
      String prompt = resolvePrompt(config);
      ExtractionOptions options = ExtractionOptions.fromConfiguration(config);
      if (parameters.isParameterPresent("types")) {
        options =
            options.withTypes(
                ExtractionOptions.parseTypes(
                    Arrays.asList(parameters.getParameter("types").split(","))));
      }

      EnsembleOptions ensemble = ensembleFrom(config);
      CancellationToken token =
          parameters
              .getOptionalParameter("timeout-seconds")
              .map(s -> CancellationToken.withTimeout(Duration.ofSeconds(Long.parseLong(s))))
              .orElseGet(CancellationToken::create);

      FallbackChain chain = FallbackChain.fromConfiguration(config);
      if (ensemble != null) {
        TextEmbedder embedder =
            ensemble.useEmbeddings()
                ? GeminiTextEmbedder.fromConfiguration(config).orElse(null)
                : null;
        EnsembleResult result =
            new ExtractionOrchestrator(chain, null, embedder)
                .extractConsensus(content, prompt, options, ensemble, token);
        out.println(JacksonUtility.toPrettyJson(result));
        return EXIT_OK;
      }

      ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(chain, cacheFrom(config));
      ExtractionResult result = orchestrator.extractValidated(content, prompt, options, token);
      out.println(JacksonUtility.toPrettyJson(result));
      return EXIT_OK;
    } catch (ExtractionFailedException e) {
      err.println(e.getUserMessage());
      log.debug("Extraction failure details: {}", ExceptionUtil.formatCompactStackTrace(e));
      return EXIT_FAILED;
    } catch (ExtractionCancelledException e) {
      err.println(e.getMessage());
      return EXIT_FAILED;
    } catch (NuggetsException e) {
      err.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      return EXIT_FAILED;
    } catch (IllegalArgumentException e) {
      err.println("Invalid option value: " + e.getMessage());
      return EXIT_USAGE;
    }
  }

  /**
   * Consensus settings when {@code --runs} is given or {@code extraction.ensemble.enabled} is set;
   * {@code null} for a single extraction.
   */
  EnsembleOptions ensembleFrom(Configuration config) {
    EnsembleOptions ensemble = EnsembleOptions.fromConfiguration(config);
    Optional<String> runs = parameters.getOptionalParameter("runs");
    if (runs.isPresent()) {
      return ensemble.withRuns(Integer.parseInt(runs.get().trim()));
    }
    return config.getBoolean("extraction.ensemble.enabled", false) ? ensemble : null;
  }

  static ResponseCache cacheFrom(Configuration config) {
    if (!config.getBoolean("cache.enabled", true)) {
      return null;
    }
    return new ResponseCache(
        config.getInt("cache.capacity", ResponseCache.DEFAULT_CAPACITY),
        Duration.ofSeconds(
            config.getLong("cache.ttl-seconds", ResponseCache.DEFAULT_TTL.toSeconds())),
        Clock.systemUTC());
  }

  private String resolvePrompt(Configuration config) {
    String value = parameters.getOptionalParameter("prompt").orElse(null);
    if (value == null || value.isBlank()) {
      String fallback = config.getString("extraction.default-prompt", null);
      if (fallback == null || fallback.isBlank()) {
        throw new ValidationException("No --prompt given and extraction.default-prompt is empty");
      }
      return fallback;
    }
    Path path = asPath(value);
    if (path != null && Files.isRegularFile(path)) {
      return readFile(path);
    }
    return value;
  }

  /** The value as a path, or null when it cannot be one (inline prompt text). */
  private static Path asPath(String value) {
    if (value.length() > 1024 || value.indexOf('\n') >= 0) {
      return null;
    }
    try {
      return Path.of(value);
    } catch (InvalidPathException e) {
      return null;
    }
  }

  private static String readInput(String location) {
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ValidationException("Input file not found: " + path.toAbsolutePath());
    }
    return readFile(path);
  }

  private static String readFile(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new NuggetsException(
          NuggetsErrorCode.IO_ERROR,
          "Failed to read " + path.toAbsolutePath(),
          e);
    }
  }

  private void printUsage() {
    out.println(
        """
        Usage: golden-nuggets --input <file> [--prompt <file|text>] [--types tool,media,...]
                              [--timeout-seconds <n>] [--runs <n>] [--config-file <location>]

        Extracts golden nuggets from the input text and prints them as JSON.""");
  }
}
