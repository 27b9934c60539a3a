package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.exception.ErrorCategory;
import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.exception.ProviderException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps provider failures to an {@link ErrorCategory}.
 *
 * <p>The upstream status code wins when present. Otherwise the message is matched against the
 * keyword table below, and finally the exception type is inspected. Provider messages are not a
 * stable contract, so the keyword table needs revisiting whenever a backend changes its wording.
 */
public final class ErrorClassifier {

  private static final List<Pattern> AUTH =
      patterns(
          "invalid api key",
          "api key not found",
          "api key",
          "unauthorized",
          "authentication",
          "authorization",
          "forbidden",
          "\\b401\\b",
          "\\b403\\b");

  private static final List<Pattern> RATE_LIMIT =
      patterns(
          "rate limit",
          "rate_limit_exceeded",
          "too many requests",
          "quota exceeded",
          "requests per minute",
          "daily quota",
          "resource_exhausted",
          "\\b429\\b");

  private static final List<Pattern> INVALID_REQUEST =
      patterns(
          "invalid request",
          "bad request",
          "malformed",
          "model not found",
          "model_not_found",
          "does not exist",
          "\\b400\\b",
          "\\b404\\b",
          "\\b422\\b");

  private static final List<Pattern> SERVER =
      patterns(
          "server error",
          "internal error",
          "service unavailable",
          "bad gateway",
          "overloaded",
          "\\b50[0-4]\\b");

  private static final List<Pattern> NETWORK =
      patterns(
          "network error",
          "network request failed",
          "timeout",
          "timed out",
          "connection failed",
          "connection reset",
          "connection refused",
          "temporarily unavailable",
          "fetch failed");

  private ErrorClassifier() {}

  /** Category of an HTTP-like status code, or {@code null} when the code says nothing. */
  public static ErrorCategory fromStatus(int statusCode) {
    if (statusCode == 401 || statusCode == 403) return ErrorCategory.AUTH_CONFIG;
    if (statusCode == 400 || statusCode == 404 || statusCode == 422) {
      return ErrorCategory.AUTH_CONFIG;
    }
    if (statusCode == 408) return ErrorCategory.TRANSIENT;
    if (statusCode == 429) return ErrorCategory.RATE_LIMIT;
    if (statusCode >= 500 && statusCode <= 599) return ErrorCategory.SERVER_ERROR;
    return null;
  }

  /** Category derived from the message text, or {@code null} when no keyword matches. */
  public static ErrorCategory fromMessage(String message) {
    if (message == null || message.isBlank()) return null;
    String m = message.toLowerCase(Locale.ROOT);
    if (matchesAny(RATE_LIMIT, m)) return ErrorCategory.RATE_LIMIT;
    if (matchesAny(AUTH, m)) return ErrorCategory.AUTH_CONFIG;
    if (matchesAny(INVALID_REQUEST, m)) return ErrorCategory.AUTH_CONFIG;
    if (matchesAny(SERVER, m)) return ErrorCategory.SERVER_ERROR;
    if (matchesAny(NETWORK, m)) return ErrorCategory.TRANSIENT;
    return null;
  }

  public static ErrorCategory classify(int statusCode, Throwable error) {
    ErrorCategory byStatus = fromStatus(statusCode);
    if (byStatus != null) return byStatus;

    ErrorCategory byMessage = fromMessage(error == null ? null : error.getMessage());
    if (byMessage != null) return byMessage;

    if (ExceptionUtil.findCause(error, IOException.class) != null) {
      return ErrorCategory.TRANSIENT;
    }
    return ErrorCategory.UNKNOWN;
  }

  /** Wraps an arbitrary provider failure; {@link ProviderException}s pass through unchanged. */
  public static ProviderException toProviderException(
      String providerId, int statusCode, Throwable error) {
    if (error instanceof ProviderException pe) {
      return pe;
    }
    ErrorCategory category = classify(statusCode, error);
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      message = error.getClass().getSimpleName();
    }
    return new ProviderException(providerId, statusCode, category, message, error);
  }

  /** Text meant for the person who triggered the extraction. */
  public static String userMessage(ProviderException error) {
    String providerId = error.getProviderId();
    return switch (error.getCategory()) {
      case AUTH_CONFIG -> isCredentialProblem(error)
          ? "Invalid or missing API key for %s. Please check the API key in your configuration."
              .formatted(providerId)
          : ("%s rejected the request: %s. The selected model may not be available or the"
                  + " request settings are invalid; check the provider configuration.")
              .formatted(providerId, error.getMessage());
      case RATE_LIMIT -> "Rate limit reached for %s. Please wait a moment and try again."
          .formatted(providerId);
      case TRANSIENT -> "Could not reach %s. Check your network connection and try again."
          .formatted(providerId);
      case SERVER_ERROR -> "%s service is temporarily unavailable. Please try again later."
          .formatted(providerId);
      case STRUCTURAL -> "%s returned a response in an unexpected format: %s"
          .formatted(providerId, error.getMessage());
      case UNKNOWN -> "%s encountered an error: %s".formatted(providerId, error.getMessage());
    };
  }

  private static boolean isCredentialProblem(ProviderException error) {
    int status = error.getStatusCode();
    if (status == 401 || status == 403) return true;
    String message = error.getMessage();
    return status <= 0
        && message != null
        && matchesAny(AUTH, message.toLowerCase(Locale.ROOT));
  }

  private static boolean matchesAny(List<Pattern> patterns, String text) {
    for (Pattern p : patterns) {
      if (p.matcher(text).find()) return true;
    }
    return false;
  }

  private static List<Pattern> patterns(String... regexes) {
    return Arrays.stream(regexes).map(Pattern::compile).toList();
  }
}
