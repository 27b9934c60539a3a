package com.gentoro.nuggets.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure reported by an LLM provider call, tagged with an {@link ErrorCategory} and the
 * HTTP-like status code of the upstream response ({@code 0} when there was none).
 */
public class ProviderException extends NuggetsException {
  private final String providerId;
  private final int statusCode;
  private final ErrorCategory category;

  public ProviderException(
      String providerId, int statusCode, ErrorCategory category, String message) {
    this(providerId, statusCode, category, message, null);
  }

  public ProviderException(
      String providerId,
      int statusCode,
      ErrorCategory category,
      String message,
      Throwable cause) {
    super(
        NuggetsErrorCode.PROVIDER_ERROR,
        message,
        context(providerId, statusCode, category),
        cause);
    this.providerId = Objects.requireNonNull(providerId, "providerId");
    this.statusCode = statusCode;
    this.category = Objects.requireNonNull(category, "category");
  }

  /** Shortcut for a payload that does not match the expected response shape. */
  public static ProviderException structural(String providerId, String message) {
    return new ProviderException(providerId, 0, ErrorCategory.STRUCTURAL, message);
  }

  public static ProviderException structural(String providerId, String message, Throwable cause) {
    return new ProviderException(providerId, 0, ErrorCategory.STRUCTURAL, message, cause);
  }

  public String getProviderId() {
    return providerId;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  private static Map<String, Object> context(
      String providerId, int statusCode, ErrorCategory category) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("provider", providerId);
    if (statusCode > 0) m.put("status", statusCode);
    m.put("category", category);
    return m;
  }
}
