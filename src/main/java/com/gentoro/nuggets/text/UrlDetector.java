package com.gentoro.nuggets.text;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Detects and parses strings that are entirely a URL. */
public final class UrlDetector {
  private static final String STRICT_BODY =
      "https?://(?:www\\.)?(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)*"
          + "[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?(?:\\.[a-zA-Z]{2,})?"
          + "(?::\\d{1,5})?(?:[/?#]\\S*)?";

  private static final String RELAXED_BODY =
      "(?:https?://)?(?:www\\.)?[a-zA-Z0-9][a-zA-Z0-9-]*(?:\\.[a-zA-Z0-9][a-zA-Z0-9-]*)*"
          + "\\.[a-zA-Z]{2,}(?:[/?#]\\S*)?";

  static final Pattern STRICT =
      Pattern.compile("^" + STRICT_BODY + "$", Pattern.CASE_INSENSITIVE);
  static final Pattern RELAXED =
      Pattern.compile("^" + RELAXED_BODY + "$", Pattern.CASE_INSENSITIVE);
  private static final Pattern EXTRACT_STRICT =
      Pattern.compile(STRICT_BODY, Pattern.CASE_INSENSITIVE);
  private static final Pattern EXTRACT_RELAXED =
      Pattern.compile(RELAXED_BODY, Pattern.CASE_INSENSITIVE);

  private UrlDetector() {}

  /** True when the whole (trimmed) text is a URL under the strict pattern. */
  public static boolean isUrl(String text) {
    return isUrl(text, true);
  }

  public static boolean isUrl(String text, boolean strict) {
    if (text == null) return false;
    String trimmed = text.trim();
    if (trimmed.isEmpty()) return false;
    return (strict ? STRICT : RELAXED).matcher(trimmed).matches();
  }

  public static Optional<String> extractUrl(String text) {
    return extractUrl(text, true);
  }

  /** First URL embedded in {@code text}. */
  public static Optional<String> extractUrl(String text, boolean strict) {
    if (text == null || text.isEmpty()) return Optional.empty();
    Matcher m = (strict ? EXTRACT_STRICT : EXTRACT_RELAXED).matcher(text);
    return m.find() ? Optional.of(m.group()) : Optional.empty();
  }

  /** Splits a URL into protocol, host and path; a missing scheme is assumed to be https. */
  public static ParsedUrl parse(String url) {
    if (url == null || url.isBlank()) {
      return new ParsedUrl("", url == null ? "" : url, "", false, url);
    }
    String normalized = url.regionMatches(true, 0, "http", 0, 4) ? url : "https://" + url;
    try {
      URI uri = new URI(normalized);
      if (uri.getScheme() == null || uri.getHost() == null) {
        return new ParsedUrl("", url, "", false, url);
      }
      StringBuilder path = new StringBuilder();
      if (uri.getRawPath() != null) path.append(uri.getRawPath());
      if (uri.getRawQuery() != null) path.append('?').append(uri.getRawQuery());
      if (uri.getRawFragment() != null) path.append('#').append(uri.getRawFragment());
      String p = path.toString();
      return new ParsedUrl(
          uri.getScheme().toLowerCase(), uri.getHost(), "/".equals(p) ? "" : p, true, url);
    } catch (URISyntaxException e) {
      return new ParsedUrl("", url, "", false, url);
    }
  }
}
