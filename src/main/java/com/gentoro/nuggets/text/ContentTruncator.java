package com.gentoro.nuggets.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Shortens page content before it is sent to a provider. */
public final class ContentTruncator {
  public static final int DEFAULT_MAX_LENGTH = 30_000;

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)");

  private ContentTruncator() {}

  public static String truncate(String content) {
    return truncate(content, DEFAULT_MAX_LENGTH);
  }

  /**
   * Returns {@code content} unchanged when it fits, otherwise the longest prefix ending at a
   * sentence terminator. Falls back to a hard cut when the first sentence alone is too long.
   */
  public static String truncate(String content, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
    }
    if (content == null || content.length() <= maxLength) {
      return content;
    }
    Matcher m = SENTENCE_END.matcher(content);
    m.region(0, Math.min(content.length(), maxLength + 1));
    m.useTransparentBounds(true);
    int cut = -1;
    while (m.find()) {
      if (m.end() > maxLength) break;
      cut = m.end();
    }
    return cut > 0 ? content.substring(0, cut) : content.substring(0, maxLength);
  }
}
