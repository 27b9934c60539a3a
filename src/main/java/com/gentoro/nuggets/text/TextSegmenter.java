package com.gentoro.nuggets.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies content as URL or prose and splits it into a head and a tail segment. Segments are
 * always literal substrings of the input so they can be located again by plain text search.
 */
public final class TextSegmenter {
  private static final Pattern WORD = Pattern.compile("\\S+");
  private static final Pattern URL_HEAD =
      Pattern.compile(
          "^(?:https?://)?(?:www\\.)?([^/?#\\s:]+)(?::\\d+)?", Pattern.CASE_INSENSITIVE);

  public enum ContentKind {
    URL,
    PROSE
  }

  /** A head and a tail segment. Either may be empty. */
  public record Segments(String head, String tail) {
    public boolean distinct() {
      return !head.isEmpty() && !tail.isEmpty() && !head.equals(tail);
    }
  }

  private TextSegmenter() {}

  public static ContentKind classify(String text) {
    return UrlDetector.isUrl(text, true) ? ContentKind.URL : ContentKind.PROSE;
  }

  /**
   * Splits a URL at the host/path boundary: {@code head} is scheme and host as written, {@code
   * tail} is path, query and fragment. Without a path the tail is the host alone.
   */
  public static Segments splitUrl(String url) {
    if (url == null) return new Segments("", "");
    String trimmed = url.trim();
    Matcher m = URL_HEAD.matcher(trimmed);
    if (!m.find()) {
      return new Segments(trimmed, "");
    }
    String head = m.group();
    String rest = trimmed.substring(m.end());
    if (rest.isEmpty() || "/".equals(rest)) {
      return new Segments(head, m.group(1));
    }
    return new Segments(head, rest);
  }

  /**
   * The span of the first {@code maxStartWords} words and the span of the last {@code
   * maxEndWords} words. Whitespace between the selected words is kept as it appears in the input.
   */
  public static Segments splitWords(String text, int maxStartWords, int maxEndWords) {
    if (text == null) return new Segments("", "");
    List<int[]> spans = new ArrayList<>();
    Matcher m = WORD.matcher(text);
    while (m.find()) {
      spans.add(new int[] {m.start(), m.end()});
    }
    if (spans.isEmpty()) return new Segments("", "");

    int headEnd = spans.get(Math.min(maxStartWords, spans.size()) - 1)[1];
    int tailStart = spans.get(Math.max(0, spans.size() - maxEndWords))[0];
    int start = spans.get(0)[0];
    int end = spans.get(spans.size() - 1)[1];
    return new Segments(text.substring(start, headEnd), text.substring(tailStart, end));
  }

  /** Whitespace-separated words, empty tokens removed. */
  public static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    if (text == null) return out;
    Matcher m = WORD.matcher(text);
    while (m.find()) {
      out.add(m.group());
    }
    return out;
  }
}
