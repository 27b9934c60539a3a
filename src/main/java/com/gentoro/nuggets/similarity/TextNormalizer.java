package com.gentoro.nuggets.similarity;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds typographic variants so that text echoed back by a model compares equal to the source.
 */
public final class TextNormalizer {
  private static final Pattern APOSTROPHES =
      Pattern.compile("[\\u2018\\u2019\\u201A\\u201B\\u2032`]");
  private static final Pattern QUOTES =
      Pattern.compile("[\\u201C\\u201D\\u201E\\u201F\\u2033\\u00AB\\u00BB]");
  private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212]");
  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

  private TextNormalizer() {}

  /**
   * Lower-cases, maps apostrophe, quote and dash variants to their ASCII form, expands the
   * ellipsis character, collapses whitespace runs and trims.
   */
  public static String normalize(String text) {
    if (text == null || text.isEmpty()) return "";
    String s = text.toLowerCase(Locale.ROOT);
    s = APOSTROPHES.matcher(s).replaceAll("'");
    s = QUOTES.matcher(s).replaceAll("\"");
    s = DASHES.matcher(s).replaceAll("-");
    s = s.replace("\u2026", "...");
    s = WHITESPACE.matcher(s).replaceAll(" ");
    return s.trim();
  }
}
