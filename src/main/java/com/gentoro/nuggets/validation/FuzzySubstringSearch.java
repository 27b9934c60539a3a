package com.gentoro.nuggets.validation;

/**
 * Approximate substring search: the smallest edit distance between a pattern and any substring of
 * a text (semi-global Levenshtein, the match may start and end anywhere in the text).
 */
public final class FuzzySubstringSearch {
  private FuzzySubstringSearch() {}

  public static int bestDistance(String pattern, String text) {
    int m = pattern.length();
    int n = text.length();
    if (m == 0) return 0;
    if (n == 0) return m;

    // prev[j]: cost of matching the first i pattern chars ending at text position j
    int[] prev = new int[n + 1];
    int[] curr = new int[n + 1];
    for (int i = 1; i <= m; i++) {
      curr[0] = i;
      char c = pattern.charAt(i - 1);
      for (int j = 1; j <= n; j++) {
        int cost = c == text.charAt(j - 1) ? 0 : 1;
        curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    int best = m;
    for (int j = 0; j <= n; j++) {
      best = Math.min(best, prev[j]);
    }
    return best;
  }

  /** True when some substring of {@code text} is within {@code maxEdits} edits of the pattern. */
  public static boolean matches(String pattern, String text, int maxEdits) {
    if (maxEdits < 0) return false;
    if (pattern.length() - maxEdits > text.length()) return false;
    return bestDistance(pattern, text) <= maxEdits;
  }
}
