package com.gentoro.nuggets.similarity;

/**
 * Levenshtein edit distance and the normalized similarity derived from it.
 *
 * <p>Inputs are short passages and single words, so the full dynamic-programming matrix is used.
 * {@code null} is treated as the empty string.
 */
public final class EditDistance {
  public static final double DEFAULT_THRESHOLD = 0.8;

  private EditDistance() {}

  /** Minimum number of single-character insertions, deletions or substitutions. */
  public static int distance(String a, String b) {
    String s = a == null ? "" : a;
    String t = b == null ? "" : b;
    int n = s.length();
    int m = t.length();
    if (n == 0) return m;
    if (m == 0) return n;

    int[][] d = new int[n + 1][m + 1];
    for (int i = 0; i <= n; i++) d[i][0] = i;
    for (int j = 0; j <= m; j++) d[0][j] = j;

    for (int i = 1; i <= n; i++) {
      char c = s.charAt(i - 1);
      for (int j = 1; j <= m; j++) {
        int cost = c == t.charAt(j - 1) ? 0 : 1;
        d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
      }
    }
    return d[n][m];
  }

  /** {@code 1 - distance / max(|a|, |b|, 1)}; two empty strings are identical. */
  public static double similarity(String a, String b) {
    int n = a == null ? 0 : a.length();
    int m = b == null ? 0 : b.length();
    int longest = Math.max(Math.max(n, m), 1);
    return 1.0 - (double) distance(a, b) / longest;
  }

  public static boolean isSimilar(String a, String b) {
    return isSimilar(a, b, DEFAULT_THRESHOLD);
  }

  public static boolean isSimilar(String a, String b, double threshold) {
    return similarity(a, b) >= threshold;
  }
}
