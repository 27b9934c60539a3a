package com.gentoro.nuggets.similarity;

import com.gentoro.nuggets.text.TextSegmenter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Position-by-position similarity of two equally long word sequences.
 *
 * <p>Each position scores {@code exactMatchScore} for identical words, {@code substringMatchScore}
 * when one word contains the other, {@code similarity * levenshteinMultiplier} when the edit
 * similarity reaches {@code levenshteinThreshold}, and 0 otherwise. The result is the mean.
 */
public final class WordSimilarity {
  public static final double DEFAULT_THRESHOLD = 0.7;

  private WordSimilarity() {}

  public static double score(List<String> a, List<String> b) {
    return score(a, b, SimilarityOptions.defaults());
  }

  public static double score(List<String> a, List<String> b, SimilarityOptions options) {
    if (a.size() != b.size()) return 0.0;
    if (a.isEmpty()) return 1.0;

    double total = 0.0;
    for (int i = 0; i < a.size(); i++) {
      total += scoreWord(a.get(i), b.get(i), options);
    }
    return total / a.size();
  }

  /** Tokenizes both texts on whitespace and scores the word sequences. */
  public static double scoreText(String text1, String text2, SimilarityOptions options) {
    return score(TextSegmenter.words(text1), TextSegmenter.words(text2), options);
  }

  public static double scoreText(String text1, String text2) {
    return scoreText(text1, text2, SimilarityOptions.defaults());
  }

  public static boolean areSimilar(String text1, String text2) {
    return areSimilar(text1, text2, DEFAULT_THRESHOLD, SimilarityOptions.defaults());
  }

  public static boolean areSimilar(
      String text1, String text2, double threshold, SimilarityOptions options) {
    return scoreText(text1, text2, options) >= threshold;
  }

  /**
   * Share of the lowercased words of {@code text1} that also occur in {@code text2}, relative to
   * the number of distinct words of both. Capped at 1.
   */
  public static double overlap(String text1, String text2) {
    List<String> words1 = TextSegmenter.words(lower(text1));
    List<String> words2 = TextSegmenter.words(lower(text2));
    Set<String> union = new HashSet<>(words1);
    union.addAll(words2);
    if (union.isEmpty()) return 0.0;
    Set<String> second = new HashSet<>(words2);
    long shared = words1.stream().filter(second::contains).count();
    return Math.min(1.0, (double) shared / union.size());
  }

  private static String lower(String text) {
    return text == null ? "" : text.toLowerCase(Locale.ROOT);
  }

  private static double scoreWord(String w1, String w2, SimilarityOptions options) {
    if (w1.equals(w2)) {
      return options.exactMatchScore();
    }
    if (w1.contains(w2) || w2.contains(w1)) {
      return options.substringMatchScore();
    }
    double similarity = EditDistance.similarity(w1, w2);
    if (similarity >= options.levenshteinThreshold()) {
      return similarity * options.levenshteinMultiplier();
    }
    return 0.0;
  }
}
