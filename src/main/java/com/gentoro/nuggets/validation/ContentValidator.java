package com.gentoro.nuggets.validation;

import com.gentoro.nuggets.similarity.SimilarityOptions;
import com.gentoro.nuggets.similarity.TextNormalizer;
import com.gentoro.nuggets.similarity.WordSimilarity;
import com.gentoro.nuggets.text.TextSegmenter;
import java.util.List;
import java.util.Locale;

/**
 * Scores whether a passage claimed by a model actually occurs in the source text.
 *
 * <p>Tiers are tried in order and the first hit wins: exact containment, case-insensitive
 * containment, chunked fuzzy search over normalized text, and exact containment of the first
 * {@value #PREFIX_LENGTH} characters for long passages. Blank input scores 0. Never throws for
 * non-null input.
 */
public final class ContentValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(ContentValidator.class);

  public static final double DEFAULT_TOLERANCE = 0.8;
  public static final int PREFIX_LENGTH = 100;
  static final int MIN_WINDOW = 200;

  // No credit for a word that merely contains another ("cat" in "concatenate").
  private static final SimilarityOptions WORD_WINDOW_OPTIONS = SimilarityOptions.substringOnly(0.0);

  private final double tolerance;

  public ContentValidator() {
    this(DEFAULT_TOLERANCE);
  }

  /**
   * @param tolerance minimum similarity for the fuzzy tier, in {@code [0, 1]}
   */
  public ContentValidator(double tolerance) {
    if (tolerance < 0.0 || tolerance > 1.0) {
      throw new IllegalArgumentException("tolerance must be within [0, 1]: " + tolerance);
    }
    this.tolerance = tolerance;
  }

  public double tolerance() {
    return tolerance;
  }

  public ValidationResult validate(String passage, String source) {
    if (passage == null || source == null || passage.isBlank() || source.isBlank()) {
      return ValidationResult.NOT_FOUND;
    }
    String p = passage.trim();

    if (source.contains(p)) {
      return ValidationResult.of(MatchMethod.EXACT);
    }
    if (source.toLowerCase(Locale.ROOT).contains(p.toLowerCase(Locale.ROOT))) {
      return ValidationResult.of(MatchMethod.CASE_INSENSITIVE);
    }
    if (fuzzyMatch(p, source)) {
      return ValidationResult.of(MatchMethod.FUZZY);
    }
    if (p.length() > PREFIX_LENGTH && source.contains(p.substring(0, PREFIX_LENGTH))) {
      return ValidationResult.of(MatchMethod.PARTIAL_PREFIX);
    }
    if (log.isTraceEnabled()) {
      log.trace("Passage not found in source: {}", abbreviate(p));
    }
    return ValidationResult.NOT_FOUND;
  }

  public static boolean isValidated(ValidationResult result, double minConfidenceThreshold) {
    return result.isValidated(minConfidenceThreshold);
  }

  private boolean fuzzyMatch(String passage, String source) {
    String np = TextNormalizer.normalize(passage);
    String ns = TextNormalizer.normalize(source);
    if (np.isEmpty() || ns.isEmpty()) return false;
    if (ns.contains(np)) return true;

    int maxEdits = (int) Math.floor(np.length() * (1.0 - tolerance));
    List<String> passageWords = TextSegmenter.words(np);
    int window = Math.max(2 * np.length(), MIN_WINDOW);
    int stride = Math.max(1, window / 2);

    for (int start = 0; start < ns.length(); start += stride) {
      String chunk = ns.substring(start, Math.min(ns.length(), start + window));
      if (FuzzySubstringSearch.matches(np, chunk, maxEdits)) {
        log.debug("Fuzzy hit at window offset {} (max {} edits)", start, maxEdits);
        return true;
      }
      if (wordWindowMatch(passageWords, TextSegmenter.words(chunk))) {
        log.debug("Word-window hit at window offset {}", start);
        return true;
      }
      if (start + window >= ns.length()) break;
    }
    return false;
  }

  private boolean wordWindowMatch(List<String> passageWords, List<String> chunkWords) {
    int k = passageWords.size();
    if (k == 0 || chunkWords.size() < k) return false;
    for (int i = 0; i + k <= chunkWords.size(); i++) {
      double score =
          WordSimilarity.score(passageWords, chunkWords.subList(i, i + k), WORD_WINDOW_OPTIONS);
      if (score >= tolerance) return true;
    }
    return false;
  }

  private static String abbreviate(String s) {
    return s.length() <= 60 ? s : s.substring(0, 57) + "...";
  }
}
