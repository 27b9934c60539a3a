package com.gentoro.nuggets.boundary;

import com.gentoro.nuggets.model.RawCandidate;
import com.gentoro.nuggets.model.ResolvedNugget;
import com.gentoro.nuggets.text.TextSegmenter;
import com.gentoro.nuggets.text.TextSegmenter.ContentKind;
import com.gentoro.nuggets.text.TextSegmenter.Segments;
import com.gentoro.nuggets.validation.ContentValidator;
import com.gentoro.nuggets.validation.MatchMethod;
import com.gentoro.nuggets.validation.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns candidate passages into {@link ResolvedNugget}s: validates them against the source text
 * and derives a pair of distinct anchors from the passage itself.
 *
 * <p>Anchors come from the host/path split for URLs and from the leading and trailing words for
 * prose. When neither yields two different non-empty strings, a character prefix and a strictly
 * shorter character suffix are used instead. Instances are immutable and thread-safe.
 */
public class BoundaryResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(BoundaryResolver.class);

  static final int MAX_SUFFIX_CHARS = 24;
  static final int MAX_PREFIX_CHARS = 25;

  private final BoundaryMatchOptions options;
  private final ContentValidator validator;

  public BoundaryResolver() {
    this(BoundaryMatchOptions.defaults());
  }

  public BoundaryResolver(BoundaryMatchOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.validator = new ContentValidator(options.tolerance());
  }

  public BoundaryMatchOptions options() {
    return options;
  }

  /**
   * Anchors derived from {@code fullContent}. Blank content yields {@link AnchorPair#EMPTY}; a
   * single visible character (code point) yields that character and an empty end anchor.
   */
  public AnchorPair anchors(String fullContent) {
    if (fullContent == null || fullContent.isBlank()) {
      return AnchorPair.EMPTY;
    }
    String trimmed = fullContent.trim();

    if (TextSegmenter.classify(trimmed) == ContentKind.URL) {
      Segments url = TextSegmenter.splitUrl(trimmed);
      if (url.distinct()) {
        return new AnchorPair(url.head(), url.tail());
      }
      log.debug("URL split produced identical anchors for '{}', trying word split", trimmed);
    }

    Segments words =
        TextSegmenter.splitWords(trimmed, options.maxStartWords(), options.maxEndWords());
    if (words.distinct()) {
      return new AnchorPair(words.head(), words.tail());
    }
    return characterAnchors(trimmed);
  }

  // Counted in code points so a supplementary character is never split.
  static AnchorPair characterAnchors(String trimmed) {
    int n = trimmed.codePointCount(0, trimmed.length());
    if (n == 1) {
      return new AnchorPair(trimmed, "");
    }
    int suffix = Math.max(1, Math.min(n / 2, MAX_SUFFIX_CHARS));
    int prefix = Math.min(n, Math.max(suffix + 1, Math.min(MAX_PREFIX_CHARS, (n + 1) / 2)));
    return new AnchorPair(
        trimmed.substring(0, trimmed.offsetByCodePoints(0, prefix)),
        trimmed.substring(trimmed.offsetByCodePoints(0, n - suffix)));
  }

  /** Validates the candidate against {@code source} and builds its nugget. Deterministic. */
  public ResolvedNugget resolve(RawCandidate candidate, String source) {
    ValidationResult validation = validator.validate(candidate.fullContent(), source);
    MatchMethod method =
        validation.isValidated(options.minConfidenceThreshold())
            ? validation.method()
            : MatchMethod.UNVERIFIED;

    AnchorPair anchors = anchors(candidate.fullContent());
    if (!anchors.startAnchor().isEmpty() && anchors.endAnchor().isEmpty()) {
      anchors = widenSingleCharacter(anchors.startAnchor(), source);
    }

    if (method == MatchMethod.UNVERIFIED && log.isDebugEnabled()) {
      log.debug(
          "Unverified {} nugget (score {}): {}",
          candidate.type().wireName(),
          validation.score(),
          anchors);
    }
    return new ResolvedNugget(
        candidate.type(),
        candidate.fullContent(),
        anchors.startAnchor(),
        anchors.endAnchor(),
        candidate.confidence(),
        validation.score(),
        method);
  }

  public List<ResolvedNugget> resolveAll(List<RawCandidate> candidates, String source) {
    List<ResolvedNugget> out = new ArrayList<>(candidates.size());
    for (RawCandidate candidate : candidates) {
      out.add(resolve(candidate, source));
    }
    return out;
  }

  /** The character plus its right neighbour (or left, at the end) at its first occurrence. */
  private static AnchorPair widenSingleCharacter(String c, String source) {
    int idx = source == null ? -1 : source.indexOf(c);
    if (idx < 0) {
      log.debug("Single-character nugget '{}' not in source; end anchor left empty", c);
      return new AnchorPair(c, "");
    }
    int end = idx + c.length();
    if (end < source.length()) {
      return new AnchorPair(c, source.substring(idx, source.offsetByCodePoints(end, 1)));
    }
    if (idx > 0) {
      return new AnchorPair(c, source.substring(source.offsetByCodePoints(idx, -1), end));
    }
    log.debug("Source holds only the single-character nugget '{}'; end anchor left empty", c);
    return new AnchorPair(c, "");
  }
}
