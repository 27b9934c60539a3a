package com.gentoro.nuggets.model;

import java.util.List;
import java.util.Set;

/**
 * One LLM backend able to propose golden nugget candidates for a piece of content.
 *
 * <p>Implementations report every failure as a {@link
 * com.gentoro.nuggets.exception.ProviderException} carrying the upstream status code and an
 * {@link com.gentoro.nuggets.exception.ErrorCategory}.
 */
public interface NuggetProvider {

  /** Stable lowercase identifier, e.g. "gemini". */
  String providerId();

  /**
   * @param content source text to analyze
   * @param prompt extraction instructions, placeholders already applied
   * @param temperature sampling temperature
   * @param types nugget types to ask for; empty means all
   */
  List<RawCandidate> extract(
      String content, String prompt, double temperature, Set<NuggetType> types);
}
