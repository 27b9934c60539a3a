package com.gentoro.nuggets.similarity;

import java.util.List;

/**
 * Turns texts into embedding vectors for {@link VectorSimilarity}.
 *
 * <p>Implementations report failures as {@link com.gentoro.nuggets.exception.NuggetsException}s
 * so callers can fall back to word overlap.
 */
public interface TextEmbedder {

  /** One vector per input text, in input order. All vectors have the same dimension. */
  List<double[]> embed(List<String> texts);
}
