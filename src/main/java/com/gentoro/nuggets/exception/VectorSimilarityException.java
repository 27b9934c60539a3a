package com.gentoro.nuggets.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** Programmer error while comparing embedding vectors. */
public class VectorSimilarityException extends NuggetsException {

  public enum Kind {
    DIMENSION_MISMATCH,
    EMPTY_VECTOR,
    INVALID_COMPONENT,
    BATCH_SIZE_MISMATCH
  }

  private final Kind kind;
  private final int pairIndex;

  public VectorSimilarityException(Kind kind, String message) {
    this(kind, message, -1, null);
  }

  public VectorSimilarityException(Kind kind, String message, int pairIndex, Throwable cause) {
    super(NuggetsErrorCode.INVALID_ARGUMENT, message, context(kind, pairIndex), cause);
    this.kind = kind;
    this.pairIndex = pairIndex;
  }

  public Kind getKind() {
    return kind;
  }

  /** Index of the failing pair in a batch comparison, {@code -1} outside batches. */
  public int getPairIndex() {
    return pairIndex;
  }

  private static Map<String, Object> context(Kind kind, int pairIndex) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("kind", kind);
    if (pairIndex >= 0) m.put("pairIndex", pairIndex);
    return m;
  }
}
