package com.gentoro.nuggets.exception;

/** The caller cancelled the extraction or its deadline passed. */
public class ExtractionCancelledException extends NuggetsException {
  public ExtractionCancelledException(String message) {
    super(NuggetsErrorCode.CANCELLED, message);
  }

  public ExtractionCancelledException(String message, Throwable cause) {
    super(NuggetsErrorCode.CANCELLED, message, cause);
  }
}
