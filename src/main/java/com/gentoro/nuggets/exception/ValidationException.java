package com.gentoro.nuggets.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends NuggetsException {
  public ValidationException(String message) {
    super(NuggetsErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(NuggetsErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
