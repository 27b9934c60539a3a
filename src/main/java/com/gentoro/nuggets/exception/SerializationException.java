package com.gentoro.nuggets.exception;

/** Failure while reading or writing JSON/YAML payloads. */
public class SerializationException extends NuggetsException {
  public SerializationException(String message) {
    super(NuggetsErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(NuggetsErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
