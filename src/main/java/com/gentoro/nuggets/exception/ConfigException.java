package com.gentoro.nuggets.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends NuggetsException {
  public ConfigException(String message) {
    super(NuggetsErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(NuggetsErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
