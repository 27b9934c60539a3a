package com.gentoro.nuggets.exception;

/** A prompt template could not be located, parsed or rendered. */
public class PromptException extends NuggetsException {
  public PromptException(String message) {
    super(NuggetsErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(NuggetsErrorCode.PROMPT_ERROR, message, cause);
  }
}
