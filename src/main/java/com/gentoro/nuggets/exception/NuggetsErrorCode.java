package com.gentoro.nuggets.exception;

/**
 * Canonical error codes. Codes are stable and suitable for downstream services and logs. Prefer
 * the most specific code that reflects the failure origin and actionability.
 */
public enum NuggetsErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PROMPT_ERROR,
  PROVIDER_ERROR,
  EXTRACTION_FAILED,
}
