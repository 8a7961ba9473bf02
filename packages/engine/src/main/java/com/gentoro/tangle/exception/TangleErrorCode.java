package com.gentoro.tangle.exception;

/**
 * Canonical error codes for Tangle. Codes are stable and suitable for logs and diagnostics
 * payloads. Prefer choosing the most specific code that reflects the failure origin.
 */
public enum TangleErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EXTRACTION_ERROR,
  PARSE_ERROR,
  LOCATION_NOT_FOUND,
  CIRCULAR_REFERENCE,
}
