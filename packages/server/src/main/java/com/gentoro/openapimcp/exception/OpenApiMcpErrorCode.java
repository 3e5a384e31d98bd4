package com.gentoro.openapimcp.exception;

/**
 * Canonical error codes. Codes are stable and suitable for downstream clients and logs. Prefer
 * choosing the most specific code that reflects the failure origin and actionability.
 */
public enum OpenApiMcpErrorCode {
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
  SPECIFICATION_ERROR,
  EXECUTION_ERROR,
  NETWORK_ERROR,
}
