package com.gentoro.openapimcp.exception;

/** Tool arguments could not be shaped into a request (e.g. a malformed file payload). */
public class ValidationException extends OpenApiMcpException {
  public ValidationException(String message) {
    super(OpenApiMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
