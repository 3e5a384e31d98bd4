package com.gentoro.openapimcp.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends OpenApiMcpException {
  public StateException(String message) {
    super(OpenApiMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
