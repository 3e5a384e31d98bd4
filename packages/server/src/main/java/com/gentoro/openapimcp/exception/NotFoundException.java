package com.gentoro.openapimcp.exception;

/** Resource requested was not found. */
public class NotFoundException extends OpenApiMcpException {
  public NotFoundException(String message) {
    super(OpenApiMcpErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.NOT_FOUND, message, cause);
  }
}
