package com.gentoro.openapimcp.exception;

/** Network-level communication error (connect failures, timeouts, cancelled calls). */
public class NetworkException extends OpenApiMcpException {
  public NetworkException(String message) {
    super(OpenApiMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
