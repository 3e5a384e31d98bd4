package com.gentoro.openapimcp.exception;

/** I/O operation failed (filesystem, classpath). */
public class IoException extends OpenApiMcpException {
  public IoException(String message) {
    super(OpenApiMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.IO_ERROR, message, cause);
  }
}
