package com.gentoro.openapimcp.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends OpenApiMcpException {
  public SerializationException(String message) {
    super(OpenApiMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
