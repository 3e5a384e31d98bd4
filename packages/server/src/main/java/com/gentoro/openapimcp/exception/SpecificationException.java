package com.gentoro.openapimcp.exception;

/** The API description is malformed or uses an unsupported OpenAPI version. */
public class SpecificationException extends OpenApiMcpException {
  public SpecificationException(String message) {
    super(OpenApiMcpErrorCode.SPECIFICATION_ERROR, message);
  }

  public SpecificationException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.SPECIFICATION_ERROR, message, cause);
  }
}
