package com.gentoro.openapimcp.exception;

/** Configuration problem: bad base URL, unsupported HTTP method, unreadable config file. */
public class ConfigException extends OpenApiMcpException {
  public ConfigException(String message) {
    super(OpenApiMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
