package com.gentoro.openapimcp.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call reached the remote API but did not produce a usable result: a non-2xx status, or a
 * response declared as JSON whose body does not parse.
 */
public class ExecutionException extends OpenApiMcpException {
  public static final String STATUS = "status";
  public static final String BODY = "body";

  public ExecutionException(String message) {
    super(OpenApiMcpErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(OpenApiMcpErrorCode.EXECUTION_ERROR, message, cause);
  }

  public ExecutionException(String message, int status, String body) {
    super(OpenApiMcpErrorCode.EXECUTION_ERROR, message, httpContext(status, body));
  }

  public ExecutionException(String message, int status, Throwable cause) {
    super(OpenApiMcpErrorCode.EXECUTION_ERROR, message, httpContext(status, null), cause);
  }

  /** HTTP status of the failed call, or {@code null} when the failure was not an HTTP status. */
  public Integer getStatus() {
    Object status = getContext().get(STATUS);
    return status instanceof Integer i ? i : null;
  }

  private static Map<String, Object> httpContext(int status, String body) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put(STATUS, status);
    if (body != null) context.put(BODY, body);
    return context;
  }
}
