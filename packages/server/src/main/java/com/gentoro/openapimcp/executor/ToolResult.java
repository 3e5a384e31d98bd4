package com.gentoro.openapimcp.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.exception.ExecutionException;
import com.gentoro.openapimcp.exception.OpenApiMcpException;
import com.gentoro.openapimcp.utility.JacksonUtility;
import java.util.Objects;

/** Outcome of a tool call: either a JSON value or an error, never both. */
public final class ToolResult {
  public static final String FAILURE_PREFIX = "Tool execution failed: ";

  private final JsonNode value;
  private final OpenApiMcpException error;

  private ToolResult(JsonNode value, OpenApiMcpException error) {
    this.value = value;
    this.error = error;
  }

  public static ToolResult success(JsonNode value) {
    return new ToolResult(Objects.requireNonNull(value, "value"), null);
  }

  public static ToolResult failure(OpenApiMcpException error) {
    return new ToolResult(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public JsonNode value() {
    return value;
  }

  public OpenApiMcpException error() {
    return error;
  }

  /** HTTP status of a failed call, when the failure came from the remote API. */
  public Integer statusCode() {
    return error instanceof ExecutionException ex ? ex.getStatus() : null;
  }

  public String message() {
    return error == null ? null : ExceptionUtil.describe(error);
  }

  /**
   * Text handed to MCP clients: plain text results verbatim, other values as indented JSON,
   * failures prefixed with {@value #FAILURE_PREFIX}.
   */
  public String toContentText() {
    if (error != null) {
      return FAILURE_PREFIX + message();
    }
    if (value.isTextual()) {
      return value.textValue();
    }
    return JacksonUtility.toPrettyJson(value);
  }

  @Override
  public String toString() {
    return isSuccess() ? "ToolResult{success}" : "ToolResult{failure=" + error + "}";
  }
}
