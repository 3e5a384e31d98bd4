package com.gentoro.openapimcp.executor;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.openapimcp.exception.ExecutionException;
import com.gentoro.openapimcp.exception.NotFoundException;
import org.junit.jupiter.api.Test;

class ToolResultTest {

  @Test
  void textResultIsReturnedVerbatim() {
    assertEquals("pong", ToolResult.success(TextNode.valueOf("pong")).toContentText());
  }

  @Test
  void jsonResultIsPrettyPrinted() throws Exception {
    ToolResult result = ToolResult.success(new ObjectMapper().readTree("{\"a\":1}"));

    String text = result.toContentText();
    assertTrue(text.contains("\"a\" : 1"), text);
    assertTrue(text.contains("\n"));
  }

  @Test
  void nullResultRendersNull() {
    assertEquals("null", ToolResult.success(NullNode.getInstance()).toContentText());
  }

  @Test
  void failureTextHasPrefix() {
    ToolResult result = ToolResult.failure(new NotFoundException("Tool not found: nope"));

    assertFalse(result.isSuccess());
    assertNull(result.value());
    assertNull(result.statusCode());
    assertEquals("Tool execution failed: Tool not found: nope", result.toContentText());
  }

  @Test
  void statusComesFromExecutionFailures() {
    ToolResult result =
        ToolResult.failure(new ExecutionException("HTTP 500 error: boom", 500, "boom"));

    assertEquals(500, result.statusCode());
  }

  @Test
  void successRequiresValue() {
    assertThrows(NullPointerException.class, () -> ToolResult.success(null));
  }
}
