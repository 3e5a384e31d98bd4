package com.gentoro.openapimcp.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void errorDetailsKeepCodeAndContext() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new ExecutionException("HTTP 502 error: bad", 502, "bad"));

    assertEquals("ExecutionException", details.type);
    assertEquals(OpenApiMcpErrorCode.EXECUTION_ERROR, details.code);
    assertEquals(502, details.context.get(ExecutionException.STATUS));
    assertEquals("bad", details.context.get(ExecutionException.BODY));
    assertNotNull(details.timestamp);
  }

  @Test
  void foreignThrowableIsUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(OpenApiMcpErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertNull(details.context);
  }

  @Test
  void describeFallsBackToStackTrace() {
    assertEquals("boom", ExceptionUtil.describe(new RuntimeException("boom")));
    assertTrue(ExceptionUtil.describe(new RuntimeException()).contains("ExceptionUtilTest"));
    assertEquals("", ExceptionUtil.describe(null));
  }

  @Test
  void compactStackTraceHonoursFrameLimit() {
    RuntimeException e = new RuntimeException("x");
    String oneFrame = ExceptionUtil.formatCompactStackTrace(e, 1);

    assertFalse(oneFrame.contains(" > "));
    assertTrue(oneFrame.startsWith(ExceptionUtilTest.class.getName()));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void rethrowIfUncheckedWrapsForeignExceptions() {
    NetworkException network = new NetworkException("down");
    assertSame(network, ExceptionUtil.rethrowIfUnchecked(network, t -> new IoException("no")));

    OpenApiMcpException wrapped =
        ExceptionUtil.rethrowIfUnchecked(
            new IOException("disk"), t -> new IoException(t.getMessage(), t));
    assertInstanceOf(IoException.class, wrapped);
    assertEquals(OpenApiMcpErrorCode.IO_ERROR, wrapped.getCode());
  }

  @Test
  void executionStatusIsOnlyPresentForHttpFailures() {
    assertEquals(404, new ExecutionException("nf", 404, "x").getStatus());
    assertNull(new ExecutionException("plain").getStatus());
  }
}
