package com.gentoro.openapimcp.http;

import java.io.IOException;
import okhttp3.*;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  // Larger bodies (file uploads) are summarized by size only.
  private static final long MAX_LOGGED_BODY = 16 * 1024;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url(),
          redacted(request.headers()),
          bodyToString(request));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}\n",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code(),
        response.headers());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }

  static Headers redacted(Headers headers) {
    if (headers.get("Authorization") == null) return headers;
    return headers.newBuilder().set("Authorization", "<redacted>").build();
  }

  private static String bodyToString(Request request) {
    try {
      RequestBody body = request.body();
      if (body == null) return "";
      if (body.contentLength() > MAX_LOGGED_BODY) {
        return "(" + body.contentLength() + " bytes)";
      }
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
