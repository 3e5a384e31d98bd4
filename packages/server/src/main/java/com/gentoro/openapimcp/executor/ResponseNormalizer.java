package com.gentoro.openapimcp.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.openapimcp.exception.ExecutionException;
import com.gentoro.openapimcp.exception.NetworkException;
import com.gentoro.openapimcp.utility.JacksonUtility;
import java.io.IOException;
import java.util.Locale;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Converts an HTTP response into a {@link ToolResult}. The caller owns the response and closes
 * it.
 */
public class ResponseNormalizer {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(ResponseNormalizer.class);

  public ToolResult normalize(Response response) {
    int status = response.code();
    String contentType = response.header("Content-Type");
    String body = readBody(response);

    if (status < 200 || status > 299) {
      log.debug("HTTP {} from {}", status, response.request().url());
      return ToolResult.failure(
          new ExecutionException("HTTP " + status + " error: " + body, status, body));
    }

    if (isJson(contentType)) {
      if (body.isBlank()) {
        return ToolResult.success(NullNode.getInstance());
      }
      try {
        JsonNode parsed = JacksonUtility.getJsonMapper().readTree(body);
        return ToolResult.success(parsed == null ? NullNode.getInstance() : parsed);
      } catch (IOException e) {
        return ToolResult.failure(
            new ExecutionException("Failed to parse JSON response: " + e.getMessage(), status, e));
      }
    }
    return ToolResult.success(TextNode.valueOf(body));
  }

  /** {@code application/json} or any {@code +json} subtype, parameters ignored. */
  public static boolean isJson(String contentType) {
    if (contentType == null) return false;
    String type = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return type.equals("application/json") || type.endsWith("+json");
  }

  private static String readBody(Response response) {
    ResponseBody body = response.body();
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException e) {
      throw new NetworkException("Failed to read response body: " + e.getMessage(), e);
    }
  }
}
