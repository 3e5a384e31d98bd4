package com.gentoro.openapimcp.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.openapimcp.catalog.ToolCatalog;
import com.gentoro.openapimcp.exception.ExecutionException;
import com.gentoro.openapimcp.exception.ErrorDetails;
import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.exception.NetworkException;
import com.gentoro.openapimcp.exception.NotFoundException;
import com.gentoro.openapimcp.exception.OpenApiMcpException;
import com.gentoro.openapimcp.exception.ValidationException;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Runs tool calls against the remote API: catalog lookup, request building, the HTTP exchange and
 * response normalization. Every failure is returned as a {@link ToolResult}; nothing is thrown to
 * the caller.
 */
public class ToolExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(ToolExecutor.class);

  private final ToolCatalog catalog;
  private final RequestBuilder requestBuilder;
  private final OkHttpClient httpClient;
  private final ResponseNormalizer normalizer;

  public ToolExecutor(ToolCatalog catalog, RequestBuilder requestBuilder, OkHttpClient httpClient) {
    this(catalog, requestBuilder, httpClient, new ResponseNormalizer());
  }

  public ToolExecutor(
      ToolCatalog catalog,
      RequestBuilder requestBuilder,
      OkHttpClient httpClient,
      ResponseNormalizer normalizer) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.requestBuilder = Objects.requireNonNull(requestBuilder, "requestBuilder");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  public ToolCatalog catalog() {
    return catalog;
  }

  public ToolResult call(String toolName, JsonNode arguments) {
    Call call;
    try {
      call = prepare(toolName, arguments);
    } catch (OpenApiMcpException e) {
      return failed(toolName, e);
    }
    try (Response response = call.execute()) {
      return logged(toolName, normalizer.normalize(response));
    } catch (IOException e) {
      return failed(toolName, transportError(call, e));
    } catch (OpenApiMcpException e) {
      return failed(toolName, e);
    } catch (RuntimeException e) {
      return failed(toolName, unexpected(e));
    }
  }

  /**
   * Asynchronous variant of {@link #call}. The returned future always completes normally with a
   * result; cancelling it cancels the in-flight HTTP call.
   */
  public CompletableFuture<ToolResult> callAsync(String toolName, JsonNode arguments) {
    Call call;
    try {
      call = prepare(toolName, arguments);
    } catch (OpenApiMcpException e) {
      return CompletableFuture.completedFuture(failed(toolName, e));
    }

    CompletableFuture<ToolResult> future = new CompletableFuture<>();
    future.whenComplete(
        (result, error) -> {
          if (future.isCancelled()) {
            log.debug("Cancelling call to tool {}", toolName);
            call.cancel();
          }
        });
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(@NotNull Call c, @NotNull IOException e) {
            future.complete(failed(toolName, transportError(c, e)));
          }

          @Override
          public void onResponse(@NotNull Call c, @NotNull Response response) {
            try (response) {
              future.complete(logged(toolName, normalizer.normalize(response)));
            } catch (OpenApiMcpException e) {
              future.complete(failed(toolName, e));
            } catch (RuntimeException e) {
              future.complete(failed(toolName, unexpected(e)));
            }
          }
        });
    return future;
  }

  private Call prepare(String toolName, JsonNode arguments) {
    ToolDefinition tool =
        catalog
            .byName(toolName)
            .orElseThrow(() -> new NotFoundException("Tool not found: " + toolName));
    log.info("Calling tool: {}", toolName);
    try {
      RequestPlan plan = requestBuilder.build(tool, asObject(arguments));
      log.debug("Executing {} for tool {}", plan, toolName);
      return httpClient.newCall(plan.toRequest());
    } catch (OpenApiMcpException e) {
      throw e;
    } catch (RuntimeException e) {
      throw unexpected(e);
    }
  }

  private static ObjectNode asObject(JsonNode arguments) {
    if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
      return JacksonUtility.getJsonMapper().createObjectNode();
    }
    if (arguments instanceof ObjectNode object) {
      return object;
    }
    throw new ValidationException("Tool arguments must be a JSON object");
  }

  private static OpenApiMcpException transportError(Call call, IOException e) {
    String target = call.request().method() + " " + call.request().url();
    if (e instanceof InterruptedIOException) {
      return new NetworkException("Request timed out: " + target, e);
    }
    if (call.isCanceled()) {
      return new NetworkException("Request was cancelled: " + target, e);
    }
    return new NetworkException("HTTP request failed: " + target + ": " + e.getMessage(), e);
  }

  private static OpenApiMcpException unexpected(RuntimeException e) {
    return new ExecutionException(ExceptionUtil.describe(e), e);
  }

  private static ToolResult failed(String toolName, OpenApiMcpException error) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    log.warn("Tool {} failed [{}]: {}", toolName, details.code, details.message);
    return ToolResult.failure(error);
  }

  private static ToolResult logged(String toolName, ToolResult result) {
    if (result.isSuccess()) {
      log.info("Tool {} completed", toolName);
    } else {
      log.warn("Tool {} failed: {}", toolName, result.message());
    }
    return result;
  }
}
