package com.gentoro.openapimcp.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.openapimcp.executor.ToolResult;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** The operations of an HTTP API, seen as a catalog of callable tools. */
public interface OpenApiProxy {
  /** Every tool in catalog order. */
  List<ToolDefinition> listTools();

  /** Invokes a tool. Failures are returned in the result, never thrown. */
  ToolResult callTool(String name, JsonNode arguments);

  CompletableFuture<ToolResult> callToolAsync(String name, JsonNode arguments);

  int getCatalogSize();

  ServerDescription getServerDescription();
}
