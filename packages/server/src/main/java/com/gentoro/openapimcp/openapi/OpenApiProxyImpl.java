package com.gentoro.openapimcp.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.openapimcp.executor.ToolExecutor;
import com.gentoro.openapimcp.executor.ToolResult;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

public class OpenApiProxyImpl implements OpenApiProxy {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(OpenApiProxyImpl.class);

  private final ToolExecutor executor;
  private final String serverName;
  private final String serverVersion;

  public OpenApiProxyImpl(ToolExecutor executor, String serverName, String serverVersion) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.serverName = Objects.requireNonNull(serverName, "serverName");
    this.serverVersion = Objects.requireNonNull(serverVersion, "serverVersion");
  }

  @Override
  public List<ToolDefinition> listTools() {
    return executor.catalog().all();
  }

  @Override
  public ToolResult callTool(String name, JsonNode arguments) {
    log.trace("Invoking tool {}", name);
    return executor.call(name, arguments);
  }

  @Override
  public CompletableFuture<ToolResult> callToolAsync(String name, JsonNode arguments) {
    log.trace("Invoking tool {} asynchronously", name);
    return executor.callAsync(name, arguments);
  }

  @Override
  public int getCatalogSize() {
    return executor.catalog().size();
  }

  @Override
  public ServerDescription getServerDescription() {
    return new ServerDescription(serverName, serverVersion, getCatalogSize());
  }
}
