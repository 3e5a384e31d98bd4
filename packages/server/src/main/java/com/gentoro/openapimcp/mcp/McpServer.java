package com.gentoro.openapimcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.exception.StateException;
import com.gentoro.openapimcp.executor.ToolResult;
import com.gentoro.openapimcp.http.EmbeddedJettyServer;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.model.ToolSchema;
import com.gentoro.openapimcp.openapi.OpenApiProxy;
import com.gentoro.openapimcp.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import reactor.core.publisher.Mono;

/**
 * Publishes the tools of an {@link OpenApiProxy} through the official MCP SDK, over stdio or as a
 * streamable HTTP servlet mounted on {@link EmbeddedJettyServer}.
 *
 * <p>Tools are served by the SDK's asynchronous server: a call runs on OkHttp's dispatcher and
 * cancelling the MCP request cancels the outbound HTTP call.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 * </ul>
 */
public class McpServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(McpServer.class);

  private final OpenApiProxy proxy;
  private final Configuration configuration;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpAsyncServer mcpServer;

  public McpServer(OpenApiProxy proxy, Configuration configuration) {
    this.proxy = Objects.requireNonNull(proxy, "proxy");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Serve MCP over this process's stdin/stdout. */
  public void startStdio() {
    ensureNotStarted();
    ServerDescription info = proxy.getServerDescription();
    var transport = new StdioServerTransportProvider(jsonMapper());
    mcpServer =
        io.modelcontextprotocol.server.McpServer.async(transport)
            .serverInfo(info.name(), info.version())
            .instructions(instructions())
            .capabilities(capabilities())
            .tools(toolSpecifications())
            .build();
    log.info(
        "MCP server {} v{} serving {} tools over stdio",
        info.name(),
        info.version(),
        info.toolCount());
  }

  /** Mount the streamable HTTP servlet on {@code http}; Jetty's lifecycle stays with the caller. */
  public void register(EmbeddedJettyServer http) {
    ensureNotStarted();
    ServerDescription info = proxy.getServerDescription();
    String endpoint = normalizeEndpoint(configuration.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = configuration.getBoolean("http.mcp.disallow-delete", false);

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(jsonMapper())
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.async(servletTransport)
            .serverInfo(info.name(), info.version())
            .instructions(instructions())
            .capabilities(capabilities())
            .tools(toolSpecifications())
            .build();

    http.prepare();
    http.getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info("MCP servlet registered at http://localhost:{}{}", http.getPort(), endpoint);
  }

  String instructions() {
    return "This server provides "
        + proxy.getCatalogSize()
        + " tools converted from an OpenAPI specification. Each tool corresponds to an API"
        + " endpoint and accepts parameters as defined in the OpenAPI spec.";
  }

  /**
   * One specification per callable tool name, in catalog order. When two operations share a
   * name, only the one that owns the name is published.
   */
  List<McpServerFeatures.AsyncToolSpecification> toolSpecifications() {
    Map<String, ToolDefinition> callable = new LinkedHashMap<>();
    for (ToolDefinition tool : proxy.listTools()) {
      callable.remove(tool.name());
      callable.put(tool.name(), tool);
    }
    List<McpServerFeatures.AsyncToolSpecification> specs = new ArrayList<>(callable.size());
    for (ToolDefinition tool : callable.values()) {
      specs.add(
          McpServerFeatures.AsyncToolSpecification.builder()
              .tool(toMcpTool(tool))
              .callHandler((exchange, request) -> handleCall(tool.name(), request.arguments()))
              .build());
    }
    return specs;
  }

  /** Disposing the returned mono cancels the in-flight HTTP call. */
  Mono<McpSchema.CallToolResult> handleCall(String toolName, Map<String, Object> arguments) {
    return Mono.defer(
            () -> {
              JsonNode args =
                  JacksonUtility.getJsonMapper()
                      .valueToTree(arguments == null ? Map.<String, Object>of() : arguments);
              CompletableFuture<ToolResult> call = proxy.callToolAsync(toolName, args);
              return Mono.fromFuture(call)
                  .doOnCancel(
                      () -> {
                        log.debug("MCP request for tool {} was cancelled", toolName);
                        call.cancel(true);
                      });
            })
        .map(McpServer::toCallToolResult)
        .onErrorResume(
            e -> {
              log.error("Failed to handle MCP tool request for {}", toolName, e);
              return Mono.just(
                  McpSchema.CallToolResult.builder()
                      .addTextContent(ToolResult.FAILURE_PREFIX + ExceptionUtil.describe(e))
                      .isError(true)
                      .build());
            });
  }

  static McpSchema.Tool toMcpTool(ToolDefinition tool) {
    ToolSchema input = tool.inputSchema();
    Map<String, Object> properties = new LinkedHashMap<>();
    if (input.getProperties() != null) {
      input.getProperties().forEach((name, schema) -> properties.put(name, schema.toMap()));
    }
    List<String> required = input.getRequired() == null ? List.of() : input.getRequired();
    return McpSchema.Tool.builder()
        .name(tool.name())
        .description(tool.description() == null ? "" : tool.description())
        .inputSchema(
            new McpSchema.JsonSchema(
                input.getType().wireName(), properties, required, null, null, null))
        .build();
  }

  static McpSchema.CallToolResult toCallToolResult(ToolResult result) {
    return McpSchema.CallToolResult.builder()
        .addTextContent(result.toContentText())
        .isError(!result.isSuccess())
        .build();
  }

  private static McpSchema.ServerCapabilities capabilities() {
    return McpSchema.ServerCapabilities.builder().tools(true).logging().build();
  }

  private static JacksonMcpJsonMapper jsonMapper() {
    return new JacksonMcpJsonMapper(new ObjectMapper());
  }

  private void ensureNotStarted() {
    if (mcpServer != null) {
      throw new StateException("MCP server already started");
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully().block();
      }
    } finally {
      mcpServer = null;
      if (servletTransport != null) {
        try {
          servletTransport.destroy();
        } finally {
          servletTransport = null;
        }
      }
    }
  }
}
