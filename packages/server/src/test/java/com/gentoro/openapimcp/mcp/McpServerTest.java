package com.gentoro.openapimcp.mcp;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.openapimcp.exception.ExecutionException;
import com.gentoro.openapimcp.executor.ToolResult;
import com.gentoro.openapimcp.model.HttpMethod;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.model.ToolSchema;
import com.gentoro.openapimcp.openapi.OpenApiProxy;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.Disposable;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class McpServerTest {

  @Mock private OpenApiProxy proxy;

  private McpServer server;

  private static final ToolDefinition GET_USER =
      ToolDefinition.builder()
          .name("getUser")
          .description("Get a user")
          .method(HttpMethod.GET)
          .pathTemplate("/users/{id}")
          .inputSchema(
              ToolSchema.builder()
                  .type(ToolSchema.Type.OBJECT)
                  .property("id", ToolSchema.builder().type(ToolSchema.Type.STRING).build())
                  .property("limit", ToolSchema.builder().type(ToolSchema.Type.INTEGER).build())
                  .required("id")
                  .required("limit")
                  .build())
          .build();

  @BeforeEach
  void setUp() {
    when(proxy.getServerDescription()).thenReturn(new ServerDescription("test-server", "1.2.3", 2));
    when(proxy.getCatalogSize()).thenReturn(2);
    server = new McpServer(proxy, new BaseConfiguration());
  }

  @Test
  void toolSchemaIsPublishedAsJsonSchema() {
    McpSchema.Tool tool = McpServer.toMcpTool(GET_USER);

    assertEquals("getUser", tool.name());
    assertEquals("Get a user", tool.description());
    assertEquals("object", tool.inputSchema().type());
    assertEquals(List.of("id", "limit"), tool.inputSchema().required());
    assertEquals(Map.of("type", "integer"), tool.inputSchema().properties().get("limit"));
  }

  @Test
  void toolWithoutInputsHasEmptyProperties() {
    ToolDefinition health =
        ToolDefinition.builder().name("health").method(HttpMethod.GET).pathTemplate("/health").build();

    McpSchema.Tool tool = McpServer.toMcpTool(health);

    assertTrue(tool.inputSchema().properties().isEmpty());
    assertEquals("", tool.description());
  }

  @Test
  void shadowedDuplicatesAreNotPublished() {
    ToolDefinition first =
        ToolDefinition.builder().name("fetch").method(HttpMethod.GET).pathTemplate("/a").build();
    ToolDefinition second =
        ToolDefinition.builder().name("fetch").method(HttpMethod.GET).pathTemplate("/b").build();
    when(proxy.listTools()).thenReturn(List.of(first, GET_USER, second));

    List<McpServerFeatures.AsyncToolSpecification> specs = server.toolSpecifications();

    assertEquals(List.of("getUser", "fetch"), specs.stream().map(s -> s.tool().name()).toList());
  }

  @Test
  void successfulCallReturnsContentText() {
    when(proxy.callToolAsync(eq("getUser"), any()))
        .thenReturn(CompletableFuture.completedFuture(ToolResult.success(TextNode.valueOf("hi"))));

    McpSchema.CallToolResult result =
        server.handleCall("getUser", Map.of("id", "42", "limit", 5)).block();

    assertFalse(result.isError());
    assertEquals("hi", ((McpSchema.TextContent) result.content().get(0)).text());

    ArgumentCaptor<JsonNode> args = ArgumentCaptor.forClass(JsonNode.class);
    verify(proxy).callToolAsync(eq("getUser"), args.capture());
    verify(proxy, never()).callTool(any(), any());
    assertEquals("42", args.getValue().get("id").asText());
    assertEquals(5, args.getValue().get("limit").asInt());
  }

  @Test
  void failedCallIsAnErrorResult() {
    when(proxy.callToolAsync(eq("getUser"), any()))
        .thenReturn(
            CompletableFuture.completedFuture(
                ToolResult.failure(new ExecutionException("HTTP 404 error: nope", 404, "nope"))));

    McpSchema.CallToolResult result = server.handleCall("getUser", null).block();

    assertTrue(result.isError());
    assertEquals(
        "Tool execution failed: HTTP 404 error: nope",
        ((McpSchema.TextContent) result.content().get(0)).text());
  }

  @Test
  void unexpectedExceptionIsAnErrorResult() {
    when(proxy.callToolAsync(any(), any())).thenThrow(new IllegalStateException("broken"));

    McpSchema.CallToolResult result = server.handleCall("getUser", Map.of()).block();

    assertTrue(result.isError());
    assertTrue(((McpSchema.TextContent) result.content().get(0)).text().contains("broken"));
  }

  @Test
  void cancellingTheMcpRequestCancelsTheToolCall() {
    CompletableFuture<ToolResult> inFlight = new CompletableFuture<>();
    when(proxy.callToolAsync(eq("getUser"), any())).thenReturn(inFlight);

    Disposable subscription = server.handleCall("getUser", Map.of("id", "1")).subscribe();
    assertFalse(inFlight.isDone());

    subscription.dispose();

    assertTrue(inFlight.isCancelled());
  }

  @Test
  void instructionsMentionToolCount() {
    assertTrue(server.instructions().startsWith("This server provides 2 tools"));
  }

  @Test
  void transportParsing() {
    assertEquals(Transport.STDIO, Transport.parse(null));
    assertEquals(Transport.STDIO, Transport.parse("STDIO"));
    assertEquals(Transport.STREAMABLE_HTTP, Transport.parse("streamable-http"));
    assertEquals(Transport.STREAMABLE_HTTP, Transport.parse("sse"));
    assertThrows(
        com.gentoro.openapimcp.exception.ConfigException.class, () -> Transport.parse("grpc"));
  }
}
