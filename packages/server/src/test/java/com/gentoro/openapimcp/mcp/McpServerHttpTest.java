package com.gentoro.openapimcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.openapimcp.catalog.ToolCatalog;
import com.gentoro.openapimcp.executor.RequestBuilder;
import com.gentoro.openapimcp.executor.ToolExecutor;
import com.gentoro.openapimcp.http.OkHttpFactory;
import com.gentoro.openapimcp.openapi.OpenApiLoader;
import com.gentoro.openapimcp.openapi.OpenApiProxyImpl;
import com.gentoro.openapimcp.openapi.OperationExtractor;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.File;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

/** MCP tool calls routed through a real executor against a local HTTP server. */
class McpServerHttpTest {

  private MockWebServer api;
  private OkHttpClient client;
  private McpServer server;

  @BeforeEach
  void setUp() throws Exception {
    api = new MockWebServer();
    api.start();

    URL resource = getClass().getClassLoader().getResource("openapi/users-api.yaml");
    assertNotNull(resource);
    ToolCatalog catalog =
        ToolCatalog.build(
            new OperationExtractor()
                .extract(OpenApiLoader.load(new File(resource.getFile()).getAbsolutePath())));
    client = OkHttpFactory.create(Duration.ofSeconds(10));
    ToolExecutor executor =
        new ToolExecutor(catalog, new RequestBuilder(api.url("/").toString(), Map.of()), client);
    server =
        new McpServer(
            new OpenApiProxyImpl(executor, "users", "1.0.0"), new BaseConfiguration());
  }

  @AfterEach
  void tearDown() throws Exception {
    api.shutdown();
    client.dispatcher().executorService().shutdown();
  }

  @Test
  void toolCallReturnsResponseText() {
    api.enqueue(
        new MockResponse().setHeader("Content-Type", "text/plain").setBody("ok"));

    McpSchema.CallToolResult result = server.handleCall("get__health", Map.of()).block();

    assertNotNull(result);
    assertFalse(result.isError());
    assertEquals("ok", ((McpSchema.TextContent) result.content().get(0)).text());
  }

  @Test
  @DisplayName("Disposing a pending MCP call cancels the outbound HTTP request")
  void disposingTheCallCancelsTheHttpRequest() throws Exception {
    api.enqueue(new MockResponse().setBody("slow").setHeadersDelay(5, TimeUnit.SECONDS));

    Disposable call = server.handleCall("get__health", Map.of()).subscribe();
    assertNotNull(api.takeRequest(2, TimeUnit.SECONDS), "request should reach the API");
    assertEquals(1, client.dispatcher().runningCallsCount());

    call.dispose();

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (client.dispatcher().runningCallsCount() > 0 && System.nanoTime() < deadline) {
      Thread.sleep(20);
    }
    assertEquals(0, client.dispatcher().runningCallsCount());
  }
}
