package com.gentoro.openapimcp;

import com.gentoro.openapimcp.catalog.DuplicateNamePolicy;
import com.gentoro.openapimcp.catalog.ToolCatalog;
import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.exception.StateException;
import com.gentoro.openapimcp.executor.RequestBuilder;
import com.gentoro.openapimcp.executor.ToolExecutor;
import com.gentoro.openapimcp.http.DefaultHeaders;
import com.gentoro.openapimcp.http.EmbeddedJettyServer;
import com.gentoro.openapimcp.http.OkHttpFactory;
import com.gentoro.openapimcp.logging.LoggingService;
import com.gentoro.openapimcp.mcp.McpServer;
import com.gentoro.openapimcp.mcp.Transport;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.openapi.OpenApiLoader;
import com.gentoro.openapimcp.openapi.OpenApiProxy;
import com.gentoro.openapimcp.openapi.OpenApiProxyImpl;
import com.gentoro.openapimcp.openapi.OperationExtractor;
import com.gentoro.openapimcp.utility.StdoutUtility;
import com.gentoro.openapimcp.utility.StringUtility;
import io.swagger.v3.oas.models.OpenAPI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Application lifecycle: configuration, OpenAPI loading, tool catalog, HTTP client and the MCP
 * transport selected on the command line.
 */
public class OpenApiMcp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(OpenApiMcp.class);

  static final String DEFAULT_BASE_URL = "http://localhost:31009";

  private final StartupParameters startupParameters;
  private Configuration configuration;
  private String specLocation;
  private ToolCatalog catalog;
  private OkHttpClient httpClient;
  private OpenApiProxy proxy;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public OpenApiMcp(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  public OpenApiMcp(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  /** Loads configuration and the API description and builds the proxy. Nothing is served yet. */
  public void initialize() {
    // java.util.logging is unused; keep third-party JUL output off stdout/stderr.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    initialize(new ConfigurationProvider(startupParameters.configFile()).config());
  }

  void initialize(Configuration configuration) {
    this.configuration = configuration;
    LoggingService.applyConfiguration(configuration);
    if (startupParameters.debug()) {
      LoggingService.enableDebug();
    }

    this.specLocation =
        StringUtility.firstNonBlank(
            startupParameters.specPath().orElse(null),
            configValue(configuration, "openapi.spec-path"));
    if (specLocation == null) {
      throw new ConfigException(
          "No OpenAPI specification provided, use --spec-path or openapi.spec-path");
    }

    OpenAPI openAPI = OpenApiLoader.load(specLocation);
    List<ToolDefinition> tools = new OperationExtractor().extract(openAPI);
    this.catalog =
        ToolCatalog.build(
            tools,
            DuplicateNamePolicy.parse(configuration.getString("openapi.duplicate-names", null)));
    log.info("Loaded {} tools from OpenAPI specification", catalog.size());

    String baseUrl =
        resolveBaseUrl(
            startupParameters.baseUrl().orElse(null),
            configValue(configuration, "openapi.base-url"),
            OpenApiLoader.baseUrl(openAPI, specLocation).orElse(null),
            configValue(configuration, "openapi.default-base-url"));
    log.info("Using API base URL: {}", baseUrl);

    Map<String, String> headers = DefaultHeaders.fromConfiguration(configuration);
    this.httpClient =
        OkHttpFactory.create(
            Duration.ofSeconds(
                configuration.getLong(
                    "http.client.timeout-seconds", OkHttpFactory.DEFAULT_TIMEOUT.toSeconds())));
    ToolExecutor executor =
        new ToolExecutor(catalog, new RequestBuilder(baseUrl, headers), httpClient);
    this.proxy =
        new OpenApiProxyImpl(
            executor,
            configuration.getString("mcp.server.name", "openapi-mcp-server"),
            configuration.getString("mcp.server.version", "1.0.0"));
  }

  /**
   * Base URL precedence: command line, configuration, first server of the description, then the
   * configured default.
   */
  static String resolveBaseUrl(
      String commandLine, String configured, String fromSpecification, String configuredDefault) {
    String url =
        StringUtility.firstNonBlank(commandLine, configured, fromSpecification, configuredDefault);
    return url == null ? DEFAULT_BASE_URL : url;
  }

  /** Executes the selected command; {@code run} blocks until shutdown. */
  public void run() {
    switch (startupParameters.command()) {
      case HELP -> StdoutUtility.printNewLine(StartupParameters.usage());
      case VALIDATE -> validate();
      case LIST_TOOLS -> listTools();
      case RUN -> {
        serve();
        waitShutdownSignal();
      }
    }
  }

  private void validate() {
    ServerDescription description = proxy().getServerDescription();
    StdoutUtility.printSuccessLine("Server configuration is valid!");
    StdoutUtility.printNewLine(description.toString());
  }

  private void listTools() {
    List<ToolDefinition> tools = proxy().listTools();
    if (tools.isEmpty()) {
      StdoutUtility.printNewLine("No tools available.");
      return;
    }
    StdoutUtility.printNewLine("Available tools (" + tools.size() + "):");
    for (int i = 0; i < tools.size(); i++) {
      ToolDefinition tool = tools.get(i);
      StdoutUtility.printNewLine(
          "  %d. %s - %s %s%s"
              .formatted(
                  i + 1,
                  tool.name(),
                  tool.method(),
                  tool.pathTemplate(),
                  tool.description() == null ? "" : ": " + tool.description()));
    }
  }

  private void serve() {
    Transport transport =
        startupParameters
            .transport()
            .orElseGet(() -> Transport.parse(configuration().getString("mcp.transport", "stdio")));
    this.mcpServer = new McpServer(proxy(), configuration());
    try {
      if (transport == Transport.STREAMABLE_HTTP) {
        this.httpServer =
            EmbeddedJettyServer.fromConfiguration(
                configuration(), startupParameters.port().orElse(null));
        mcpServer.register(httpServer);
        httpServer.start();
      } else {
        mcpServer.startStdio();
      }
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "openapi-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        if (httpClient != null) {
          httpClient.dispatcher().executorService().shutdown();
          httpClient.connectionPool().evictAll();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while releasing {}: {}", closeable, ExceptionUtil.describe(e));
      }
    }
  }

  private static String configValue(Configuration cfg, String key) {
    String value = cfg.getString(key, null);
    if (value == null || value.isBlank() || value.trim().startsWith("${")) return null;
    return value.trim();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("OpenApiMcp not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public OpenApiProxy proxy() {
    if (proxy == null) {
      throw new StateException("OpenApiMcp not initialized. Call initialize() first.");
    }
    return proxy;
  }

  public String specLocation() {
    return specLocation;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
