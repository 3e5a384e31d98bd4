package com.gentoro.openapimcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.exception.SpecificationException;
import com.gentoro.openapimcp.exception.StateException;
import com.gentoro.openapimcp.model.ServerDescription;
import com.gentoro.openapimcp.model.ToolDefinition;
import java.io.File;
import java.net.URL;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenApiMcpTest {

  private OpenApiMcp app;

  private static String spec(String name) {
    URL resource = OpenApiMcpTest.class.getClassLoader().getResource("openapi/" + name);
    assertNotNull(resource);
    return new File(resource.getFile()).getAbsolutePath();
  }

  @AfterEach
  void tearDown() {
    if (app != null) app.shutdown();
  }

  @Test
  void baseUrlPrecedence() {
    assertEquals("http://cli", OpenApiMcp.resolveBaseUrl("http://cli", "http://cfg", "http://spec", "http://def"));
    assertEquals("http://cfg", OpenApiMcp.resolveBaseUrl(null, "http://cfg", "http://spec", "http://def"));
    assertEquals("http://spec", OpenApiMcp.resolveBaseUrl(" ", null, "http://spec", "http://def"));
    assertEquals("http://def", OpenApiMcp.resolveBaseUrl(null, null, null, "http://def"));
    assertEquals(OpenApiMcp.DEFAULT_BASE_URL, OpenApiMcp.resolveBaseUrl(null, null, null, null));
  }

  @Test
  void initializesFromSpecPathOnCommandLine() {
    app = new OpenApiMcp(new String[] {"list-tools", "--spec-path", spec("users-api.yaml")});
    app.initialize(new BaseConfiguration());

    ServerDescription description = app.proxy().getServerDescription();
    assertEquals("openapi-mcp-server", description.name());
    assertEquals("1.0.0", description.version());
    assertEquals(6, description.toolCount());

    List<String> names = app.proxy().listTools().stream().map(ToolDefinition::name).toList();
    assertEquals(
        List.of("getUser", "deleteUser", "listUsers", "createUser", "post__files", "get__health"),
        names);
  }

  @Test
  void specPathFromConfigurationAndServerIdentity() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("openapi.spec-path", spec("users-api.yaml"));
    cfg.setProperty("mcp.server.name", "users");
    cfg.setProperty("mcp.server.version", "2.0");

    app = new OpenApiMcp(new String[] {"validate"});
    app.initialize(cfg);

    assertEquals(new ServerDescription("users", "2.0", 6), app.proxy().getServerDescription());
    assertEquals(spec("users-api.yaml"), app.specLocation());
  }

  @Test
  void unresolvedPlaceholderCountsAsMissingSpec() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("openapi.spec-path", "${env:OPENAPI_MCP_TEST_SURELY_UNSET_42}");

    app = new OpenApiMcp(new String[] {"validate"});
    assertThrows(ConfigException.class, () -> app.initialize(cfg));
  }

  @Test
  void failFastDuplicatePolicy() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("openapi.duplicate-names", "fail");

    app = new OpenApiMcp(new String[] {"--spec-path", spec("duplicate-names.yaml")});
    assertThrows(SpecificationException.class, () -> app.initialize(cfg));
  }

  @Test
  void invalidSpecificationIsReported() {
    app = new OpenApiMcp(new String[] {"--spec-path", spec("no-paths.yaml")});
    assertThrows(SpecificationException.class, () -> app.initialize(new BaseConfiguration()));
  }

  @Test
  void proxyRequiresInitialization() {
    app = new OpenApiMcp(new String[0]);
    assertThrows(StateException.class, () -> app.proxy());
    assertThrows(StateException.class, () -> app.configuration());
  }
}
