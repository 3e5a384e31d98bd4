package com.gentoro.openapimcp.openapi;

import com.gentoro.openapimcp.exception.SpecificationException;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.servers.ServerVariable;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Loads an OpenAPI 3.x description from a file, a URL or an in-memory document and checks the
 * structural minimum needed to build a tool catalog.
 */
public class OpenApiLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(OpenApiLoader.class);

  /** Parse the description at {@code location} (file path or http(s) URL) and validate it. */
  public static OpenAPI load(String location) {
    if (location == null || location.isBlank()) {
      throw new SpecificationException("No OpenAPI specification location was provided");
    }
    log.info("Loading OpenAPI specification from: {}", location);
    SwaggerParseResult result = new OpenAPIV3Parser().readLocation(location, null, options());
    return validated(result, location);
  }

  /** Parse a JSON or YAML document held in memory and validate it. */
  public static OpenAPI parse(String content) {
    if (content == null || content.isBlank()) {
      throw new SpecificationException("OpenAPI specification content is empty");
    }
    SwaggerParseResult result = new OpenAPIV3Parser().readContents(content, null, options());
    return validated(result, "<inline>");
  }

  /**
   * Structural checks performed once, before any extraction: a 3.x version, a title and at least
   * one path.
   */
  public static void validate(OpenAPI openAPI) {
    if (openAPI == null) {
      throw new SpecificationException("OpenAPI specification is missing");
    }
    String version = openAPI.getOpenapi();
    if (version == null || version.isBlank()) {
      throw new SpecificationException("OpenAPI version is required");
    }
    if (!version.trim().startsWith("3.")) {
      throw new SpecificationException(
          "Unsupported OpenAPI version: " + version + ". Only 3.x is supported");
    }
    if (openAPI.getInfo() == null
        || openAPI.getInfo().getTitle() == null
        || openAPI.getInfo().getTitle().isBlank()) {
      throw new SpecificationException("API title is required");
    }
    if (openAPI.getPaths() == null || openAPI.getPaths().isEmpty()) {
      throw new SpecificationException("At least one path is required");
    }
    log.debug("OpenAPI specification validation passed");
  }

  /**
   * Base URL taken from the first declared server, with server variables replaced by their
   * defaults. A relative server URL is resolved against {@code location} when that is an http(s)
   * URL.
   */
  public static Optional<String> baseUrl(OpenAPI openAPI, String location) {
    if (openAPI == null) return Optional.empty();
    List<Server> servers = openAPI.getServers();
    if (servers == null || servers.isEmpty() || servers.get(0).getUrl() == null) {
      return Optional.empty();
    }
    Server server = servers.get(0);
    String url = server.getUrl().trim();
    if (server.getVariables() != null) {
      for (var entry : server.getVariables().entrySet()) {
        ServerVariable variable = entry.getValue();
        if (variable != null && variable.getDefault() != null) {
          url = url.replace("{" + entry.getKey() + "}", variable.getDefault());
        }
      }
    }
    // swagger-parser substitutes "/" when a description declares no servers at all
    if (url.isEmpty() || "/".equals(url)) {
      return Optional.empty();
    }
    if (url.startsWith("/") && location != null && location.matches("(?i)^https?://.*")) {
      url = URI.create(location).resolve(url).toString();
    }
    return Optional.of(url);
  }

  private static OpenAPI validated(SwaggerParseResult result, String source) {
    OpenAPI openAPI = result == null ? null : result.getOpenAPI();
    if (openAPI == null) {
      List<String> messages = result == null ? List.of() : result.getMessages();
      throw new SpecificationException(
          "Failed to parse OpenAPI specification from "
              + source
              + (messages == null || messages.isEmpty() ? "" : ": " + String.join("; ", messages)));
    }
    if (result.getMessages() != null && !result.getMessages().isEmpty()) {
      result.getMessages().forEach(m -> log.debug("OpenAPI parser message: {}", m));
    }
    validate(openAPI);
    return openAPI;
  }

  private static ParseOptions options() {
    ParseOptions options = new ParseOptions();
    // Remote and relative references are inlined; local component references are left to the
    // converter, which resolves them and breaks cycles.
    options.setResolve(true);
    return options;
  }
}
