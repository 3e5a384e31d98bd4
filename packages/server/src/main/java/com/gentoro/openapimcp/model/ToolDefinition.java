package com.gentoro.openapimcp.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One tool of the catalog, derived 1:1 from an OpenAPI operation.
 *
 * <p>Besides the name/description/input schema shown to MCP clients, the definition keeps what the
 * request builder needs to route arguments back onto the wire: the HTTP method, the raw path
 * template and the names of declared query parameters.
 */
public final class ToolDefinition {
  private final String name;
  private final String description;
  private final ToolSchema inputSchema;
  private final HttpMethod method;
  private final String pathTemplate;
  private final Set<String> queryParameters;
  private final boolean requestBodyDeclared;
  private final boolean multipartUpload;

  public ToolDefinition(
      String name,
      String description,
      ToolSchema inputSchema,
      HttpMethod method,
      String pathTemplate,
      Set<String> queryParameters,
      boolean requestBodyDeclared,
      boolean multipartUpload) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = description; // may be null
    this.inputSchema =
        inputSchema == null
            ? ToolSchema.builder().type(ToolSchema.Type.OBJECT).emptyProperties().build()
            : inputSchema;
    this.method = Objects.requireNonNull(method, "method");
    this.pathTemplate = Objects.requireNonNull(pathTemplate, "pathTemplate");
    this.queryParameters =
        queryParameters == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(queryParameters));
    this.requestBodyDeclared = requestBodyDeclared;
    this.multipartUpload = multipartUpload;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public ToolSchema inputSchema() {
    return inputSchema;
  }

  public HttpMethod method() {
    return method;
  }

  public String pathTemplate() {
    return pathTemplate;
  }

  public Set<String> queryParameters() {
    return queryParameters;
  }

  /** True when the operation's JSON request body is exposed as the {@code body} argument. */
  public boolean requestBodyDeclared() {
    return requestBodyDeclared;
  }

  /** True when the operation accepts {@code multipart/form-data}. */
  public boolean multipartUpload() {
    return multipartUpload;
  }

  @Override
  public String toString() {
    return name + " (" + method + " " + pathTemplate + ")";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private ToolSchema inputSchema;
    private HttpMethod method;
    private String pathTemplate;
    private final Set<String> queryParameters = new LinkedHashSet<>();
    private boolean requestBodyDeclared;
    private boolean multipartUpload;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder inputSchema(ToolSchema inputSchema) {
      this.inputSchema = inputSchema;
      return this;
    }

    public Builder method(HttpMethod method) {
      this.method = method;
      return this;
    }

    public Builder pathTemplate(String pathTemplate) {
      this.pathTemplate = pathTemplate;
      return this;
    }

    public Builder queryParameter(String name) {
      this.queryParameters.add(name);
      return this;
    }

    public Builder requestBodyDeclared(boolean requestBodyDeclared) {
      this.requestBodyDeclared = requestBodyDeclared;
      return this;
    }

    public Builder multipartUpload(boolean multipartUpload) {
      this.multipartUpload = multipartUpload;
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(
          name,
          description,
          inputSchema,
          method,
          pathTemplate,
          queryParameters,
          requestBodyDeclared,
          multipartUpload);
    }
  }
}
