package com.gentoro.openapimcp.openapi;

import com.gentoro.openapimcp.model.HttpMethod;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.model.ToolSchema;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walks the path table of a description and produces one {@link ToolDefinition} per operation.
 *
 * <p>Parameters become top-level properties of the tool's input schema under their own names; a
 * JSON request body becomes the {@code body} property. Output order follows the document: paths
 * as declared, and per path the methods GET, POST, PUT, DELETE, PATCH.
 */
public class OperationExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(OperationExtractor.class);

  /** Property name under which a request body is exposed. */
  public static final String BODY_PROPERTY = "body";

  private static final String MULTIPART = "multipart/form-data";

  /** Validates the description and extracts its operations in document order. */
  public List<ToolDefinition> extract(OpenAPI openAPI) {
    OpenApiLoader.validate(openAPI);

    ComponentResolver resolver = new ComponentResolver(openAPI);
    SchemaConverter converter = new SchemaConverter(resolver);
    List<ToolDefinition> tools = new ArrayList<>();

    for (Map.Entry<String, PathItem> pathEntry : openAPI.getPaths().entrySet()) {
      String path = pathEntry.getKey();
      PathItem pathItem = pathEntry.getValue();
      if (pathItem == null) continue;

      for (Map.Entry<HttpMethod, Operation> op : operations(pathItem).entrySet()) {
        tools.add(
            toTool(path, op.getKey(), op.getValue(), pathItem.getParameters(), resolver, converter));
      }
    }

    log.debug("Converted {} OpenAPI operations to tools", tools.size());
    return tools;
  }

  /** Tool name for an operation: its operationId, or {@code method_path} with '/' as '_'. */
  public static String toolName(String operationId, HttpMethod method, String path) {
    if (operationId != null && !operationId.isBlank()) {
      return operationId;
    }
    return method.name().toLowerCase(Locale.ROOT) + "_" + path.replace('/', '_');
  }

  private ToolDefinition toTool(
      String path,
      HttpMethod method,
      Operation operation,
      List<Parameter> pathLevelParameters,
      ComponentResolver resolver,
      SchemaConverter converter) {
    String name = toolName(operation.getOperationId(), method, path);
    ToolDefinition.Builder tool =
        ToolDefinition.builder()
            .name(name)
            .description(
                operation.getDescription() != null
                    ? operation.getDescription()
                    : operation.getSummary())
            .method(method)
            .pathTemplate(path);

    ToolSchema.Builder input = ToolSchema.builder().type(ToolSchema.Type.OBJECT).emptyProperties();

    for (Parameter parameter :
        mergeParameters(name, pathLevelParameters, operation.getParameters(), resolver)) {
      input.property(parameter.getName(), parameterSchema(parameter, converter));
      if (Boolean.TRUE.equals(parameter.getRequired())) {
        input.required(parameter.getName());
      }
      if ("query".equalsIgnoreCase(parameter.getIn())) {
        tool.queryParameter(parameter.getName());
      }
    }

    if (method.carriesBody() && operation.getRequestBody() != null) {
      addRequestBody(name, operation.getRequestBody(), resolver, converter, input, tool);
    }

    return tool.inputSchema(input.build()).build();
  }

  /** Path-level parameters first, operation-level ones replacing those with the same name+in. */
  private List<Parameter> mergeParameters(
      String toolName,
      List<Parameter> pathLevel,
      List<Parameter> operationLevel,
      ComponentResolver resolver) {
    Map<String, Parameter> merged = new LinkedHashMap<>();
    for (List<Parameter> source : List.of(nullSafe(pathLevel), nullSafe(operationLevel))) {
      for (Parameter declared : source) {
        Parameter parameter = resolver.parameter(declared).orElse(null);
        if (parameter == null) {
          log.warn(
              "Parameter reference not supported, skipping it for tool {}: {}",
              toolName,
              declared.get$ref());
          continue;
        }
        if (parameter.getName() == null) {
          log.warn("Skipping unnamed parameter of tool {}", toolName);
          continue;
        }
        merged.put(parameter.getIn() + ":" + parameter.getName(), parameter);
      }
    }
    return new ArrayList<>(merged.values());
  }

  private ToolSchema parameterSchema(Parameter parameter, SchemaConverter converter) {
    Schema<?> schema = parameter.getSchema();
    if (schema == null) {
      schema = firstSchema(parameter.getContent());
    }
    ToolSchema converted =
        schema == null
            ? ToolSchema.builder().type(ToolSchema.Type.STRING).build()
            : converter.convert(schema);
    if (converted.getDescription() == null && parameter.getDescription() != null) {
      converted = converted.toBuilder().description(parameter.getDescription()).build();
    }
    return converted;
  }

  private void addRequestBody(
      String toolName,
      RequestBody declared,
      ComponentResolver resolver,
      SchemaConverter converter,
      ToolSchema.Builder input,
      ToolDefinition.Builder tool) {
    RequestBody requestBody = resolver.requestBody(declared).orElse(null);
    if (requestBody == null) {
      log.warn(
          "Request body reference not supported, using a generic object for tool {}: {}",
          toolName,
          declared.get$ref());
      input.property(BODY_PROPERTY, ToolSchema.genericObject());
      tool.requestBodyDeclared(true);
      return;
    }

    Content content = requestBody.getContent();
    if (content == null || content.isEmpty()) return;

    if (content.containsKey(MULTIPART)) {
      tool.multipartUpload(true);
    }

    Schema<?> jsonSchema = jsonSchema(content);
    if (jsonSchema != null) {
      input.property(BODY_PROPERTY, converter.convert(jsonSchema));
      tool.requestBodyDeclared(true);
      if (Boolean.TRUE.equals(requestBody.getRequired())) {
        input.required(BODY_PROPERTY);
      }
    }
  }

  /** Schema of {@code application/json}, else of the first {@code +json} media type. */
  private static Schema<?> jsonSchema(Content content) {
    MediaType json = content.get("application/json");
    if (json != null && json.getSchema() != null) {
      return json.getSchema();
    }
    for (Map.Entry<String, MediaType> entry : content.entrySet()) {
      if (isJson(entry.getKey()) && entry.getValue() != null && entry.getValue().getSchema() != null) {
        return entry.getValue().getSchema();
      }
    }
    return null;
  }

  private static Schema<?> firstSchema(Content content) {
    if (content == null) return null;
    for (MediaType media : content.values()) {
      if (media != null && media.getSchema() != null) {
        return media.getSchema();
      }
    }
    return null;
  }

  static boolean isJson(String mediaType) {
    if (mediaType == null) return false;
    String type = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return type.equals("application/json") || type.endsWith("+json");
  }

  private static Map<HttpMethod, Operation> operations(PathItem item) {
    Map<HttpMethod, Operation> ops = new LinkedHashMap<>();
    if (item.getGet() != null) ops.put(HttpMethod.GET, item.getGet());
    if (item.getPost() != null) ops.put(HttpMethod.POST, item.getPost());
    if (item.getPut() != null) ops.put(HttpMethod.PUT, item.getPut());
    if (item.getDelete() != null) ops.put(HttpMethod.DELETE, item.getDelete());
    if (item.getPatch() != null) ops.put(HttpMethod.PATCH, item.getPatch());
    return ops;
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
