package com.gentoro.openapimcp.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.exception.ValidationException;
import com.gentoro.openapimcp.model.ToolDefinition;
import com.gentoro.openapimcp.openapi.OperationExtractor;
import com.gentoro.openapimcp.utility.JacksonUtility;
import com.gentoro.openapimcp.utility.StringUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;

/**
 * Maps a tool name plus argument object back onto an HTTP request.
 *
 * <p>Arguments are routed by name: path placeholders first, then the query string for GET and
 * DELETE, and a JSON or multipart body for POST, PUT and PATCH. Keys starting with {@value
 * #RESERVED_PREFIX} are control arguments and never forwarded as fields. Instances are immutable
 * and shared by concurrent calls.
 */
public class RequestBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(RequestBuilder.class);

  public static final String RESERVED_PREFIX = "_";
  public static final String FILE_UPLOAD = "_file_upload";

  static final MediaType JSON = MediaType.get("application/json");
  static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}/]+)}");

  private final String baseUrl;
  private final Headers defaultHeaders;

  public RequestBuilder(String baseUrl, Map<String, String> defaultHeaders) {
    this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl").trim());
    try {
      this.defaultHeaders = Headers.of(defaultHeaders == null ? Map.of() : defaultHeaders);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid default header: " + e.getMessage(), e);
    }
    if (HttpUrl.parse(this.baseUrl) == null) {
      log.warn("Base URL is not an absolute http(s) URL, tool calls will fail: {}", baseUrl);
    }
  }

  public String baseUrl() {
    return baseUrl;
  }

  public RequestPlan build(ToolDefinition tool, ObjectNode arguments) {
    ObjectNode args = arguments == null ? JacksonUtility.getJsonMapper().createObjectNode() : arguments;

    Set<String> consumed = new HashSet<>();
    HttpUrl url = resolveUrl(tool, args, consumed);
    HttpUrl.Builder urlBuilder = url.newBuilder();
    Headers.Builder headers = defaultHeaders.newBuilder();

    if (!tool.method().carriesBody()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = args.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> field = it.next();
        if (forwarded(field, consumed)) {
          urlBuilder.addQueryParameter(field.getKey(), wireString(field.getValue()));
        }
      }
      return new RequestPlan(
          tool.method(), urlBuilder.build(), headers.build(), RequestPlan.BodyKind.NONE, null);
    }

    for (Iterator<Map.Entry<String, JsonNode>> it = args.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      if (!tool.queryParameters().contains(field.getKey())) continue;
      if (forwarded(field, consumed)) {
        urlBuilder.addQueryParameter(field.getKey(), wireString(field.getValue()));
      }
      consumed.add(field.getKey());
    }

    RequestPlan.BodyKind kind;
    RequestBody body;
    if (args.has(FILE_UPLOAD) && tool.multipartUpload()) {
      kind = RequestPlan.BodyKind.MULTIPART;
      body = multipartBody(args, consumed);
    } else {
      kind = RequestPlan.BodyKind.JSON;
      body = RequestBody.create(JacksonUtility.toJson(jsonBody(tool, args, consumed)), JSON);
    }
    MediaType contentType = body.contentType();
    if (contentType != null) {
      headers.set("Content-Type", contentType.toString());
    }
    return new RequestPlan(tool.method(), urlBuilder.build(), headers.build(), kind, body);
  }

  /**
   * String form of an argument on the wire. Strings pass through as-is; anything else is rendered
   * as compact JSON with one enclosing pair of double quotes removed.
   */
  public static String wireString(JsonNode value) {
    if (value == null || value.isMissingNode()) return "";
    if (value.isTextual()) return value.textValue();
    return StringUtility.stripEnclosingQuotes(JacksonUtility.toJson(value));
  }

  private HttpUrl resolveUrl(ToolDefinition tool, ObjectNode args, Set<String> consumed) {
    String template = tool.pathTemplate();
    Set<String> missing = new LinkedHashSet<>();
    StringBuilder path = new StringBuilder();
    Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      String name = matcher.group(1);
      JsonNode value = args.get(name);
      if (value == null || value.isNull()) {
        missing.add(name);
        matcher.appendReplacement(path, Matcher.quoteReplacement(matcher.group()));
      } else {
        consumed.add(name);
        matcher.appendReplacement(path, Matcher.quoteReplacement(wireString(value)));
      }
    }
    matcher.appendTail(path);

    if (!missing.isEmpty()) {
      throw new ConfigException(
          "Missing path parameter(s) " + missing + " for tool " + tool.name() + " (" + template + ")");
    }

    String full = baseUrl + (path.length() == 0 || path.charAt(0) == '/' ? "" : "/") + path;
    HttpUrl url = HttpUrl.parse(full);
    if (url == null) {
      throw new ConfigException("Invalid request URL for tool " + tool.name() + ": " + full);
    }
    return url;
  }

  private JsonNode jsonBody(ToolDefinition tool, ObjectNode args, Set<String> consumed) {
    if (tool.requestBodyDeclared() && args.has(OperationExtractor.BODY_PROPERTY)) {
      List<String> ignored = new ArrayList<>();
      args.fieldNames()
          .forEachRemaining(
              name -> {
                if (!name.equals(OperationExtractor.BODY_PROPERTY)
                    && !name.startsWith(RESERVED_PREFIX)
                    && !consumed.contains(name)) {
                  ignored.add(name);
                }
              });
      if (!ignored.isEmpty()) {
        log.debug("Tool {} sends its body argument only, not forwarding {}", tool.name(), ignored);
      }
      return args.get(OperationExtractor.BODY_PROPERTY);
    }

    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    for (Iterator<Map.Entry<String, JsonNode>> it = args.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      if (!field.getKey().startsWith(RESERVED_PREFIX) && !consumed.contains(field.getKey())) {
        body.set(field.getKey(), field.getValue());
      }
    }
    return body;
  }

  private RequestBody multipartBody(ObjectNode args, Set<String> consumed) {
    MultipartBody.Builder multipart = new MultipartBody.Builder().setType(MultipartBody.FORM);
    for (Iterator<Map.Entry<String, JsonNode>> it = args.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      if (FILE_UPLOAD.equals(field.getKey())) {
        JsonNode upload = field.getValue();
        if (upload == null || !upload.isTextual()) {
          throw new ValidationException(FILE_UPLOAD + " must be a string");
        }
        byte[] content = FileUploadDecoder.decode(upload.textValue());
        multipart.addFormDataPart("file", "upload", RequestBody.create(content, OCTET_STREAM));
      } else if (forwarded(field, consumed)) {
        multipart.addFormDataPart(field.getKey(), wireString(field.getValue()));
      }
    }
    return multipart.build();
  }

  private static boolean forwarded(Map.Entry<String, JsonNode> field, Set<String> consumed) {
    return !field.getKey().startsWith(RESERVED_PREFIX)
        && !consumed.contains(field.getKey())
        && field.getValue() != null
        && !field.getValue().isNull();
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
