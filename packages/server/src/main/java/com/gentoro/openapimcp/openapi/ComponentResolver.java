package com.gentoro.openapimcp.openapi;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Looks up local {@code #/components/...} references of a parsed description.
 *
 * <p>Only references into the same document are resolved. Anything else (remote files, JSON
 * pointers into paths) yields an empty result and is left to the caller's degradation policy.
 */
public class ComponentResolver {
  static final String SCHEMAS = "#/components/schemas/";
  static final String PARAMETERS = "#/components/parameters/";
  static final String REQUEST_BODIES = "#/components/requestBodies/";

  private final Components components;

  public ComponentResolver(OpenAPI openAPI) {
    this(openAPI == null ? null : openAPI.getComponents());
  }

  public ComponentResolver(Components components) {
    this.components = components;
  }

  /** A resolver for a description without components; every lookup is empty. */
  public static ComponentResolver empty() {
    return new ComponentResolver((Components) null);
  }

  /** Resolves a schema reference one level, without following the target's own reference. */
  public Optional<Schema<?>> schema(String ref) {
    if (components == null || components.getSchemas() == null) return Optional.empty();
    String name = localName(ref, SCHEMAS);
    if (name == null) return Optional.empty();
    return Optional.ofNullable(components.getSchemas().get(name));
  }

  /** Resolves a parameter, following chained references. */
  public Optional<Parameter> parameter(Parameter parameter) {
    return follow(
        parameter,
        Parameter::get$ref,
        PARAMETERS,
        components == null ? null : components.getParameters());
  }

  /** Resolves a request body, following chained references. */
  public Optional<RequestBody> requestBody(RequestBody requestBody) {
    return follow(
        requestBody,
        RequestBody::get$ref,
        REQUEST_BODIES,
        components == null ? null : components.getRequestBodies());
  }

  private static <T> Optional<T> follow(
      T start, Function<T, String> refOf, String prefix, Map<String, T> table) {
    T current = start;
    Set<String> seen = new HashSet<>();
    while (current != null && refOf.apply(current) != null) {
      String ref = refOf.apply(current);
      String name = localName(ref, prefix);
      if (name == null || table == null || !seen.add(name)) return Optional.empty();
      current = table.get(name);
    }
    return Optional.ofNullable(current);
  }

  static String localName(String ref, String prefix) {
    if (ref == null) return null;
    if (ref.startsWith(prefix)) {
      String name = ref.substring(prefix.length());
      return name.isEmpty() || name.contains("/") ? null : name;
    }
    // swagger-parser keeps a bare component name as-is in some code paths
    return ref.contains("/") || ref.contains("#") || ref.isBlank() ? null : ref;
  }
}
