package com.gentoro.openapimcp.openapi;

import com.gentoro.openapimcp.model.ToolSchema;
import io.swagger.v3.oas.models.media.Schema;
import java.util.ArrayDeque;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites OpenAPI schema objects into {@link ToolSchema}s.
 *
 * <p>Conversion never fails. Unknown kinds, unresolvable references and reference cycles all
 * degrade to the generic object schema, so the result is always finite and always typed.
 */
public class SchemaConverter {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(SchemaConverter.class);

  private final ComponentResolver resolver;

  public SchemaConverter() {
    this(ComponentResolver.empty());
  }

  public SchemaConverter(ComponentResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public ToolSchema convert(Schema<?> schema) {
    return convert(schema, new ArrayDeque<>());
  }

  private ToolSchema convert(Schema<?> schema, Deque<String> resolving) {
    if (schema == null) {
      return ToolSchema.genericObject();
    }
    if (schema.get$ref() != null) {
      return convertReference(schema.get$ref(), resolving);
    }

    ToolSchema.Type declared = declaredType(schema);
    ToolSchema.Builder builder = ToolSchema.builder();

    if (isUnion(schema)) {
      builder.type(declared == null ? ToolSchema.Type.OBJECT : declared);
      if (notEmpty(schema.getOneOf())) builder.oneOf(convertAll(schema.getOneOf(), resolving));
      if (notEmpty(schema.getAnyOf())) builder.anyOf(convertAll(schema.getAnyOf(), resolving));
      if (notEmpty(schema.getAllOf())) builder.allOf(convertAll(schema.getAllOf(), resolving));
    } else if (declared == null) {
      if (schema.getProperties() != null && !schema.getProperties().isEmpty()) {
        convertObject(schema, builder, resolving);
      } else {
        builder.type(ToolSchema.Type.OBJECT);
      }
    } else {
      switch (declared) {
        case OBJECT -> convertObject(schema, builder, resolving);
        case ARRAY -> {
          builder.type(ToolSchema.Type.ARRAY);
          if (schema.getItems() != null) {
            builder.items(convert(schema.getItems(), resolving));
          }
        }
        default -> {
          builder.type(declared);
          builder.format(schema.getFormat());
          builder.enumValues(enumValues(schema.getEnum(), schema.getFormat()));
        }
      }
    }

    builder.title(schema.getTitle());
    builder.description(schema.getDescription());
    return builder.build();
  }

  private ToolSchema convertReference(String ref, Deque<String> resolving) {
    if (resolving.contains(ref)) {
      log.debug("Breaking schema reference cycle at {}", ref);
      return ToolSchema.genericObject();
    }
    Schema<?> target = resolver.schema(ref).orElse(null);
    if (target == null) {
      log.warn("Schema reference could not be resolved, using a generic object: {}", ref);
      return ToolSchema.genericObject();
    }
    resolving.push(ref);
    try {
      return convert(target, resolving);
    } finally {
      resolving.pop();
    }
  }

  @SuppressWarnings("rawtypes")
  private void convertObject(Schema<?> schema, ToolSchema.Builder builder, Deque<String> resolving) {
    builder.type(ToolSchema.Type.OBJECT);
    Map<String, Schema> properties = schema.getProperties();
    if (properties != null) {
      properties.forEach((name, property) -> builder.property(name, convert(property, resolving)));
    }
    List<String> required = schema.getRequired();
    if (required != null) {
      for (String name : required) {
        if (properties == null || properties.containsKey(name)) {
          builder.required(name);
        } else {
          log.debug("Dropping required entry '{}' that is not a declared property", name);
        }
      }
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<ToolSchema> convertAll(List<Schema> members, Deque<String> resolving) {
    List<ToolSchema> result = new ArrayList<>(members.size());
    for (Schema member : members) {
      result.add(convert((Schema<?>) member, resolving));
    }
    return result;
  }

  private static boolean isUnion(Schema<?> schema) {
    return notEmpty(schema.getOneOf()) || notEmpty(schema.getAnyOf()) || notEmpty(schema.getAllOf());
  }

  private static boolean notEmpty(List<?> list) {
    return list != null && !list.isEmpty();
  }

  /** Declared kind of the schema; OpenAPI 3.1 type arrays use their first non-null entry. */
  static ToolSchema.Type declaredType(Schema<?> schema) {
    if (schema.getType() != null) {
      return ToolSchema.Type.fromWireName(schema.getType());
    }
    Set<String> types = schema.getTypes();
    if (types != null) {
      for (String t : types) {
        if (t != null && !"null".equals(t)) {
          return ToolSchema.Type.fromWireName(t);
        }
      }
    }
    return null;
  }

  /**
   * Enum entries as JSON scalars. swagger-parser types {@code date}, {@code date-time} and {@code
   * byte} values; those are written back in their ISO-8601 / base64 wire form.
   */
  static List<Object> enumValues(List<?> source, String format) {
    if (source == null) return null;
    List<Object> values = new ArrayList<>();
    for (Object v : source) {
      if (v == null) continue;
      if (v instanceof String || v instanceof Number || v instanceof Boolean) {
        values.add(v);
      } else if (v instanceof Date date) {
        values.add(
            "date".equals(format)
                ? date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate().toString()
                : date.toInstant().toString());
      } else if (v instanceof OffsetDateTime dateTime) {
        values.add(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime));
      } else if (v instanceof TemporalAccessor temporal) {
        values.add(temporal.toString());
      } else if (v instanceof byte[] bytes) {
        values.add(Base64.getEncoder().encodeToString(bytes));
      } else {
        values.add(String.valueOf(v));
      }
    }
    return values;
  }
}
