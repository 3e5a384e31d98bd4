package com.gentoro.openapimcp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generic tool input schema: the subset of JSON Schema exposed to MCP clients.
 *
 * <p>Instances are immutable. Optional members are {@code null} when absent, never empty, so that
 * {@link #toMap()} emits only the keys the source schema actually declared.
 */
public final class ToolSchema {
  public enum Type {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Maps a JSON Schema type keyword to a kind, or {@code null} when it is not recognised. */
    public static Type fromWireName(String name) {
      if (name == null) return null;
      for (Type t : values()) {
        if (t.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return t;
      }
      return null;
    }
  }

  private final Type type;
  private final Map<String, ToolSchema> properties;
  private final List<String> required;
  private final ToolSchema items;
  private final List<Object> enumValues;
  private final String format;
  private final String title;
  private final String description;
  private final List<ToolSchema> oneOf;
  private final List<ToolSchema> anyOf;
  private final List<ToolSchema> allOf;

  private ToolSchema(Builder b) {
    this.type = b.type == null ? Type.OBJECT : b.type;
    this.properties =
        b.properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
    this.required = b.required == null ? null : List.copyOf(b.required);
    this.items = b.items;
    this.enumValues = copyEnum(b.enumValues);
    this.format = b.format;
    this.title = b.title;
    this.description = b.description;
    this.oneOf = b.oneOf == null ? null : List.copyOf(b.oneOf);
    this.anyOf = b.anyOf == null ? null : List.copyOf(b.anyOf);
    this.allOf = b.allOf == null ? null : List.copyOf(b.allOf);
  }

  private static List<Object> copyEnum(List<Object> values) {
    if (values == null) return null;
    List<Object> copy = values.stream().filter(Objects::nonNull).collect(Collectors.toList());
    return copy.isEmpty() ? null : Collections.unmodifiableList(copy);
  }

  /** The generic open object schema, {@code {"type": "object"}}. */
  public static ToolSchema genericObject() {
    return builder().type(Type.OBJECT).build();
  }

  public Type getType() {
    return type;
  }

  public Map<String, ToolSchema> getProperties() {
    return properties;
  }

  public List<String> getRequired() {
    return required;
  }

  public ToolSchema getItems() {
    return items;
  }

  public List<Object> getEnumValues() {
    return enumValues;
  }

  public String getFormat() {
    return format;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public List<ToolSchema> getOneOf() {
    return oneOf;
  }

  public List<ToolSchema> getAnyOf() {
    return anyOf;
  }

  public List<ToolSchema> getAllOf() {
    return allOf;
  }

  /** JSON-schema map, keys in a stable order, nested schemas rendered recursively. */
  public Map<String, Object> toMap() {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("type", type.wireName());
    if (format != null) result.put("format", format);
    if (enumValues != null) result.put("enum", enumValues);
    if (properties != null) {
      Map<String, Object> props = new LinkedHashMap<>();
      properties.forEach((name, schema) -> props.put(name, schema.toMap()));
      result.put("properties", props);
    }
    if (required != null) result.put("required", required);
    if (items != null) result.put("items", items.toMap());
    if (oneOf != null) result.put("oneOf", oneOf.stream().map(ToolSchema::toMap).toList());
    if (anyOf != null) result.put("anyOf", anyOf.stream().map(ToolSchema::toMap).toList());
    if (allOf != null) result.put("allOf", allOf.stream().map(ToolSchema::toMap).toList());
    if (title != null) result.put("title", title);
    if (description != null) result.put("description", description);
    return result;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.type = type;
    b.properties = properties == null ? null : new LinkedHashMap<>(properties);
    b.required = required == null ? null : new ArrayList<>(required);
    b.items = items;
    b.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
    b.format = format;
    b.title = title;
    b.description = description;
    b.oneOf = oneOf == null ? null : new ArrayList<>(oneOf);
    b.anyOf = anyOf == null ? null : new ArrayList<>(anyOf);
    b.allOf = allOf == null ? null : new ArrayList<>(allOf);
    return b;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolSchema that)) return false;
    return toMap().equals(that.toMap());
  }

  @Override
  public int hashCode() {
    return Objects.hash(toMap());
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Type type;
    private Map<String, ToolSchema> properties;
    private List<String> required;
    private ToolSchema items;
    private List<Object> enumValues;
    private String format;
    private String title;
    private String description;
    private List<ToolSchema> oneOf;
    private List<ToolSchema> anyOf;
    private List<ToolSchema> allOf;

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    /** Adds a property, keeping insertion order. */
    public Builder property(String name, ToolSchema schema) {
      if (this.properties == null) {
        this.properties = new LinkedHashMap<>();
      }
      this.properties.put(name, schema);
      return this;
    }

    /** Sets an empty properties map so that it is rendered even without members. */
    public Builder emptyProperties() {
      if (this.properties == null) {
        this.properties = new LinkedHashMap<>();
      }
      return this;
    }

    public Builder required(String name) {
      if (this.required == null) {
        this.required = new ArrayList<>();
      }
      if (!this.required.contains(name)) {
        this.required.add(name);
      }
      return this;
    }

    public Builder items(ToolSchema items) {
      this.items = items;
      return this;
    }

    public Builder enumValues(List<Object> enumValues) {
      this.enumValues = enumValues == null || enumValues.isEmpty() ? null : enumValues;
      return this;
    }

    public Builder format(String format) {
      this.format = format;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder oneOf(List<ToolSchema> oneOf) {
      this.oneOf = oneOf;
      return this;
    }

    public Builder anyOf(List<ToolSchema> anyOf) {
      this.anyOf = anyOf;
      return this;
    }

    public Builder allOf(List<ToolSchema> allOf) {
      this.allOf = allOf;
      return this;
    }

    public ToolSchema build() {
      return new ToolSchema(this);
    }
  }
}
