package com.gentoro.openapimcp.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolSchemaTest {

  @Test
  void rendersOnlyDeclaredKeys() {
    ToolSchema schema =
        ToolSchema.builder()
            .type(ToolSchema.Type.OBJECT)
            .property(
                "status",
                ToolSchema.builder()
                    .type(ToolSchema.Type.STRING)
                    .enumValues(List.of("active", "disabled"))
                    .build())
            .property(
                "tags",
                ToolSchema.builder()
                    .type(ToolSchema.Type.ARRAY)
                    .items(ToolSchema.builder().type(ToolSchema.Type.STRING).build())
                    .build())
            .required("status")
            .required("status")
            .description("Filter")
            .build();

    assertEquals(
        Map.of(
            "type", "object",
            "properties",
                Map.of(
                    "status", Map.of("type", "string", "enum", List.of("active", "disabled")),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string"))),
            "required", List.of("status"),
            "description", "Filter"),
        schema.toMap());
  }

  @Test
  void emptyEnumIsDropped() {
    ToolSchema schema = ToolSchema.builder().type(ToolSchema.Type.STRING).enumValues(List.of()).build();
    assertNull(schema.getEnumValues());
    assertEquals(Map.of("type", "string"), schema.toMap());
  }

  @Test
  void missingTypeDefaultsToObject() {
    assertEquals(ToolSchema.Type.OBJECT, ToolSchema.builder().build().getType());
    assertEquals(ToolSchema.genericObject(), ToolSchema.builder().type(ToolSchema.Type.OBJECT).build());
  }

  @Test
  void wireNames() {
    assertEquals(ToolSchema.Type.INTEGER, ToolSchema.Type.fromWireName(" Integer "));
    assertNull(ToolSchema.Type.fromWireName("null"));
    assertEquals("boolean", ToolSchema.Type.BOOLEAN.wireName());
  }

  @Test
  void toBuilderCopiesAndOverrides() {
    ToolSchema base = ToolSchema.builder().type(ToolSchema.Type.INTEGER).format("int32").build();
    ToolSchema described = base.toBuilder().description("Page number").build();

    assertEquals("int32", described.getFormat());
    assertEquals("Page number", described.getDescription());
    assertNull(base.getDescription());
  }

  @Test
  void builtSchemaIsDetachedFromItsBuilder() {
    List<Object> values = new ArrayList<>(List.of("a"));
    ToolSchema.Builder builder =
        ToolSchema.builder()
            .type(ToolSchema.Type.OBJECT)
            .property("a", ToolSchema.builder().type(ToolSchema.Type.STRING).build())
            .enumValues(values);
    ToolSchema built = builder.build();

    builder.property("b", ToolSchema.builder().type(ToolSchema.Type.STRING).build());
    values.add("b");

    assertEquals(List.of("a"), List.copyOf(built.getProperties().keySet()));
    assertEquals(List.of("a"), built.getEnumValues());
    assertThrows(UnsupportedOperationException.class, () -> built.getProperties().clear());
  }

  @Test
  void nullEnumEntriesAreDropped() {
    ToolSchema schema =
        ToolSchema.builder()
            .type(ToolSchema.Type.STRING)
            .enumValues(Arrays.<Object>asList("x", null))
            .build();
    assertEquals(List.of("x"), schema.getEnumValues());

    ToolSchema onlyNull =
        ToolSchema.builder().type(ToolSchema.Type.STRING).enumValues(Arrays.asList((Object) null)).build();
    assertNull(onlyNull.getEnumValues());
  }
}
