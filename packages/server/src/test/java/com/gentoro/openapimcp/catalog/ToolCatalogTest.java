package com.gentoro.openapimcp.catalog;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.exception.SpecificationException;
import com.gentoro.openapimcp.model.HttpMethod;
import com.gentoro.openapimcp.model.ToolDefinition;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolCatalogTest {

  private static ToolDefinition tool(String name, HttpMethod method, String path) {
    return ToolDefinition.builder().name(name).method(method).pathTemplate(path).build();
  }

  @Test
  void lookupAndOrder() {
    ToolDefinition a = tool("a", HttpMethod.GET, "/a");
    ToolDefinition b = tool("b", HttpMethod.POST, "/b");

    ToolCatalog catalog = ToolCatalog.build(List.of(a, b));

    assertEquals(2, catalog.size());
    assertEquals(List.of(a, b), catalog.all());
    assertSame(b, catalog.byName("b").orElseThrow());
    assertTrue(catalog.byName("missing").isEmpty());
    assertTrue(catalog.byName(null).isEmpty());
  }

  @Test
  void lastWinsKeepsBothEntriesButLaterOwnsTheName() {
    ToolDefinition first = tool("fetch", HttpMethod.GET, "/a");
    ToolDefinition second = tool("fetch", HttpMethod.GET, "/b");

    ToolCatalog catalog = ToolCatalog.build(List.of(first, second), DuplicateNamePolicy.LAST_WINS);

    assertEquals(2, catalog.size());
    assertEquals(List.of(first, second), catalog.all());
    assertSame(second, catalog.byName("fetch").orElseThrow());
    assertEquals(List.of(second), catalog.reachable());
  }

  @Test
  void failPolicyRejectsDuplicates() {
    List<ToolDefinition> tools =
        List.of(tool("fetch", HttpMethod.GET, "/a"), tool("fetch", HttpMethod.DELETE, "/b"));

    SpecificationException e =
        assertThrows(
            SpecificationException.class,
            () -> ToolCatalog.build(tools, DuplicateNamePolicy.FAIL));
    assertTrue(e.getMessage().contains("fetch"));
  }

  @Test
  void catalogIsImmutable() {
    ToolCatalog catalog = ToolCatalog.build(List.of(tool("a", HttpMethod.GET, "/a")));

    assertThrows(
        UnsupportedOperationException.class,
        () -> catalog.all().add(tool("b", HttpMethod.GET, "/b")));
  }

  @Test
  void emptyCatalog() {
    ToolCatalog catalog = ToolCatalog.build(null);

    assertEquals(0, catalog.size());
    assertTrue(catalog.all().isEmpty());
  }

  @Test
  void policyParsing() {
    assertEquals(DuplicateNamePolicy.LAST_WINS, DuplicateNamePolicy.parse(null));
    assertEquals(DuplicateNamePolicy.LAST_WINS, DuplicateNamePolicy.parse("last-wins"));
    assertEquals(DuplicateNamePolicy.FAIL, DuplicateNamePolicy.parse("FAIL"));
    assertThrows(ConfigException.class, () -> DuplicateNamePolicy.parse("first-wins"));
  }
}
