package com.gentoro.openapimcp.openapi;

import static org.junit.jupiter.api.Assertions.*;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import org.junit.jupiter.api.Test;

class ComponentResolverTest {

  @Test
  void followsChainedParameterReferences() {
    Components components =
        new Components()
            .addParameters("Alias", new Parameter().$ref("#/components/parameters/Limit"))
            .addParameters("Limit", new Parameter().name("limit").in("query"));
    ComponentResolver resolver = new ComponentResolver(components);

    Parameter resolved =
        resolver.parameter(new Parameter().$ref("#/components/parameters/Alias")).orElseThrow();

    assertEquals("limit", resolved.getName());
  }

  @Test
  void parameterReferenceLoopIsEmpty() {
    Components components =
        new Components()
            .addParameters("A", new Parameter().$ref("#/components/parameters/B"))
            .addParameters("B", new Parameter().$ref("#/components/parameters/A"));
    ComponentResolver resolver = new ComponentResolver(components);

    assertTrue(resolver.parameter(new Parameter().$ref("#/components/parameters/A")).isEmpty());
  }

  @Test
  void inlineValuesAreReturnedAsIs() {
    Parameter inline = new Parameter().name("id").in("path");

    assertSame(inline, ComponentResolver.empty().parameter(inline).orElseThrow());
  }

  @Test
  void missingRequestBodyIsEmpty() {
    ComponentResolver resolver = new ComponentResolver(new Components());

    assertTrue(
        resolver
            .requestBody(new RequestBody().$ref("#/components/requestBodies/Missing"))
            .isEmpty());
  }

  @Test
  void remoteReferencesAreNotResolved() {
    assertNull(ComponentResolver.localName("other.yaml#/components/schemas/X", "#/components/schemas/"));
    assertNull(ComponentResolver.localName("#/paths/~1users", "#/components/schemas/"));
    assertEquals("X", ComponentResolver.localName("#/components/schemas/X", "#/components/schemas/"));
  }
}
