package com.gentoro.openapimcp.model;

/** Introspection summary reported by {@code validate} and the MCP handshake. */
public record ServerDescription(String name, String version, int toolCount) {

  @Override
  public String toString() {
    return "Server: %s v%s%nTools: %d".formatted(name, version, toolCount);
  }
}
