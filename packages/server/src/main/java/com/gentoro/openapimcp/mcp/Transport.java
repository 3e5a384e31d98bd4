package com.gentoro.openapimcp.mcp;

import com.gentoro.openapimcp.exception.ConfigException;
import java.util.Locale;

/** How MCP clients reach the server. */
public enum Transport {
  STDIO("stdio"),
  STREAMABLE_HTTP("streamable-http");

  private final String cliName;

  Transport(String cliName) {
    this.cliName = cliName;
  }

  public String cliName() {
    return cliName;
  }

  /** Accepts {@code stdio}, {@code streamable-http}, and {@code http} / {@code sse} as aliases. */
  public static Transport parse(String value) {
    if (value == null || value.isBlank()) return STDIO;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "stdio" -> STDIO;
      case "streamable-http", "http", "sse" -> STREAMABLE_HTTP;
      default -> throw new ConfigException(
          "Unknown transport '" + value + "', expected stdio or streamable-http");
    };
  }
}
