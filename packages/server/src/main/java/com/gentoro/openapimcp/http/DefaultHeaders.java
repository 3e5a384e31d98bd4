package com.gentoro.openapimcp.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.openapimcp.utility.JacksonUtility;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Headers sent with every tool call, assembled from configuration:
 *
 * <ul>
 *   <li>{@code Content-Type: application/json}
 *   <li>the API version header ({@code http.client.version-header.name} / {@code .value})
 *   <li>extra headers under {@code http.client.headers}, then the JSON object held by the {@code
 *       OPENAPI_MCP_HEADERS} environment variable
 *   <li>{@code Authorization: Bearer <api.key>} when a key is configured
 * </ul>
 *
 * Later entries override earlier ones with the same name.
 */
public final class DefaultHeaders {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(DefaultHeaders.class);

  public static final String HEADERS_ENV = "OPENAPI_MCP_HEADERS";

  private DefaultHeaders() {}

  public static Map<String, String> fromConfiguration(Configuration cfg) {
    return fromConfiguration(cfg, System::getenv);
  }

  public static Map<String, String> fromConfiguration(
      Configuration cfg, Function<String, String> environment) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");

    String versionName = value(cfg, "http.client.version-header.name");
    String versionValue = value(cfg, "http.client.version-header.value");
    if (versionName != null && versionValue != null) {
      headers.put(versionName, versionValue);
    }

    Configuration extra = cfg.subset("http.client.headers");
    for (Iterator<String> it = extra.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String v = value(extra, name);
      if (v != null) headers.put(name, v);
    }

    String fromEnv = environment.apply(HEADERS_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      try {
        Map<String, String> parsed =
            JacksonUtility.getJsonMapper()
                .readValue(fromEnv, new TypeReference<Map<String, String>>() {});
        headers.putAll(parsed);
      } catch (Exception e) {
        log.warn(
            "Ignoring {}: not a JSON object of string values ({})", HEADERS_ENV, e.getMessage());
      }
    }

    String apiKey = value(cfg, "api.key");
    if (apiKey != null) {
      log.debug("Adding Authorization header with Bearer token");
      headers.put("Authorization", "Bearer " + apiKey);
    } else {
      log.debug("No API key provided, skipping Authorization header");
    }
    return headers;
  }

  /** Non-blank configured value; an unresolved {@code ${...}} placeholder counts as absent. */
  static String value(Configuration cfg, String key) {
    String v = cfg.getString(key, null);
    if (v == null || v.isBlank() || v.trim().startsWith("${")) return null;
    return v.trim();
  }
}
