package com.gentoro.openapimcp.catalog;

import com.gentoro.openapimcp.exception.SpecificationException;
import com.gentoro.openapimcp.model.ToolDefinition;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collection of tools plus a name-keyed lookup.
 *
 * <p>Built once at startup; every accessor is a plain read, so instances are safe to share
 * between concurrent tool calls without synchronization.
 */
public final class ToolCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(ToolCatalog.class);

  private final List<ToolDefinition> tools;
  private final Map<String, ToolDefinition> byName;

  private ToolCatalog(List<ToolDefinition> tools, Map<String, ToolDefinition> byName) {
    this.tools = tools;
    this.byName = byName;
  }

  public static ToolCatalog build(List<ToolDefinition> definitions) {
    return build(definitions, DuplicateNamePolicy.LAST_WINS);
  }

  public static ToolCatalog build(List<ToolDefinition> definitions, DuplicateNamePolicy policy) {
    List<ToolDefinition> ordered = definitions == null ? List.of() : List.copyOf(definitions);
    Map<String, ToolDefinition> lookup = new HashMap<>();
    for (ToolDefinition tool : ordered) {
      ToolDefinition previous = lookup.put(tool.name(), tool);
      if (previous != null) {
        if (policy == DuplicateNamePolicy.FAIL) {
          throw new SpecificationException(
              "Duplicate tool name '%s' produced by %s %s and %s %s"
                  .formatted(
                      tool.name(),
                      previous.method(),
                      previous.pathTemplate(),
                      tool.method(),
                      tool.pathTemplate()));
        }
        log.warn(
            "Duplicate tool name '{}': {} {} shadows {} {}",
            tool.name(),
            tool.method(),
            tool.pathTemplate(),
            previous.method(),
            previous.pathTemplate());
      }
    }
    return new ToolCatalog(ordered, Collections.unmodifiableMap(lookup));
  }

  public Optional<ToolDefinition> byName(String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(byName.get(name));
  }

  /** All tools in extraction order, duplicates included. */
  public List<ToolDefinition> all() {
    return tools;
  }

  /**
   * Tools whose name resolves to themselves, in extraction order. Equals {@link #all()} unless a
   * later duplicate shadowed an earlier entry.
   */
  public List<ToolDefinition> reachable() {
    return tools.stream().filter(t -> byName.get(t.name()) == t).toList();
  }

  public int size() {
    return tools.size();
  }
}
