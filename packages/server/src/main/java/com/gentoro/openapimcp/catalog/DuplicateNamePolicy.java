package com.gentoro.openapimcp.catalog;

import com.gentoro.openapimcp.exception.ConfigException;
import java.util.Locale;

/** What the catalog does when two operations map to the same tool name. */
public enum DuplicateNamePolicy {
  /** The later operation owns the name lookup; the ordered list keeps both entries. */
  LAST_WINS,
  /** Catalog construction fails. */
  FAIL;

  /** Parses {@code last-wins} / {@code fail} (case and separator insensitive). */
  public static DuplicateNamePolicy parse(String value) {
    if (value == null || value.isBlank()) return LAST_WINS;
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return DuplicateNamePolicy.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown duplicate name policy: " + value, e);
    }
  }
}
