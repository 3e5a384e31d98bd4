package com.gentoro.openapimcp.utility;

public class StringUtility {

  /**
   * Removes exactly one leading and one trailing double quote, each only if present. {@code
   * "\"a\""} becomes {@code a}, {@code "\"a"} becomes {@code a}, {@code "a"} is unchanged.
   */
  public static String stripEnclosingQuotes(String input) {
    if (input == null || input.isEmpty()) return input;
    int start = input.charAt(0) == '"' ? 1 : 0;
    int end = input.length();
    if (end > start && input.charAt(end - 1) == '"') end--;
    return input.substring(start, end);
  }

  public static boolean isBlank(String input) {
    return input == null || input.isBlank();
  }

  /** First non-blank value, or {@code null}. */
  public static String firstNonBlank(String... values) {
    if (values == null) return null;
    for (String v : values) {
      if (!isBlank(v)) return v.trim();
    }
    return null;
  }
}
