package com.gentoro.openapimcp.utility;

import com.gentoro.openapimcp.exception.ExceptionUtil;

/** Console output for the one-shot commands ({@code validate}, {@code list-tools}). */
public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  public static void printSuccessLine(String message) {
    System.out.print("✅ ");
    for (String line : message.split("\n")) {
      System.out.printf("%s%s%s%n", green, line, reset);
    }
  }

  public static void printNewLine(String message) {
    System.out.printf("%s%n", message);
  }

  public static void printError(String message, Throwable cause) {
    System.err.printf("❌ %s%s%s%n", red, message, reset);
    if (cause != null) {
      System.err.printf("  %s%s%s%n", red, ExceptionUtil.formatCompactStackTrace(cause), reset);
    }
  }
}
