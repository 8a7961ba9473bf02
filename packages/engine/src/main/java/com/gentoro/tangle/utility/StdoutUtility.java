package com.gentoro.tangle.utility;

import com.gentoro.tangle.exception.ExceptionUtil;
import java.io.PrintStream;

/** Console output of the command line tool. Results go to stdout, problems to stderr. */
public class StdoutUtility {
  private static final String red = "\u001B[31m";
  private static final String yellow = "\u001B[33m";
  private static final String reset = "\u001B[0m";

  private StdoutUtility() {}

  public static void printResult(PrintStream out, String text) {
    out.print(text);
    if (!text.endsWith("\n")) out.println();
    out.flush();
  }

  public static void printWarning(PrintStream err, String message) {
    err.printf("%s%s%s%n", yellow, message, reset);
  }

  public static void printError(PrintStream err, String message, Throwable cause) {
    err.printf("%s%s%s%n", red, message, reset);
    if (cause != null) {
      err.printf("  %s%s%s%n", red, cause.getMessage(), reset);
      for (String line : ExceptionUtil.formatCompactStackTrace(cause, 3).split("\n")) {
        err.printf("  %s%s%s%n", red, line, reset);
      }
    }
  }
}
