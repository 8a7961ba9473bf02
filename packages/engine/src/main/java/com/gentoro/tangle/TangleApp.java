package com.gentoro.tangle;

import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.utility.StdoutUtility;
import java.io.PrintStream;

public class TangleApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(TangleApp.class);

  public static void main(String[] args) {
    System.exit(execute(args, System.out, System.err));
  }

  static int execute(String[] args, PrintStream out, PrintStream err) {
    Tangle app;
    try {
      app = new Tangle(args, out, err);
    } catch (IllegalArgumentException e) {
      StdoutUtility.printError(err, e.getMessage(), null);
      err.print(Tangle.usage());
      return Tangle.EXIT_FAILURE;
    }
    try {
      app.initialize();
      return app.run();
    } catch (Exception e) {
      log.error("Application failed", e);
      StdoutUtility.printError(err, "Application failed: " + e.getMessage(), null);
      return Tangle.EXIT_FAILURE;
    } finally {
      app.shutdown();
    }
  }
}
