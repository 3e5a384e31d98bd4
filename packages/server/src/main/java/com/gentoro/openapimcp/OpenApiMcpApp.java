package com.gentoro.openapimcp;

import com.gentoro.openapimcp.exception.ExceptionUtil;
import com.gentoro.openapimcp.utility.StdoutUtility;

public class OpenApiMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(OpenApiMcpApp.class);

  public static void main(String[] args) {
    OpenApiMcp app = null;
    try {
      app = new OpenApiMcp(args);
      StartupParameters.Command command = app.startupParameters().command();
      if (command != StartupParameters.Command.HELP) {
        app.initialize();
      }
      app.run();
      if (command != StartupParameters.Command.RUN) {
        app.shutdown();
      }
    } catch (Exception e) {
      log.error("Application failed", e);
      StdoutUtility.printError(ExceptionUtil.describe(e), null);
      if (app != null) app.shutdown();
      System.exit(1);
    }
  }
}
