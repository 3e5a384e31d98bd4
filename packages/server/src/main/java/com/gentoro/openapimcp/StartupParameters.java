package com.gentoro.openapimcp;

import com.gentoro.openapimcp.exception.ConfigException;
import com.gentoro.openapimcp.mcp.Transport;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line of the application: {@code [command] [--name value]... [--debug]}.
 *
 * <p>Commands are {@code run} (default), {@code validate}, {@code list-tools} and {@code help}.
 * Options: {@code --spec-path}, {@code --base-url}, {@code --config-file}, {@code --transport}
 * (alias {@code --mode}), {@code --port} and the {@code --debug} flag.
 */
public class StartupParameters {

  public enum Command {
    RUN("run"),
    VALIDATE("validate"),
    LIST_TOOLS("list-tools"),
    HELP("help");

    private final String cliName;

    Command(String cliName) {
      this.cliName = cliName;
    }

    public String cliName() {
      return cliName;
    }

    static Command parse(String value) {
      for (Command c : values()) {
        if (c.cliName.equals(value.toLowerCase(Locale.ROOT))) return c;
      }
      throw new ConfigException(
          "Unknown command '" + value + "', expected run, validate, list-tools or help");
    }
  }

  private static final Set<String> FLAGS = Set.of("debug", "help");

  final Map<String, Object> parameters = new HashMap<>();
  private Command command = Command.RUN;

  {
    parameters.put("config-file", "classpath:application.yaml");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments == null ? new String[0] : arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    boolean commandSeen = false;
    for (int p = 0; p < arguments.length; p++) {
      String argument = arguments[p];
      if (!argument.startsWith("--")) {
        if (commandSeen) {
          throw new ConfigException("Unexpected argument: " + argument);
        }
        command = Command.parse(argument);
        commandSeen = true;
        continue;
      }

      String paramName = argument.substring(2);
      String paramValue = null;
      int eq = paramName.indexOf('=');
      if (eq > 0) {
        paramValue = paramName.substring(eq + 1);
        paramName = paramName.substring(0, eq);
      } else if (FLAGS.contains(paramName)) {
        paramValue = "true";
      } else if (p < arguments.length - 1) {
        paramValue = arguments[p + 1];
        p++;
      } else {
        throw new ConfigException("Missing value for --" + paramName);
      }

      if ("mode".equals(paramName)) {
        paramName = "transport";
      }
      result.put(paramName, paramValue);
    }
    if (Boolean.parseBoolean(String.valueOf(result.get("help")))) {
      command = Command.HELP;
    }
    return result;
  }

  private void validate() {
    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new ConfigException("Missing config file location");
    }
    if (parameters.containsKey("transport")) {
      Transport.parse((String) parameters.get("transport"));
    }
    if (parameters.containsKey("port")) {
      port();
    }
  }

  public Command command() {
    return command;
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/openapi-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public Optional<String> specPath() {
    return getOptionalParameter("spec-path", String.class).filter(s -> !s.isBlank());
  }

  public Optional<String> baseUrl() {
    return getOptionalParameter("base-url", String.class).filter(s -> !s.isBlank());
  }

  public Optional<Transport> transport() {
    return getOptionalParameter("transport", String.class).map(Transport::parse);
  }

  public Optional<Integer> port() {
    return getOptionalParameter("port", String.class)
        .map(
            value -> {
              try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65535) throw new NumberFormatException(value);
                return port;
              } catch (NumberFormatException e) {
                throw new ConfigException("Invalid --port value: " + value, e);
              }
            });
  }

  public boolean debug() {
    return Boolean.parseBoolean(String.valueOf(parameters.get("debug")));
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: openapi-mcp [run|validate|list-tools|help] [options]",
        "",
        "Options:",
        "  --spec-path <file|url>     OpenAPI 3.x description (JSON or YAML)",
        "  --base-url <url>           Override the API base URL",
        "  --config-file <location>   YAML configuration (default classpath:application.yaml)",
        "  --transport <mode>         stdio (default) or streamable-http",
        "  --port <port>              Port for streamable-http (default 8080)",
        "  --debug                    Enable debug logging");
  }
}
