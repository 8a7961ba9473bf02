package com.gentoro.tangle;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line in {@code --name value} form, with defaults and per-mode validation. */
public class StartupParameters {

  public static final Set<String> MODES = Set.of("outline", "expand", "cycles", "help");
  public static final Set<String> FORMATS = Set.of("json", "yaml");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "outline"); // outline, expand, cycles, help
    parameters.put("format", "json");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (isBlank("config-file")) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if (!"help".equals(mode) && isBlank("input")) {
      throw new IllegalArgumentException("Missing --input (markdown file or directory)");
    }

    if ("expand".equals(mode) && isBlank("block")) {
      throw new IllegalArgumentException("Mode 'expand' requires --block <identifier>");
    }

    Object format = parameters.get("format");
    if (format == null || !FORMATS.contains(format.toString())) {
      throw new IllegalArgumentException("Invalid format: " + format);
    }
  }

  private boolean isBlank(String name) {
    Object value = parameters.get(name);
    return value == null || value.toString().isBlank();
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/tangle.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
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
}
