package com.gentoro.nuggets;

import com.gentoro.nuggets.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Command line arguments in {@code --name value} form. Flags without a value map to "true". */
public class StartupParameters {

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = "true";

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if (!isParameterPresent("help") && !isParameterPresent("input")) {
      throw new ValidationException("Missing --input <file>; use --help for usage");
    }
  }

  /** Configuration location, e.g. "classpath:application.yaml" or "config/local.yaml". */
  public String configFile() {
    return getOptionalParameter("config-file").orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
