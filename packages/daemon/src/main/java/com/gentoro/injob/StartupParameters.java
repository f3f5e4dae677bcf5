package com.gentoro.injob;

import com.gentoro.injob.exception.ConfigException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line parameters. Accepts {@code --name value} and {@code --name=value}; a flag without a
 * value is recorded as {@code "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        continue;
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq > 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public Map<String, String> parameters() {
    return Collections.unmodifiableMap(parameters);
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** Returns the parameter converted to String, Integer, Long or Boolean; {@code null} if absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    try {
      if (type == String.class) return type.cast(raw);
      if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
      if (type == Long.class) return type.cast(Long.valueOf(raw.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid value for --%s: %s".formatted(name, raw), e);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Configuration file passed with {@code --config}, or {@code null} to use the classpath. */
  public Path configFile() {
    String value = getParameter("config", String.class);
    return value == null || value.isBlank() ? null : Path.of(value.trim());
  }
}
