package com.kvrestore.core.launcher;

import com.kvrestore.core.config.ScopedConfig;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line options layered over {@link ScopedConfig}.
 *
 * <p>{@code --source-table orders} and {@code --source-table=orders} both set the key {@code
 * SOURCE_TABLE}; an option always wins over configuration.
 */
public class CommandArgs {

  private final Map<String, String> options;

  private CommandArgs(Map<String, String> options) {
    this.options = options;
  }

  public static CommandArgs parse(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new IllegalArgumentException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      String value;
      int eq = name.indexOf('=');
      if (eq >= 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        value = args[++i];
      } else {
        throw new IllegalArgumentException("Missing value for option --" + name);
      }
      options.put(toKey(name), value);
    }
    return new CommandArgs(options);
  }

  static String toKey(String optionName) {
    return optionName.replace('-', '_').toUpperCase(Locale.ROOT);
  }

  public String require(String key) {
    String value = options.get(key);
    return value != null ? value : ScopedConfig.require(key);
  }

  public String getOrDefault(String key, String defaultValue) {
    String value = options.get(key);
    return value != null ? value : ScopedConfig.getOrDefault(key, defaultValue);
  }

  public Optional<String> find(String key) {
    String value = options.get(key);
    if (value != null) {
      return Optional.of(value);
    }
    return ScopedConfig.exists(key) ? Optional.of(ScopedConfig.require(key)) : Optional.empty();
  }

  public int getInt(String key, int defaultValue) {
    String value = options.get(key);
    if (value == null) {
      return ScopedConfig.getInt(key, defaultValue);
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option " + key + " is not an integer: " + value, e);
    }
  }

  public Duration getSeconds(String key, Duration defaultValue) {
    return Duration.ofSeconds(getInt(key, (int) defaultValue.toSeconds()));
  }

  public Map<String, String> options() {
    return Collections.unmodifiableMap(options);
  }
}
