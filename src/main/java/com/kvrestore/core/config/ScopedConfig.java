package com.kvrestore.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cdimascio.dotenv.Dotenv;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScopedConfig {

  private static final Logger log = LoggerFactory.getLogger(ScopedConfig.class);

  static final String COMMON_KEY = "common";
  static final String CONFIG_FILE = "kvrestore.json";

  private static final Dotenv dotenv;
  private static final Map<String, Map<String, String>> jsonConfig;
  private static volatile String activeCommand;

  static {
    dotenv = Dotenv.configure().directory(".").filename(".env").ignoreIfMissing().load();
    jsonConfig = loadJsonConfig(CONFIG_FILE);

    log.debug("[CONFIG] dotenv loaded: {} entries", dotenv.entries().size());
    log.debug("[CONFIG] json loaded: {} sections", jsonConfig.size());
  }

  private ScopedConfig() {}

  public static void activateCommand(String commandName) {
    activeCommand = commandName;
    log.debug("[CONFIG] active command: {}", commandName);
  }

  public static String activeCommand() {
    return activeCommand;
  }

  /** Resolution order: System property → env var → .env → JSON[activeCommand] → JSON[common] */
  public static String require(String key) {
    String value = resolve(key);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Missing required config: " + key);
    }
    return value;
  }

  public static String getOrDefault(String key, String defaultValue) {
    String value = resolve(key);
    return (value != null && !value.isBlank()) ? value : defaultValue;
  }

  public static int getInt(String key, int defaultValue) {
    String value = resolve(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Config " + key + " is not an integer: " + value, e);
    }
  }

  public static Duration getSeconds(String key, Duration defaultValue) {
    return Duration.ofSeconds(getInt(key, (int) defaultValue.toSeconds()));
  }

  public static boolean exists(String key) {
    String value = resolve(key);
    return value != null && !value.isBlank();
  }

  private static String resolve(String key) {
    // 1. System property
    String value = System.getProperty(key);
    if (value != null) return value;

    // 2. Environment variable
    value = System.getenv(key);
    if (value != null) return value;

    // 3. .env file
    value = dotenv.get(key);
    if (value != null) return value;

    // 4. JSON: active command section
    if (activeCommand != null) {
      Map<String, String> commandSection = jsonConfig.get(activeCommand);
      if (commandSection != null) {
        value = commandSection.get(key);
        if (value != null) return value;
      }
    }

    // 5. JSON: common section
    Map<String, String> commonSection = jsonConfig.get(COMMON_KEY);
    if (commonSection != null) {
      value = commonSection.get(key);
      if (value != null) return value;
    }

    return null;
  }

  static Map<String, Map<String, String>> loadJsonConfig(String path) {
    File file = new File(path);
    if (!file.exists()) {
      return Collections.emptyMap();
    }
    try {
      ObjectMapper mapper = new ObjectMapper();
      return mapper.readValue(file, new TypeReference<>() {});
    } catch (IOException e) {
      log.error("[CONFIG] Failed to load {}: {}", path, e.getMessage());
      return Collections.emptyMap();
    }
  }
}
