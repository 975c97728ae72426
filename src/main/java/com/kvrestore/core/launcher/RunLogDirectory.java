package com.kvrestore.core.launcher;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.joran.util.ConfigurationWatchListUtil;
import com.kvrestore.core.config.ConfigKeys;
import java.net.URL;
import java.nio.file.Path;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the run log into the directory error artifacts are written to.
 *
 * <p>Logback starts before command options are parsed, so it only sees {@code KVRESTORE_LOG_DIR}
 * from the environment or a system property. Once the command has resolved the directory through
 * every configuration layer, the property is pinned and the logging configuration reloaded.
 */
public final class RunLogDirectory {

  private static final Logger log = LoggerFactory.getLogger(RunLogDirectory.class);
  static final String LOG_DIR_PROPERTY = "LOG_DIR";

  private RunLogDirectory() {}

  public static boolean redirect(Path directory) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      return false;
    }
    LoggerContext context = (LoggerContext) factory;
    return redirect(context, ConfigurationWatchListUtil.getMainWatchURL(context), directory);
  }

  /** Returns true when the configuration was reloaded with the new directory. */
  static boolean redirect(LoggerContext context, URL configuration, Path directory) {
    String current = context.getProperty(LOG_DIR_PROPERTY);
    // no file log configured (tests) or already in place
    if (current == null || configuration == null || Path.of(current).equals(directory)) {
      return false;
    }
    System.setProperty(ConfigKeys.LOG_DIR, directory.toString());
    context.reset();
    JoranConfigurator configurator = new JoranConfigurator();
    configurator.setContext(context);
    try {
      configurator.doConfigure(configuration);
    } catch (JoranException e) {
      throw new IllegalStateException("Failed to reload logging configuration " + configuration, e);
    }
    log.info("[RunLog] Run log moved from {} to {}", current, directory);
    return true;
  }
}
