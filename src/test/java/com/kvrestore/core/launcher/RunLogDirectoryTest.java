package com.kvrestore.core.launcher;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.FileAppender;
import com.kvrestore.core.config.ConfigKeys;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

class RunLogDirectoryTest {

  private static final URL CONFIGURATION = RunLogDirectoryTest.class.getResource("/logback.xml");

  @TempDir Path tempDir;

  private String previous;
  private LoggerContext context;

  @BeforeEach
  void setUp() throws Exception {
    previous = System.getProperty(ConfigKeys.LOG_DIR);
    System.setProperty(ConfigKeys.LOG_DIR, tempDir.resolve("startup").toString());
    context = new LoggerContext();
    JoranConfigurator configurator = new JoranConfigurator();
    configurator.setContext(context);
    configurator.doConfigure(CONFIGURATION);
  }

  @AfterEach
  void tearDown() {
    context.stop();
    if (previous == null) {
      System.clearProperty(ConfigKeys.LOG_DIR);
    } else {
      System.setProperty(ConfigKeys.LOG_DIR, previous);
    }
  }

  private Path fileLog() {
    FileAppender<?> appender =
        (FileAppender<?>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("FILE");
    return Path.of(appender.getFile());
  }

  @Test
  @DisplayName("The file log follows the directory resolved for error artifacts")
  void movesFileLog() {
    // given
    Path runDir = tempDir.resolve("run");
    assertThat(fileLog()).isEqualTo(tempDir.resolve("startup").resolve("kvrestore.log"));

    // when
    boolean moved = RunLogDirectory.redirect(context, CONFIGURATION, runDir);

    // then
    assertThat(moved).isTrue();
    assertThat(context.getProperty(RunLogDirectory.LOG_DIR_PROPERTY)).isEqualTo(runDir.toString());
    assertThat(fileLog()).isEqualTo(runDir.resolve("kvrestore.log"));
    assertThat(Files.exists(runDir.resolve("kvrestore.log"))).isTrue();
    assertThat(System.getProperty(ConfigKeys.LOG_DIR)).isEqualTo(runDir.toString());
  }

  @Test
  @DisplayName("Nothing is reloaded when the log is already in that directory")
  void keepsSameDirectory() {
    boolean moved = RunLogDirectory.redirect(context, CONFIGURATION, tempDir.resolve("startup"));

    assertThat(moved).isFalse();
    assertThat(fileLog()).isEqualTo(tempDir.resolve("startup").resolve("kvrestore.log"));
  }

  @Test
  @DisplayName("A configuration without a file log is left alone")
  void ignoresConfigurationWithoutFileLog() {
    LoggerContext consoleOnly = new LoggerContext();

    boolean moved = RunLogDirectory.redirect(consoleOnly, CONFIGURATION, tempDir.resolve("run"));

    assertThat(moved).isFalse();
    assertThat(System.getProperty(ConfigKeys.LOG_DIR)).isEqualTo(tempDir.resolve("startup").toString());
  }
}
