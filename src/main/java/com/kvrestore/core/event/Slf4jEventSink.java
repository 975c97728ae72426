package com.kvrestore.core.event;

import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders events as {@code [stage] message key=value ...} log lines. */
public class Slf4jEventSink implements EventSink {

  private static final Logger log = LoggerFactory.getLogger("com.kvrestore.events");

  @Override
  public void emit(RecoveryEvent event) {
    String line = render(event);
    Throwable cause = event.getCause();
    switch (event.getSeverity()) {
      case DEBUG -> log.debug(line, cause);
      case INFO -> log.info(line, cause);
      case WARN -> log.warn(line, cause);
      case ERROR -> log.error(line, cause);
    }
  }

  static String render(RecoveryEvent event) {
    StringBuilder line =
        new StringBuilder("[").append(event.getStage()).append("] ").append(event.getMessage());
    Map<String, Object> fields = event.getFields();
    if (!fields.isEmpty()) {
      line.append(' ')
          .append(
              fields.entrySet().stream()
                  .map(e -> e.getKey() + "=" + e.getValue())
                  .collect(Collectors.joining(" ")));
    }
    return line.toString();
  }
}
