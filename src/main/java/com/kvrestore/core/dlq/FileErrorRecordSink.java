package com.kvrestore.core.dlq;

import com.kvrestore.core.model.ErrorRecord;
import com.kvrestore.core.util.JsonUtils;
import com.kvrestore.core.util.Timestamps;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each sub-batch's failed records as a JSON array named {@code batch_errors_<timestamp>.json}
 * into the run's log directory. Names never collide: a numeric suffix is added when two artifacts
 * land in the same millisecond.
 */
public class FileErrorRecordSink implements ErrorRecordSink {

  private static final Logger log = LoggerFactory.getLogger(FileErrorRecordSink.class);
  static final int MAX_NAME_ATTEMPTS = 1000;

  private final Path directory;
  private final Clock clock;

  public FileErrorRecordSink(Path directory, Clock clock) {
    this.directory = directory;
    this.clock = clock;
  }

  @Override
  public Optional<String> publish(List<ErrorRecord> errorRecords) {
    if (errorRecords.isEmpty()) {
      return Optional.empty();
    }
    try {
      Files.createDirectories(directory);
      byte[] json = JsonUtils.toPrettyJson(errorRecords).getBytes(StandardCharsets.UTF_8);
      String base = "batch_errors_" + Timestamps.errorArtifactSuffix(clock.instant());

      for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
        String name = attempt == 0 ? base + ".json" : base + "_" + attempt + ".json";
        Path file = directory.resolve(name);
        try {
          Files.write(file, json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
          log.warn("[ErrorRecords] {} failed records saved to {}", errorRecords.size(), file);
          return Optional.of(name);
        } catch (FileAlreadyExistsException e) {
          log.debug("[ErrorRecords] {} exists, trying next name", file);
        }
      }
      log.error("[ErrorRecords] No free artifact name for prefix {} in {}", base, directory);
    } catch (IOException | RuntimeException e) {
      log.error(
          "[ErrorRecords] Failed to save {} failed records to {}",
          errorRecords.size(),
          directory,
          e);
    }
    return Optional.empty();
  }
}
