package com.kvrestore.core.dlq;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.kvrestore.core.model.ErrorRecord;
import com.kvrestore.core.util.JsonUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileErrorRecordSinkTest {

  private static final Clock FIXED =
      Clock.fixed(Instant.parse("2025-12-20T08:45:13.123Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  private static ErrorRecord error(int index) {
    return ErrorRecord.builder()
        .recordIndex(index)
        .error("VALIDATION: bad item")
        .recordData(JsonUtils.readTree("{\"eventName\":\"INSERT\"}".getBytes()))
        .build();
  }

  @Test
  @DisplayName("Failed records are written as a JSON array named after the clock")
  void writesArtifact() throws Exception {
    // given
    FileErrorRecordSink sink = new FileErrorRecordSink(tempDir.resolve("logs"), FIXED);

    // when
    Optional<String> name = sink.publish(List.of(error(4), error(7)));

    // then
    assertThat(name).contains("batch_errors_20251220_084513_123.json");
    JsonNode written =
        JsonUtils.readTree(Files.readAllBytes(tempDir.resolve("logs").resolve(name.get())));
    assertThat(written.isArray()).isTrue();
    assertThat(written).hasSize(2);
    assertThat(written.get(0).get("record_index").asInt()).isEqualTo(4);
    assertThat(written.get(1).get("error").asText()).isEqualTo("VALIDATION: bad item");
    assertThat(written.get(1).get("record_data").get("eventName").asText()).isEqualTo("INSERT");
  }

  @Test
  @DisplayName("Artifacts written in the same millisecond get a numeric suffix")
  void avoidsNameCollisions() {
    // given
    FileErrorRecordSink sink = new FileErrorRecordSink(tempDir, FIXED);

    // when
    Optional<String> first = sink.publish(List.of(error(0)));
    Optional<String> second = sink.publish(List.of(error(1)));

    // then
    assertThat(first).contains("batch_errors_20251220_084513_123.json");
    assertThat(second).contains("batch_errors_20251220_084513_123_1.json");
  }

  @Test
  @DisplayName("Nothing is written for an empty list")
  void skipsEmptyList() throws Exception {
    FileErrorRecordSink sink = new FileErrorRecordSink(tempDir, FIXED);

    assertThat(sink.publish(List.of())).isEmpty();
    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  @DisplayName("A write failure is reported as empty instead of thrown")
  void swallowsWriteFailure() throws Exception {
    // given: the target directory path is occupied by a regular file
    Path blocked = tempDir.resolve("blocked");
    Files.writeString(blocked, "x");
    FileErrorRecordSink sink = new FileErrorRecordSink(blocked, FIXED);

    // when / then
    assertThat(sink.publish(List.of(error(0)))).isEmpty();
  }
}
