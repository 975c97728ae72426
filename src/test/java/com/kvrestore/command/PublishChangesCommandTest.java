package com.kvrestore.command;

import static com.kvrestore.testing.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.kvrestore.connector.feed.BlobChangeFeedSource;
import com.kvrestore.connector.feed.ChangeFeedPublisher;
import com.kvrestore.core.model.ChangeBatch;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.model.OperationKind;
import com.kvrestore.testing.InMemoryBlobStore;
import com.kvrestore.testing.RecordingEventSink;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PublishChangesCommandTest {

  @TempDir Path tempDir;

  private InMemoryBlobStore store;
  private ChangeFeedPublisher publisher;

  @BeforeEach
  void setUp() {
    store = new InMemoryBlobStore();
    publisher =
        new ChangeFeedPublisher(
            store,
            storageRetry(new RecordingEventSink()),
            Clock.fixed(Instant.parse("2025-12-20T08:46:00Z"), ZoneOffset.UTC),
            "ddb-changes/");
  }

  @Test
  @DisplayName("A Records envelope captured from the stream is published as one artifact")
  void publishesEnvelope() throws Exception {
    // given
    Path input = tempDir.resolve("records.json");
    Files.writeString(
        input,
        """
        {"Records": [
          {"eventName": "INSERT",
           "dynamodb": {"ApproximateCreationDateTime": 1766220360,
                        "Keys": {"id": {"N": "1"}},
                        "NewImage": {"id": {"N": "1"}, "name": {"S": "one"}}}},
          {"eventName": "REMOVE",
           "dynamodb": {"Keys": {"id": {"N": "2"}}}}
        ]}
        """);

    // when
    Optional<String> key = PublishChangesCommand.publish(publisher, input);

    // then
    assertThat(key).contains("ddb-changes/ddb_changes_20251220_084600_000000.json");
    ChangeBatch batch = new BlobChangeFeedSource(store).getArtifact(key.get());
    assertThat(batch.getRecords())
        .extracting(ChangeRecord::getOperationKind)
        .containsExactly(OperationKind.INSERT, OperationKind.REMOVE);
    assertThat(batch.getRecords().get(0).getNewImage()).isEqualTo(row(1, "one"));
  }

  @Test
  @DisplayName("An empty capture publishes nothing")
  void emptyCapture() throws Exception {
    Path input = tempDir.resolve("empty.json");
    Files.writeString(input, "[]");

    assertThat(PublishChangesCommand.publish(publisher, input)).isEmpty();
    assertThat(store.keys()).isEmpty();
  }
}
