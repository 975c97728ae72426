package com.kvrestore.recovery;

import static com.kvrestore.testing.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.feed.BlobChangeFeedSource;
import com.kvrestore.connector.snapshot.BlobSnapshotService;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ImportProgress;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.recovery.replay.ReplayEngine;
import com.kvrestore.recovery.snapshot.FullBackupScheduler;
import com.kvrestore.recovery.snapshot.SnapshotCatalog;
import com.kvrestore.recovery.window.ChangeWindowResolver;
import com.kvrestore.testing.CapturingErrorRecordSink;
import com.kvrestore.testing.InMemoryBlobStore;
import com.kvrestore.testing.InMemoryKeyValueTable;
import com.kvrestore.testing.InMemoryTableCatalog;
import com.kvrestore.testing.RecordingEventSink;
import com.kvrestore.testing.RecordingSleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecoveryOrchestratorTest {

  private static final Instant CUTOVER = Instant.parse("2025-12-20T08:45:13Z");
  private static final RecoveryRequest REQUEST =
      RecoveryRequest.builder().sourceTable("orders").targetTable("orders_restored").build();

  private InMemoryBlobStore store;
  private InMemoryTableCatalog source;
  private InMemoryTableCatalog target;
  private RecordingEventSink events;
  private RecordingSleeper sleeper;
  private CapturingErrorRecordSink errorSink;
  private SnapshotCatalog snapshotCatalog;
  private Function<KeyValueTable, ReplayEngine> engineFactory;
  private BlobChangeFeedSource feed;

  @BeforeEach
  void setUp() {
    store = new InMemoryBlobStore();
    source = new InMemoryTableCatalog();
    target = new InMemoryTableCatalog();
    events = new RecordingEventSink();
    sleeper = new RecordingSleeper();
    errorSink = new CapturingErrorRecordSink();
    source.addTable(ordersSchema("orders"), row(1, "one"), row(2, "two"), row(3, "three"));
    feed = new BlobChangeFeedSource(store);
    snapshotCatalog = new SnapshotCatalog(store, storageRetry(events), events);
    engineFactory =
        table ->
            ReplayEngine.builder()
                .table(table)
                .tableRetry(tableRetry(events))
                .errorSink(errorSink)
                .events(events)
                .sleeper(sleeper)
                .build();
  }

  private RecoveryOrchestrator orchestrator(SnapshotService snapshotService, Duration importTimeout) {
    return RecoveryOrchestrator.builder()
        .backupStore(store)
        .snapshotCatalog(snapshotCatalog)
        .backupScheduler(
            new FullBackupScheduler(snapshotService, snapshotCatalog, bulkRetry(events), events))
        .snapshotService(snapshotService)
        .sourceCatalog(source)
        .targetCatalog(target)
        .windowResolver(
            new ChangeWindowResolver(
                feed, storageRetry(events), events, "ddb-changes/", ChangeWindowResolver.DEFAULT_OVERLAP))
        .feed(feed)
        .engineFactory(engineFactory)
        .bulkRetry(bulkRetry(events))
        .storageRetry(storageRetry(events))
        .events(events)
        .sleeper(sleeper)
        .importTimeout(importTimeout)
        .build();
  }

  @Nested
  class EndToEnd {

    private BlobSnapshotService snapshotService;

    @BeforeEach
    void backUpSource() {
      snapshotService =
          new BlobSnapshotService(
              source, target, store, Clock.fixed(CUTOVER, ZoneOffset.UTC), Runnable::run);
      new FullBackupScheduler(snapshotService, snapshotCatalog, bulkRetry(events), events)
          .startBackup("orders");
    }

    @Test
    @DisplayName("Snapshot {1,2,3} plus changes (REMOVE 1, INSERT 4) restores {2,3,4}")
    void restoresSnapshotAndReplaysChanges() {
      // given
      store.putAt(
          "ddb-changes/ddb_changes_old.json",
          artifact(ChangeRecord.insert(key(99), row(99, "stale"))),
          CUTOVER.minusSeconds(120));
      store.putAt(
          "ddb-changes/ddb_changes_new.json",
          artifact(ChangeRecord.remove(key(1)), ChangeRecord.insert(key(4), row(4, "four"))),
          CUTOVER.plusSeconds(10));

      // when
      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      // then
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getStage()).isEqualTo(RecoveryStage.DONE);
      assertThat(result.getSnapshot().getSnapshotId()).isEqualTo("orders/20251220_084513");
      assertThat(result.getWindowSize()).isEqualTo(1);
      assertThat(result.getBatchesReplayed()).isEqualTo(1);
      assertThat(result.getAppliedCount()).isEqualTo(2);
      assertThat(target.table("orders_restored").snapshotRows())
          .containsOnlyKeys(key(2), key(3), key(4));
      assertThat(snapshotCatalog.load("orders", "20251220_084513"))
          .map(SnapshotMetadata::getStatus)
          .contains(TransferStatus.COMPLETED);
    }

    @Test
    @DisplayName("Running the same recovery into a fresh target gives the same table")
    void replayIsRepeatable() {
      store.putAt(
          "ddb-changes/a.json",
          artifact(ChangeRecord.insert(key(4), row(4, "four")), ChangeRecord.remove(key(4))),
          CUTOVER.plusSeconds(1));
      store.putAt(
          "ddb-changes/b.json", artifact(ChangeRecord.insert(key(4), row(4, "again"))), CUTOVER.plusSeconds(2));

      RecoveryResult first = orchestrator(snapshotService, null).recover(REQUEST);
      RecoveryResult second =
          orchestrator(snapshotService, null)
              .recover(RecoveryRequest.builder().sourceTable("orders").targetTable("orders_second").build());

      assertThat(first.isSuccess()).isTrue();
      assertThat(second.isSuccess()).isTrue();
      assertThat(target.table("orders_second").snapshotRows())
          .isEqualTo(target.table("orders_restored").snapshotRows());
      assertThat(target.table("orders_second").getItem(key(4))).contains(row(4, "again"));
    }

    @Test
    @DisplayName("An empty change window still completes the recovery")
    void emptyWindow() {
      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getWindowSize()).isZero();
      assertThat(target.table("orders_restored").snapshotRows()).hasSize(3);
      assertThat(events.messages()).contains("Change window is empty");
    }

    @Test
    @DisplayName("A batch that keeps failing stops the run at REPLAY_CHANGES")
    void permanentlyFailingBatch() {
      // given
      engineFactory =
          table -> {
            ((InMemoryKeyValueTable) table)
                .failWritesWith(
                    item ->
                        item.get("id").asNumber().intValue() == 4
                            ? new RemoteServiceException(ErrorKind.VALIDATION, "rejected")
                            : null);
            return ReplayEngine.builder()
                .table(table)
                .tableRetry(tableRetry(events))
                .errorSink(errorSink)
                .events(events)
                .sleeper(sleeper)
                .build();
          };
      store.putAt(
          "ddb-changes/a.json",
          artifact(ChangeRecord.insert(key(4), row(4, "four")), ChangeRecord.remove(key(1))),
          CUTOVER.plusSeconds(1));
      store.putAt(
          "ddb-changes/b.json", artifact(ChangeRecord.insert(key(5), row(5, "five"))), CUTOVER.plusSeconds(2));

      // when
      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      // then
      assertThat(result.getStage()).isEqualTo(RecoveryStage.FAILED);
      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.REPLAY_CHANGES);
      assertThat(result.getBatchesReplayed()).isZero();
      assertThat(result.getErrorCount()).isEqualTo(1);
      assertThat(errorSink.getArtifacts()).hasSize(3);
      assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
      assertThat(target.table("orders_restored").getItem(key(5))).isEmpty();
      assertThat(target.table("orders_restored").getItem(key(1))).isEmpty();
    }

    @Test
    @DisplayName("A batch that fails to load once is fetched again and applied")
    void transientBatchFailure() {
      store.putAt(
          "ddb-changes/a.json", artifact(ChangeRecord.insert(key(4), row(4, "four"))), CUTOVER.plusSeconds(1));
      feed = spy(new BlobChangeFeedSource(store));
      doThrow(new RemoteServiceException(ErrorKind.ACCESS_DENIED, "token expired"))
          .doCallRealMethod()
          .when(feed)
          .getArtifact("ddb-changes/a.json");

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.isSuccess()).isTrue();
      assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1));
      assertThat(target.table("orders_restored").getItem(key(4))).isPresent();
    }
  }

  @Nested
  class SnapshotSelection {

    private SnapshotService snapshotService;

    @BeforeEach
    void setUp() {
      snapshotService = mock(SnapshotService.class);
      when(snapshotService.requestImport(anyString(), any(TableSchema.class), anyString()))
          .thenReturn(new ImportHandle("imp-1", "orders_restored"));
      when(snapshotService.pollImport(any())).thenReturn(ImportProgress.completed(3));
    }

    @Test
    @DisplayName("Without any snapshot the run fails at LOCATE_SNAPSHOT before touching the target")
    void noSnapshot() {
      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getStage()).isEqualTo(RecoveryStage.FAILED);
      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.LOCATE_SNAPSHOT);
      assertThat(result.getReason()).contains("No completed snapshot for table orders");
      verify(snapshotService, never()).requestImport(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("The disaster time bounds automatic selection")
    void disasterTimeBound() {
      // given
      snapshotCatalog.save(snapshot("orders", "20251218_000000", Instant.parse("2025-12-18T00:00:00Z"), TransferStatus.COMPLETED));
      snapshotCatalog.save(snapshot("orders", "20251220_000000", Instant.parse("2025-12-20T00:00:00Z"), TransferStatus.COMPLETED));

      // when
      RecoveryResult result =
          orchestrator(snapshotService, null)
              .recover(REQUEST.toBuilder().disasterTime(Instant.parse("2025-12-19T00:00:00Z")).build());

      // then
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getSnapshot().getRecoveryPointId()).isEqualTo("20251218_000000");
      verify(snapshotService)
          .requestImport(eq("full-backups/orders/20251218_000000/"), any(TableSchema.class), eq("orders_restored"));
    }

    @Test
    @DisplayName("An explicit selector wins over newer snapshots and must be COMPLETED")
    void explicitSelector() {
      snapshotCatalog.save(snapshot("orders", "20251218_000000", Instant.parse("2025-12-18T00:00:00Z"), TransferStatus.COMPLETED));
      snapshotCatalog.save(snapshot("orders", "20251219_000000", Instant.parse("2025-12-19T00:00:00Z"), TransferStatus.FAILED));
      snapshotCatalog.save(snapshot("orders", "20251220_000000", Instant.parse("2025-12-20T00:00:00Z"), TransferStatus.COMPLETED));

      RecoveryResult chosen =
          orchestrator(snapshotService, null)
              .recover(REQUEST.toBuilder().snapshotSelector("full_backup_20251218_000000").build());
      RecoveryResult failed =
          orchestrator(snapshotService, null)
              .recover(REQUEST.toBuilder().snapshotSelector("full_backup_20251219_000000").build());
      RecoveryResult missing =
          orchestrator(snapshotService, null)
              .recover(REQUEST.toBuilder().snapshotSelector("full_backup_20240101_000000").build());

      assertThat(chosen.getSnapshot().getRecoveryPointId()).isEqualTo("20251218_000000");
      assertThat(failed.getFailedStage()).isEqualTo(RecoveryStage.LOCATE_SNAPSHOT);
      assertThat(failed.getReason()).contains("FAILED, not COMPLETED");
      assertThat(missing.getFailedStage()).isEqualTo(RecoveryStage.LOCATE_SNAPSHOT);
      assertThat(missing.getReason()).contains("not found");
    }

    @Test
    @DisplayName("An unfinished newest snapshot is refreshed, then skipped for an older completed one")
    void skipsUnfinishedSnapshot() {
      snapshotCatalog.save(snapshot("orders", "20251218_000000", Instant.parse("2025-12-18T00:00:00Z"), TransferStatus.COMPLETED));
      snapshotCatalog.save(snapshot("orders", "20251220_000000", Instant.parse("2025-12-20T00:00:00Z"), TransferStatus.IN_PROGRESS));
      when(snapshotService.pollExport("orders/20251220_000000")).thenReturn(TransferStatus.IN_PROGRESS);

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getSnapshot().getRecoveryPointId()).isEqualTo("20251218_000000");
      assertThat(events.messages()).contains("Skipping unfinished snapshot");
    }

    @Test
    @DisplayName("An inaccessible backup store fails the run before any import")
    void inaccessibleStore() {
      store.setAccessible(false);

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getStage()).isEqualTo(RecoveryStage.FAILED);
      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.START);
      assertThat(result.getCause()).isInstanceOf(IllegalStateException.class);
      verifyNoInteractions(snapshotService);
    }
  }

  @Nested
  class ImportPolling {

    private SnapshotService snapshotService;

    @BeforeEach
    void setUp() {
      snapshotService = mock(SnapshotService.class);
      when(snapshotService.requestImport(anyString(), any(TableSchema.class), anyString()))
          .thenReturn(new ImportHandle("imp-1", "orders_restored"));
      snapshotCatalog.save(snapshot("orders", "20251220_084513", CUTOVER, TransferStatus.COMPLETED));
    }

    @Test
    @DisplayName("A FAILED import ends the run at RESTORE_FULL with the service's reason")
    void importFailed() {
      when(snapshotService.pollImport(any())).thenReturn(ImportProgress.failed("VALIDATION", "bad data"));

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.RESTORE_FULL);
      assertThat(result.getReason()).isEqualTo("IMPORT_FAILED: VALIDATION - bad data");
      assertThat(result.getCause()).isNotInstanceOf(ImportTimeoutException.class);
    }

    @Test
    @DisplayName("An import still running at the ceiling raises ImportTimeoutException")
    void importTimeout() {
      when(snapshotService.pollImport(any())).thenReturn(ImportProgress.inProgress(1));

      RecoveryResult result = orchestrator(snapshotService, Duration.ofSeconds(90)).recover(REQUEST);

      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.RESTORE_FULL);
      assertThat(result.getCause()).isInstanceOf(ImportTimeoutException.class);
      assertThat(result.getReason()).startsWith("IMPORT_TIMEOUT");
      assertThat(sleeper.getSleeps()).hasSize(3).containsOnly(Duration.ofSeconds(30));
      verify(snapshotService, times(3)).pollImport(any());
    }

    @Test
    @DisplayName("Transient poll errors are logged and polling continues")
    void pollErrorThenSuccess() {
      when(snapshotService.pollImport(any()))
          .thenThrow(new RemoteServiceException(ErrorKind.INTERNAL_ERROR, "hiccup"))
          .thenReturn(ImportProgress.inProgress(1))
          .thenReturn(ImportProgress.completed(3));

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.isSuccess()).isTrue();
      assertThat(sleeper.getSleeps()).hasSize(2);
      assertThat(events.withSeverity(Severity.WARN))
          .extracting(e -> e.getMessage())
          .contains("Import status poll failed");
    }

    @Test
    @DisplayName("A session-scoped poll error fails the run immediately")
    void sessionPollError() {
      when(snapshotService.pollImport(any()))
          .thenThrow(new RemoteServiceException(ErrorKind.ACCESS_DENIED, "revoked"));

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.RESTORE_FULL);
      assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("An existing target table fails the restore without retries")
    void targetExists() {
      when(snapshotService.requestImport(anyString(), any(TableSchema.class), anyString()))
          .thenThrow(new RemoteServiceException(ErrorKind.RESOURCE_IN_USE, "exists"));

      RecoveryResult result = orchestrator(snapshotService, null).recover(REQUEST);

      assertThat(result.getFailedStage()).isEqualTo(RecoveryStage.RESTORE_FULL);
      verify(snapshotService, times(1)).requestImport(anyString(), any(TableSchema.class), anyString());
    }
  }
}
