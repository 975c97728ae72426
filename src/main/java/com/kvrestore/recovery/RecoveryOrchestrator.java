package com.kvrestore.recovery;

import static com.kvrestore.core.config.ErrorCodes.IMPORT_FAILED;

import com.kvrestore.connector.BlobStore;
import com.kvrestore.connector.ChangeFeedSource;
import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.ChangeArtifact;
import com.kvrestore.core.model.ChangeBatch;
import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ImportProgress;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.core.retry.Sleeper;
import com.kvrestore.recovery.replay.BatchResult;
import com.kvrestore.recovery.replay.ReplayEngine;
import com.kvrestore.recovery.snapshot.FullBackupScheduler;
import com.kvrestore.recovery.snapshot.SnapshotCatalog;
import com.kvrestore.recovery.window.ChangeWindowResolver;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one recovery: locate a snapshot, restore it into the target table, then replay every
 * change artifact produced since the snapshot's cutover.
 *
 * <p>Each step must finish before the next starts. The first unresolved failure ends the run as
 * FAILED with the failing step and cause; whatever was already restored or replayed stays in
 * place and can be completed by running the recovery again.
 */
public class RecoveryOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_IMPORT_TIMEOUT = Duration.ofSeconds(3600);
  public static final int DEFAULT_BATCH_ATTEMPTS = 3;

  private final BlobStore backupStore;
  private final SnapshotCatalog snapshotCatalog;
  private final FullBackupScheduler backupScheduler;
  private final SnapshotService snapshotService;
  private final TableCatalog sourceCatalog;
  private final TableCatalog targetCatalog;
  private final ChangeWindowResolver windowResolver;
  private final ChangeFeedSource feed;
  private final Function<KeyValueTable, ReplayEngine> engineFactory;
  private final RetryPolicy bulkRetry;
  private final RetryPolicy storageRetry;
  private final EventSink events;
  private final Sleeper sleeper;
  private final Duration pollInterval;
  private final Duration importTimeout;
  private final int batchAttempts;

  @Builder
  private RecoveryOrchestrator(
      @NonNull BlobStore backupStore,
      @NonNull SnapshotCatalog snapshotCatalog,
      @NonNull FullBackupScheduler backupScheduler,
      @NonNull SnapshotService snapshotService,
      @NonNull TableCatalog sourceCatalog,
      @NonNull TableCatalog targetCatalog,
      @NonNull ChangeWindowResolver windowResolver,
      @NonNull ChangeFeedSource feed,
      @NonNull Function<KeyValueTable, ReplayEngine> engineFactory,
      @NonNull RetryPolicy bulkRetry,
      @NonNull RetryPolicy storageRetry,
      @NonNull EventSink events,
      Sleeper sleeper,
      Duration pollInterval,
      Duration importTimeout,
      Integer batchAttempts) {
    this.backupStore = backupStore;
    this.snapshotCatalog = snapshotCatalog;
    this.backupScheduler = backupScheduler;
    this.snapshotService = snapshotService;
    this.sourceCatalog = sourceCatalog;
    this.targetCatalog = targetCatalog;
    this.windowResolver = windowResolver;
    this.feed = feed;
    this.engineFactory = engineFactory;
    this.bulkRetry = bulkRetry;
    this.storageRetry = storageRetry;
    this.events = events;
    this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    this.pollInterval = pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL;
    this.importTimeout = importTimeout != null ? importTimeout : DEFAULT_IMPORT_TIMEOUT;
    this.batchAttempts = batchAttempts != null ? batchAttempts : DEFAULT_BATCH_ATTEMPTS;
    if (this.pollInterval.isNegative() || this.pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be > 0: " + this.pollInterval);
    }
    if (this.batchAttempts <= 0) {
      throw new IllegalArgumentException("batchAttempts must be > 0: " + this.batchAttempts);
    }
  }

  public RecoveryResult recover(RecoveryRequest request) {
    RecoveryRun run = new RecoveryRun(request);
    emit(
        event(run.getStage(), Severity.INFO, "Recovery started")
            .field("source", request.getSourceTable())
            .field("target", request.getTargetTable())
            .field("disasterTime", request.findDisasterTime().map(Object::toString).orElse("-"))
            .field("snapshot", request.findSnapshotSelector().orElse("latest")));
    try {
      backupStore.verifyAccessible();

      run.enter(RecoveryStage.LOCATE_SNAPSHOT);
      run.setSnapshot(locateSnapshot(request));

      run.enter(RecoveryStage.RESTORE_FULL);
      restoreFull(run);

      run.enter(RecoveryStage.RESOLVE_WINDOW);
      run.setWindow(windowResolver.resolve(run.getSnapshot().getCutoverTime()));

      run.enter(RecoveryStage.REPLAY_CHANGES);
      replayChanges(run);

      run.enter(RecoveryStage.DONE);
    } catch (RuntimeException e) {
      RecoveryStage failedStage =
          e instanceof RecoveryFailedException failed ? failed.getStage() : run.getStage();
      run.enter(RecoveryStage.FAILED);
      RecoveryResult result = RecoveryResult.failed(run, failedStage, e);
      emit(
          event(failedStage, Severity.ERROR, "Recovery failed")
              .field("reason", result.getReason())
              .field("applied", result.getAppliedCount())
              .field("errors", result.getErrorCount())
              .cause(e));
      return result;
    }

    RecoveryResult result = RecoveryResult.done(run);
    emit(
        event(RecoveryStage.DONE, Severity.INFO, "Recovery completed")
            .field("snapshot", result.getSnapshot().getSnapshotId())
            .field("target", result.getTargetTable())
            .field("batches", result.getBatchesReplayed())
            .field("applied", result.getAppliedCount())
            .field("errors", result.getErrorCount()));
    return result;
  }

  SnapshotMetadata locateSnapshot(RecoveryRequest request) {
    String table = request.getSourceTable();
    if (request.findSnapshotSelector().isPresent()) {
      String selector = request.findSnapshotSelector().get();
      SnapshotMetadata selected =
          snapshotCatalog
              .load(table, selector)
              .orElseThrow(
                  () ->
                      new RecoveryFailedException(
                          RecoveryStage.LOCATE_SNAPSHOT,
                          "Snapshot " + selector + " not found for table " + table));
      selected = backupScheduler.refreshStatus(selected);
      if (selected.getStatus() != TransferStatus.COMPLETED) {
        throw new RecoveryFailedException(
            RecoveryStage.LOCATE_SNAPSHOT,
            "Snapshot " + selector + " is " + selected.getStatus() + ", not COMPLETED");
      }
      return announce(selected);
    }

    List<SnapshotMetadata> candidates = snapshotCatalog.candidates(table, request.findDisasterTime());
    for (SnapshotMetadata candidate : candidates) {
      SnapshotMetadata current;
      try {
        current = backupScheduler.refreshStatus(candidate);
      } catch (RuntimeException e) {
        emit(
            event(RecoveryStage.LOCATE_SNAPSHOT, Severity.WARN, "Snapshot status unavailable")
                .field("snapshotId", candidate.getSnapshotId())
                .cause(e));
        continue;
      }
      if (current.getStatus() == TransferStatus.COMPLETED) {
        return announce(current);
      }
      emit(
          event(RecoveryStage.LOCATE_SNAPSHOT, Severity.WARN, "Skipping unfinished snapshot")
              .field("snapshotId", current.getSnapshotId())
              .field("status", current.getStatus()));
    }
    throw new RecoveryFailedException(
        RecoveryStage.LOCATE_SNAPSHOT,
        "No completed snapshot for table "
            + table
            + request.findDisasterTime().map(t -> " at or before " + t).orElse(""));
  }

  void restoreFull(RecoveryRun run) {
    SnapshotMetadata snapshot = run.getSnapshot();
    String source = run.getRequest().getSourceTable();
    String target = run.getRequest().getTargetTable();

    TableSchema schema =
        bulkRetry.execute("describeTable " + source, () -> sourceCatalog.describeTable(source));
    ImportHandle handle =
        bulkRetry.execute(
            "requestImport " + target,
            () -> snapshotService.requestImport(snapshot.getLocationReference(), schema, target));
    run.setImportHandle(handle);
    emit(
        event(RecoveryStage.RESTORE_FULL, Severity.INFO, "Import started")
            .field("import", handle.importId())
            .field("location", snapshot.getLocationReference())
            .field("target", target));

    Duration waited = Duration.ZERO;
    while (waited.compareTo(importTimeout) < 0) {
      ImportProgress progress = pollImport(handle);
      if (progress != null) {
        if (progress.status() == TransferStatus.COMPLETED) {
          emit(
              event(RecoveryStage.RESTORE_FULL, Severity.INFO, "Import completed")
                  .field("import", handle.importId())
                  .field("items", progress.importedItemCount()));
          return;
        }
        if (progress.status() == TransferStatus.FAILED) {
          throw new RecoveryFailedException(
              RecoveryStage.RESTORE_FULL,
              IMPORT_FAILED + ": " + progress.failureReason().orElse("Unknown - Unknown"));
        }
        log.info(
            "[Recovery] Import {} in progress ({} items, {}s elapsed)",
            handle.importId(),
            progress.importedItemCount(),
            waited.toSeconds());
      }
      sleeper.sleep(pollInterval);
      waited = waited.plus(pollInterval);
    }
    throw new ImportTimeoutException(handle, importTimeout);
  }

  private ImportProgress pollImport(ImportHandle handle) {
    try {
      return snapshotService.pollImport(handle);
    } catch (RuntimeException e) {
      if (RemoteServiceException.kindOf(e).isSessionScoped()) {
        throw e;
      }
      emit(
          event(RecoveryStage.RESTORE_FULL, Severity.WARN, "Import status poll failed")
              .field("import", handle.importId())
              .cause(e));
      return null;
    }
  }

  void replayChanges(RecoveryRun run) {
    List<ChangeArtifact> window = run.getWindow();
    if (window.isEmpty()) {
      emit(event(RecoveryStage.REPLAY_CHANGES, Severity.INFO, "Change window is empty"));
      return;
    }

    KeyValueTable table = targetCatalog.openTable(run.getRequest().getTargetTable());
    ReplayEngine engine = engineFactory.apply(table);
    for (int i = 0; i < window.size(); i++) {
      ChangeArtifact artifact = window.get(i);
      log.info("[Recovery] Replaying batch {}/{}: {}", i + 1, window.size(), artifact.key());
      BatchResult result = replayBatch(engine, artifact);
      run.getStats().merge(result.getStats());
      if (!result.isSuccess()) {
        throw new RecoveryFailedException(
            RecoveryStage.REPLAY_CHANGES,
            "Batch "
                + artifact.key()
                + " still had "
                + result.getStats().getErrorCount()
                + " failed records after "
                + batchAttempts
                + " attempts");
      }
      run.batchReplayed();
    }
  }

  private BatchResult replayBatch(ReplayEngine engine, ChangeArtifact artifact) {
    String key = artifact.key();
    BatchResult last = null;
    RuntimeException lastError = null;
    for (int attempt = 0; attempt < batchAttempts; attempt++) {
      try {
        ChangeBatch batch = storageRetry.execute("get " + key, () -> feed.getArtifact(key));
        last = engine.applyBatch(batch);
        lastError = null;
        if (last.isSuccess()) {
          return last;
        }
      } catch (RuntimeException e) {
        lastError = e;
      }
      if (attempt + 1 < batchAttempts) {
        Duration delay = Duration.ofSeconds(1L << attempt);
        emit(
            event(RecoveryStage.REPLAY_CHANGES, Severity.WARN, "Batch failed, retrying")
                .field("batch", key)
                .field("attempt", attempt + 1)
                .field("delayMs", delay.toMillis())
                .cause(lastError));
        sleeper.sleep(delay);
      }
    }
    if (lastError != null) {
      throw new RecoveryFailedException(
          RecoveryStage.REPLAY_CHANGES,
          "Batch " + key + " failed after " + batchAttempts + " attempts: " + lastError.getMessage(),
          lastError);
    }
    return last;
  }

  private SnapshotMetadata announce(SnapshotMetadata snapshot) {
    emit(
        event(RecoveryStage.LOCATE_SNAPSHOT, Severity.INFO, "Snapshot selected")
            .field("snapshotId", snapshot.getSnapshotId())
            .field("cutover", snapshot.getCutoverTime())
            .field("location", snapshot.getLocationReference()));
    return snapshot;
  }

  private static RecoveryEvent.RecoveryEventBuilder event(
      RecoveryStage stage, Severity severity, String message) {
    return RecoveryEvent.builder().stage(stage.name()).severity(severity).message(message);
  }

  private void emit(RecoveryEvent.RecoveryEventBuilder event) {
    events.emit(event.build());
  }
}
