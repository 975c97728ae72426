package com.kvrestore.recovery.snapshot;

import com.kvrestore.connector.SnapshotService;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.RetryPolicy;
import java.util.ArrayList;
import java.util.List;

/** Starts full snapshots of a table and keeps their persisted status current. */
public class FullBackupScheduler {

  static final String STAGE = "full-backup";

  private final SnapshotService snapshotService;
  private final SnapshotCatalog catalog;
  private final RetryPolicy bulkRetry;
  private final EventSink events;

  public FullBackupScheduler(
      SnapshotService snapshotService,
      SnapshotCatalog catalog,
      RetryPolicy bulkRetry,
      EventSink events) {
    this.snapshotService = snapshotService;
    this.catalog = catalog;
    this.bulkRetry = bulkRetry;
    this.events = events;
  }

  /** Requests an export and records it as IN_PROGRESS. */
  public SnapshotMetadata startBackup(String tableId) {
    SnapshotMetadata metadata =
        bulkRetry.execute("requestExport " + tableId, () -> snapshotService.requestExport(tableId));
    SnapshotMetadata pending = metadata.withStatus(TransferStatus.IN_PROGRESS);
    String key = catalog.save(pending);
    events.emit(
        RecoveryEvent.builder()
            .stage(STAGE)
            .severity(Severity.INFO)
            .message("Full backup started")
            .field("table", tableId)
            .field("snapshotId", pending.getSnapshotId())
            .field("location", pending.getLocationReference())
            .field("metadata", key)
            .build());
    return pending;
  }

  /** Polls the export once and persists the status if it changed. */
  public SnapshotMetadata refreshStatus(SnapshotMetadata metadata) {
    if (metadata.getStatus().isTerminal()) {
      return metadata;
    }
    TransferStatus status =
        bulkRetry.execute(
            "pollExport " + metadata.getSnapshotId(),
            () -> snapshotService.pollExport(metadata.getSnapshotId()));
    if (status == metadata.getStatus()) {
      return metadata;
    }
    SnapshotMetadata updated = metadata.withStatus(status);
    catalog.save(updated);
    events.emit(
        RecoveryEvent.builder()
            .stage(STAGE)
            .severity(status == TransferStatus.FAILED ? Severity.ERROR : Severity.INFO)
            .message("Full backup status changed")
            .field("snapshotId", metadata.getSnapshotId())
            .field("status", status)
            .build());
    return updated;
  }

  /** Refreshes every unfinished snapshot of the table. */
  public List<SnapshotMetadata> refreshPending(String tableId) {
    List<SnapshotMetadata> refreshed = new ArrayList<>();
    for (SnapshotMetadata metadata : catalog.listForTable(tableId)) {
      if (!metadata.getStatus().isTerminal()) {
        refreshed.add(refreshStatus(metadata));
      }
    }
    return refreshed;
  }
}
