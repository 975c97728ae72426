package com.kvrestore.recovery.snapshot;

import com.kvrestore.connector.BlobObject;
import com.kvrestore.connector.BlobStore;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.core.util.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot metadata persisted in the backup store as
 * {@code backup-metadata/<table>/full_backup_<yyyyMMdd_HHmmss>.json}.
 */
public class SnapshotCatalog {

  public static final String METADATA_PREFIX = "backup-metadata/";
  public static final String FILE_PREFIX = "full_backup_";
  static final String FILE_SUFFIX = ".json";
  static final String STAGE = "snapshot-catalog";

  static final Comparator<SnapshotMetadata> BY_CUTOVER =
      Comparator.comparing(SnapshotMetadata::getCutoverTime)
          .thenComparing(SnapshotMetadata::getRecoveryPointId);

  private final BlobStore store;
  private final RetryPolicy storageRetry;
  private final EventSink events;

  public SnapshotCatalog(BlobStore store, RetryPolicy storageRetry, EventSink events) {
    this.store = store;
    this.storageRetry = storageRetry;
    this.events = events;
  }

  public static String keyFor(String tableId, String recoveryPointId) {
    return METADATA_PREFIX + tableId + "/" + FILE_PREFIX + recoveryPointId + FILE_SUFFIX;
  }

  public String save(SnapshotMetadata metadata) {
    String key = keyFor(metadata.getSourceTableId(), metadata.getRecoveryPointId());
    byte[] body = JsonUtils.toPrettyJson(metadata).getBytes(StandardCharsets.UTF_8);
    storageRetry.run("put " + key, () -> store.put(key, body));
    events.emit(
        RecoveryEvent.builder()
            .stage(STAGE)
            .severity(Severity.INFO)
            .message("Saved snapshot metadata")
            .field("key", key)
            .field("status", metadata.getStatus())
            .build());
    return key;
  }

  /** All readable snapshot records of a table. Unreadable records are skipped with a warning. */
  public List<SnapshotMetadata> listForTable(String tableId) {
    String prefix = METADATA_PREFIX + tableId + "/";
    List<BlobObject> blobs = storageRetry.execute("list " + prefix, () -> store.list(prefix));
    List<SnapshotMetadata> snapshots = new ArrayList<>();
    for (BlobObject blob : blobs) {
      if (!blob.key().endsWith(FILE_SUFFIX)) {
        continue;
      }
      read(blob.key())
          .filter(metadata -> tableId.equals(metadata.getSourceTableId()))
          .ifPresent(snapshots::add);
    }
    snapshots.sort(BY_CUTOVER);
    return snapshots;
  }

  /**
   * Loads a snapshot by selector: {@code full_backup_20251220_084513}, {@code 20251220_084513}
   * or either with a {@code .json} suffix.
   */
  public Optional<SnapshotMetadata> load(String tableId, String selector) {
    String key = keyFor(tableId, recoveryPointOf(selector));
    boolean exists = storageRetry.execute("head " + key, () -> store.exists(key));
    if (!exists) {
      return Optional.empty();
    }
    byte[] body = storageRetry.execute("get " + key, () -> store.get(key));
    try {
      return Optional.of(JsonUtils.fromBytes(body, SnapshotMetadata.class));
    } catch (RuntimeException e) {
      throw new IllegalStateException("Invalid snapshot metadata at " + key, e);
    }
  }

  /**
   * Latest snapshot whose cutover is not after {@code notAfter} (when given). FAILED snapshots are
   * never returned.
   */
  public Optional<SnapshotMetadata> findLatest(String tableId, Optional<Instant> notAfter) {
    return candidates(tableId, notAfter).stream().findFirst();
  }

  /** Selectable snapshots, newest first. */
  public List<SnapshotMetadata> candidates(String tableId, Optional<Instant> notAfter) {
    List<SnapshotMetadata> candidates = new ArrayList<>();
    for (SnapshotMetadata metadata : listForTable(tableId)) {
      if (metadata.getStatus() == TransferStatus.FAILED) {
        continue;
      }
      if (notAfter.isPresent() && metadata.getCutoverTime().isAfter(notAfter.get())) {
        continue;
      }
      candidates.add(metadata);
    }
    candidates.sort(BY_CUTOVER.reversed());
    return candidates;
  }

  static String recoveryPointOf(String selector) {
    String name = selector.trim();
    if (name.endsWith(FILE_SUFFIX)) {
      name = name.substring(0, name.length() - FILE_SUFFIX.length());
    }
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    return name.startsWith(FILE_PREFIX) ? name.substring(FILE_PREFIX.length()) : name;
  }

  private Optional<SnapshotMetadata> read(String key) {
    byte[] body = storageRetry.execute("get " + key, () -> store.get(key));
    try {
      return Optional.of(JsonUtils.fromBytes(body, SnapshotMetadata.class));
    } catch (RuntimeException e) {
      events.emit(
          RecoveryEvent.builder()
              .stage(STAGE)
              .severity(Severity.WARN)
              .message("Skipping unreadable snapshot metadata")
              .field("key", key)
              .cause(e)
              .build());
      return Optional.empty();
    }
  }
}
