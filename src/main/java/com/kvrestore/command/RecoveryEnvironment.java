package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.BlobStore;
import com.kvrestore.connector.ChangeFeedSource;
import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.connector.feed.BlobChangeFeedSource;
import com.kvrestore.connector.feed.ChangeFeedPublisher;
import com.kvrestore.connector.fs.FileSystemBlobStore;
import com.kvrestore.connector.mongo.MongoTableCatalog;
import com.kvrestore.connector.snapshot.BlobSnapshotService;
import com.kvrestore.core.dlq.ErrorRecordSink;
import com.kvrestore.core.dlq.FileErrorRecordSink;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.Slf4jEventSink;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RunLogDirectory;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.core.retry.RetryProfile;
import com.kvrestore.core.retry.Sleeper;
import com.kvrestore.recovery.replay.ReplayEngine;
import com.kvrestore.recovery.snapshot.FullBackupScheduler;
import com.kvrestore.recovery.snapshot.SnapshotCatalog;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Production wiring shared by the commands. Owns and closes every client it opens. */
@Getter
public class RecoveryEnvironment implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(RecoveryEnvironment.class);
  static final String DEFAULT_REGION = "default";

  private final CommandArgs args;
  private final Clock clock = Clock.systemUTC();
  private final EventSink events = new Slf4jEventSink();
  private final BlobStore backupStore;
  private final RetryPolicy storageRetry;
  private final RetryPolicy tableRetry;
  private final RetryPolicy bulkRetry;
  private final ErrorRecordSink errorSink;
  private final ChangeFeedSource feed;
  private final SnapshotCatalog snapshotCatalog;

  private final Map<String, MongoTableCatalog> catalogs = new HashMap<>();
  private final Deque<AutoCloseable> resources = new ArrayDeque<>();

  public RecoveryEnvironment(CommandArgs args) {
    this.args = args;
    this.backupStore = new FileSystemBlobStore(Path.of(args.require(BACKUP_ROOT)));
    this.storageRetry = new RetryPolicy(RetryProfile.STORAGE_OPERATION, events);
    this.tableRetry = new RetryPolicy(RetryProfile.TABLE_OPERATION, events);
    this.bulkRetry = new RetryPolicy(RetryProfile.BULK_TRANSFER, events);
    Path logDir = Path.of(args.getOrDefault(LOG_DIR, DEFAULT_LOG_DIR));
    RunLogDirectory.redirect(logDir);
    this.errorSink = new FileErrorRecordSink(logDir, clock);
    this.feed = new BlobChangeFeedSource(backupStore);
    this.snapshotCatalog = new SnapshotCatalog(backupStore, storageRetry, events);
  }

  /** Table catalog of a region; tables of the same region share one client. */
  public TableCatalog catalog(String region) {
    String name = region != null && !region.isBlank() ? region : DEFAULT_REGION;
    return catalogs.computeIfAbsent(
        name,
        key -> {
          MongoTableCatalog catalog = MongoTableCatalog.forRegion(region);
          resources.push(catalog);
          return catalog;
        });
  }

  public SnapshotService snapshotService(TableCatalog source, TableCatalog target) {
    BlobSnapshotService service = new BlobSnapshotService(source, target, backupStore, clock);
    resources.push(service);
    return service;
  }

  public FullBackupScheduler backupScheduler(SnapshotService snapshotService) {
    return new FullBackupScheduler(snapshotService, snapshotCatalog, bulkRetry, events);
  }

  public Function<KeyValueTable, ReplayEngine> engineFactory() {
    int subBatchSize = args.getInt(REPLAY_SUB_BATCH_SIZE, ReplayEngine.DEFAULT_SUB_BATCH_SIZE);
    return table ->
        ReplayEngine.builder()
            .table(table)
            .tableRetry(tableRetry)
            .errorSink(errorSink)
            .events(events)
            .sleeper(Sleeper.SYSTEM)
            .subBatchSize(subBatchSize)
            .build();
  }

  public ChangeFeedPublisher changeFeedPublisher() {
    return new ChangeFeedPublisher(backupStore, storageRetry, clock, changePrefix());
  }

  public String changePrefix() {
    return args.getOrDefault(CHANGE_PREFIX, DEFAULT_CHANGE_PREFIX);
  }

  @Override
  public void close() {
    while (!resources.isEmpty()) {
      AutoCloseable resource = resources.pop();
      try {
        resource.close();
      } catch (Exception e) {
        log.warn("[Environment] Failed to close {}", resource.getClass().getSimpleName(), e);
      }
    }
  }
}
