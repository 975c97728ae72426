package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.config.ScopedConfig;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RecoveryCommand;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.Sleeper;
import com.kvrestore.recovery.RecoveryOrchestrator;
import com.kvrestore.recovery.snapshot.FullBackupScheduler;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code backup --table-name T --backup-root DIR [--source-region R] [--wait true]} */
public class BackupCommand implements RecoveryCommand {

  private static final Logger log = LoggerFactory.getLogger(BackupCommand.class);
  public static final String NAME = "backup";
  static final String WAIT = "WAIT";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int run(String[] rawArgs) {
    ScopedConfig.activateCommand(name());
    CommandArgs args = CommandArgs.parse(rawArgs);
    String table = args.find(TABLE_NAME).orElseGet(() -> args.require(SOURCE_TABLE));

    try (RecoveryEnvironment env = new RecoveryEnvironment(args)) {
      env.getBackupStore().verifyAccessible();
      TableCatalog source = env.catalog(args.find(SOURCE_REGION).orElse(null));
      SnapshotService snapshots = env.snapshotService(source, source);
      FullBackupScheduler scheduler = env.backupScheduler(snapshots);

      SnapshotMetadata metadata = scheduler.startBackup(table);
      log.info(
          "[Backup] Export {} started for {} into {}",
          metadata.getSnapshotId(),
          table,
          metadata.getLocationReference());

      if (!Boolean.parseBoolean(args.getOrDefault(WAIT, "false"))) {
        return 0;
      }
      Duration interval =
          args.getSeconds(IMPORT_POLL_INTERVAL_SECONDS, RecoveryOrchestrator.DEFAULT_POLL_INTERVAL);
      metadata = awaitCompletion(scheduler, metadata, Sleeper.SYSTEM, interval);
      log.info("[Backup] Export {} finished with status {}", metadata.getSnapshotId(), metadata.getStatus());
      return metadata.getStatus() == TransferStatus.COMPLETED ? 0 : 1;
    }
  }

  static SnapshotMetadata awaitCompletion(
      FullBackupScheduler scheduler, SnapshotMetadata metadata, Sleeper sleeper, Duration interval) {
    SnapshotMetadata current = scheduler.refreshStatus(metadata);
    while (!current.getStatus().isTerminal()) {
      sleeper.sleep(interval);
      current = scheduler.refreshStatus(current);
    }
    return current;
  }
}
