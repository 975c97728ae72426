package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.config.ScopedConfig;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RecoveryCommand;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.recovery.snapshot.FullBackupScheduler;
import com.kvrestore.recovery.snapshot.SnapshotCatalog;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code backup-status --table-name T --backup-root DIR [--backup-dir full_backup_...]}: refreshes
 * unfinished snapshots and prints every snapshot of the table.
 */
public class BackupStatusCommand implements RecoveryCommand {

  private static final Logger log = LoggerFactory.getLogger(BackupStatusCommand.class);
  public static final String NAME = "backup-status";

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
      TableCatalog source = env.catalog(args.find(SOURCE_REGION).orElse(null));
      SnapshotService snapshots = env.snapshotService(source, source);
      FullBackupScheduler scheduler = env.backupScheduler(snapshots);

      List<SnapshotMetadata> reported =
          report(scheduler, env.getSnapshotCatalog(), table, args.find(BACKUP_DIR));
      if (reported.isEmpty()) {
        log.info("[BackupStatus] No snapshots recorded for {}", table);
      }
      reported.forEach(BackupStatusCommand::print);
      return 0;
    }
  }

  /** Refreshes the selected snapshot, or every unfinished one, and returns what should be shown. */
  static List<SnapshotMetadata> report(
      FullBackupScheduler scheduler, SnapshotCatalog catalog, String table, Optional<String> selector) {
    if (selector.isPresent()) {
      SnapshotMetadata metadata =
          catalog
              .load(table, selector.get())
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Snapshot " + selector.get() + " not found for " + table));
      return List.of(scheduler.refreshStatus(metadata));
    }
    scheduler.refreshPending(table);
    return catalog.listForTable(table);
  }

  private static void print(SnapshotMetadata metadata) {
    log.info(
        "[BackupStatus] {} cutover={} status={} location={}",
        metadata.getSnapshotId(),
        metadata.getCutoverTime(),
        metadata.getStatus(),
        metadata.getLocationReference());
  }
}
