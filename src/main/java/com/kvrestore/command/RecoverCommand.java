package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.config.ScopedConfig;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RecoveryCommand;
import com.kvrestore.core.retry.Sleeper;
import com.kvrestore.core.util.Timestamps;
import com.kvrestore.recovery.RecoveryOrchestrator;
import com.kvrestore.recovery.RecoveryRequest;
import com.kvrestore.recovery.RecoveryResult;
import com.kvrestore.recovery.window.ChangeWindowResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code recover --source-table T --target-table T2 --backup-root DIR [--disaster-time
 * 20251220_090000] [--backup-dir full_backup_20251220_084513] [--source-region R] [--target-region
 * R2]}
 */
public class RecoverCommand implements RecoveryCommand {

  private static final Logger log = LoggerFactory.getLogger(RecoverCommand.class);
  public static final String NAME = "recover";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int run(String[] rawArgs) {
    ScopedConfig.activateCommand(name());
    CommandArgs args = CommandArgs.parse(rawArgs);
    RecoveryRequest request = toRequest(args);

    try (RecoveryEnvironment env = new RecoveryEnvironment(args)) {
      TableCatalog source = env.catalog(args.find(SOURCE_REGION).orElse(null));
      TableCatalog target = env.catalog(args.find(TARGET_REGION).orElse(null));
      SnapshotService snapshots = env.snapshotService(source, target);

      RecoveryOrchestrator orchestrator =
          RecoveryOrchestrator.builder()
              .backupStore(env.getBackupStore())
              .snapshotCatalog(env.getSnapshotCatalog())
              .backupScheduler(env.backupScheduler(snapshots))
              .snapshotService(snapshots)
              .sourceCatalog(source)
              .targetCatalog(target)
              .windowResolver(
                  new ChangeWindowResolver(
                      env.getFeed(),
                      env.getStorageRetry(),
                      env.getEvents(),
                      env.changePrefix(),
                      args.getSeconds(
                          WINDOW_OVERLAP_SECONDS, ChangeWindowResolver.DEFAULT_OVERLAP)))
              .feed(env.getFeed())
              .engineFactory(env.engineFactory())
              .bulkRetry(env.getBulkRetry())
              .storageRetry(env.getStorageRetry())
              .events(env.getEvents())
              .sleeper(Sleeper.SYSTEM)
              .pollInterval(
                  args.getSeconds(
                      IMPORT_POLL_INTERVAL_SECONDS, RecoveryOrchestrator.DEFAULT_POLL_INTERVAL))
              .importTimeout(
                  args.getSeconds(
                      IMPORT_TIMEOUT_SECONDS, RecoveryOrchestrator.DEFAULT_IMPORT_TIMEOUT))
              .build();

      RecoveryResult result = orchestrator.recover(request);
      if (result.isSuccess()) {
        log.info(
            "[Recover] {} restored into {}: {} batches, {} records applied",
            request.getSourceTable(),
            result.getTargetTable(),
            result.getBatchesReplayed(),
            result.getAppliedCount());
        return 0;
      }
      log.error("[Recover] Recovery failed at {}: {}", result.getFailedStage(), result.getReason());
      return 1;
    }
  }

  static RecoveryRequest toRequest(CommandArgs args) {
    return RecoveryRequest.builder()
        .sourceTable(args.require(SOURCE_TABLE))
        .targetTable(args.require(TARGET_TABLE))
        .disasterTime(args.find(DISASTER_TIME).map(Timestamps::parse).orElse(null))
        .snapshotSelector(args.find(BACKUP_DIR).orElse(null))
        .build();
  }
}
