package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.ChangeFeedSource;
import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.config.ScopedConfig;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RecoveryCommand;
import com.kvrestore.core.model.ChangeBatch;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.recovery.replay.BatchResult;
import com.kvrestore.recovery.replay.ReplayEngine;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code apply-changes --change-file ddb-changes/ddb_changes_....json --target-table T
 * --backup-root DIR [--target-region R] [--replay-sub-batch-size 100]}
 */
public class ApplyChangesCommand implements RecoveryCommand {

  private static final Logger log = LoggerFactory.getLogger(ApplyChangesCommand.class);
  public static final String NAME = "apply-changes";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int run(String[] rawArgs) {
    ScopedConfig.activateCommand(name());
    CommandArgs args = CommandArgs.parse(rawArgs);
    String changeFile = args.require(CHANGE_FILE);
    String targetTable = args.require(TARGET_TABLE);

    try (RecoveryEnvironment env = new RecoveryEnvironment(args)) {
      env.getBackupStore().verifyAccessible();
      TableCatalog target = env.catalog(args.find(TARGET_REGION).orElse(null));
      BatchResult result =
          apply(
              env.getFeed(),
              env.getStorageRetry(),
              target,
              targetTable,
              env.engineFactory(),
              changeFile);
      return result.isSuccess() ? 0 : 1;
    }
  }

  static BatchResult apply(
      ChangeFeedSource feed,
      RetryPolicy storageRetry,
      TableCatalog catalog,
      String tableName,
      Function<KeyValueTable, ReplayEngine> engineFactory,
      String changeFile) {
    if (!catalog.tableExists(tableName)) {
      throw new IllegalStateException("Target table " + tableName + " does not exist");
    }
    KeyValueTable table = catalog.openTable(tableName);
    ChangeBatch batch = storageRetry.execute("get " + changeFile, () -> feed.getArtifact(changeFile));
    log.info("[ApplyChanges] Read {} records from {}", batch.size(), changeFile);

    BatchResult result = engineFactory.apply(table).applyBatch(batch);
    if (result.isSuccess()) {
      log.info("[ApplyChanges] All {} records applied to {}", result.getRecordCount(), tableName);
    } else {
      log.warn(
          "[ApplyChanges] {} of {} records failed on {}",
          result.getStats().getErrorCount(),
          result.getRecordCount(),
          tableName);
    }
    return result;
  }
}
