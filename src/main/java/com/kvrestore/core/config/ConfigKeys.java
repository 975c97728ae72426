package com.kvrestore.core.config;

public final class ConfigKeys {

  private ConfigKeys() {}

  public static final String SOURCE_TABLE = "SOURCE_TABLE";
  public static final String TARGET_TABLE = "TARGET_TABLE";
  public static final String SOURCE_REGION = "SOURCE_REGION";
  public static final String TARGET_REGION = "TARGET_REGION";
  public static final String TABLE_NAME = "TABLE_NAME";

  /** Root directory of the backup store. */
  public static final String BACKUP_ROOT = "BACKUP_ROOT";
  public static final String CHANGE_PREFIX = "CHANGE_PREFIX";

  /** Upper bound for snapshot selection, {@code yyyyMMdd_HHmmss} (UTC) or ISO-8601. */
  public static final String DISASTER_TIME = "DISASTER_TIME";
  /** Explicit snapshot selector, e.g. {@code full_backup_20251220_084513}. */
  public static final String BACKUP_DIR = "BACKUP_DIR";
  public static final String CHANGE_FILE = "CHANGE_FILE";
  /** Local file of captured stream records to publish as one change artifact. */
  public static final String INPUT_FILE = "INPUT_FILE";

  public static final String LOG_DIR = "KVRESTORE_LOG_DIR";
  public static final String REPLAY_SUB_BATCH_SIZE = "REPLAY_SUB_BATCH_SIZE";
  public static final String WINDOW_OVERLAP_SECONDS = "WINDOW_OVERLAP_SECONDS";
  public static final String IMPORT_POLL_INTERVAL_SECONDS = "IMPORT_POLL_INTERVAL_SECONDS";
  public static final String IMPORT_TIMEOUT_SECONDS = "IMPORT_TIMEOUT_SECONDS";

  public static final String DEFAULT_CHANGE_PREFIX = "ddb-changes/";
  public static final String DEFAULT_LOG_DIR = "logs";
}
