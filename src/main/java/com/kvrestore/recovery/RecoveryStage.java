package com.kvrestore.recovery;

/** Steps of one recovery run, in execution order. DONE and FAILED are terminal. */
public enum RecoveryStage {
  START,
  LOCATE_SNAPSHOT,
  RESTORE_FULL,
  RESOLVE_WINDOW,
  REPLAY_CHANGES,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
