package com.kvrestore.recovery;

import com.kvrestore.core.model.SnapshotMetadata;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecoveryResult {

  RecoveryStage stage;
  RecoveryStage failedStage;
  String reason;
  Throwable cause;
  SnapshotMetadata snapshot;
  String targetTable;
  int windowSize;
  int batchesReplayed;
  long appliedCount;
  long errorCount;

  public boolean isSuccess() {
    return stage == RecoveryStage.DONE;
  }

  static RecoveryResult done(RecoveryRun run) {
    return from(run).stage(RecoveryStage.DONE).build();
  }

  static RecoveryResult failed(RecoveryRun run, RecoveryStage failedStage, Throwable cause) {
    return from(run)
        .stage(RecoveryStage.FAILED)
        .failedStage(failedStage)
        .reason(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName())
        .cause(cause)
        .build();
  }

  private static RecoveryResultBuilder from(RecoveryRun run) {
    return RecoveryResult.builder()
        .snapshot(run.getSnapshot())
        .targetTable(run.getRequest().getTargetTable())
        .windowSize(run.getWindow().size())
        .batchesReplayed(run.getBatchesReplayed())
        .appliedCount(run.getStats().getAppliedCount())
        .errorCount(run.getStats().getErrorCount());
  }
}
