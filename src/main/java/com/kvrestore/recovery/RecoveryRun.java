package com.kvrestore.recovery;

import com.kvrestore.core.model.ChangeArtifact;
import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ReplayStats;
import com.kvrestore.core.model.SnapshotMetadata;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/** Mutable state of one recovery run. Lives only as long as the run. */
@Getter
public class RecoveryRun {

  private final RecoveryRequest request;
  private final ReplayStats stats = new ReplayStats();
  private RecoveryStage stage = RecoveryStage.START;
  @Setter private SnapshotMetadata snapshot;
  @Setter private ImportHandle importHandle;
  @Setter private List<ChangeArtifact> window = List.of();
  private int batchesReplayed;

  public RecoveryRun(RecoveryRequest request) {
    this.request = request;
  }

  void enter(RecoveryStage next) {
    if (stage.isTerminal()) {
      throw new IllegalStateException("Run already finished in stage " + stage);
    }
    stage = next;
  }

  void batchReplayed() {
    batchesReplayed++;
  }
}
