package com.kvrestore.recovery.replay;

import com.kvrestore.core.model.ReplayStats;
import lombok.Value;

/** Outcome of applying one change batch. */
@Value
public class BatchResult {

  String location;
  int recordCount;
  ReplayStats stats;

  /** True only when no record of the batch failed. */
  public boolean isSuccess() {
    return stats.getErrorCount() == 0;
  }
}
