package com.kvrestore.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Applied/failed counters of one sub-batch or batch application. Also used as the run-wide total
 * by merging per-batch stats into it.
 */
@Getter
public class ReplayStats {

  private long appliedCount;
  private long errorCount;
  private final List<ErrorRecord> errorRecords = new ArrayList<>();

  public void recordApplied() {
    appliedCount++;
  }

  public void recordError(ErrorRecord errorRecord) {
    errorCount++;
    errorRecords.add(errorRecord);
  }

  /** Counts records as failed without attributing individual errors to them. */
  public void recordUnattributedErrors(int count) {
    errorCount += count;
  }

  public void merge(ReplayStats other) {
    appliedCount += other.appliedCount;
    errorCount += other.errorCount;
    errorRecords.addAll(other.errorRecords);
  }

  public List<ErrorRecord> getErrorRecords() {
    return Collections.unmodifiableList(errorRecords);
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  /** Percentage of applied records over {@code total}; 100 when there was nothing to apply. */
  public double successRate(long total) {
    return total == 0 ? 100.0 : (appliedCount * 100.0) / total;
  }

  @Override
  public String toString() {
    return "ReplayStats{applied=" + appliedCount + ", errors=" + errorCount + "}";
  }
}
