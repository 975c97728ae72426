package com.kvrestore.recovery;

import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RecoveryRequest {

  @NonNull String sourceTable;
  @NonNull String targetTable;

  /** Only snapshots with a cutover at or before this instant are considered. */
  Instant disasterTime;

  /** Explicit snapshot, e.g. {@code full_backup_20251220_084513}; overrides automatic selection. */
  String snapshotSelector;

  public Optional<Instant> findDisasterTime() {
    return Optional.ofNullable(disasterTime);
  }

  public Optional<String> findSnapshotSelector() {
    return Optional.ofNullable(snapshotSelector).filter(selector -> !selector.isBlank());
  }
}
