package com.kvrestore.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Durable record of one full snapshot: what was backed up, when, and where it lives.
 *
 * <p>Only {@code status} ever changes, and only as the result of polling the snapshot service.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SnapshotMetadata {

  @NonNull
  @JsonProperty("snapshot_id")
  String snapshotId;

  /** Source table name. */
  @NonNull
  @JsonProperty("table_name")
  String sourceTableId;

  /** Recovery-point identifier, {@code yyyyMMdd_HHmmss} in UTC. */
  @NonNull
  @JsonProperty("export_time")
  String recoveryPointId;

  @NonNull
  @JsonProperty("cutover_time")
  Instant cutoverTime;

  /** Storage prefix holding the snapshot data. */
  @NonNull
  @JsonProperty("s3_path")
  String locationReference;

  @NonNull
  @With
  @JsonProperty("status")
  TransferStatus status;
}
