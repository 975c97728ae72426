package com.kvrestore.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One captured mutation of a table row.
 *
 * <p>{@code newImage} is always the complete post-write row for INSERT and MODIFY; replay
 * overwrites whole rows and never merges fields. The raw {@code eventName} is kept as received so
 * that unsupported kinds can be reported per record instead of rejecting the whole batch. In the
 * same way a record whose attributes could not be decoded keeps its original JSON and the decode
 * error, and fails on its own when replayed.
 */
@Value
@Builder(toBuilder = true)
public class ChangeRecord implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  @NonNull String eventName;
  @NonNull Map<String, AttributeValue> key;
  Map<String, AttributeValue> newImage;
  Instant arrivalTime;
  JsonNode rawRecord;
  String decodeError;

  public OperationKind getOperationKind() {
    return OperationKind.fromEventName(eventName);
  }

  public boolean isMalformed() {
    return decodeError != null;
  }

  /** A record that could not be decoded, kept as received. */
  public static ChangeRecord malformed(String eventName, JsonNode rawRecord, String decodeError) {
    return ChangeRecord.builder()
        .eventName(eventName)
        .key(Map.of())
        .rawRecord(rawRecord)
        .decodeError(decodeError)
        .build();
  }

  public static ChangeRecord insert(Map<String, AttributeValue> key, Map<String, AttributeValue> image) {
    return of(OperationKind.INSERT, key, image);
  }

  public static ChangeRecord modify(Map<String, AttributeValue> key, Map<String, AttributeValue> image) {
    return of(OperationKind.MODIFY, key, image);
  }

  public static ChangeRecord remove(Map<String, AttributeValue> key) {
    return of(OperationKind.REMOVE, key, null);
  }

  private static ChangeRecord of(
      OperationKind kind, Map<String, AttributeValue> key, Map<String, AttributeValue> image) {
    return ChangeRecord.builder()
        .eventName(kind.name())
        .key(key)
        .newImage(image)
        .arrivalTime(Instant.now())
        .build();
  }
}
