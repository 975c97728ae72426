package com.kvrestore.core.event;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A structured progress or failure notice emitted by the recovery components. */
@Value
@Builder
public class RecoveryEvent {

  @NonNull String stage;
  @NonNull Severity severity;
  @NonNull String message;
  @Singular Map<String, Object> fields;
  Throwable cause;

  public static RecoveryEvent warn(String stage, String message) {
    return RecoveryEvent.builder().stage(stage).severity(Severity.WARN).message(message).build();
  }
}
