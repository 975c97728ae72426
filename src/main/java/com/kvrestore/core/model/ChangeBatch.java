package com.kvrestore.core.model;

import java.time.Instant;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** The ordered change records read from one feed artifact. Immutable once produced. */
@Value
public class ChangeBatch {

  @NonNull String location;
  Instant producedAt;
  @NonNull List<ChangeRecord> records;

  public ChangeBatch(String location, Instant producedAt, List<ChangeRecord> records) {
    this.location = location;
    this.producedAt = producedAt;
    this.records = List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
