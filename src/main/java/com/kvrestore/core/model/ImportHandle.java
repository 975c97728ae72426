package com.kvrestore.core.model;

import java.util.Objects;

/**
 * Reference to a submitted bulk import.
 *
 * @param importId identifier assigned by the snapshot service
 * @param tableName the table the import creates
 */
public record ImportHandle(String importId, String tableName) {
  public ImportHandle {
    Objects.requireNonNull(importId, "Import id cannot be null");
    Objects.requireNonNull(tableName, "Import table name cannot be null");
  }

  @Override
  public String toString() {
    return importId + " -> " + tableName;
  }
}
