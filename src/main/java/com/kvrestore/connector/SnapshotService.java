package com.kvrestore.connector;

import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ImportProgress;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.model.TransferStatus;

/** Bulk export of a table into storage and bulk import of a stored snapshot into a new table. */
public interface SnapshotService extends AutoCloseable {

  /** Starts a point-in-time export; the returned metadata is usually still IN_PROGRESS. */
  SnapshotMetadata requestExport(String tableId);

  TransferStatus pollExport(String snapshotId);

  /**
   * Starts importing the snapshot at {@code location} into a table that must not exist yet.
   *
   * @throws com.kvrestore.core.retry.RemoteServiceException RESOURCE_IN_USE when the table exists
   */
  ImportHandle requestImport(String location, TableSchema schema, String newTableName);

  ImportProgress pollImport(ImportHandle handle);

  @Override
  default void close() {}
}
