package com.kvrestore.connector;

import com.kvrestore.core.model.TableSchema;

/** Table management of one table backend (one region). */
public interface TableCatalog {

  /**
   * @throws com.kvrestore.core.retry.RemoteServiceException RESOURCE_NOT_FOUND for unknown tables
   */
  TableSchema describeTable(String tableName);

  boolean tableExists(String tableName);

  /**
   * @throws com.kvrestore.core.retry.RemoteServiceException RESOURCE_IN_USE when it already exists
   */
  void createTable(TableSchema schema);

  /**
   * @throws com.kvrestore.core.retry.RemoteServiceException RESOURCE_NOT_FOUND for unknown tables
   */
  KeyValueTable openTable(String tableName);
}
