package com.kvrestore.connector;

import com.kvrestore.core.model.AttributeValue;
import com.kvrestore.core.model.TableSchema;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Row-level access to one live table. */
public interface KeyValueTable {

  String name();

  TableSchema schema();

  /** Unconditionally replaces the whole row addressed by the item's key attributes. */
  void putItem(Map<String, AttributeValue> item);

  /**
   * Deletes the row only if it exists and carries {@code keyAttribute}.
   *
   * @throws com.kvrestore.core.retry.RemoteServiceException CONDITIONAL_CHECK_FAILED when the row
   *     is absent
   */
  void deleteItemIfExists(Map<String, AttributeValue> key, String keyAttribute);

  Optional<Map<String, AttributeValue>> getItem(Map<String, AttributeValue> key);

  List<Map<String, AttributeValue>> scan();
}
