package com.kvrestore.connector;

import java.util.List;
import java.util.Optional;

/**
 * Flat key/bytes object storage holding snapshots, snapshot metadata and change artifacts. Keys
 * use {@code /} as separator; a prefix lists everything below it.
 *
 * <p>Failures surface as {@link com.kvrestore.core.retry.RemoteServiceException}.
 */
public interface BlobStore {

  /** All objects whose key starts with {@code prefix}, sorted by key. */
  List<BlobObject> list(String prefix);

  Optional<BlobObject> head(String key);

  byte[] get(String key);

  void put(String key, byte[] body);

  default boolean exists(String key) {
    return head(key).isPresent();
  }

  /**
   * Fails with {@link IllegalStateException} when the store cannot be read and written.
   */
  void verifyAccessible();

  /** Human-readable location of the store, for logs. */
  String describe();
}
