package com.kvrestore.connector.feed;

import com.kvrestore.connector.BlobStore;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.core.util.JsonUtils;
import com.kvrestore.core.util.StreamRecordCodec;
import com.kvrestore.core.util.Timestamps;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one captured group of stream records as a change artifact named
 * {@code <prefix>ddb_changes_<yyyyMMdd_HHmmss_SSSSSS>.json}.
 */
public class ChangeFeedPublisher {

  private static final Logger log = LoggerFactory.getLogger(ChangeFeedPublisher.class);
  static final String ARTIFACT_PREFIX = "ddb_changes_";

  private final BlobStore store;
  private final RetryPolicy storageRetry;
  private final Clock clock;
  private final String prefix;

  public ChangeFeedPublisher(BlobStore store, RetryPolicy storageRetry, Clock clock, String prefix) {
    this.store = store;
    this.storageRetry = storageRetry;
    this.clock = clock;
    this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
  }

  /** @return the artifact key, or empty when there was nothing to publish */
  public Optional<String> publish(List<ChangeRecord> records) {
    if (records.isEmpty()) {
      return Optional.empty();
    }
    byte[] body = JsonUtils.toBytes(StreamRecordCodec.writeArtifact(records));
    String base = prefix + ARTIFACT_PREFIX + Timestamps.changeArtifactSuffix(clock.instant());
    String target = freeKey(base);
    storageRetry.run("put " + target, () -> store.put(target, body));
    log.info("[ChangeFeed] Published {} records to {}", records.size(), target);
    return Optional.of(target);
  }

  private String freeKey(String base) {
    String key = base + BlobChangeFeedSource.ARTIFACT_SUFFIX;
    for (int n = 1; exists(key); n++) {
      key = base + "_" + n + BlobChangeFeedSource.ARTIFACT_SUFFIX;
    }
    return key;
  }

  private boolean exists(String key) {
    return storageRetry.execute("head " + key, () -> store.exists(key));
  }
}
