package com.kvrestore.connector.feed;

import com.kvrestore.connector.BlobObject;
import com.kvrestore.connector.BlobStore;
import com.kvrestore.connector.ChangeFeedSource;
import com.kvrestore.core.model.ChangeArtifact;
import com.kvrestore.core.model.ChangeBatch;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.util.StreamRecordCodec;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change feed stored as JSON artifacts in a {@link BlobStore}. The production time of an artifact
 * is the last-modified time the store reports, never a timestamp parsed from its name.
 *
 * <p>Calls are not retried here; callers wrap them in the storage retry profile.
 */
public class BlobChangeFeedSource implements ChangeFeedSource {

  private static final Logger log = LoggerFactory.getLogger(BlobChangeFeedSource.class);
  static final String ARTIFACT_SUFFIX = ".json";

  private final BlobStore store;

  public BlobChangeFeedSource(BlobStore store) {
    this.store = store;
  }

  @Override
  public List<ChangeArtifact> listChangeArtifacts(String prefix) {
    List<ChangeArtifact> artifacts =
        store.list(prefix).stream()
            .filter(blob -> blob.key().endsWith(ARTIFACT_SUFFIX))
            .map(blob -> new ChangeArtifact(blob.key(), blob.lastModified(), blob.size()))
            .collect(Collectors.toList());
    log.debug("[ChangeFeed] {} artifacts under {}", artifacts.size(), prefix);
    return artifacts;
  }

  @Override
  public ChangeBatch getArtifact(String key) {
    byte[] body = store.get(key);
    Instant producedAt = store.head(key).map(BlobObject::lastModified).orElse(null);
    List<ChangeRecord> records = StreamRecordCodec.parseArtifact(body);
    long malformed = records.stream().filter(ChangeRecord::isMalformed).count();
    if (malformed > 0) {
      log.warn("[ChangeFeed] {} of {} records in {} could not be decoded", malformed, records.size(), key);
    }
    log.debug("[ChangeFeed] Read {} records from {}", records.size(), key);
    return new ChangeBatch(key, producedAt, records);
  }
}
