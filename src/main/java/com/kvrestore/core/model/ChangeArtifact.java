package com.kvrestore.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A listing entry of the change feed.
 *
 * @param key blob key of the artifact
 * @param producedAt the time the storage layer recorded for the artifact
 * @param size artifact size in bytes
 */
public record ChangeArtifact(String key, Instant producedAt, long size) {
  public ChangeArtifact {
    Objects.requireNonNull(key, "Artifact key cannot be null");
    Objects.requireNonNull(producedAt, "Artifact production time cannot be null");
  }
}
