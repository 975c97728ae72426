package com.kvrestore.recovery.window;

import com.kvrestore.connector.ChangeFeedSource;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.ChangeArtifact;
import com.kvrestore.core.retry.RetryPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the change artifacts to replay after a snapshot: everything produced at or after
 * {@code cutover - overlap}, oldest first. The overlap catches writes that landed around the
 * cutover; replaying them again is harmless because replay is idempotent.
 */
public class ChangeWindowResolver {

  public static final Duration DEFAULT_OVERLAP = Duration.ofSeconds(60);
  static final String STAGE = "resolve-window";

  static final Comparator<ChangeArtifact> REPLAY_ORDER =
      Comparator.comparing(ChangeArtifact::producedAt).thenComparing(ChangeArtifact::key);

  private final ChangeFeedSource feed;
  private final RetryPolicy storageRetry;
  private final EventSink events;
  private final String prefix;
  private final Duration overlap;

  public ChangeWindowResolver(
      ChangeFeedSource feed,
      RetryPolicy storageRetry,
      EventSink events,
      String prefix,
      Duration overlap) {
    if (overlap.isNegative()) {
      throw new IllegalArgumentException("overlap must not be negative: " + overlap);
    }
    this.feed = feed;
    this.storageRetry = storageRetry;
    this.events = events;
    this.prefix = prefix;
    this.overlap = overlap;
  }

  public List<ChangeArtifact> resolve(Instant cutover) {
    Instant windowStart = cutover.minus(overlap);
    List<ChangeArtifact> listed =
        storageRetry.execute("list " + prefix, () -> feed.listChangeArtifacts(prefix));
    List<ChangeArtifact> window =
        listed.stream()
            .filter(artifact -> !artifact.producedAt().isBefore(windowStart))
            .sorted(REPLAY_ORDER)
            .collect(Collectors.toList());

    events.emit(
        RecoveryEvent.builder()
            .stage(STAGE)
            .severity(Severity.INFO)
            .message("Resolved change window")
            .field("prefix", prefix)
            .field("windowStart", windowStart)
            .field("listed", listed.size())
            .field("selected", window.size())
            .build());
    return window;
  }
}
