package com.kvrestore.core.retry;

import static com.kvrestore.core.retry.ErrorKind.*;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Bounded exponential backoff parameters: {@code delay = initialDelay * backoffFactor^attempt},
 * at most {@code maxRetries} retries after the first attempt, only for {@code retriableKinds}.
 */
@Value
public class RetryProfile {

  public static final RetryProfile STORAGE_OPERATION =
      RetryProfile.builder()
          .name("storage-operation")
          .maxRetries(3)
          .initialDelay(Duration.ofMillis(500))
          .backoffFactor(2.0)
          .retriableKinds(
              EnumSet.of(REQUEST_TIMEOUT, SERVICE_UNAVAILABLE, RATE_LIMITED, INTERNAL_ERROR))
          .build();

  public static final RetryProfile TABLE_OPERATION =
      RetryProfile.builder()
          .name("table-operation")
          .maxRetries(3)
          .initialDelay(Duration.ofSeconds(1))
          .backoffFactor(2.0)
          .retriableKinds(EnumSet.of(THROUGHPUT_EXCEEDED, THROTTLED, RATE_LIMITED, INTERNAL_ERROR))
          .build();

  public static final RetryProfile BULK_TRANSFER =
      RetryProfile.builder()
          .name("bulk-transfer")
          .maxRetries(5)
          .initialDelay(Duration.ofSeconds(2))
          .backoffFactor(2.0)
          .retriableKinds(EnumSet.of(LIMIT_EXCEEDED, THROTTLED, INTERNAL_ERROR))
          .build();

  @NonNull String name;
  int maxRetries;
  @NonNull @With Duration initialDelay;
  double backoffFactor;
  @NonNull Set<ErrorKind> retriableKinds;

  @Builder(toBuilder = true)
  private RetryProfile(
      String name,
      int maxRetries,
      Duration initialDelay,
      double backoffFactor,
      Set<ErrorKind> retriableKinds) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    if (initialDelay.isNegative() || initialDelay.isZero()) {
      throw new IllegalArgumentException("initialDelay must be > 0: " + initialDelay);
    }
    if (backoffFactor < 1.0) {
      throw new IllegalArgumentException("backoffFactor must be >= 1: " + backoffFactor);
    }
    this.name = name;
    this.maxRetries = maxRetries;
    this.initialDelay = initialDelay;
    this.backoffFactor = backoffFactor;
    this.retriableKinds = Set.copyOf(retriableKinds);
  }

  public boolean isRetriable(ErrorKind kind) {
    return retriableKinds.contains(kind);
  }

  /** Delay before retry number {@code attempt + 1}, where {@code attempt} starts at 0. */
  public Duration delayBeforeRetry(int attempt) {
    return Duration.ofMillis(
        Math.round(initialDelay.toMillis() * Math.pow(backoffFactor, attempt)));
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }
}
