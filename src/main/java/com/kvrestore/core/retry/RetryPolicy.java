package com.kvrestore.core.retry;

import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.function.Supplier;

/**
 * Runs remote operations under a {@link RetryProfile}.
 *
 * <p>Each call gets its own Resilience4j {@link Retry} so no state is shared between operations.
 * Non-retriable errors are rethrown on the first failure; after the last retry the last error is
 * rethrown unchanged.
 */
public class RetryPolicy {

  public static final String STAGE = "retry";

  private final RetryProfile profile;
  private final EventSink events;
  private final RetryConfig config;

  public RetryPolicy(RetryProfile profile, EventSink events) {
    this.profile = profile;
    this.events = events;
    this.config =
        RetryConfig.custom()
            .maxAttempts(profile.maxAttempts())
            .intervalFunction(
                (IntervalFunction) retryNumber -> profile.delayBeforeRetry(retryNumber - 1).toMillis())
            .retryOnException(error -> profile.isRetriable(RemoteServiceException.kindOf(error)))
            .build();
  }

  public <T> T execute(String operation, Supplier<T> call) {
    return newRetry(operation).executeSupplier(call);
  }

  public void run(String operation, Runnable call) {
    newRetry(operation).executeRunnable(call);
  }

  private Retry newRetry(String operation) {
    Retry retry = Retry.of(profile.getName() + ":" + operation, config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                events.emit(
                    RecoveryEvent.builder()
                        .stage(STAGE)
                        .severity(Severity.WARN)
                        .message("Retrying " + operation)
                        .field("profile", profile.getName())
                        .field("errorKind", RemoteServiceException.kindOf(event.getLastThrowable()))
                        .field("attempt", event.getNumberOfRetryAttempts())
                        .field("maxRetries", profile.getMaxRetries())
                        .field("delayMs", event.getWaitInterval().toMillis())
                        .build()));
    return retry;
  }
}
