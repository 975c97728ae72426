package com.kvrestore.core.retry;

import java.time.Duration;

/** Blocks the calling thread. Injected so that polling and batch-retry loops stay testable. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM =
      duration -> {
        try {
          Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting " + duration, e);
        }
      };

  void sleep(Duration duration);
}
