package com.kvrestore.core.retry;

/**
 * Error kinds reported by remote collaborators (blob store, table backend, snapshot service).
 * Retry profiles select which kinds they retry.
 */
public enum ErrorKind {
  REQUEST_TIMEOUT,
  SERVICE_UNAVAILABLE,
  RATE_LIMITED,
  INTERNAL_ERROR,
  THROUGHPUT_EXCEEDED,
  THROTTLED,
  LIMIT_EXCEEDED,
  VALIDATION,
  CONDITIONAL_CHECK_FAILED,
  RESOURCE_IN_USE,
  RESOURCE_NOT_FOUND(true),
  ACCESS_DENIED(true),
  UNKNOWN;

  private final boolean sessionScoped;

  ErrorKind() {
    this(false);
  }

  ErrorKind(boolean sessionScoped) {
    this.sessionScoped = sessionScoped;
  }

  /**
   * Whether the error concerns the whole connection or table rather than the single item being
   * written. Such errors abort a replay sub-batch instead of being charged to one record.
   */
  public boolean isSessionScoped() {
    return sessionScoped;
  }
}
