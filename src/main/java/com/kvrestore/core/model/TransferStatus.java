package com.kvrestore.core.model;

/** Lifecycle of a snapshot export or a bulk import. */
public enum TransferStatus {
  IN_PROGRESS,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}
