package com.kvrestore.recovery;

import lombok.Getter;

/** A recovery step could not complete; names the step that failed. */
@Getter
public class RecoveryFailedException extends RuntimeException {

  private final RecoveryStage stage;

  public RecoveryFailedException(RecoveryStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public RecoveryFailedException(RecoveryStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }
}
