package com.kvrestore.recovery;

import static com.kvrestore.core.config.ErrorCodes.IMPORT_TIMEOUT;

import com.kvrestore.core.model.ImportHandle;
import java.time.Duration;
import lombok.Getter;

/** The import was still running when the polling ceiling was reached. */
@Getter
public class ImportTimeoutException extends RecoveryFailedException {

  private final ImportHandle handle;
  private final Duration timeout;

  public ImportTimeoutException(ImportHandle handle, Duration timeout) {
    super(
        RecoveryStage.RESTORE_FULL,
        IMPORT_TIMEOUT + ": import " + handle + " not finished after " + timeout.toSeconds() + "s");
    this.handle = handle;
    this.timeout = timeout;
  }
}
