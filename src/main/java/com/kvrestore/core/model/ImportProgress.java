package com.kvrestore.core.model;

import java.util.Optional;

/**
 * Result of polling a bulk import.
 *
 * @param status current status
 * @param failureCode failure code, only for {@link TransferStatus#FAILED}
 * @param failureMessage failure message, only for {@link TransferStatus#FAILED}
 * @param importedItemCount items written so far
 */
public record ImportProgress(
    TransferStatus status, String failureCode, String failureMessage, long importedItemCount) {

  public static ImportProgress inProgress(long importedItemCount) {
    return new ImportProgress(TransferStatus.IN_PROGRESS, null, null, importedItemCount);
  }

  public static ImportProgress completed(long importedItemCount) {
    return new ImportProgress(TransferStatus.COMPLETED, null, null, importedItemCount);
  }

  public static ImportProgress failed(String failureCode, String failureMessage) {
    return new ImportProgress(TransferStatus.FAILED, failureCode, failureMessage, 0L);
  }

  public Optional<String> failureReason() {
    if (status != TransferStatus.FAILED) {
      return Optional.empty();
    }
    return Optional.of(
        (failureCode != null ? failureCode : "Unknown")
            + " - "
            + (failureMessage != null ? failureMessage : "Unknown"));
  }
}
