package com.kvrestore.recovery.replay;

import static com.kvrestore.core.config.ErrorCodes.*;

import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.core.dlq.ErrorRecordSink;
import com.kvrestore.core.event.EventSink;
import com.kvrestore.core.event.RecoveryEvent;
import com.kvrestore.core.event.Severity;
import com.kvrestore.core.model.AttributeValue;
import com.kvrestore.core.model.ChangeBatch;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.model.ErrorRecord;
import com.kvrestore.core.model.ReplayStats;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.core.retry.RetryPolicy;
import com.kvrestore.core.retry.Sleeper;
import com.kvrestore.core.util.StreamRecordCodec;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies change records to a live table.
 *
 * <p>INSERT and MODIFY write the full new image unconditionally; REMOVE deletes only when the row
 * exists, and an already absent row counts as applied. The result depends only on the last
 * record per key, so replaying overlapping or duplicated batches converges to the same state.
 *
 * <p>A failing record is charged to that record alone. Errors that concern the whole table
 * (access denied, table gone) abort the sub-batch, which is retried as a unit.
 */
public class ReplayEngine {

  private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

  public static final int DEFAULT_SUB_BATCH_SIZE = 100;
  public static final int DEFAULT_SUB_BATCH_ATTEMPTS = 3;
  static final String STAGE = "replay";

  private final KeyValueTable table;
  private final RetryPolicy tableRetry;
  private final ErrorRecordSink errorSink;
  private final EventSink events;
  private final Sleeper sleeper;
  private final int subBatchSize;
  private final int maxSubBatchAttempts;
  private final String keyAttribute;

  @Builder
  private ReplayEngine(
      @NonNull KeyValueTable table,
      @NonNull RetryPolicy tableRetry,
      @NonNull ErrorRecordSink errorSink,
      @NonNull EventSink events,
      Sleeper sleeper,
      Integer subBatchSize,
      Integer maxSubBatchAttempts) {
    this.table = table;
    this.tableRetry = tableRetry;
    this.errorSink = errorSink;
    this.events = events;
    this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    this.subBatchSize = positive("subBatchSize", subBatchSize, DEFAULT_SUB_BATCH_SIZE);
    this.maxSubBatchAttempts =
        positive("maxSubBatchAttempts", maxSubBatchAttempts, DEFAULT_SUB_BATCH_ATTEMPTS);
    this.keyAttribute = table.schema().partitionKeyName();
  }

  public BatchResult applyBatch(ChangeBatch batch) {
    List<ChangeRecord> records = batch.getRecords();
    ReplayStats total = new ReplayStats();
    if (records.isEmpty()) {
      log.info("[ReplayEngine] {} is empty, nothing to apply", batch.getLocation());
      return new BatchResult(batch.getLocation(), 0, total);
    }

    int subBatches = (records.size() + subBatchSize - 1) / subBatchSize;
    for (int start = 0; start < records.size(); start += subBatchSize) {
      List<ChangeRecord> subBatch = records.subList(start, Math.min(start + subBatchSize, records.size()));
      int number = start / subBatchSize + 1;
      log.info(
          "[ReplayEngine] Applying sub-batch {}/{} of {} ({} records)",
          number,
          subBatches,
          batch.getLocation(),
          subBatch.size());
      total.merge(applyWithRetry(subBatch, start, number));
    }

    double successRate = total.successRate(records.size());
    log.info(
        "[ReplayEngine] {} done: {} applied, {} failed ({}%)",
        batch.getLocation(),
        total.getAppliedCount(),
        total.getErrorCount(),
        String.format("%.1f", successRate));
    events.emit(
        RecoveryEvent.builder()
            .stage(STAGE)
            .severity(total.hasErrors() ? Severity.WARN : Severity.INFO)
            .message("Applied change batch")
            .field("location", batch.getLocation())
            .field("records", records.size())
            .field("applied", total.getAppliedCount())
            .field("errors", total.getErrorCount())
            .field("successRate", String.format("%.1f", successRate))
            .build());
    return new BatchResult(batch.getLocation(), records.size(), total);
  }

  /**
   * Applies records one by one and writes the failed ones to the error sink.
   *
   * @param baseIndex index of the first record within its batch, used in error records
   */
  public ReplayStats applySubBatch(List<ChangeRecord> records, int baseIndex) {
    ReplayStats stats = new ReplayStats();
    for (int i = 0; i < records.size(); i++) {
      ChangeRecord record = records.get(i);
      try {
        applyRecord(record);
        stats.recordApplied();
      } catch (RuntimeException e) {
        if (RemoteServiceException.kindOf(e).isSessionScoped()) {
          throw e;
        }
        int index = baseIndex + i;
        String error = describe(e);
        log.error("[ReplayEngine] Record {} failed: {}", index, error);
        stats.recordError(
            ErrorRecord.builder()
                .recordIndex(index)
                .error(error)
                .recordData(StreamRecordCodec.toJson(record))
                .build());
      }
    }

    if (stats.hasErrors()) {
      Optional<String> artifact = errorSink.publish(stats.getErrorRecords());
      events.emit(
          RecoveryEvent.builder()
              .stage(STAGE)
              .severity(Severity.WARN)
              .message("Sub-batch finished with record errors")
              .field("applied", stats.getAppliedCount())
              .field("errors", stats.getErrorCount())
              .field("errorArtifact", artifact.orElse("<not written>"))
              .build());
    }
    return stats;
  }

  private ReplayStats applyWithRetry(List<ChangeRecord> subBatch, int baseIndex, int number) {
    for (int attempt = 0; ; attempt++) {
      try {
        return applySubBatch(subBatch, baseIndex);
      } catch (RuntimeException e) {
        if (attempt + 1 >= maxSubBatchAttempts) {
          events.emit(
              RecoveryEvent.builder()
                  .stage(STAGE)
                  .severity(Severity.ERROR)
                  .message("Sub-batch failed permanently")
                  .field("code", SUB_BATCH_FAILED)
                  .field("subBatch", number)
                  .field("records", subBatch.size())
                  .field("attempts", attempt + 1)
                  .cause(e)
                  .build());
          ReplayStats failed = new ReplayStats();
          failed.recordUnattributedErrors(subBatch.size());
          return failed;
        }
        Duration delay = Duration.ofSeconds(1L << attempt);
        events.emit(
            RecoveryEvent.builder()
                .stage(STAGE)
                .severity(Severity.WARN)
                .message("Sub-batch failed, retrying")
                .field("subBatch", number)
                .field("attempt", attempt + 1)
                .field("delayMs", delay.toMillis())
                .cause(e)
                .build());
        sleeper.sleep(delay);
      }
    }
  }

  void applyRecord(ChangeRecord record) {
    if (record.isMalformed()) {
      throw new IllegalArgumentException(INVALID_RECORD + ": " + record.getDecodeError());
    }
    switch (record.getOperationKind()) {
      case INSERT, MODIFY -> {
        Map<String, AttributeValue> image = record.getNewImage();
        if (image == null || image.isEmpty()) {
          throw new IllegalArgumentException(
              INVALID_RECORD + ": " + record.getEventName() + " record has no new image");
        }
        tableRetry.run("putItem " + table.name(), () -> table.putItem(image));
      }
      case REMOVE -> {
        Map<String, AttributeValue> key = record.getKey();
        if (key.isEmpty()) {
          throw new IllegalArgumentException(INVALID_RECORD + ": REMOVE record has no key");
        }
        try {
          tableRetry.run("deleteItem " + table.name(), () -> table.deleteItemIfExists(key, keyAttribute));
        } catch (RemoteServiceException e) {
          if (e.getKind() != ErrorKind.CONDITIONAL_CHECK_FAILED) {
            throw e;
          }
          log.debug("[ReplayEngine] REMOVE skipped, row already absent: {}", key);
        }
      }
      case UNKNOWN -> throw new IllegalArgumentException(
          UNSUPPORTED_OPERATION + ": unknown operation '" + record.getEventName() + "'");
    }
  }

  private static String describe(RuntimeException e) {
    if (e instanceof RemoteServiceException || e instanceof IllegalArgumentException) {
      return e.getMessage();
    }
    return RECORD_APPLY_ERROR + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getName());
  }

  private static int positive(String name, Integer value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0: " + value);
    }
    return value;
  }
}
