package com.kvrestore.core.dlq;

import com.kvrestore.core.model.ErrorRecord;
import java.util.List;
import java.util.Optional;

/** Destination for the failed records of one replay sub-batch. */
public interface ErrorRecordSink {

  /**
   * Persists one error artifact. Never throws: a failed write is logged and reported as empty.
   *
   * @return the artifact name, or empty when nothing was written
   */
  Optional<String> publish(List<ErrorRecord> errorRecords);
}
