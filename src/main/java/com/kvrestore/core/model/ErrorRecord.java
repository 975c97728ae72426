package com.kvrestore.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One failed record of a sub-batch, as written to the error artifact. */
@Value
@Builder
@Jacksonized
public class ErrorRecord {

  @JsonProperty("record_index")
  int recordIndex;

  @JsonProperty("error")
  String error;

  @JsonProperty("record_data")
  JsonNode recordData;
}
