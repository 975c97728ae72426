package com.kvrestore.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kvrestore.core.model.AttributeValue;
import com.kvrestore.core.model.ChangeRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes change artifacts: JSON arrays of stream records shaped as
 * {@code {"eventName": "...", "dynamodb": {"Keys": {...}, "NewImage": {...},
 * "ApproximateCreationDateTime": 1734684313.5}}}.
 */
public final class StreamRecordCodec {

  static final String EVENT_NAME = "eventName";
  static final String BODY = "dynamodb";
  static final String KEYS = "Keys";
  static final String NEW_IMAGE = "NewImage";
  static final String CREATED = "ApproximateCreationDateTime";

  private StreamRecordCodec() {}

  /**
   * Parses an artifact body. A Lambda-style {@code {"Records": [...]}} envelope is accepted too.
   * Only a body that is not a JSON array fails; a record with undecodable attributes is returned
   * as {@link ChangeRecord#malformed}.
   */
  public static List<ChangeRecord> parseArtifact(byte[] body) {
    JsonNode root = JsonUtils.readTree(body);
    if (root.isObject() && root.has("Records")) {
      root = root.get("Records");
    }
    if (!root.isArray()) {
      throw new IllegalArgumentException("Change artifact must be a JSON array of stream records");
    }
    List<ChangeRecord> records = new ArrayList<>(root.size());
    root.forEach(node -> records.add(parseLenient(node)));
    return records;
  }

  static ChangeRecord parseLenient(JsonNode node) {
    try {
      return parse(node);
    } catch (RuntimeException e) {
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return ChangeRecord.malformed(node.path(EVENT_NAME).asText(""), node.deepCopy(), error);
    }
  }

  public static ChangeRecord parse(JsonNode node) {
    JsonNode body = node.path(BODY);
    Map<String, AttributeValue> key =
        AttributeValueJson.readItem(body.get(KEYS));
    return ChangeRecord.builder()
        .eventName(node.path(EVENT_NAME).asText(""))
        .key(key != null ? key : Map.of())
        .newImage(AttributeValueJson.readItem(body.get(NEW_IMAGE)))
        .arrivalTime(parseCreationTime(body.get(CREATED)))
        .build();
  }

  public static ObjectNode write(ChangeRecord record) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put(EVENT_NAME, record.getEventName());
    ObjectNode body = node.putObject(BODY);
    if (record.getArrivalTime() != null) {
      body.put(CREATED, toEpochSeconds(record.getArrivalTime()));
    }
    body.set(KEYS, AttributeValueJson.writeItem(record.getKey()));
    if (record.getNewImage() != null) {
      body.set(NEW_IMAGE, AttributeValueJson.writeItem(record.getNewImage()));
    }
    return node;
  }

  /** The record as stream-record JSON; a malformed record is returned exactly as it was read. */
  public static JsonNode toJson(ChangeRecord record) {
    return record.isMalformed() ? record.getRawRecord().deepCopy() : write(record);
  }

  public static ArrayNode writeArtifact(List<ChangeRecord> records) {
    ArrayNode array = JsonNodeFactory.instance.arrayNode();
    records.forEach(record -> array.add(toJson(record)));
    return array;
  }

  static Instant parseCreationTime(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      BigDecimal seconds = value.decimalValue();
      return Instant.ofEpochSecond(
          seconds.longValue(),
          seconds.remainder(BigDecimal.ONE).movePointRight(9).longValue());
    }
    String text = value.asText().trim();
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant();
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }

  private static BigDecimal toEpochSeconds(Instant instant) {
    return BigDecimal.valueOf(instant.getEpochSecond())
        .add(BigDecimal.valueOf(instant.getNano(), 9))
        .stripTrailingZeros();
  }
}
