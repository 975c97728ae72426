package com.kvrestore.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kvrestore.core.model.AttributeType;
import com.kvrestore.core.model.AttributeValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Codec for typed attribute JSON, e.g. {@code {"id": {"N": "1"}, "tags": {"SS": ["a", "b"]}}}.
 */
public final class AttributeValueJson {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private AttributeValueJson() {}

  public static Map<String, AttributeValue> readItem(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (!node.isObject()) {
      throw new IllegalArgumentException("Item must be a JSON object: " + node);
    }
    Map<String, AttributeValue> item = new LinkedHashMap<>();
    node.fields().forEachRemaining(e -> item.put(e.getKey(), read(e.getValue())));
    return item;
  }

  public static AttributeValue read(JsonNode node) {
    if (node == null || !node.isObject() || node.size() != 1) {
      throw new IllegalArgumentException("Typed attribute must have exactly one type tag: " + node);
    }
    Map.Entry<String, JsonNode> tagged = node.fields().next();
    AttributeType type;
    try {
      type = AttributeType.valueOf(tagged.getKey());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown attribute type tag: " + tagged.getKey(), e);
    }
    JsonNode value = tagged.getValue();
    return switch (type) {
      case S -> AttributeValue.s(value.asText());
      case N -> AttributeValue.n(value.asText());
      case B -> AttributeValue.bBase64(value.asText());
      case BOOL -> AttributeValue.bool(value.isBoolean() ? value.booleanValue() : Boolean.parseBoolean(value.asText()));
      case NULL -> AttributeValue.nul();
      case M -> AttributeValue.m(readItem(value));
      case L -> {
        List<AttributeValue> list = new ArrayList<>();
        value.forEach(element -> list.add(read(element)));
        yield AttributeValue.l(list);
      }
      case SS -> AttributeValue.ss(texts(value));
      case NS -> AttributeValue.ns(texts(value));
      case BS -> AttributeValue.bs(texts(value));
    };
  }

  public static ObjectNode writeItem(Map<String, AttributeValue> item) {
    ObjectNode node = NODES.objectNode();
    item.forEach((name, value) -> node.set(name, write(value)));
    return node;
  }

  public static ObjectNode write(AttributeValue value) {
    ObjectNode node = NODES.objectNode();
    String tag = value.type().name();
    switch (value.type()) {
      case S, N, B -> node.put(tag, value.asString());
      case BOOL -> node.put(tag, value.asBool());
      case NULL -> node.put(tag, true);
      case M -> node.set(tag, writeItem(value.asMap()));
      case L -> {
        ArrayNode array = node.putArray(tag);
        value.asList().forEach(element -> array.add(write(element)));
      }
      case SS, NS, BS -> {
        ArrayNode array = node.putArray(tag);
        value.asSet().forEach(array::add);
      }
    }
    return node;
  }

  private static List<String> texts(JsonNode array) {
    if (!array.isArray()) {
      throw new IllegalArgumentException("Set attribute must be a JSON array: " + array);
    }
    List<String> values = new ArrayList<>();
    for (Iterator<JsonNode> it = array.elements(); it.hasNext(); ) {
      values.add(it.next().asText());
    }
    return values;
  }
}
