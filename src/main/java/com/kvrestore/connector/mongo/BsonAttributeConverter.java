package com.kvrestore.connector.mongo;

import com.kvrestore.core.model.AttributeType;
import com.kvrestore.core.model.AttributeValue;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;

/**
 * Converts typed attributes to BSON values and back.
 *
 * <p>Numbers become {@link Decimal128} when they fit, otherwise they are kept as text in a marker
 * document. Sets have no BSON counterpart and always use a marker document {@code {_t: "SS", _v:
 * [...]}}.
 */
final class BsonAttributeConverter {

  static final String ID = "_id";
  static final String TYPE_MARKER = "_t";
  static final String VALUE_MARKER = "_v";

  private BsonAttributeConverter() {}

  static Document toDocument(Map<String, AttributeValue> item) {
    Document document = new Document();
    item.forEach((name, value) -> document.put(name, toBson(value)));
    return document;
  }

  static Map<String, AttributeValue> fromDocument(Document document) {
    Map<String, AttributeValue> item = new LinkedHashMap<>();
    document.forEach(
        (name, value) -> {
          if (!ID.equals(name)) {
            item.put(name, fromBson(value));
          }
        });
    return item;
  }

  static Object toBson(AttributeValue value) {
    return switch (value.type()) {
      case S -> value.asString();
      case N -> toDecimal(value.asString());
      case B -> new Binary(value.asBytes());
      case BOOL -> value.asBool();
      case NULL -> null;
      case M -> toDocument(value.asMap());
      case L -> {
        List<Object> list = new ArrayList<>();
        value.asList().forEach(element -> list.add(toBson(element)));
        yield list;
      }
      case SS, NS, BS -> marker(value.type(), new ArrayList<>(value.asSet()));
    };
  }

  static AttributeValue fromBson(Object value) {
    if (value == null) {
      return AttributeValue.nul();
    }
    if (value instanceof String s) {
      return AttributeValue.s(s);
    }
    if (value instanceof Decimal128 decimal) {
      return AttributeValue.n(decimal.bigDecimalValue().toString());
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Double) {
      return AttributeValue.n(new BigDecimal(value.toString()).toString());
    }
    if (value instanceof Boolean b) {
      return AttributeValue.bool(b);
    }
    if (value instanceof Binary binary) {
      return AttributeValue.b(binary.getData());
    }
    if (value instanceof Document document) {
      return isMarker(document) ? fromMarker(document) : AttributeValue.m(fromDocument(document));
    }
    if (value instanceof List<?> list) {
      List<AttributeValue> values = new ArrayList<>();
      list.forEach(element -> values.add(fromBson(element)));
      return AttributeValue.l(values);
    }
    throw new IllegalArgumentException("Unsupported BSON value type: " + value.getClass().getName());
  }

  private static Object toDecimal(String number) {
    try {
      return new Decimal128(new BigDecimal(number));
    } catch (NumberFormatException e) {
      // outside Decimal128 precision or range
      return marker(AttributeType.N, number);
    }
  }

  private static Document marker(AttributeType type, Object value) {
    return new Document(TYPE_MARKER, type.name()).append(VALUE_MARKER, value);
  }

  private static boolean isMarker(Document document) {
    return document.size() == 2
        && document.get(TYPE_MARKER) instanceof String
        && document.containsKey(VALUE_MARKER);
  }

  private static AttributeValue fromMarker(Document document) {
    AttributeType type = AttributeType.valueOf(document.getString(TYPE_MARKER));
    return switch (type) {
      case N -> AttributeValue.n(document.getString(VALUE_MARKER));
      case SS -> AttributeValue.ss(document.getList(VALUE_MARKER, String.class));
      case NS -> AttributeValue.ns(document.getList(VALUE_MARKER, String.class));
      case BS -> AttributeValue.bs(document.getList(VALUE_MARKER, String.class));
      default -> throw new IllegalArgumentException("Unsupported marker type: " + type);
    };
  }
}
