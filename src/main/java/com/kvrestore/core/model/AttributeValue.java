package com.kvrestore.core.model;

import java.io.Serial;
import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A single typed attribute value.
 *
 * <p>Scalars are held as {@code String} (numbers keep their textual form, binaries are base64),
 * sets as a sorted {@code List<String>}, maps and lists as unmodifiable collections of nested
 * values. This keeps equality structural, which replay tests rely on when comparing table state.
 */
public record AttributeValue(AttributeType type, Object value) implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  public AttributeValue {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(value, "value must not be null");
  }

  public static AttributeValue s(String value) {
    return new AttributeValue(AttributeType.S, value);
  }

  public static AttributeValue n(String value) {
    new BigDecimal(value);
    return new AttributeValue(AttributeType.N, value);
  }

  public static AttributeValue n(long value) {
    return new AttributeValue(AttributeType.N, Long.toString(value));
  }

  public static AttributeValue b(byte[] value) {
    return new AttributeValue(AttributeType.B, Base64.getEncoder().encodeToString(value));
  }

  public static AttributeValue bBase64(String base64) {
    return new AttributeValue(AttributeType.B, base64);
  }

  public static AttributeValue bool(boolean value) {
    return new AttributeValue(AttributeType.BOOL, value);
  }

  public static AttributeValue nul() {
    return new AttributeValue(AttributeType.NULL, Boolean.TRUE);
  }

  public static AttributeValue m(Map<String, AttributeValue> value) {
    return new AttributeValue(
        AttributeType.M, Collections.unmodifiableMap(new LinkedHashMap<>(value)));
  }

  public static AttributeValue l(List<AttributeValue> value) {
    return new AttributeValue(AttributeType.L, List.copyOf(value));
  }

  public static AttributeValue ss(Collection<String> values) {
    return set(AttributeType.SS, values);
  }

  public static AttributeValue ns(Collection<String> values) {
    values.forEach(BigDecimal::new);
    return set(AttributeType.NS, values);
  }

  public static AttributeValue bs(Collection<String> base64Values) {
    return set(AttributeType.BS, base64Values);
  }

  private static AttributeValue set(AttributeType type, Collection<String> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException(type + " set must not be empty");
    }
    return new AttributeValue(type, List.copyOf(new TreeSet<>(values)));
  }

  public String asString() {
    return switch (type) {
      case S, N, B -> (String) value;
      default -> throw new IllegalStateException("Not a scalar attribute: " + type);
    };
  }

  public BigDecimal asNumber() {
    if (type != AttributeType.N) {
      throw new IllegalStateException("Not a number attribute: " + type);
    }
    return new BigDecimal((String) value);
  }

  public byte[] asBytes() {
    if (type != AttributeType.B) {
      throw new IllegalStateException("Not a binary attribute: " + type);
    }
    return Base64.getDecoder().decode((String) value);
  }

  public boolean asBool() {
    if (type != AttributeType.BOOL) {
      throw new IllegalStateException("Not a boolean attribute: " + type);
    }
    return (Boolean) value;
  }

  @SuppressWarnings("unchecked")
  public Map<String, AttributeValue> asMap() {
    if (type != AttributeType.M) {
      throw new IllegalStateException("Not a map attribute: " + type);
    }
    return (Map<String, AttributeValue>) value;
  }

  @SuppressWarnings("unchecked")
  public List<AttributeValue> asList() {
    if (type != AttributeType.L) {
      throw new IllegalStateException("Not a list attribute: " + type);
    }
    return (List<AttributeValue>) value;
  }

  @SuppressWarnings("unchecked")
  public List<String> asSet() {
    if (!type.isSet()) {
      throw new IllegalStateException("Not a set attribute: " + type);
    }
    return (List<String>) value;
  }

  @Override
  public String toString() {
    return "{" + type + ": " + value + "}";
  }
}
