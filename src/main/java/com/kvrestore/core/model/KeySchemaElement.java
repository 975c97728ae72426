package com.kvrestore.core.model;

import java.util.Objects;

public record KeySchemaElement(String attributeName, KeyType keyType) {

  public enum KeyType {
    HASH,
    RANGE
  }

  public KeySchemaElement {
    Objects.requireNonNull(attributeName, "Attribute name cannot be null");
    Objects.requireNonNull(keyType, "Key type cannot be null");
  }
}
