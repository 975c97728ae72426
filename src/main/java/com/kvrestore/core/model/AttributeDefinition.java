package com.kvrestore.core.model;

import java.util.Objects;

/**
 * Declared type of a key attribute.
 *
 * @param attributeName attribute name
 * @param attributeType one of {@code S}, {@code N} or {@code B}
 */
public record AttributeDefinition(String attributeName, String attributeType) {
  public AttributeDefinition {
    Objects.requireNonNull(attributeName, "Attribute name cannot be null");
    Objects.requireNonNull(attributeType, "Attribute type cannot be null");
  }
}
