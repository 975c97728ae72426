package com.kvrestore.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/** Attribute definitions and key schema of a table, as read from the live table description. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableSchema {

  @NonNull
  @With
  @JsonProperty("tableName")
  String tableName;

  @Singular
  @JsonProperty("attributeDefinitions")
  List<AttributeDefinition> attributeDefinitions;

  @Singular("keyElement")
  @JsonProperty("keySchema")
  List<KeySchemaElement> keySchema;

  @JsonIgnore
  public String partitionKeyName() {
    return keySchema.stream()
        .filter(element -> element.keyType() == KeySchemaElement.KeyType.HASH)
        .map(KeySchemaElement::attributeName)
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("Table " + tableName + " has no HASH key"));
  }

  /** Key attribute names, partition key first. */
  @JsonIgnore
  public List<String> keyAttributeNames() {
    return keySchema.stream()
        .sorted((a, b) -> a.keyType().compareTo(b.keyType()))
        .map(KeySchemaElement::attributeName)
        .toList();
  }
}
