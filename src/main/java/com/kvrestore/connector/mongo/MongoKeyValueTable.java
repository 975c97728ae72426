package com.kvrestore.connector.mongo;

import static com.kvrestore.connector.mongo.BsonAttributeConverter.ID;
import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.exists;

import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.core.model.AttributeValue;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;

/**
 * A table stored as one MongoDB collection. The row key becomes the document {@code _id}: a
 * sub-document of the key attributes, partition key first.
 */
public class MongoKeyValueTable implements KeyValueTable {

  private final MongoCollection<Document> collection;
  private final TableSchema schema;

  public MongoKeyValueTable(MongoCollection<Document> collection, TableSchema schema) {
    this.collection = collection;
    this.schema = schema;
  }

  @Override
  public String name() {
    return schema.getTableName();
  }

  @Override
  public TableSchema schema() {
    return schema;
  }

  @Override
  public void putItem(Map<String, AttributeValue> item) {
    Document id = idFor(item);
    Document document = BsonAttributeConverter.toDocument(item);
    document.put(ID, id);
    try {
      collection.replaceOne(eq(ID, id), document, new ReplaceOptions().upsert(true));
    } catch (MongoException e) {
      throw MongoErrors.translate("putItem " + name(), e);
    }
  }

  @Override
  public void deleteItemIfExists(Map<String, AttributeValue> key, String keyAttribute) {
    Document id = idFor(key);
    DeleteResult result;
    try {
      result = collection.deleteOne(and(eq(ID, id), exists(keyAttribute)));
    } catch (MongoException e) {
      throw MongoErrors.translate("deleteItem " + name(), e);
    }
    if (result.getDeletedCount() == 0) {
      throw new RemoteServiceException(
          ErrorKind.CONDITIONAL_CHECK_FAILED, "No row with " + keyAttribute + " for key " + id.toJson());
    }
  }

  @Override
  public Optional<Map<String, AttributeValue>> getItem(Map<String, AttributeValue> key) {
    try {
      Document document = collection.find(eq(ID, idFor(key))).first();
      return Optional.ofNullable(document).map(BsonAttributeConverter::fromDocument);
    } catch (MongoException e) {
      throw MongoErrors.translate("getItem " + name(), e);
    }
  }

  @Override
  public List<Map<String, AttributeValue>> scan() {
    List<Map<String, AttributeValue>> items = new ArrayList<>();
    try {
      collection.find().forEach(document -> items.add(BsonAttributeConverter.fromDocument(document)));
    } catch (MongoException e) {
      throw MongoErrors.translate("scan " + name(), e);
    }
    return items;
  }

  Document idFor(Map<String, AttributeValue> item) {
    Document id = new Document();
    for (String attribute : schema.keyAttributeNames()) {
      AttributeValue value = item.get(attribute);
      if (value == null) {
        throw new IllegalArgumentException(
            "Missing key attribute '" + attribute + "' for table " + name());
      }
      id.put(attribute, BsonAttributeConverter.toBson(value));
    }
    return id;
  }
}
