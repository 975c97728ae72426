package com.kvrestore.connector.mongo;

import static com.kvrestore.connector.mongo.MongoConfigKeys.*;
import static com.kvrestore.core.config.ScopedConfig.*;
import static com.mongodb.client.model.Filters.eq;

import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.core.util.JsonUtils;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tables backed by MongoDB collections of one database. Each table's schema is kept in the
 * {@value MongoConfigKeys#CATALOG_COLLECTION} collection, keyed by table name.
 */
public class MongoTableCatalog implements TableCatalog, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MongoTableCatalog.class);
  static final String SCHEMA_FIELD = "schema";

  private final MongoClient client;
  private final MongoDatabase database;
  private final MongoCollection<Document> catalog;

  // for unit tests
  public MongoTableCatalog(MongoDatabase database) {
    this(null, database);
  }

  private MongoTableCatalog(MongoClient client, MongoDatabase database) {
    this.client = client;
    this.database = database;
    this.catalog = database.getCollection(CATALOG_COLLECTION);
  }

  /** Connects with {@code MONGO_URI_<REGION>} when configured, otherwise {@code MONGO_URI}. */
  public static MongoTableCatalog forRegion(String region) {
    String uriKey = region != null && exists(uriKeyFor(region)) ? uriKeyFor(region) : MONGO_URI;
    MongoClient client = MongoClients.create(require(uriKey));
    MongoDatabase database = client.getDatabase(require(MONGO_DB));
    log.info("[MongoCatalog] Connected region={} db={} via {}", region, database.getName(), uriKey);
    return new MongoTableCatalog(client, database);
  }

  @Override
  public TableSchema describeTable(String tableName) {
    Document entry;
    try {
      entry = catalog.find(eq(BsonAttributeConverter.ID, tableName)).first();
    } catch (MongoException e) {
      throw MongoErrors.translate("describeTable " + tableName, e);
    }
    if (entry == null) {
      throw new RemoteServiceException(ErrorKind.RESOURCE_NOT_FOUND, "Table not found: " + tableName);
    }
    return JsonUtils.fromJson(entry.get(SCHEMA_FIELD, Document.class).toJson(), TableSchema.class);
  }

  @Override
  public boolean tableExists(String tableName) {
    try {
      return catalog.countDocuments(eq(BsonAttributeConverter.ID, tableName)) > 0;
    } catch (MongoException e) {
      throw MongoErrors.translate("tableExists " + tableName, e);
    }
  }

  @Override
  public void createTable(TableSchema schema) {
    Document entry =
        new Document(BsonAttributeConverter.ID, schema.getTableName())
            .append(SCHEMA_FIELD, Document.parse(JsonUtils.toJson(schema)));
    try {
      catalog.insertOne(entry);
    } catch (MongoException e) {
      throw MongoErrors.translate("createTable " + schema.getTableName(), e);
    }
    log.info("[MongoCatalog] Created table {} keys={}", schema.getTableName(), schema.keyAttributeNames());
  }

  @Override
  public KeyValueTable openTable(String tableName) {
    TableSchema schema = describeTable(tableName);
    return new MongoKeyValueTable(database.getCollection(tableName), schema);
  }

  @Override
  public void close() {
    if (client != null) {
      try {
        client.close();
        log.info("[MongoCatalog] MongoClient closed for db={}", database.getName());
      } catch (Exception e) {
        log.warn("[MongoCatalog] Failed to close MongoClient for db={}", database.getName(), e);
      }
    }
  }
}
