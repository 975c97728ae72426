package com.kvrestore.connector.mongo;

import java.util.Locale;

public final class MongoConfigKeys {

  private MongoConfigKeys() {}

  public static final String MONGO_URI = "MONGO_URI";
  public static final String MONGO_DB = "MONGO_DB";

  /** Collection holding one schema document per table. */
  public static final String CATALOG_COLLECTION = "_kvrestore_tables";

  /** Region-specific connection string, e.g. {@code MONGO_URI_US_EAST_1}. */
  public static String uriKeyFor(String region) {
    return MONGO_URI + "_" + region.trim().replace('-', '_').toUpperCase(Locale.ROOT);
  }
}
