package com.kvrestore.connector.mongo;

import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

/** Maps driver exceptions onto the {@link ErrorKind}s the retry profiles understand. */
final class MongoErrors {

  private MongoErrors() {}

  static RemoteServiceException translate(String operation, MongoException e) {
    return new RemoteServiceException(kindOf(e), operation + " failed: " + e.getMessage(), e);
  }

  static ErrorKind kindOf(MongoException e) {
    if (e instanceof MongoTimeoutException || e instanceof MongoExecutionTimeoutException) {
      return ErrorKind.REQUEST_TIMEOUT;
    }
    if (e instanceof MongoSocketException) {
      return ErrorKind.SERVICE_UNAVAILABLE;
    }
    if (e instanceof MongoSecurityException) {
      return ErrorKind.ACCESS_DENIED;
    }
    return switch (e.getCode()) {
      case 13 -> ErrorKind.ACCESS_DENIED; // Unauthorized
      case 26 -> ErrorKind.RESOURCE_NOT_FOUND; // NamespaceNotFound
      case 50 -> ErrorKind.REQUEST_TIMEOUT; // MaxTimeMSExpired
      case 2, 10334 -> ErrorKind.VALIDATION; // BadValue, BSONObjectTooLarge
      case 11000 -> ErrorKind.RESOURCE_IN_USE; // DuplicateKey
      case 16500, 429 -> ErrorKind.THROTTLED; // request rate too large
      case 91, 189, 10107, 11600 -> ErrorKind.SERVICE_UNAVAILABLE; // failover
      default -> ErrorKind.INTERNAL_ERROR;
    };
  }
}
