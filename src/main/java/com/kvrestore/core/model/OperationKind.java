package com.kvrestore.core.model;

import java.util.Locale;

public enum OperationKind {
  INSERT,
  MODIFY,
  REMOVE,
  UNKNOWN;

  public static OperationKind fromEventName(String eventName) {
    if (eventName == null) {
      return UNKNOWN;
    }
    return switch (eventName.trim().toUpperCase(Locale.ROOT)) {
      case "INSERT" -> INSERT;
      case "MODIFY" -> MODIFY;
      case "REMOVE" -> REMOVE;
      default -> UNKNOWN;
    };
  }
}
