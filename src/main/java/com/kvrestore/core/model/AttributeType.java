package com.kvrestore.core.model;

/** Type tags of the typed attribute JSON used by change records and snapshot files. */
public enum AttributeType {
  S,
  N,
  B,
  BOOL,
  NULL,
  M,
  L,
  SS,
  NS,
  BS;

  public boolean isSet() {
    return this == SS || this == NS || this == BS;
  }
}
