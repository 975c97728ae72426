package com.kvrestore.core.event;

public enum Severity {
  DEBUG,
  INFO,
  WARN,
  ERROR
}
