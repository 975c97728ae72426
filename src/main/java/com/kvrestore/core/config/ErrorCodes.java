package com.kvrestore.core.config;

public final class ErrorCodes {

  private ErrorCodes() {}

  public static final String INVALID_RECORD = "INVALID_RECORD";
  public static final String UNSUPPORTED_OPERATION = "UNSUPPORTED_OPERATION";
  public static final String RECORD_APPLY_ERROR = "RECORD_APPLY_ERROR";
  public static final String SUB_BATCH_FAILED = "SUB_BATCH_FAILED";
  public static final String IMPORT_FAILED = "IMPORT_FAILED";
  public static final String IMPORT_TIMEOUT = "IMPORT_TIMEOUT";
}
