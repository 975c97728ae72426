package com.kvrestore.core.launcher;

/** A named CLI command, discovered through {@link java.util.ServiceLoader}. */
public interface RecoveryCommand {

  String name();

  /**
   * @param args arguments after the command name
   * @return process exit code, 0 on full success
   */
  int run(String[] args) throws Exception;
}
