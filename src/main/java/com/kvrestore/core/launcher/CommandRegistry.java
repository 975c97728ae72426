package com.kvrestore.core.launcher;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;

public class CommandRegistry {

  private static final Map<String, RecoveryCommand> COMMANDS = new TreeMap<>();

  static {
    ServiceLoader.load(RecoveryCommand.class).forEach(command -> COMMANDS.put(command.name(), command));
  }

  private CommandRegistry() {}

  public static RecoveryCommand get(String name) {
    return COMMANDS.get(name);
  }

  public static Set<String> listCommands() {
    return COMMANDS.keySet();
  }
}
