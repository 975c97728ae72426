package com.kvrestore;

import com.kvrestore.core.launcher.CommandRegistry;
import com.kvrestore.core.launcher.RecoveryCommand;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {

  private static final Logger log = LoggerFactory.getLogger(App.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length == 0) {
      System.err.println("Usage: java -jar kvrestore.jar <command> [--option value ...]");
      System.err.println("Available commands: " + CommandRegistry.listCommands());
      return EXIT_USAGE;
    }

    String commandName = args[0];
    RecoveryCommand command = CommandRegistry.get(commandName);
    if (command == null) {
      System.err.println("Unknown command: " + commandName);
      System.err.println("Available commands: " + CommandRegistry.listCommands());
      return EXIT_USAGE;
    }

    try {
      return command.run(Arrays.copyOfRange(args, 1, args.length));
    } catch (IllegalArgumentException | IllegalStateException e) {
      log.error("[App] {} aborted: {}", commandName, e.getMessage());
      return EXIT_USAGE;
    } catch (Exception e) {
      log.error("[App] {} failed", commandName, e);
      return EXIT_FAILURE;
    }
  }
}
