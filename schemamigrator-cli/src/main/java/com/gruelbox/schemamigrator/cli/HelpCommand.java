package com.gruelbox.schemamigrator.cli;

import java.io.PrintStream;
import java.util.Map;

class HelpCommand implements Command {

  private final Map<String, Command> commands;

  HelpCommand(Map<String, Command> commands) {
    this.commands = commands;
  }

  @Override
  public String usage() {
    return "help";
  }

  @Override
  public String description() {
    return "Show this list";
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    print(context.getOut());
  }

  void print(PrintStream out) {
    int width = commands.values().stream().mapToInt(c -> c.usage().length()).max().orElse(0);
    out.println("Usage: schemamigrator [--config=FILE] <command> [options]");
    out.println();
    out.println("Commands:");
    for (Command command : commands.values()) {
      out.println(
          "  "
              + command.usage()
              + " ".repeat(width - command.usage().length() + 2)
              + command.description());
    }
    out.println();
    out.println(
        "Configuration is read from "
            + CliConfiguration.DEFAULT_FILE
            + " or --config=FILE, and SCHEMAMIGRATOR_* environment variables override it.");
  }
}
