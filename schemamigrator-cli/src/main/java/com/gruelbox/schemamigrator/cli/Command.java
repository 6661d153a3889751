package com.gruelbox.schemamigrator.cli;

import java.util.Set;

/** One CLI command. Commands report progress on the context's output stream. */
interface Command {

  /** The name and arguments, as shown by {@code help}. */
  String usage();

  String description();

  /** The options the command accepts, without the leading {@code --}. */
  default Set<String> options() {
    return Set.of();
  }

  default int maxArguments() {
    return 0;
  }

  /**
   * @param line The arguments, already checked against {@link #options()} and {@link
   *     #maxArguments()}.
   * @param context The context.
   * @throws UsageException If the arguments make no sense together.
   */
  void execute(CommandLine line, CliContext context);
}
