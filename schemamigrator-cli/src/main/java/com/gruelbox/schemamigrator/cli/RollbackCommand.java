package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrationExecutor;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Rolls back the last migration, the last N, or everything back to and including a version. */
class RollbackCommand implements Command {

  @Override
  public String usage() {
    return "migration:rollback [--steps=N | --version=VERSION]";
  }

  @Override
  public String description() {
    return "Roll back the last N migrations (default 1), or back to and including VERSION";
  }

  @Override
  public Set<String> options() {
    return Set.of("steps", "version");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    Optional<String> version = line.option("version");
    Optional<Integer> steps = line.positiveInt("steps");
    if (version.isPresent() && steps.isPresent()) {
      throw new UsageException("Use either --steps or --version, not both");
    }
    MigrationExecutor executor = context.executor();
    List<String> reversed =
        version.isPresent()
            ? executor.rollbackToVersion(version.get())
            : executor.rollback(steps.orElse(1));
    if (reversed.isEmpty()) {
      context.getOut().println("Nothing to roll back");
      return;
    }
    reversed.forEach(v -> context.getOut().println("Rolled back " + v));
    context.getOut().println("Migrations rolled back successfully");
  }
}
