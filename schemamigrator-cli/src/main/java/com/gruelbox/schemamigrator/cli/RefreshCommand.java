package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrationResult;
import java.util.Set;

class RefreshCommand implements Command {

  @Override
  public String usage() {
    return "migration:refresh --force";
  }

  @Override
  public String description() {
    return "Roll back every migration, then run them all again";
  }

  @Override
  public Set<String> options() {
    return Set.of("force");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    if (!line.flag("force")) {
      throw new UsageException("migration:refresh loses data. Run it with --force to proceed");
    }
    MigrationResult result = context.executor().refresh(true);
    context.getOut().println("Refreshed " + result.getExecuted().size() + " migrations");
  }
}
