package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrationResult;
import java.util.Set;

class FreshCommand implements Command {

  @Override
  public String usage() {
    return "migration:fresh --force";
  }

  @Override
  public String description() {
    return "Drop every table, then run all migrations from scratch";
  }

  @Override
  public Set<String> options() {
    return Set.of("force");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    if (!line.flag("force")) {
      throw new UsageException("migration:fresh drops every table. Run it with --force to proceed");
    }
    MigrationResult result = context.executor().fresh(true);
    context
        .getOut()
        .println("Dropped all tables and ran " + result.getExecuted().size() + " migrations");
  }
}
