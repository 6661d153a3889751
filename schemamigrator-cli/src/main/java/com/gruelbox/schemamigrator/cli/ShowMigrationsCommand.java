package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrationStatus;
import java.util.List;

class ShowMigrationsCommand implements Command {

  @Override
  public String usage() {
    return "show:migrations";
  }

  @Override
  public String description() {
    return "List every migration with its status";
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    List<MigrationStatus> statuses = context.executor().status();
    if (statuses.isEmpty()) {
      context.getOut().println("No migrations found");
      return;
    }
    TextTable table = new TextTable("VERSION", "NAME", "STATUS", "EXECUTED AT");
    int executed = 0;
    for (MigrationStatus status : statuses) {
      table.row(status.getVersion(), status.getName(), status.getState(), status.getExecutedAt());
      if (status.getState() == MigrationStatus.State.EXECUTED) {
        executed++;
      }
    }
    table.print(context.getOut());
    context.getOut().println("Total: " + statuses.size() + " | Executed: " + executed);
  }
}
