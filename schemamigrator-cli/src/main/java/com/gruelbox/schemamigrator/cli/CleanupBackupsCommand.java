package com.gruelbox.schemamigrator.cli;

import java.util.Set;

class CleanupBackupsCommand implements Command {

  static final int DEFAULT_RETENTION_DAYS = 30;

  @Override
  public String usage() {
    return "cleanup:backups [--days=N]";
  }

  @Override
  public String description() {
    return "Delete backups older than N days, all of them for 0 (default "
        + DEFAULT_RETENTION_DAYS
        + ")";
  }

  @Override
  public Set<String> options() {
    return Set.of("days");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    int days = line.nonNegativeInt("days").orElse(DEFAULT_RETENTION_DAYS);
    int deleted = context.backupManager().cleanup(days);
    context.getOut().println("Deleted " + deleted + " backups older than " + days + " days");
  }
}
