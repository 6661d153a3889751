package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.BackupNotFoundException;
import com.gruelbox.schemamigrator.backup.BackupFile;
import com.gruelbox.schemamigrator.backup.BackupManager;
import java.io.PrintStream;
import java.util.Set;

/** Restores the newest backup taken for a migration version, after asking unless forced. */
class RestoreBackupCommand implements Command {

  @Override
  public String usage() {
    return "restore:backup <version> [--force]";
  }

  @Override
  public String description() {
    return "Replace the database with the backup taken before a migration";
  }

  @Override
  public Set<String> options() {
    return Set.of("force");
  }

  @Override
  public int maxArguments() {
    return 1;
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    String version =
        line.argument(0)
            .orElseThrow(
                () -> new UsageException("Please provide a version: restore:backup <version>"));
    BackupManager backupManager = context.backupManager();
    BackupFile backup =
        backupManager.find(version).orElseThrow(() -> new BackupNotFoundException(version));
    PrintStream out = context.getOut();
    if (!line.flag("force")) {
      out.println(
          "WARNING: this replaces "
              + (backup.isSelective() ? "the tables held in " : "every table with the contents of ")
              + backup.getPath());
      out.println("All changes made since " + backup.getCreatedAt() + " will be lost");
      if (!context.ask("Restore?").orElse(false)) {
        out.println("Restore cancelled");
        return;
      }
    }
    backupManager.restore(backup);
    out.println("Database restored from " + backup.getFileName());
    out.println("Run migration:migrate to bring it back up to date");
  }
}
