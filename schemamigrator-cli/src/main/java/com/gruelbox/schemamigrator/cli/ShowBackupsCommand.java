package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.backup.BackupFile;
import com.gruelbox.schemamigrator.backup.BackupManager;
import java.util.List;

class ShowBackupsCommand implements Command {

  @Override
  public String usage() {
    return "show:backups";
  }

  @Override
  public String description() {
    return "List backups, newest first";
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    BackupManager backupManager = context.backupManager();
    List<BackupFile> backups = backupManager.list();
    if (backups.isEmpty()) {
      context.getOut().println("No backups found");
      return;
    }
    TextTable table = new TextTable("FILE", "VERSION", "SIZE", "CREATED");
    for (BackupFile backup : backups) {
      table.row(
          backup.getFileName(),
          backup.isManual() ? "manual" : backup.getVersion(),
          BackupManager.formatSize(backup.getSizeBytes()),
          backup.getCreatedAt());
    }
    table.print(context.getOut());
    context
        .getOut()
        .println(
            "Total: "
                + backups.size()
                + " | Total size: "
                + BackupManager.formatSize(backupManager.totalSize()));
  }
}
