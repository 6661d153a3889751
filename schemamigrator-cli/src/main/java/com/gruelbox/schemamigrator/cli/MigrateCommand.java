package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrateOptions;
import com.gruelbox.schemamigrator.MigrationResult;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

class MigrateCommand implements Command {

  @Override
  public String usage() {
    return "migration:migrate [--force] [--dry-run]";
  }

  @Override
  public String description() {
    return "Run pending migrations. --dry-run prints their SQL instead, --force skips validation";
  }

  @Override
  public Set<String> options() {
    return Set.of("force", "dry-run");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    boolean dryRun = line.flag("dry-run");
    MigrationResult result =
        context
            .executor()
            .migrate(MigrateOptions.builder().force(line.flag("force")).dryRun(dryRun).build());
    PrintStream out = context.getOut();
    result.getWarnings().forEach(warning -> out.println("Warning: " + warning));
    if (dryRun) {
      printPreviews(result.getPreviews(), out);
      return;
    }
    if (result.getExecuted().isEmpty()) {
      out.println("Nothing to migrate");
      return;
    }
    result.getExecuted().forEach(version -> out.println("Migrated " + version));
    out.println("Migrations executed successfully");
  }

  private static void printPreviews(Map<String, List<String>> previews, PrintStream out) {
    if (previews.isEmpty()) {
      out.println("Nothing to migrate");
      return;
    }
    previews.forEach(
        (version, statements) -> {
          out.println("-- " + version);
          statements.forEach(statement -> out.println(statement + ";"));
        });
    out.println("Dry run: " + previews.size() + " pending migrations, nothing executed");
  }
}
