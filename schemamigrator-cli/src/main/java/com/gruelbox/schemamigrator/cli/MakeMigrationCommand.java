package com.gruelbox.schemamigrator.cli;

import static com.gruelbox.schemamigrator.Utils.uncheckedly;

import com.gruelbox.schemamigrator.MigrationGenerator;
import com.gruelbox.schemamigrator.MigrationLedger;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.RenameDecisions;
import com.gruelbox.schemamigrator.diff.RenameCandidate;
import com.gruelbox.schemamigrator.diff.SchemaDiff;
import com.gruelbox.schemamigrator.diff.SchemaDiffer;
import com.gruelbox.schemamigrator.jackson.JsonMigrationRepository;
import com.gruelbox.schemamigrator.schema.SchemaIntrospector;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.io.PrintStream;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Diffs the schema supplied by the configured {@link SchemaProvider} against the live database
 * and stores the migration which closes the gap. Every rename candidate is put to the user; if the
 * input ends before all are answered, nothing is generated.
 */
@Slf4j
class MakeMigrationCommand implements Command {

  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

  @Override
  public String usage() {
    return "make:migration <name>";
  }

  @Override
  public String description() {
    return "Generate a migration from the difference between the desired and actual schema";
  }

  @Override
  public int maxArguments() {
    return 1;
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    String name =
        line.argument(0)
            .orElseThrow(() -> new UsageException("Please provide a name: make:migration <name>"));
    if (!NAME.matcher(name).matches()) {
      throw new UsageException(
          "Migration names may only contain letters, digits and underscores: " + name);
    }
    SchemaSnapshot desired = context.schemaProvider().desiredSchema();
    SchemaIntrospector introspector =
        SchemaIntrospector.builder()
            .dialect(context.getConfiguration().getDialect())
            .excludedTables(Set.of(MigrationLedger.builder().build().getTableName()))
            .build();
    SchemaSnapshot actual =
        uncheckedly(
            () ->
                context
                    .transactionManager()
                    .inTransactionReturnsThrows(tx -> introspector.introspect(tx.connection())));
    SchemaDiff diff =
        SchemaDiffer.builder()
            .dialect(context.getConfiguration().getDialect())
            .build()
            .diff(desired, actual);
    PrintStream out = context.getOut();
    if (diff.isEmpty()) {
      out.println("The database already matches the desired schema. No migration created");
      return;
    }

    RenameDecisions.Explicit decisions = RenameDecisions.explicit();
    for (RenameCandidate candidate : diff.renameCandidates()) {
      Optional<Boolean> answer = context.ask("Was " + candidate.describe() + " a rename?");
      if (answer.isEmpty()) {
        log.info("Input ended before {} was decided", candidate.describe());
        break;
      }
      if (answer.get()) {
        decisions.confirm(
            candidate.getTable(), candidate.getFrom().getName(), candidate.getTo().getName());
      } else {
        decisions.deny(
            candidate.getTable(), candidate.getFrom().getName(), candidate.getTo().getName());
      }
    }

    MigrationRecord record =
        MigrationGenerator.builder()
            .dialect(context.getConfiguration().getDialect())
            .build()
            .generate(name, diff, decisions);
    context.repository().save(record);
    if (record.isDestructive()) {
      out.println("Warning: this migration loses data. A backup will be taken before it runs");
    }
    out.println(
        "Migration created: "
            + context
                .getConfiguration()
                .getMigrationsDirectory()
                .resolve(JsonMigrationRepository.fileName(record)));
  }
}
