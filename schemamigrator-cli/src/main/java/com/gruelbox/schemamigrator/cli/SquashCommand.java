package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.MigrationSquasher;
import com.gruelbox.schemamigrator.jackson.JsonMigrationRepository;
import java.util.Optional;
import java.util.Set;

class SquashCommand implements Command {

  @Override
  public String usage() {
    return "migration:squash --to=VERSION [--from=VERSION]";
  }

  @Override
  public String description() {
    return "Replace the migrations from the first (or --from) up to --to with one baseline";
  }

  @Override
  public Set<String> options() {
    return Set.of("from", "to");
  }

  @Override
  public void execute(CommandLine line, CliContext context) {
    String to =
        line.option("to")
            .orElseThrow(() -> new UsageException("Please provide a version: --to=<VERSION>"));
    Optional<String> from = line.option("from");
    MigrationSquasher squasher = context.squasher();
    MigrationRecord baseline =
        from.isPresent() ? squasher.squash(from.get(), to) : squasher.squashUpTo(to);
    context
        .getOut()
        .println(
            "Squashed migrations into "
                + context.getConfiguration().getMigrationsDirectory().resolve(
                    JsonMigrationRepository.fileName(baseline)));
  }
}
