package com.gruelbox.schemamigrator;

import static java.util.stream.Collectors.toList;

import com.gruelbox.schemamigrator.diff.RenameCandidate;
import com.gruelbox.schemamigrator.diff.SchemaDiff;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link SchemaDiff} into a {@link MigrationRecord} whose {@code down} is the exact
 * structural inverse of its {@code up}.
 */
@Slf4j
public class MigrationGenerator {

  static final DateTimeFormatter VERSION_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

  private final Dialect dialect;
  private final Supplier<Clock> clockProvider;

  /**
   * @param dialect The dialect to render SQL for.
   * @param clockProvider Source of the generation time, used as the version. Defaults to the UTC
   *     system clock.
   */
  @Builder
  private MigrationGenerator(Dialect dialect, Supplier<Clock> clockProvider) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clockProvider = clockProvider == null ? Clock::systemUTC : clockProvider;
  }

  /**
   * @param name A short description, used with the version to name the artifact.
   * @param diff The diff.
   * @param decisions A decision for every rename candidate in the diff.
   * @return The migration, versioned by the current time.
   * @throws DiffAmbiguityException If any rename candidate is undecided. No SQL is produced.
   */
  public MigrationRecord generate(String name, SchemaDiff diff, RenameDecisions decisions) {
    List<SchemaOperation> operations = resolve(diff, decisions);
    String version = VERSION_FORMAT.format(clockProvider.get().instant());
    return fromOperations(version, name, operations);
  }

  /**
   * Replaces every rename candidate with the operations its decision calls for.
   *
   * @param diff The diff.
   * @param decisions The decisions.
   * @return The executable operations in canonical order.
   * @throws DiffAmbiguityException If any candidate is undecided.
   */
  public static List<SchemaOperation> resolve(SchemaDiff diff, RenameDecisions decisions) {
    List<RenameCandidate> undecided = new ArrayList<>();
    List<SchemaOperation> result = new ArrayList<>();
    for (SchemaOperation operation : diff.getOperations()) {
      if (operation instanceof RenameCandidate) {
        RenameCandidate candidate = (RenameCandidate) operation;
        Boolean confirmed = decisions.decide(candidate).orElse(null);
        if (confirmed == null) {
          undecided.add(candidate);
        } else {
          log.info("Rename {} {}", candidate.describe(), confirmed ? "confirmed" : "denied");
          result.addAll(confirmed ? candidate.confirm() : candidate.deny());
        }
      } else {
        result.add(operation);
      }
    }
    if (!undecided.isEmpty()) {
      throw new DiffAmbiguityException(undecided);
    }
    return SchemaDiff.canonicalOrder(result);
  }

  /**
   * @param version The version.
   * @param name The name.
   * @param operations Executable operations, in execution order.
   * @return The migration.
   */
  public MigrationRecord fromOperations(
      String version, String name, List<SchemaOperation> operations) {
    List<String> up =
        operations.stream().flatMap(op -> op.toSql(dialect).stream()).collect(toList());
    List<SchemaOperation> inverses =
        operations.stream().map(SchemaOperation::inverse).collect(toList());
    Collections.reverse(inverses);
    List<String> down =
        inverses.stream().flatMap(op -> op.toSql(dialect).stream()).collect(toList());
    boolean destructive = operations.stream().anyMatch(SchemaOperation::isDestructive);
    log.debug("Generated {} with {} up and {} down statements", version, up.size(), down.size());
    return MigrationRecord.builder()
        .version(version)
        .name(name)
        .destructive(destructive)
        .up(new SqlScript(up))
        .down(new SqlScript(down))
        .dryRun(connection -> up)
        .operations(List.copyOf(operations))
        .build();
  }
}
