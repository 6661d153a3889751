package com.gruelbox.schemamigrator;

import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

import com.gruelbox.schemamigrator.diff.SchemaDiff;
import com.gruelbox.schemamigrator.diff.SchemaDiffer;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Collapses a contiguous range of migrations into one baseline migration with the same net
 * effect. The schemas before and after the range are computed by replaying the structured
 * operations of the records onto an empty schema, so no database is needed to work out the
 * baseline. Only the ledger rewrite touches the database. The baseline is stored before the
 * ledger is rewritten; if either step fails, the original migrations are stored again.
 */
@Slf4j
public class MigrationSquasher {

  private final TransactionManager transactionManager;
  private final MigrationRepository repository;
  private final MigrationLedger ledger;
  private final MigrationGenerator generator;
  private final SchemaDiffer differ;

  /**
   * @param transactionManager Source of transactions for the ledger rewrite.
   * @param repository The migrations.
   * @param dialect The dialect to render the baseline for.
   * @param ledger The ledger. Defaults to a ledger in {@code schema_migrations}.
   */
  @Builder
  private MigrationSquasher(
      TransactionManager transactionManager,
      MigrationRepository repository,
      Dialect dialect,
      MigrationLedger ledger) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.ledger = ledger == null ? MigrationLedger.builder().build() : ledger;
    this.generator = MigrationGenerator.builder().dialect(dialect).build();
    this.differ = SchemaDiffer.builder().dialect(dialect).detectRenames(false).build();
  }

  /**
   * Squashes every migration up to and including {@code to}.
   *
   * @param to The last version to squash.
   * @return The baseline.
   * @throws SquashException If the range cannot be squashed.
   */
  public MigrationRecord squashUpTo(String to) {
    List<MigrationRecord> records = sortedRecords();
    if (records.isEmpty()) {
      throw new SquashException("There are no migrations to squash");
    }
    return squash(records.get(0).getVersion(), to);
  }

  /**
   * Replaces the migrations from {@code from} to {@code to} inclusive with one baseline which
   * takes the version of {@code to}. If the range has been executed, its ledger entries are
   * replaced by a single entry for the baseline.
   *
   * @param from The first version to squash.
   * @param to The last version to squash.
   * @return The baseline.
   * @throws SquashException If the range cannot be squashed.
   */
  public MigrationRecord squash(String from, String to) {
    List<MigrationRecord> records = sortedRecords();
    int first = indexOf(records, from);
    int last = indexOf(records, to);
    if (last - first + 1 < 2) {
      throw new SquashException(
          "At least two migrations are needed to squash, but "
              + from
              + ".."
              + to
              + " has "
              + Math.max(0, last - first + 1));
    }
    List<MigrationRecord> range = records.subList(first, last + 1);
    Set<String> rangeVersions = range.stream().map(MigrationRecord::getVersion).collect(toSet());
    checkExternalDependents(records, rangeVersions, to);

    SchemaSnapshot before = replay(SchemaSnapshot.empty(), records.subList(0, first));
    SchemaSnapshot after = replay(before, range);
    SchemaDiff diff = differ.diff(after, before);

    Set<String> dependsOn = new TreeSet<>();
    Set<String> conflictsWith = new TreeSet<>();
    for (MigrationRecord record : range) {
      dependsOn.addAll(record.getDependsOn());
      conflictsWith.addAll(record.getConflictsWith());
    }
    dependsOn.removeAll(rangeVersions);
    conflictsWith.removeAll(rangeVersions);

    MigrationRecord baseline =
        generator
            .fromOperations(to, "squashed_" + from + "_" + to, diff.getOperations())
            .toBuilder()
            .dependsOn(dependsOn)
            .conflictsWith(conflictsWith)
            .build();

    List<LedgerEntry> executed = executedEntries(range, from, to);
    try {
      repository.save(baseline);
      rangeVersions.stream().filter(v -> !v.equals(to)).forEach(repository::delete);
      Utils.uncheck(
          () ->
              transactionManager.inTransactionThrows(
                  tx -> {
                    for (String version : rangeVersions) {
                      ledger.delete(tx.connection(), version);
                    }
                    if (!executed.isEmpty()) {
                      LedgerEntry latest =
                          executed.stream()
                              .max(Comparator.comparing(LedgerEntry::getExecutedAt))
                              .orElseThrow();
                      ledger.put(
                          tx.connection(),
                          new LedgerEntry(to, latest.getExecutedAt(), true, null));
                    }
                  }));
    } catch (RuntimeException e) {
      log.error("Squash of {}..{} failed, putting the original migrations back", from, to);
      for (MigrationRecord record : range) {
        Utils.safelyRun("restoring migration " + record, () -> repository.save(record));
      }
      throw e;
    }
    log.info("Squashed {} migrations from {} to {} into one baseline", range.size(), from, to);
    return baseline;
  }

  /**
   * @return The successful ledger entries of the range, none if it has not been executed.
   * @throws SquashException If only part of the range has been executed.
   */
  private List<LedgerEntry> executedEntries(List<MigrationRecord> range, String from, String to) {
    List<LedgerEntry> all =
        Utils.uncheckedly(
            () ->
                transactionManager.inTransactionReturnsThrows(
                    tx -> ledger.entries(tx.connection())));
    Map<String, LedgerEntry> entries = new HashMap<>();
    all.forEach(entry -> entries.put(entry.getVersion(), entry));
    List<LedgerEntry> executed =
        range.stream()
            .map(r -> entries.get(r.getVersion()))
            .filter(e -> e != null && e.isSuccess())
            .collect(toList());
    if (!executed.isEmpty() && executed.size() < range.size()) {
      throw new SquashException(
          "Cannot squash "
              + from
              + ".."
              + to
              + ": only "
              + executed.size()
              + " of "
              + range.size()
              + " migrations have been executed");
    }
    return executed;
  }

  private List<MigrationRecord> sortedRecords() {
    return repository.loadAll().stream()
        .sorted((a, b) -> a.getVersion().compareTo(b.getVersion()))
        .collect(toList());
  }

  private static int indexOf(List<MigrationRecord> records, String version) {
    for (int i = 0; i < records.size(); i++) {
      if (records.get(i).getVersion().equals(version)) {
        return i;
      }
    }
    throw new SquashException("Unknown migration version " + version);
  }

  private static void checkExternalDependents(
      List<MigrationRecord> records, Set<String> rangeVersions, String to) {
    for (MigrationRecord record : records) {
      if (rangeVersions.contains(record.getVersion())) {
        continue;
      }
      for (String dependency : record.getDependsOn()) {
        if (rangeVersions.contains(dependency) && !dependency.equals(to)) {
          throw new SquashException(
              "Migration "
                  + record.getVersion()
                  + " depends on "
                  + dependency
                  + ", which would disappear in the squash");
        }
      }
    }
  }

  private static SchemaSnapshot replay(SchemaSnapshot start, List<MigrationRecord> records) {
    SchemaSnapshot schema = start;
    for (MigrationRecord record : records) {
      List<SchemaOperation> operations =
          record
              .getOperations()
              .orElseThrow(
                  () ->
                      new SquashException(
                          "Migration "
                              + record.getVersion()
                              + " has no structured operations and cannot be replayed"));
      for (SchemaOperation operation : operations) {
        schema = operation.applyTo(schema);
      }
    }
    return schema;
  }
}
