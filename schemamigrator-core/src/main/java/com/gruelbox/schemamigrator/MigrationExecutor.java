package com.gruelbox.schemamigrator;

import static java.util.stream.Collectors.toList;

import com.gruelbox.schemamigrator.backup.BackupFile;
import com.gruelbox.schemamigrator.backup.BackupManager;
import com.gruelbox.schemamigrator.schema.SchemaIntrospector;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs pending migrations in version order and rolls executed ones back, keeping the {@link
 * MigrationLedger} consistent with what has actually been committed.
 *
 * <p>Every run starts with checks which need no SQL: records are well formed, dependencies are
 * satisfied, no two pending records conflict, and a backup can be taken wherever one is required.
 * Each record then executes in its own transaction together with its ledger entry.
 */
@Slf4j
public class MigrationExecutor {

  private final TransactionManager transactionManager;
  private final MigrationRepository repository;
  private final Dialect dialect;
  private final MigrationLedger ledger;
  private final BackupManager backupManager;
  private final Supplier<Clock> clockProvider;
  private final int parallelism;
  private final SchemaIntrospector introspector;
  private final MigrationValidator validator = new MigrationValidator();

  /**
   * @param transactionManager Source of transactions on the target database.
   * @param repository The migrations.
   * @param dialect The dialect of the target database.
   * @param ledger The ledger. Defaults to a ledger in {@code schema_migrations}.
   * @param backupManager Takes and restores backups. Optional, but migrations which require a
   *     backup cannot run without one.
   * @param clockProvider Used to time migrations. Defaults to the UTC system clock.
   * @param parallelism The maximum number of migrations to run concurrently. Defaults to 1, which
   *     disables parallel execution. Must not exceed the size of the connection pool.
   */
  @Builder
  private MigrationExecutor(
      TransactionManager transactionManager,
      MigrationRepository repository,
      Dialect dialect,
      MigrationLedger ledger,
      BackupManager backupManager,
      Supplier<Clock> clockProvider,
      Integer parallelism) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.ledger = ledger == null ? MigrationLedger.builder().build() : ledger;
    this.backupManager = backupManager;
    this.clockProvider = clockProvider == null ? Clock::systemUTC : clockProvider;
    this.parallelism = parallelism == null ? 1 : parallelism;
    new Validator().min("parallelism", this.parallelism, 1);
    this.introspector =
        SchemaIntrospector.builder()
            .dialect(dialect)
            .excludedTables(Set.of(this.ledger.getTableName()))
            .build();
  }

  public MigrationResult migrate() {
    return migrate(MigrateOptions.DEFAULT);
  }

  /**
   * Runs every pending migration, stopping at the first failure.
   *
   * @param options Options.
   * @return The versions executed, or the previews for a dry run, plus any validation warnings.
   * @throws MigrationDependencyException If a dependency will not have run.
   * @throws MigrationConflictException If conflicting migrations are pending together.
   * @throws MigrationValidationException If a migration fails validation.
   * @throws MigrationTransactionException If a migration fails.
   */
  public MigrationResult migrate(MigrateOptions options) {
    List<MigrationRecord> records = loadRecords();
    Map<String, LedgerEntry> entries = ledgerByVersion();
    List<MigrationRecord> pending =
        records.stream()
            .filter(r -> !isExecuted(entries.get(r.getVersion())))
            .collect(toList());
    checkDependencies(pending, entries);
    checkConflicts(records, pending);
    checkBackupCapability(pending);

    if (options.isDryRun()) {
      return new MigrationResult(List.of(), previews(pending), List.of());
    }
    if (pending.isEmpty()) {
      log.info("Nothing to migrate");
      return new MigrationResult(List.of(), Map.of(), List.of());
    }

    log.info("Migrating {} pending migrations", pending.size());
    List<String> executed = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    int index = 0;
    while (index < pending.size()) {
      List<MigrationRecord> group = parallelGroup(pending, index);
      if (group.size() > 1) {
        runParallel(group, options, warnings);
      } else {
        runSingle(group.get(0), options, warnings);
      }
      group.forEach(r -> executed.add(r.getVersion()));
      index += group.size();
    }
    log.info("Migrated {}", executed);
    return new MigrationResult(executed, Map.of(), warnings);
  }

  /**
   * @return The statements each pending migration would run, in version order.
   */
  public Map<String, List<String>> preview() {
    return migrate(MigrateOptions.builder().dryRun(true).build()).getPreviews();
  }

  /**
   * Reverses the most recently executed migrations.
   *
   * @param steps How many migrations to reverse.
   * @return The versions reversed, most recent first.
   */
  public List<String> rollback(int steps) {
    new Validator().min("steps", steps, 1);
    List<LedgerEntry> executed = executedMostRecentFirst();
    return rollbackEntries(executed.subList(0, Math.min(steps, executed.size())));
  }

  /**
   * Reverses every migration executed since {@code version}, {@code version} itself included.
   *
   * @param version A successfully executed version.
   * @return The versions reversed, most recent first.
   * @throws UnknownMigrationException If {@code version} has not been executed.
   */
  public List<String> rollbackToVersion(String version) {
    List<LedgerEntry> executed = executedMostRecentFirst();
    for (int i = 0; i < executed.size(); i++) {
      if (executed.get(i).getVersion().equals(version)) {
        return rollbackEntries(executed.subList(0, i + 1));
      }
    }
    throw new UnknownMigrationException(
        version, "Cannot roll back to " + version + ": it has not been executed");
  }

  public List<String> rollbackAll() {
    return rollbackEntries(executedMostRecentFirst());
  }

  /**
   * @return Every known migration in version order, followed by ledger entries whose migration is
   *     no longer known.
   */
  public List<MigrationStatus> status() {
    Map<String, LedgerEntry> entries = ledgerByVersion();
    List<MigrationStatus> result = new ArrayList<>();
    Set<String> known = new HashSet<>();
    for (MigrationRecord record : loadRecords()) {
      known.add(record.getVersion());
      LedgerEntry entry = entries.get(record.getVersion());
      MigrationStatus.State state =
          entry == null
              ? MigrationStatus.State.PENDING
              : (entry.isSuccess() ? MigrationStatus.State.EXECUTED : MigrationStatus.State.FAILED);
      result.add(
          new MigrationStatus(
              record.getVersion(),
              record.getName(),
              state,
              entry == null ? null : entry.getExecutedAt()));
    }
    entries.values().stream()
        .filter(e -> !known.contains(e.getVersion()))
        .forEach(
            e ->
                result.add(
                    new MigrationStatus(
                        e.getVersion(), null, MigrationStatus.State.MISSING, e.getExecutedAt())));
    return result;
  }

  /**
   * Reverses every executed migration and then runs them all again.
   *
   * @param force Must be true.
   * @return The result of the migration.
   * @throws DestructiveWithoutForceException If {@code force} is false.
   */
  public MigrationResult refresh(boolean force) {
    if (!force) {
      throw new DestructiveWithoutForceException("refresh");
    }
    List<String> reversed = rollbackAll();
    log.warn("Refresh rolled back {}", reversed);
    return migrate();
  }

  /**
   * Drops every table in the schema, the ledger included, and migrates from scratch.
   *
   * @param force Must be true.
   * @return The result of the migration.
   * @throws DestructiveWithoutForceException If {@code force} is false.
   */
  public MigrationResult fresh(boolean force) {
    if (!force) {
      throw new DestructiveWithoutForceException("fresh");
    }
    log.warn("Dropping all tables");
    Utils.uncheck(
        () ->
            transactionManager.inTransactionThrows(
                tx -> SchemaDropper.dropAll(tx.connection(), dialect)));
    return migrate();
  }

  private List<MigrationRecord> loadRecords() {
    List<MigrationRecord> records = new ArrayList<>(repository.loadAll());
    Validator validator = new Validator();
    Set<String> versions = new HashSet<>();
    for (MigrationRecord record : records) {
      validator.validate(record);
      if (!versions.add(record.getVersion())) {
        throw new IllegalArgumentException("Duplicate migration version " + record.getVersion());
      }
    }
    records.sort((a, b) -> a.getVersion().compareTo(b.getVersion()));
    return records;
  }

  private Map<String, LedgerEntry> ledgerByVersion() {
    Map<String, LedgerEntry> result = new TreeMap<>();
    ledgerEntries().forEach(e -> result.put(e.getVersion(), e));
    return result;
  }

  private List<LedgerEntry> ledgerEntries() {
    return Utils.uncheckedly(
        () -> transactionManager.inTransactionReturnsThrows(tx -> ledger.entries(tx.connection())));
  }

  private List<LedgerEntry> executedMostRecentFirst() {
    List<LedgerEntry> executed =
        ledgerEntries().stream().filter(LedgerEntry::isSuccess).collect(toList());
    Collections.reverse(executed);
    return executed;
  }

  private static boolean isExecuted(LedgerEntry entry) {
    return entry != null && entry.isSuccess();
  }

  private void checkDependencies(List<MigrationRecord> pending, Map<String, LedgerEntry> entries) {
    Set<String> runsEarlier = new HashSet<>();
    for (MigrationRecord record : pending) {
      for (String dependency : new TreeSet<>(record.getDependsOn())) {
        if (!isExecuted(entries.get(dependency)) && !runsEarlier.contains(dependency)) {
          throw new MigrationDependencyException(record.getVersion(), dependency);
        }
      }
      runsEarlier.add(record.getVersion());
    }
  }

  private void checkConflicts(List<MigrationRecord> records, List<MigrationRecord> pending) {
    Map<String, String> parents = new HashMap<>();
    for (MigrationRecord record : records) {
      for (String other : record.getConflictsWith()) {
        union(parents, record.getVersion(), other);
      }
    }
    Map<String, Set<String>> pendingByComponent = new TreeMap<>();
    for (MigrationRecord record : pending) {
      pendingByComponent
          .computeIfAbsent(find(parents, record.getVersion()), k -> new TreeSet<>())
          .add(record.getVersion());
    }
    for (Set<String> component : pendingByComponent.values()) {
      if (component.size() > 1) {
        throw new MigrationConflictException(component);
      }
    }
  }

  private static String find(Map<String, String> parents, String version) {
    String current = version;
    while (parents.containsKey(current) && !parents.get(current).equals(current)) {
      current = parents.get(current);
    }
    return current;
  }

  private static void union(Map<String, String> parents, String a, String b) {
    String rootA = find(parents, a);
    String rootB = find(parents, b);
    if (!rootA.equals(rootB)) {
      parents.put(rootA, rootB);
    }
  }

  private void checkBackupCapability(List<MigrationRecord> pending) {
    if (backupManager != null) {
      return;
    }
    pending.stream()
        .filter(MigrationRecord::isRequiresBackup)
        .findFirst()
        .ifPresent(
            r -> {
              throw new IllegalStateException(
                  "Migration "
                      + r.getVersion()
                      + " requires a backup but no backup manager is set");
            });
  }

  private Map<String, List<String>> previews(List<MigrationRecord> pending) {
    return Utils.uncheckedly(
        () ->
            transactionManager.inTransactionReturnsThrows(
                tx -> {
                  Map<String, List<String>> result = new LinkedHashMap<>();
                  for (MigrationRecord record : pending) {
                    List<String> statements;
                    if (record.getDryRun().isPresent()) {
                      statements = record.getDryRun().get().preview(tx.connection());
                    } else if (record.getUp() instanceof SqlScript) {
                      statements = ((SqlScript) record.getUp()).getStatements();
                    } else {
                      statements = List.of("-- " + record + " runs custom code");
                    }
                    result.put(record.getVersion(), statements);
                  }
                  return result;
                }));
  }

  private void validate(MigrationRecord record, MigrateOptions options, List<String> warnings) {
    if (options.isForce()) {
      return;
    }
    ValidationResult result =
        Utils.uncheckedly(
            () ->
                transactionManager.inTransactionReturnsThrows(
                    tx -> {
                      SchemaSnapshot schema = introspector.introspect(tx.connection());
                      return validator.validate(
                          record, schema, tx.connection(), backupManager != null);
                    }));
    result.getWarnings().forEach(w -> log.warn("{}: {}", record.getVersion(), w));
    warnings.addAll(result.getWarnings());
    if (result.hasErrors()) {
      throw new MigrationValidationException(record.getVersion(), result.getErrors());
    }
  }

  private void runSingle(MigrationRecord record, MigrateOptions options, List<String> warnings) {
    validate(record, options, warnings);
    BackupFile backup = null;
    if (record.isRequiresBackup()) {
      backup = backupManager.create(record.getVersion());
    }
    log.info("Running migration {}", record);
    long start = clockProvider.get().millis();
    try {
      transactionManager.inTransactionThrows(
          tx -> {
            record.getUp().apply(tx.connection());
            ledger.recordSuccess(tx.connection(), record.getVersion(), elapsedSince(start));
          });
    } catch (Exception e) {
      if (record.isAutoRollbackOnError()) {
        reverseFailed(record, backup);
      }
      recordFailure(record, elapsedSince(start));
      throw failure(record, e);
    }
    log.info("Migration {} completed in {}ms", record, elapsedSince(start));
  }

  private void reverseFailed(MigrationRecord record, BackupFile backup) {
    log.warn("Rolling back failed migration {}", record);
    Utils.safelyRun(
        "rolling back " + record,
        () ->
            transactionManager.inTransactionThrows(
                tx -> record.getDown().apply(tx.connection())));
    if (backup != null) {
      Utils.safelyRun(
          "restoring backup " + backup.getFileName(), () -> backupManager.restore(backup));
    }
  }

  private void recordFailure(MigrationRecord record, long elapsed) {
    Utils.safelyRun(
        "recording failure of " + record,
        () ->
            transactionManager.inTransactionThrows(
                tx -> ledger.recordFailure(tx.connection(), record.getVersion(), elapsed)));
  }

  private static MigrationTransactionException failure(MigrationRecord record, Throwable e) {
    StatementExecutionException statement = Utils.findCause(e, StatementExecutionException.class);
    return new MigrationTransactionException(
        record.getVersion(), statement == null ? null : statement.getStatement(), e);
  }

  private long elapsedSince(long start) {
    return clockProvider.get().millis() - start;
  }

  private List<MigrationRecord> parallelGroup(List<MigrationRecord> pending, int start) {
    MigrationRecord first = pending.get(start);
    if (parallelism <= 1 || !canJoinGroup(first, Set.of())) {
      return List.of(first);
    }
    List<MigrationRecord> group = new ArrayList<>();
    Set<String> versions = new HashSet<>();
    for (int i = start; i < pending.size() && canJoinGroup(pending.get(i), versions); i++) {
      group.add(pending.get(i));
      versions.add(pending.get(i).getVersion());
    }
    return group;
  }

  private static boolean canJoinGroup(MigrationRecord record, Set<String> group) {
    return record.isCanRunInParallel()
        && !record.isRequiresBackup()
        && record.getDependsOn().stream().noneMatch(group::contains);
  }

  /**
   * Runs each member of the group in its own transaction. Members start in version order and
   * write their ledger entries in version order: a member's transaction waits for its predecessor
   * to commit before recording success. A member whose predecessor failed still commits its own
   * changes, without a ledger entry. When anything fails, every member which committed is
   * compensated by running {@code down}, newest first.
   */
  private void runParallel(
      List<MigrationRecord> group, MigrateOptions options, List<String> warnings) {
    for (MigrationRecord record : group) {
      validate(record, options, warnings);
    }
    log.info("Running {} migrations in parallel: {}", group.size(), group);
    List<Member> members = group.stream().map(Member::new).collect(toList());
    ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, group.size()));
    try {
      CompletableFuture<Void> predecessor = CompletableFuture.completedFuture(null);
      for (Member member : members) {
        CompletableFuture<Void> previous = predecessor;
        predecessor = CompletableFuture.runAsync(() -> runMember(member, previous), pool);
        member.commit = predecessor;
      }
      for (Member member : members) {
        try {
          member.commit.join();
        } catch (CompletionException e) {
          log.debug("Parallel member {} did not commit", member.record);
        }
      }
    } finally {
      shutdown(pool);
    }

    Member failed = members.stream().filter(Member::failedItself).findFirst().orElse(null);
    if (failed == null) {
      return;
    }
    List<Member> reversed = new ArrayList<>(members);
    Collections.reverse(reversed);
    for (Member member : reversed) {
      if (member.failedItself()) {
        if (member.record.isAutoRollbackOnError()) {
          reverseFailed(member.record, null);
        }
        recordFailure(member.record, member.elapsed);
      } else if (member.committed) {
        log.warn("Compensating parallel migration {}", member.record);
        Utils.safelyRun(
            "compensating " + member.record,
            () ->
                transactionManager.inTransactionThrows(
                    tx -> {
                      member.record.getDown().apply(tx.connection());
                      ledger.delete(tx.connection(), member.record.getVersion());
                    }));
      }
    }
    throw failure(failed.record, failed.failure);
  }

  private void runMember(Member member, CompletableFuture<Void> predecessor) {
    long start = clockProvider.get().millis();
    CompletionException predecessorFailure;
    try {
      predecessorFailure =
          transactionManager.inTransactionReturnsThrows(
              tx -> {
                member.record.getUp().apply(tx.connection());
                try {
                  predecessor.join();
                } catch (CompletionException e) {
                  return e;
                }
                ledger.recordSuccess(
                    tx.connection(), member.record.getVersion(), elapsedSince(start));
                return null;
              });
    } catch (SQLException | RuntimeException e) {
      member.failure = e;
      member.elapsed = elapsedSince(start);
      throw new CompletionException(e);
    }
    member.committed = true;
    if (predecessorFailure != null) {
      member.failure = new PredecessorFailedException(predecessorFailure);
      throw new CompletionException(member.failure);
    }
  }

  static void shutdown(ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
        log.warn("Parallel migrations still running after one minute");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while awaiting parallel migrations", e);
    }
  }

  private static final class Member {
    private final MigrationRecord record;
    private volatile CompletableFuture<Void> commit;
    private volatile boolean committed;
    private volatile Exception failure;
    private volatile long elapsed;

    Member(MigrationRecord record) {
      this.record = record;
    }

    boolean failedItself() {
      return failure != null && !(failure instanceof PredecessorFailedException);
    }
  }

  private static final class PredecessorFailedException extends RuntimeException {
    PredecessorFailedException(Throwable cause) {
      super("An earlier migration in the parallel group failed", cause);
    }
  }

  private List<String> rollbackEntries(List<LedgerEntry> targets) {
    Map<String, MigrationRecord> records = new HashMap<>();
    loadRecords().forEach(r -> records.put(r.getVersion(), r));
    for (LedgerEntry entry : targets) {
      if (!records.containsKey(entry.getVersion())) {
        throw new UnknownMigrationException(
            entry.getVersion(),
            "Cannot roll back " + entry.getVersion() + ": no migration with that version is known");
      }
    }
    List<String> reversed = new ArrayList<>();
    for (LedgerEntry entry : targets) {
      MigrationRecord record = records.get(entry.getVersion());
      log.info("Rolling back migration {}", record);
      try {
        transactionManager.inTransactionThrows(
            tx -> {
              record.getDown().apply(tx.connection());
              ledger.delete(tx.connection(), record.getVersion());
            });
      } catch (Exception e) {
        throw failure(record, e);
      }
      reversed.add(record.getVersion());
    }
    return reversed;
  }
}
