package com.gruelbox.schemamigrator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.schemamigrator.diff.SchemaDiffer;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.EntityDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TestMigrationExecutor extends AbstractDatabaseTest {

  private static final MigrationRecord CREATE_USERS =
      MigrationRecord.builder()
          .version("001")
          .name("create_users")
          .up(
              MigrationStep.sql(
                  "CREATE TABLE users (id BIGINT NOT NULL AUTO_INCREMENT, PRIMARY KEY (id))"))
          .down(MigrationStep.sql("DROP TABLE users"))
          .build();

  private static final MigrationRecord ADD_EMAIL =
      MigrationRecord.builder()
          .version("002")
          .name("add_email")
          .up(MigrationStep.sql("ALTER TABLE users ADD COLUMN email VARCHAR(255) NOT NULL"))
          .down(MigrationStep.sql("ALTER TABLE users DROP COLUMN email"))
          .build();

  private static final MigrationRecord CREATE_POSTS =
      MigrationRecord.builder()
          .version("003")
          .name("create_posts")
          .up(
              MigrationStep.sql(
                  "CREATE TABLE posts (id BIGINT NOT NULL AUTO_INCREMENT, PRIMARY KEY (id))"))
          .down(MigrationStep.sql("DROP TABLE posts"))
          .build();

  private final MigrationLedger ledger = MigrationLedger.builder().build();

  private MigrationExecutor executor(MigrationRecord... records) {
    return executor(InMemoryMigrationRepository.of(records), 1);
  }

  private MigrationExecutor executor(MigrationRepository repository, int parallelism) {
    return MigrationExecutor.builder()
        .transactionManager(transactionManager)
        .repository(repository)
        .dialect(Dialect.H2)
        .ledger(ledger)
        .parallelism(parallelism)
        .build();
  }

  private List<LedgerEntry> ledgerEntries() {
    return Utils.uncheckedly(
        () -> transactionManager.inTransactionReturnsThrows(tx -> ledger.entries(tx.connection())));
  }

  private List<String> successfulVersions() {
    return ledgerEntries().stream()
        .filter(LedgerEntry::isSuccess)
        .map(LedgerEntry::getVersion)
        .collect(Collectors.toList());
  }

  @Test
  void migratesInVersionOrder() {
    MigrationResult result = executor(ADD_EMAIL, CREATE_USERS).migrate();

    assertThat(result.getExecuted(), contains("001", "002"));
    assertThat(successfulVersions(), contains("001", "002"));
    assertTrue(introspect().requireTable("users").hasColumn("email"));
  }

  @Test
  void secondRunDoesNothing() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL);
    executor.migrate();
    assertThat(executor.migrate().getExecuted(), empty());
  }

  @Test
  void rollbackReversesMostRecentFirst() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL, CREATE_POSTS);
    executor.migrate();

    List<String> reversed = executor.rollback(2);

    assertThat(reversed, contains("003", "002"));
    assertThat(successfulVersions(), contains("001"));
    SchemaSnapshot schema = introspect();
    assertThat(schema.tableNames(), contains("users"));
    assertFalse(schema.requireTable("users").hasColumn("email"));
  }

  @Test
  void rollbackOneStep() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL, CREATE_POSTS);
    executor.migrate();

    assertThat(executor.rollback(1), contains("003"));
    assertThat(successfulVersions(), contains("001", "002"));
    assertTrue(introspect().table("posts").isEmpty());
  }

  @Test
  void rollbackToVersionIncludesThatVersion() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL, CREATE_POSTS);
    executor.migrate();

    assertThat(executor.rollbackToVersion("002"), contains("003", "002"));
    assertThat(successfulVersions(), contains("001"));
    assertThrows(UnknownMigrationException.class, () -> executor.rollbackToVersion("999"));
  }

  @Test
  void rollbackOfForgottenMigrationFailsBeforeRunningAnything() {
    executor(CREATE_USERS, ADD_EMAIL).migrate();

    MigrationExecutor forgetful = executor(CREATE_USERS);
    assertThrows(UnknownMigrationException.class, () -> forgetful.rollback(2));
    assertThat(successfulVersions(), contains("001", "002"));
  }

  @Test
  void failedMigrationIsReversedAndRecorded() {
    MigrationRecord broken =
        MigrationRecord.builder()
            .version("002")
            .name("broken")
            .up(
                MigrationStep.sql(
                    "CREATE TABLE audit (id BIGINT NOT NULL, PRIMARY KEY (id))",
                    "INSERT INTO nowhere VALUES (1)"))
            .down(MigrationStep.sql("DROP TABLE audit"))
            .build();

    MigrationTransactionException e =
        assertThrows(
            MigrationTransactionException.class,
            () -> executor(CREATE_USERS, broken, CREATE_POSTS).migrate());

    assertEquals("002", e.getVersion());
    assertEquals("INSERT INTO nowhere VALUES (1)", e.getStatement());
    assertThat(successfulVersions(), contains("001"));
    LedgerEntry failure = ledgerEntries().get(1);
    assertEquals("002", failure.getVersion());
    assertFalse(failure.isSuccess());
    assertThat(introspect().tableNames(), contains("users"));
  }

  @Test
  void failedMigrationRunsAgainOnceFixed() {
    MigrationRecord broken =
        ADD_EMAIL.toBuilder().up(MigrationStep.sql("ALTER TABLE nowhere ADD COLUMN x INT")).build();
    assertThrows(
        MigrationTransactionException.class, () -> executor(CREATE_USERS, broken).migrate());

    MigrationResult result = executor(CREATE_USERS, ADD_EMAIL).migrate();

    assertThat(result.getExecuted(), contains("002"));
    assertThat(successfulVersions(), contains("001", "002"));
  }

  @Test
  void missingDependencyStopsEverything() {
    MigrationRecord dependent = ADD_EMAIL.toBuilder().dependsOn(Set.of("000")).build();

    MigrationDependencyException e =
        assertThrows(
            MigrationDependencyException.class,
            () -> executor(CREATE_USERS, dependent).migrate());

    assertEquals("002", e.getVersion());
    assertEquals("000", e.getMissingDependency());
    assertThat(successfulVersions(), empty());
  }

  @Test
  void dependencyMustRunFirst() {
    MigrationRecord early = CREATE_USERS.toBuilder().dependsOn(Set.of("002")).build();
    assertThrows(MigrationDependencyException.class, () -> executor(early, ADD_EMAIL).migrate());
  }

  @Test
  void dependencyOnPendingEarlierRecordIsSatisfied() {
    MigrationRecord dependent = ADD_EMAIL.toBuilder().dependsOn(Set.of("001")).build();
    assertThat(executor(CREATE_USERS, dependent).migrate().getExecuted(), contains("001", "002"));
  }

  @Test
  void pendingConflictsAreRejected() {
    MigrationRecord conflicting = CREATE_POSTS.toBuilder().conflictsWith(Set.of("002")).build();

    MigrationConflictException e =
        assertThrows(
            MigrationConflictException.class,
            () -> executor(CREATE_USERS, ADD_EMAIL, conflicting).migrate());

    assertEquals(Set.of("002", "003"), e.getVersions());
    assertThat(successfulVersions(), empty());
  }

  @Test
  void conflictWithExecutedMigrationIsAllowed() {
    executor(CREATE_USERS, ADD_EMAIL).migrate();
    MigrationRecord conflicting = CREATE_POSTS.toBuilder().conflictsWith(Set.of("002")).build();
    assertThat(
        executor(CREATE_USERS, ADD_EMAIL, conflicting).migrate().getExecuted(), contains("003"));
  }

  @Test
  void backupRequiredButUnavailable() {
    MigrationRecord destructive = ADD_EMAIL.toBuilder().destructive(true).build();
    assertThrows(
        IllegalStateException.class, () -> executor(CREATE_USERS, destructive).migrate());
    assertThat(successfulVersions(), empty());
  }

  @Test
  void notNullColumnOnPopulatedTableFailsValidation() {
    executor(CREATE_USERS).migrate();
    execute("INSERT INTO users (id) VALUES (1)");
    SchemaSnapshot desired =
        EntityDefinition.schema(
            EntityDefinition.table("users")
                .id()
                .column(
                    ColumnDefinition.builder()
                        .name("email")
                        .type(ColumnType.VARCHAR)
                        .nullable(false)
                        .build()));
    MigrationRecord addEmail =
        MigrationGenerator.builder()
            .dialect(Dialect.H2)
            .build()
            .generate(
                "add_email",
                SchemaDiffer.builder().dialect(Dialect.H2).build().diff(desired, introspect()),
                RenameDecisions.none());

    MigrationValidationException e =
        assertThrows(
            MigrationValidationException.class,
            () -> executor(CREATE_USERS, addEmail).migrate());

    assertEquals(addEmail.getVersion(), e.getVersion());
    assertThat(e.getErrors().get(0), containsString("users.email"));
    assertFalse(introspect().requireTable("users").hasColumn("email"));
  }

  @Test
  void validationHookErrorsAndWarnings() {
    MigrationRecord warned =
        CREATE_USERS.toBuilder()
            .validation(schema -> ValidationResult.warning("users is about to exist"))
            .build();
    MigrationRecord rejected =
        ADD_EMAIL.toBuilder()
            .validation(
                schema ->
                    schema.table("users").isPresent()
                        ? ValidationResult.error("not today")
                        : ValidationResult.ok())
            .build();

    MigrationExecutor executor = executor(warned, rejected);
    assertThrows(MigrationValidationException.class, executor::migrate);
    assertThat(successfulVersions(), contains("001"));

    MigrationResult forced = executor.migrate(MigrateOptions.builder().force(true).build());
    assertThat(forced.getExecuted(), contains("002"));
  }

  @Test
  void dryRunExecutesNothing() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL);

    Map<String, List<String>> previews = executor.preview();

    assertThat(previews.keySet(), contains("001", "002"));
    assertEquals(
        List.of("ALTER TABLE users ADD COLUMN email VARCHAR(255) NOT NULL"), previews.get("002"));
    assertThat(successfulVersions(), empty());
    assertTrue(introspect().isEmpty());
  }

  @Test
  void statusShowsEveryState() {
    executor(CREATE_USERS, CREATE_POSTS).migrate();

    List<MigrationStatus> status = executor(CREATE_USERS, ADD_EMAIL).status();

    assertEquals(3, status.size());
    assertEquals(MigrationStatus.State.EXECUTED, status.get(0).getState());
    assertEquals(MigrationStatus.State.PENDING, status.get(1).getState());
    assertNull(status.get(1).getExecutedAt());
    assertEquals("003", status.get(2).getVersion());
    assertEquals(MigrationStatus.State.MISSING, status.get(2).getState());
  }

  @Test
  void refreshAndFreshRequireForce() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL);
    executor.migrate();

    assertThrows(DestructiveWithoutForceException.class, () -> executor.refresh(false));
    assertThrows(DestructiveWithoutForceException.class, () -> executor.fresh(false));
    assertThat(successfulVersions(), contains("001", "002"));
  }

  @Test
  void refreshReRunsEverything() {
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL);
    executor.migrate();
    execute("INSERT INTO users (id, email) VALUES (1, 'a@b.c')");

    assertThat(executor.refresh(true).getExecuted(), contains("001", "002"));
    assertEquals(0, count("SELECT COUNT(*) FROM users"));
  }

  @Test
  void freshDropsTablesNoMigrationKnowsAbout() {
    execute("CREATE TABLE stray (id INT)");
    MigrationExecutor executor = executor(CREATE_USERS, ADD_EMAIL);
    executor.migrate();

    assertThat(executor.fresh(true).getExecuted(), contains("001", "002"));
    assertThat(introspect().tableNames(), contains("users"));
  }

  @Test
  void generatedMigrationRoundTrips() {
    SchemaSnapshot desired =
        EntityDefinition.schema(
            EntityDefinition.table("users")
                .id()
                .column(
                    ColumnDefinition.builder()
                        .name("email")
                        .type(ColumnType.VARCHAR)
                        .size(200)
                        .nullable(false)
                        .unique(true)
                        .build())
                .column(
                    ColumnDefinition.builder()
                        .name("active")
                        .type(ColumnType.BOOLEAN)
                        .nullable(false)
                        .defaultValue("true")
                        .build())
                .column(
                    ColumnDefinition.builder()
                        .name("balance")
                        .type(ColumnType.DECIMAL)
                        .size(12)
                        .scale(2)
                        .build()),
            EntityDefinition.table("posts")
                .id()
                .column(ColumnDefinition.builder().name("title").type(ColumnType.VARCHAR).build())
                .column("body", ColumnType.TEXT)
                .relation("author_id", "users", ReferentialAction.CASCADE)
                .index("idx_posts_title", "title"));
    SchemaDiffer differ = SchemaDiffer.builder().dialect(Dialect.H2).build();
    MigrationRecord record =
        MigrationGenerator.builder()
            .dialect(Dialect.H2)
            .build()
            .generate("initial", differ.diff(desired, introspect()), RenameDecisions.none());
    MigrationExecutor executor = executor(record);

    executor.migrate();
    assertTrue(differ.diff(desired, introspect()).isEmpty());

    executor.rollback(1);
    assertTrue(introspect().isEmpty());

    executor.migrate();
    assertTrue(differ.diff(desired, introspect()).isEmpty());
  }

  @Test
  void parallelGroupCommitsInVersionOrder() {
    MigrationExecutor executor =
        executor(
            InMemoryMigrationRepository.of(
                CREATE_USERS.toBuilder().canRunInParallel(true).build(),
                CREATE_POSTS.toBuilder().version("002").canRunInParallel(true).build(),
                table("003", "tags").toBuilder().canRunInParallel(true).build()),
            3);

    MigrationResult result = executor.migrate();

    assertThat(result.getExecuted(), contains("001", "002", "003"));
    assertThat(successfulVersions(), contains("001", "002", "003"));
    assertThat(introspect().tableNames(), contains("posts", "tags", "users"));
  }

  @Test
  void failedParallelMemberCompensatesTheOthers() {
    MigrationRecord broken =
        MigrationRecord.builder()
            .version("002")
            .name("broken")
            .canRunInParallel(true)
            .up(MigrationStep.sql("INSERT INTO nowhere VALUES (1)"))
            .down(MigrationStep.sql())
            .build();
    MigrationExecutor executor =
        executor(
            InMemoryMigrationRepository.of(
                CREATE_USERS.toBuilder().canRunInParallel(true).build(),
                broken,
                table("003", "tags").toBuilder().canRunInParallel(true).build()),
            3);

    MigrationTransactionException e =
        assertThrows(MigrationTransactionException.class, executor::migrate);

    assertEquals("002", e.getVersion());
    assertThat(successfulVersions(), empty());
    assertTrue(introspect().isEmpty());
    assertEquals(1, ledgerEntries().size());
    assertFalse(ledgerEntries().get(0).isSuccess());
  }

  @Test
  void memberAfterFailedParallelMemberIsReversedExactlyOnce() {
    execute("CREATE TABLE counter (n INT NOT NULL)");
    execute("INSERT INTO counter (n) VALUES (10)");
    MigrationRecord broken =
        MigrationRecord.builder()
            .version("002")
            .name("broken")
            .canRunInParallel(true)
            .up(MigrationStep.sql("INSERT INTO nowhere VALUES (1)"))
            .down(MigrationStep.sql())
            .build();
    MigrationRecord increment =
        MigrationRecord.builder()
            .version("003")
            .name("increment")
            .canRunInParallel(true)
            .up(MigrationStep.sql("UPDATE counter SET n = n + 1"))
            .down(MigrationStep.sql("UPDATE counter SET n = n - 1"))
            .build();
    MigrationExecutor executor = executor(InMemoryMigrationRepository.of(broken, increment), 2);

    assertThrows(MigrationTransactionException.class, executor::migrate);

    assertEquals(10, count("SELECT n FROM counter"));
    assertThat(successfulVersions(), empty());
  }

  @Test
  void interruptedShutdownKeepsTheInterruptFlag() {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    Thread.currentThread().interrupt();

    MigrationExecutor.shutdown(pool);

    assertTrue(Thread.interrupted());
    assertTrue(pool.isShutdown());
  }

  @Test
  void parallelismIgnoredForDependentRecords() {
    MigrationExecutor executor =
        executor(
            InMemoryMigrationRepository.of(
                CREATE_USERS.toBuilder().canRunInParallel(true).build(),
                ADD_EMAIL.toBuilder().canRunInParallel(true).dependsOn(Set.of("001")).build()),
            2);

    assertThat(executor.migrate().getExecuted(), contains("001", "002"));
    assertTrue(introspect().requireTable("users").hasColumn("email"));
  }

  private static MigrationRecord table(String version, String name) {
    return MigrationRecord.builder()
        .version(version)
        .name("create_" + name)
        .up(
            MigrationStep.sql(
                "CREATE TABLE " + name + " (id BIGINT NOT NULL AUTO_INCREMENT, PRIMARY KEY (id))"))
        .down(MigrationStep.sql("DROP TABLE " + name))
        .build();
  }
}
