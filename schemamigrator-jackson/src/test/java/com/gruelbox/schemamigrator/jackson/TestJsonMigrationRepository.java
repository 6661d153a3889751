package com.gruelbox.schemamigrator.jackson;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.MigrationExecutor;
import com.gruelbox.schemamigrator.MigrationGenerator;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.MigrationStep;
import com.gruelbox.schemamigrator.RenameDecisions;
import com.gruelbox.schemamigrator.TransactionManager;
import com.gruelbox.schemamigrator.UncheckedException;
import com.gruelbox.schemamigrator.Utils;
import com.gruelbox.schemamigrator.diff.SchemaDiffer;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.EntityDefinition;
import com.gruelbox.schemamigrator.schema.SchemaIntrospector;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestJsonMigrationRepository {

  private static final MigrationRecord SEED =
      MigrationRecord.builder()
          .version("002")
          .name("seed")
          .up(MigrationStep.sql("INSERT INTO users (id, email) VALUES (1, 'a@b.c')"))
          .down(MigrationStep.sql("DELETE FROM users WHERE id = 1"))
          .build();

  @TempDir Path directory;

  private JsonMigrationRepository repository() {
    return JsonMigrationRepository.builder().directory(directory).build();
  }

  private List<String> fileNames() throws Exception {
    try (Stream<Path> files = Files.list(directory)) {
      return files.map(f -> f.getFileName().toString()).sorted().collect(toList());
    }
  }

  @Test
  void emptyOrMissingDirectory() {
    assertThat(repository().loadAll(), empty());
    assertThat(
        JsonMigrationRepository.builder().directory(directory.resolve("nope")).build().loadAll(),
        empty());
  }

  @Test
  void onePrettyPrintedFilePerVersion() throws Exception {
    JsonMigrationRepository repository = repository();
    repository.save(SEED);
    repository.save(SEED.toBuilder().version("001").name("first").build());

    assertThat(fileNames(), contains("001_first.json", "002_seed.json"));
    assertTrue(Files.readString(directory.resolve("002_seed.json")).contains("\n"));
    assertThat(
        repository.loadAll().stream().map(MigrationRecord::getVersion).collect(toList()),
        contains("001", "002"));
  }

  @Test
  void saveReplacesEarlierFileForTheVersion() throws Exception {
    JsonMigrationRepository repository = repository();
    repository.save(SEED);
    repository.save(SEED.toBuilder().name("seed_users").build());

    assertThat(fileNames(), contains("002_seed_users.json"));
    assertEquals("seed_users", repository.loadAll().get(0).getName());
  }

  @Test
  void deleteRemovesOnlyThatVersion() throws Exception {
    JsonMigrationRepository repository = repository();
    repository.save(SEED.toBuilder().version("1").name("a").build());
    repository.save(SEED.toBuilder().version("10").name("b").build());

    repository.delete("1");
    repository.delete("999");

    assertThat(fileNames(), contains("10_b.json"));
  }

  @Test
  void invalidRecordsAreNotSaved() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () -> repository().save(SEED.toBuilder().dependsOn(Set.of("002")).build()));
    assertThat(fileNames(), empty());
  }

  @Test
  void unreadableFileFailsLoudly() throws Exception {
    Files.writeString(directory.resolve("003_broken.json"), "{\"version\":");
    assertThrows(UncheckedException.class, () -> repository().loadAll());
  }

  @Test
  void nonJsonFilesIgnored() throws Exception {
    Files.writeString(directory.resolve("README.md"), "migrations");
    repository().save(SEED);
    assertEquals(1, repository().loadAll().size());
  }

  @Test
  void storedMigrationsRunAgainstTheDatabase() {
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
    SchemaDiffer differ = SchemaDiffer.builder().dialect(Dialect.H2).build();
    MigrationRecord initial =
        MigrationGenerator.builder()
            .dialect(Dialect.H2)
            .build()
            .fromOperations(
                "001",
                "create_users",
                MigrationGenerator.resolve(
                    differ.diff(desired, SchemaSnapshot.empty()), RenameDecisions.none()));
    repository().save(initial);
    repository().save(SEED);

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(
        "jdbc:h2:mem:TestJsonMigrationRepository;MODE=MySQL;DATABASE_TO_LOWER=TRUE");
    try (HikariDataSource dataSource = new HikariDataSource(config)) {
      TransactionManager transactionManager = TransactionManager.fromDataSource(dataSource);
      MigrationExecutor executor =
          MigrationExecutor.builder()
              .transactionManager(transactionManager)
              .repository(repository())
              .dialect(Dialect.H2)
              .build();

      assertThat(executor.migrate().getExecuted(), contains("001", "002"));
      assertTrue(differ.diff(desired, introspect(transactionManager)).isEmpty());

      assertThat(executor.rollbackAll(), contains("002", "001"));
      assertFalse(introspect(transactionManager).table("users").isPresent());
    }
  }

  private static SchemaSnapshot introspect(TransactionManager transactionManager) {
    return Utils.uncheckedly(
        () ->
            transactionManager.inTransactionReturnsThrows(
                tx ->
                    SchemaIntrospector.builder()
                        .dialect(Dialect.H2)
                        .excludedTables(Set.of("schema_migrations"))
                        .build()
                        .introspect(tx.connection())));
  }
}
