package com.gruelbox.schemamigrator.cli;

import static com.gruelbox.schemamigrator.Utils.uncheckedly;

import com.gruelbox.schemamigrator.MigrationExecutor;
import com.gruelbox.schemamigrator.MigrationRepository;
import com.gruelbox.schemamigrator.MigrationSquasher;
import com.gruelbox.schemamigrator.TransactionManager;
import com.gruelbox.schemamigrator.backup.BackupManager;
import com.gruelbox.schemamigrator.jackson.JsonMigrationRepository;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.BufferedReader;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything a command works with. The connection pool and the components built on it are only
 * created when a command first asks for them, so commands such as {@code help} work without a
 * database.
 */
@Slf4j
class CliContext implements AutoCloseable {

  @Getter private final CliConfiguration configuration;
  @Getter private final BufferedReader in;
  @Getter private final PrintStream out;

  private HikariDataSource dataSource;
  private TransactionManager transactionManager;
  private MigrationRepository repository;
  private BackupManager backupManager;

  CliContext(CliConfiguration configuration, BufferedReader in, PrintStream out) {
    this.configuration = configuration;
    this.in = in;
    this.out = out;
  }

  MigrationRepository repository() {
    if (repository == null) {
      repository =
          JsonMigrationRepository.builder()
              .directory(configuration.getMigrationsDirectory())
              .build();
    }
    return repository;
  }

  TransactionManager transactionManager() {
    if (transactionManager == null) {
      transactionManager = TransactionManager.fromDataSource(dataSource());
    }
    return transactionManager;
  }

  BackupManager backupManager() {
    if (backupManager == null) {
      backupManager =
          BackupManager.builder()
              .transactionManager(transactionManager())
              .dialect(configuration.getDialect())
              .directory(configuration.getBackupsDirectory())
              .databaseName(configuration.getDatabaseName())
              .build();
    }
    return backupManager;
  }

  MigrationExecutor executor() {
    return MigrationExecutor.builder()
        .transactionManager(transactionManager())
        .repository(repository())
        .dialect(configuration.getDialect())
        .backupManager(backupManager())
        .parallelism(configuration.getParallelism())
        .build();
  }

  MigrationSquasher squasher() {
    return MigrationSquasher.builder()
        .transactionManager(transactionManager())
        .repository(repository())
        .dialect(configuration.getDialect())
        .build();
  }

  /**
   * @return A new instance of the configured {@link SchemaProvider}.
   * @throws UsageException If none is configured or it cannot be created.
   */
  SchemaProvider schemaProvider() {
    String className = configuration.getSchemaProvider();
    if (className == null) {
      throw new UsageException(
          "No schema provider configured. Set schema.provider or SCHEMAMIGRATOR_SCHEMA_PROVIDER"
              + " to the class which supplies the desired schema");
    }
    log.debug("Getting instance of schema provider [{}] via reflection", className);
    Class<?> clazz;
    try {
      clazz = Class.forName(className);
    } catch (ClassNotFoundException e) {
      throw new UsageException("Schema provider class " + className + " not found");
    }
    if (!SchemaProvider.class.isAssignableFrom(clazz)) {
      throw new UsageException(
          className + " does not implement " + SchemaProvider.class.getName());
    }
    Constructor<?> constructor = uncheckedly(clazz::getDeclaredConstructor);
    constructor.setAccessible(true);
    return (SchemaProvider) uncheckedly(constructor::newInstance);
  }

  /**
   * Asks a yes or no question on the console until it gets an answer.
   *
   * @param question The question.
   * @return The answer, or empty if the input ends first.
   */
  Optional<Boolean> ask(String question) {
    while (true) {
      out.print(question + " [y/n] ");
      out.flush();
      String answer = uncheckedly(in::readLine);
      if (answer == null) {
        out.println();
        return Optional.empty();
      }
      switch (answer.trim().toLowerCase(Locale.ROOT)) {
        case "y":
        case "yes":
          return Optional.of(true);
        case "n":
        case "no":
          return Optional.of(false);
        default:
          out.println("Please answer y or n");
      }
    }
  }

  private HikariDataSource dataSource() {
    if (dataSource == null) {
      if (configuration.getJdbcUrl() == null) {
        throw new UsageException(
            "No database configured. Set jdbc.url or SCHEMAMIGRATOR_JDBC_URL");
      }
      HikariConfig config = new HikariConfig();
      config.setJdbcUrl(configuration.getJdbcUrl());
      config.setUsername(configuration.getUser());
      config.setPassword(configuration.getPassword());
      config.setMaximumPoolSize(Math.max(2, configuration.getParallelism() + 1));
      config.setPoolName("schemamigrator");
      log.debug("Connecting to {}", configuration.getJdbcUrl());
      dataSource = new HikariDataSource(config);
    }
    return dataSource;
  }

  @Override
  public void close() {
    if (dataSource != null) {
      dataSource.close();
    }
  }
}
