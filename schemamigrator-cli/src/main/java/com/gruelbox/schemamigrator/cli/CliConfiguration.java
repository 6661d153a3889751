package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.Dialect;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings for a CLI run, read from a properties file and overridden by {@code SCHEMAMIGRATOR_*}
 * environment variables.
 */
@Slf4j
@Value
@Builder
class CliConfiguration {

  public static final String DEFAULT_FILE = "schemamigrator.properties";

  /** Property names, with the environment variables which override them. */
  private static final Map<String, String> KEYS = new LinkedHashMap<>();

  static {
    KEYS.put("jdbc.url", "SCHEMAMIGRATOR_JDBC_URL");
    KEYS.put("jdbc.user", "SCHEMAMIGRATOR_USER");
    KEYS.put("jdbc.password", "SCHEMAMIGRATOR_PASSWORD");
    KEYS.put("dialect", "SCHEMAMIGRATOR_DIALECT");
    KEYS.put("migrations.dir", "SCHEMAMIGRATOR_MIGRATIONS_DIR");
    KEYS.put("backups.dir", "SCHEMAMIGRATOR_BACKUPS_DIR");
    KEYS.put("database.name", "SCHEMAMIGRATOR_DATABASE_NAME");
    KEYS.put("schema.provider", "SCHEMAMIGRATOR_SCHEMA_PROVIDER");
    KEYS.put("parallelism", "SCHEMAMIGRATOR_PARALLELISM");
  }

  /** Null if not configured. Only commands which touch the database need it. */
  String jdbcUrl;

  String user;
  String password;
  Dialect dialect;
  Path migrationsDirectory;
  Path backupsDirectory;
  String databaseName;

  /** Fully qualified name of a {@link SchemaProvider}, or null. */
  String schemaProvider;

  int parallelism;

  /**
   * @param file The properties file. If null, {@value #DEFAULT_FILE} is read from the working
   *     directory if present.
   * @param env The environment.
   * @return The configuration.
   * @throws UsageException If an explicitly named file is missing or a value is invalid.
   */
  static CliConfiguration load(Path file, Map<String, String> env) {
    Properties properties = new Properties();
    Path source = file == null ? Path.of(DEFAULT_FILE) : file;
    if (Files.isRegularFile(source)) {
      log.debug("Reading configuration from {}", source);
      try (Reader reader = Files.newBufferedReader(source)) {
        properties.load(reader);
      } catch (IOException e) {
        throw new UsageException(
            "Cannot read configuration file " + source + ": " + e.getMessage());
      }
    } else if (file != null) {
      throw new UsageException("Configuration file " + file + " does not exist");
    }
    Map<String, String> values = new LinkedHashMap<>();
    KEYS.forEach(
        (key, variable) -> {
          String value = env.get(variable);
          if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
          }
          if (value != null && !value.isBlank()) {
            values.put(key, value.trim());
          }
        });
    return CliConfiguration.builder()
        .jdbcUrl(values.get("jdbc.url"))
        .user(values.get("jdbc.user"))
        .password(values.get("jdbc.password"))
        .dialect(dialect(values.getOrDefault("dialect", "MY_SQL_8")))
        .migrationsDirectory(Path.of(values.getOrDefault("migrations.dir", "migrations")))
        .backupsDirectory(Path.of(values.getOrDefault("backups.dir", "backups")))
        .databaseName(values.getOrDefault("database.name", "database"))
        .schemaProvider(values.get("schema.provider"))
        .parallelism(parallelism(values.getOrDefault("parallelism", "1")))
        .build();
  }

  private static Dialect dialect(String name) {
    try {
      return Dialect.forName(name);
    } catch (IllegalArgumentException e) {
      throw new UsageException(e.getMessage());
    }
  }

  private static int parallelism(String value) {
    try {
      int result = Integer.parseInt(value);
      if (result >= 1) {
        return result;
      }
      throw new UsageException("parallelism must be at least 1 but was " + value);
    } catch (NumberFormatException e) {
      throw new UsageException("parallelism must be a whole number but was '" + value + "'");
    }
  }

  @Override
  public String toString() {
    return "CliConfiguration(jdbcUrl="
        + jdbcUrl
        + ", user="
        + user
        + ", dialect="
        + dialect.getName()
        + ", migrationsDirectory="
        + migrationsDirectory
        + ", backupsDirectory="
        + backupsDirectory
        + ", databaseName="
        + databaseName
        + ", schemaProvider="
        + schemaProvider
        + ", parallelism="
        + parallelism
        + ")";
  }
}
