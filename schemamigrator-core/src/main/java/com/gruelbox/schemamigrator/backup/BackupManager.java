package com.gruelbox.schemamigrator.backup;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.gruelbox.schemamigrator.BackupNotFoundException;
import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.SchemaDropper;
import com.gruelbox.schemamigrator.SqlScript;
import com.gruelbox.schemamigrator.TransactionManager;
import com.gruelbox.schemamigrator.Utils;
import com.gruelbox.schemamigrator.Validator;
import com.gruelbox.schemamigrator.diff.AddForeignKey;
import com.gruelbox.schemamigrator.diff.CreateTable;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.SchemaIntrospector;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Takes, lists, restores and expires logical backups of the target database. A backup is a gzipped
 * SQL script which recreates every table, the migration ledger included, along with its rows. A
 * selective backup holds only some tables, and restoring it leaves the others alone.
 */
@Slf4j
public class BackupManager {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);
  private static final Pattern FILE_NAME =
      Pattern.compile(
          "backup_([A-Za-z0-9-]+)_(?:([A-Za-z0-9.-]+)_)?(\\d{17})(_selective)?\\.sql\\.gz");
  private static final Pattern CREATE_TABLE =
      Pattern.compile("CREATE TABLE (\\S+) .*", Pattern.DOTALL);
  private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9.-]+");
  private static final String[] UNITS = {"KB", "MB", "GB", "TB"};

  private final TransactionManager transactionManager;
  private final Dialect dialect;
  @Getter private final Path directory;
  @Getter private final String databaseName;
  private final Supplier<Clock> clockProvider;

  /**
   * @param transactionManager Source of transactions on the database to back up.
   * @param dialect The dialect of the database.
   * @param directory Where backups are written. Created on demand.
   * @param databaseName Identifies the database in file names. Anything other than letters,
   *     digits and hyphens is replaced with hyphens. Defaults to {@code database}.
   * @param clockProvider Source of backup timestamps and retention cut-offs. Defaults to the UTC
   *     system clock.
   */
  @Builder
  private BackupManager(
      TransactionManager transactionManager,
      Dialect dialect,
      Path directory,
      String databaseName,
      Supplier<Clock> clockProvider) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.databaseName =
        databaseName == null || databaseName.isEmpty()
            ? "database"
            : databaseName.replaceAll("[^A-Za-z0-9-]", "-");
    this.clockProvider = clockProvider == null ? Clock::systemUTC : clockProvider;
  }

  /**
   * Backs up the database before a migration.
   *
   * @param version The migration version.
   * @return The backup.
   */
  public BackupFile create(String version) {
    new Validator().matches("version", version, VERSION);
    return write(version, null);
  }

  /**
   * Backs up only some tables before a migration. The file name ends in {@code _selective}.
   *
   * @param version The migration version.
   * @param tables The tables to back up. Each must exist.
   * @return The backup.
   */
  public BackupFile create(String version, Collection<String> tables) {
    Validator validator = new Validator();
    validator.matches("version", version, VERSION);
    validator.notNull("tables", tables);
    validator.isTrue("tables", !tables.isEmpty(), "may not be empty");
    return write(version, new TreeSet<>(tables));
  }

  /**
   * @return A backup not associated with any migration.
   */
  public BackupFile createManual() {
    return write(null, null);
  }

  private BackupFile write(String version, Set<String> tables) {
    Instant now = clockProvider.get().instant();
    String fileName =
        "backup_"
            + databaseName
            + (version == null ? "" : ("_" + version))
            + "_"
            + TIMESTAMP.format(now)
            + (tables == null ? "" : "_selective")
            + ".sql.gz";
    Path file = directory.resolve(fileName);
    Utils.uncheck(
        () -> {
          Files.createDirectories(directory);
          transactionManager.inTransactionThrows(
              tx -> export(tx.connection(), file, now, tables));
        });
    BackupFile backup = toBackupFile(file).orElseThrow();
    log.info("Created backup {} ({})", fileName, formatSize(backup.getSizeBytes()));
    return backup;
  }

  private void export(Connection connection, Path file, Instant now, Set<String> tables)
      throws SQLException, IOException {
    SchemaSnapshot schema =
        SchemaIntrospector.builder().dialect(dialect).build().introspect(connection);
    Set<String> selected = tables == null ? schema.tableNames() : tables;
    for (String name : selected) {
      if (schema.table(name).isEmpty()) {
        throw new IllegalArgumentException("Cannot back up unknown table " + name);
      }
    }
    try (Writer writer =
        new BufferedWriter(
            new OutputStreamWriter(new GZIPOutputStream(Files.newOutputStream(file)), UTF_8))) {
      writer.write(
          "-- Backup of "
              + databaseName
              + (tables == null ? "" : (" tables " + String.join(", ", tables)))
              + " taken at "
              + now
              + "\n");
      for (String name : selected) {
        CreateTable create = new CreateTable(schema.requireTable(name).withoutForeignKeys());
        for (String sql : create.toSql(dialect)) {
          writeStatement(writer, sql);
        }
      }
      for (String name : selected) {
        exportRows(connection, schema.requireTable(name), writer);
      }
      // Keys into the selected tables from elsewhere are dropped on restore, so they go in too
      for (String name : schema.tableNames()) {
        TableSnapshot table = schema.requireTable(name);
        for (ForeignKeyDefinition foreignKey : table.getForeignKeys()) {
          if (selected.contains(name) || selected.contains(foreignKey.getReferencedTable())) {
            for (String sql : new AddForeignKey(name, foreignKey).toSql(dialect)) {
              writeStatement(writer, sql);
            }
          }
        }
      }
    }
  }

  private void exportRows(Connection connection, TableSnapshot table, Writer writer)
      throws SQLException, IOException {
    List<ColumnDefinition> columns = table.getColumns();
    String columnList =
        columns.stream().map(ColumnDefinition::getName).collect(Collectors.joining(", "));
    long rows = 0;
    try (Statement statement = connection.createStatement();
        ResultSet rs =
            statement.executeQuery("SELECT " + columnList + " FROM " + table.getName())) {
      while (rs.next()) {
        List<String> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
          values.add(literal(rs, i + 1, columns.get(i)));
        }
        writeStatement(
            writer,
            "INSERT INTO "
                + table.getName()
                + " ("
                + columnList
                + ") VALUES ("
                + String.join(", ", values)
                + ")");
        rows++;
      }
    }
    for (ColumnDefinition column : columns) {
      if (column.isAutoIncrement()) {
        try (Statement statement = connection.createStatement();
            ResultSet rs =
                statement.executeQuery(
                    "SELECT MAX(" + column.getName() + ") FROM " + table.getName())) {
          rs.next();
          long max = rs.getLong(1);
          if (!rs.wasNull()) {
            writeStatement(
                writer, dialect.restartIdentitySql(table.getName(), column.getName(), max + 1));
          }
        }
      }
    }
    log.debug("Exported {} rows from {}", rows, table.getName());
  }

  private String literal(ResultSet rs, int index, ColumnDefinition column) throws SQLException {
    if (rs.getObject(index) == null) {
      return "NULL";
    }
    switch (column.getType()) {
      case BOOLEAN:
        return rs.getBoolean(index) ? "TRUE" : "FALSE";
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
      case DECIMAL:
      case FLOAT:
      case DOUBLE:
        BigDecimal number = rs.getBigDecimal(index);
        return number.toPlainString();
      case BLOB:
        return hexLiteral(rs.getBytes(index));
      case JSON:
        return dialect.jsonLiteral(rs.getString(index));
      default:
        return dialect.stringLiteral(rs.getString(index));
    }
  }

  private static String hexLiteral(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 2 + 3).append("X'");
    for (byte b : bytes) {
      sb.append(String.format("%02X", b));
    }
    return sb.append('\'').toString();
  }

  private static void writeStatement(Writer writer, String sql) throws IOException {
    writer.write(sql);
    writer.write(";\n");
  }

  /**
   * @return Every backup in the directory, most recent first.
   */
  public List<BackupFile> list() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    return Utils.uncheckedly(
        () -> {
          try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(this::toBackupFile)
                .flatMap(Optional::stream)
                .sorted(
                    Comparator.comparing(BackupFile::getCreatedAt)
                        .thenComparing(BackupFile::getFileName)
                        .reversed())
                .collect(Collectors.toList());
          }
        });
  }

  /**
   * @param version A migration version.
   * @return The most recent backup taken for exactly that version.
   */
  public Optional<BackupFile> find(String version) {
    return list().stream().filter(b -> version.equals(b.getVersion())).findFirst();
  }

  /**
   * Restores the most recent backup taken for {@code version}.
   *
   * @param version The migration version.
   * @return The backup restored.
   * @throws BackupNotFoundException If there is no backup for the version.
   */
  public BackupFile restore(String version) {
    BackupFile backup = find(version).orElseThrow(() -> new BackupNotFoundException(version));
    restore(backup);
    return backup;
  }

  /**
   * Replaces the database with the contents of a backup. Every foreign key and table is dropped
   * first, in the same transaction as the replay. For a selective backup, only the tables it holds
   * are dropped, with the foreign keys which touch them.
   *
   * @param backup The backup.
   */
  public void restore(BackupFile backup) {
    log.warn("Restoring backup {}", backup.getFileName());
    List<String> statements =
        Utils.uncheckedly(
            () -> {
              try (InputStream in = new GZIPInputStream(Files.newInputStream(backup.getPath()))) {
                return new SqlScriptReader(dialect.backslashEscapes())
                    .split(new String(in.readAllBytes(), UTF_8));
              }
            });
    Utils.uncheck(
        () ->
            transactionManager.inTransactionThrows(
                tx -> {
                  if (backup.isSelective()) {
                    SchemaDropper.drop(tx.connection(), dialect, createdTables(statements));
                  } else {
                    SchemaDropper.dropAll(tx.connection(), dialect);
                  }
                  new SqlScript(statements).apply(tx.connection());
                }));
    log.info("Restored {} statements from {}", statements.size(), backup.getFileName());
  }

  private static Set<String> createdTables(List<String> statements) {
    Set<String> tables = new TreeSet<>();
    for (String statement : statements) {
      Matcher matcher = CREATE_TABLE.matcher(statement);
      if (matcher.matches()) {
        tables.add(matcher.group(1));
      }
    }
    return tables;
  }

  /**
   * Deletes every backup at least {@code retentionDays} old.
   *
   * @param retentionDays The age in days at which backups expire. Zero deletes everything.
   * @return The number of backups deleted.
   */
  public int cleanup(int retentionDays) {
    new Validator().positiveOrZero("retentionDays", retentionDays);
    Instant cutoff = clockProvider.get().instant().minus(Duration.ofDays(retentionDays));
    int deleted = 0;
    for (BackupFile backup : list()) {
      if (!backup.getCreatedAt().isAfter(cutoff)) {
        Utils.uncheck(() -> Files.deleteIfExists(backup.getPath()));
        log.info("Deleted expired backup {}", backup.getFileName());
        deleted++;
      }
    }
    return deleted;
  }

  public long totalSize() {
    return list().stream().mapToLong(BackupFile::getSizeBytes).sum();
  }

  /**
   * @param bytes A size in bytes.
   * @return The size in the largest unit which keeps it at or above 1, for example {@code 1.50
   *     KB}.
   */
  public static String formatSize(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    double value = bytes;
    int unit = -1;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
  }

  private Optional<BackupFile> toBackupFile(Path path) {
    String fileName = path.getFileName().toString();
    Matcher matcher = FILE_NAME.matcher(fileName);
    if (!matcher.matches() || !Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(
        new BackupFile(
            path,
            fileName,
            Utils.uncheckedly(() -> Files.size(path)),
            TIMESTAMP.parse(matcher.group(3), Instant::from),
            matcher.group(1),
            matcher.group(2),
            matcher.group(4) != null));
  }
}
