package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The persistent record, in the target database itself, of which versions have executed. All
 * writes happen on the connection of the caller's transaction, so an entry commits or rolls back
 * together with the work it describes.
 */
@Slf4j
public class MigrationLedger {

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  @Getter private final String tableName;
  private final Supplier<Clock> clockProvider;

  /**
   * @param tableName The ledger table. Defaults to {@code schema_migrations}.
   * @param clockProvider Source of execution timestamps. Defaults to the UTC system clock.
   */
  @Builder
  private MigrationLedger(String tableName, Supplier<Clock> clockProvider) {
    this.tableName = tableName == null ? "schema_migrations" : tableName;
    this.clockProvider = clockProvider == null ? Clock::systemUTC : clockProvider;
    new Validator().matches("tableName", this.tableName, TABLE_NAME);
  }

  /**
   * Creates the ledger table if it is missing. Checks the metadata first, since some databases
   * commit the open transaction on any DDL statement, even one which does nothing.
   *
   * @param connection The connection.
   * @throws SQLException If the table cannot be created.
   */
  public void createIfNotExists(Connection connection) throws SQLException {
    if (exists(connection)) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.execute(
          "CREATE TABLE IF NOT EXISTS "
              + tableName
              + " (version VARCHAR(255) NOT NULL, executed_at TIMESTAMP(3) NOT NULL,"
              + " success BOOLEAN NOT NULL, execution_time BIGINT, PRIMARY KEY (version))");
    }
  }

  private boolean exists(Connection connection) throws SQLException {
    try (ResultSet rs =
        connection
            .getMetaData()
            .getTables(connection.getCatalog(), connection.getSchema(), tableName, null)) {
      return rs.next();
    }
  }

  /**
   * @param connection The connection.
   * @return Every entry, ordered by execution time then version.
   * @throws SQLException If the ledger cannot be read.
   */
  public List<LedgerEntry> entries(Connection connection) throws SQLException {
    createIfNotExists(connection);
    List<LedgerEntry> result = new ArrayList<>();
    try (Statement statement = connection.createStatement();
        ResultSet rs =
            statement.executeQuery(
                "SELECT version, executed_at, success, execution_time FROM "
                    + tableName
                    + " ORDER BY executed_at, version")) {
      while (rs.next()) {
        long executionTime = rs.getLong(4);
        result.add(
            new LedgerEntry(
                rs.getString(1),
                rs.getTimestamp(2).toInstant(),
                rs.getBoolean(3),
                rs.wasNull() ? null : executionTime));
      }
    }
    return result;
  }

  public LedgerEntry recordSuccess(Connection connection, String version, Long executionTime)
      throws SQLException {
    return write(connection, version, true, executionTime);
  }

  public LedgerEntry recordFailure(Connection connection, String version, Long executionTime)
      throws SQLException {
    return write(connection, version, false, executionTime);
  }

  public void delete(Connection connection, String version) throws SQLException {
    createIfNotExists(connection);
    try (PreparedStatement stmt =
        connection.prepareStatement("DELETE FROM " + tableName + " WHERE version = ?")) {
      stmt.setString(1, version);
      stmt.executeUpdate();
    }
  }

  private LedgerEntry write(
      Connection connection, String version, boolean success, Long executionTime)
      throws SQLException {
    Instant now = clockProvider.get().instant().truncatedTo(ChronoUnit.MILLIS);
    LedgerEntry entry = new LedgerEntry(version, now, success, executionTime);
    put(connection, entry);
    return entry;
  }

  /**
   * Writes an entry exactly as given, replacing any entry for the same version.
   *
   * @param connection The connection.
   * @param entry The entry.
   * @throws SQLException If the ledger cannot be written.
   */
  public void put(Connection connection, LedgerEntry entry) throws SQLException {
    createIfNotExists(connection);
    delete(connection, entry.getVersion());
    try (PreparedStatement stmt =
        connection.prepareStatement(
            "INSERT INTO "
                + tableName
                + " (version, executed_at, success, execution_time) VALUES (?, ?, ?, ?)")) {
      stmt.setString(1, entry.getVersion());
      stmt.setTimestamp(2, Timestamp.from(entry.getExecutedAt()));
      stmt.setBoolean(3, entry.isSuccess());
      if (entry.getExecutionTime() == null) {
        stmt.setNull(4, Types.BIGINT);
      } else {
        stmt.setLong(4, entry.getExecutionTime());
      }
      stmt.executeUpdate();
    }
    log.debug("Ledger: {} success={}", entry.getVersion(), entry.isSuccess());
  }
}
