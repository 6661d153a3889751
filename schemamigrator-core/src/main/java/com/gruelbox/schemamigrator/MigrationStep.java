package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The forward or reverse half of a migration. Always called inside a transaction managed by the
 * executor, so implementations must not commit, roll back or close the connection.
 */
@FunctionalInterface
public interface MigrationStep {

  /**
   * @param connection The connection of the active transaction.
   * @throws SQLException If a statement is rejected.
   */
  void apply(Connection connection) throws SQLException;

  static SqlScript sql(String... statements) {
    return SqlScript.of(statements);
  }
}
