package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/** A {@link MigrationStep} made of plain SQL statements, executed in order. */
@Slf4j
@Value
public class SqlScript implements MigrationStep {

  List<String> statements;

  public SqlScript(List<String> statements) {
    this.statements = List.copyOf(statements);
  }

  public static SqlScript of(String... statements) {
    return new SqlScript(Arrays.asList(statements));
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  @Override
  public void apply(Connection connection) throws SQLException {
    for (String sql : statements) {
      log.debug("Executing: {}", sql);
      try (Statement statement = connection.createStatement()) {
        statement.execute(sql);
      } catch (SQLException e) {
        throw new StatementExecutionException(sql, e);
      }
    }
  }
}
