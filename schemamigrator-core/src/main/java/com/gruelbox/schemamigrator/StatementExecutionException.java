package com.gruelbox.schemamigrator;

import java.sql.SQLException;
import lombok.Getter;

/** A {@link SQLException} which records the statement the database rejected. */
@Getter
public class StatementExecutionException extends SQLException {

  private final String statement;

  public StatementExecutionException(String statement, SQLException cause) {
    super(
        "Statement failed: " + statement + " (" + cause.getMessage() + ")",
        cause.getSQLState(),
        cause.getErrorCode(),
        cause);
    this.statement = statement;
  }
}
