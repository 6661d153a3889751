package com.gruelbox.schemamigrator;

import lombok.Getter;

/**
 * Thrown when the database rejects a migration. Carries the migration version and, where known,
 * the statement which failed. The original exception is the cause.
 */
@Getter
public class MigrationTransactionException extends MigrationException {

  private final String version;
  private final String statement;

  public MigrationTransactionException(String version, String statement, Throwable cause) {
    super(
        "Migration "
            + version
            + " failed"
            + (statement == null ? "" : (" on statement [" + statement + "]"))
            + ": "
            + cause.getMessage(),
        cause);
    this.version = version;
    this.statement = statement;
  }
}
