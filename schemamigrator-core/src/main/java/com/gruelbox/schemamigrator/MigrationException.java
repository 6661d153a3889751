package com.gruelbox.schemamigrator;

/**
 * Base type of every failure raised by the migrator. Callers can catch this to handle all
 * migration problems or one of the subtypes to branch on a specific failure.
 */
public class MigrationException extends RuntimeException {

  public MigrationException(String message) {
    super(message);
  }

  public MigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
