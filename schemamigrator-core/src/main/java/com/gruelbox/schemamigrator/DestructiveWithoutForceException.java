package com.gruelbox.schemamigrator;

/** Thrown when an operation which discards data is requested without explicit confirmation. */
public class DestructiveWithoutForceException extends MigrationException {

  public DestructiveWithoutForceException(String operation) {
    super(operation + " discards data and must be explicitly forced");
  }
}
