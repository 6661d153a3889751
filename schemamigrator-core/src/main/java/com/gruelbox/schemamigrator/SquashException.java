package com.gruelbox.schemamigrator;

/** Thrown when a range of migrations cannot be safely collapsed into a baseline. */
public class SquashException extends MigrationException {

  public SquashException(String message) {
    super(message);
  }
}
