package com.gruelbox.schemamigrator;

import lombok.Getter;

/** Thrown when a version is referenced which has no matching migration or ledger entry. */
@Getter
public class UnknownMigrationException extends MigrationException {

  private final String version;

  public UnknownMigrationException(String version, String message) {
    super(message);
    this.version = version;
  }
}
