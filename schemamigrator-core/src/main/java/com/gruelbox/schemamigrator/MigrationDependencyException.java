package com.gruelbox.schemamigrator;

import lombok.Getter;

/**
 * Thrown when a pending migration depends on a version which has not run and will not run first.
 */
@Getter
public class MigrationDependencyException extends MigrationException {

  private final String version;
  private final String missingDependency;

  public MigrationDependencyException(String version, String missingDependency) {
    super(
        "Migration " + version + " depends on " + missingDependency
            + ", which has not been executed and is not scheduled to run before it");
    this.version = version;
    this.missingDependency = missingDependency;
  }
}
