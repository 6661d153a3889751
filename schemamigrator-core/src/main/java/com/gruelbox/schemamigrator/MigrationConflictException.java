package com.gruelbox.schemamigrator;

import java.util.Set;
import lombok.Getter;

/** Thrown when two or more pending migrations are declared mutually exclusive. */
@Getter
public class MigrationConflictException extends MigrationException {

  private final Set<String> versions;

  public MigrationConflictException(Set<String> versions) {
    super("Pending migrations conflict with each other and cannot run together: " + versions);
    this.versions = Set.copyOf(versions);
  }
}
