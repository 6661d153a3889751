package com.gruelbox.schemamigrator;

import lombok.Getter;

/** Thrown when a restore is requested for a version with no backup. */
@Getter
public class BackupNotFoundException extends MigrationException {

  private final String version;

  public BackupNotFoundException(String version) {
    super("No backup found for version " + version);
    this.version = version;
  }
}
