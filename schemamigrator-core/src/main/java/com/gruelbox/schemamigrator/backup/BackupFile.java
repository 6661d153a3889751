package com.gruelbox.schemamigrator.backup;

import java.nio.file.Path;
import java.time.Instant;
import lombok.Value;

/** A backup on disk. Everything but the size is parsed from the file name. */
@Value
public class BackupFile {

  Path path;
  String fileName;
  long sizeBytes;
  Instant createdAt;
  String databaseName;

  /** The migration version the backup was taken for, or null for a manual backup. */
  String version;

  /** True if the backup holds only some of the tables. */
  boolean selective;

  public boolean isManual() {
    return version == null;
  }
}
