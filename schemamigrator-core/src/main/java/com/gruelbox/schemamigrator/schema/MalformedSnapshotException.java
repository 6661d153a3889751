package com.gruelbox.schemamigrator.schema;

import com.gruelbox.schemamigrator.MigrationException;

/**
 * Thrown when a snapshot is internally inconsistent, such as a table with two equally named
 * columns.
 */
public class MalformedSnapshotException extends MigrationException {

  public MalformedSnapshotException(String message) {
    super(message);
  }
}
