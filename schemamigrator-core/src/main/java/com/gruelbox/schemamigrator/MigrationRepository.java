package com.gruelbox.schemamigrator;

import java.util.List;

/** Durable storage of {@link MigrationRecord}s, one artifact per version. */
public interface MigrationRepository {

  /**
   * @return Every stored record, sorted by version.
   */
  List<MigrationRecord> loadAll();

  /**
   * Stores a record, replacing any existing record with the same version.
   *
   * @param record The record.
   */
  void save(MigrationRecord record);

  /**
   * @param version The version to remove. Ignored if unknown.
   */
  void delete(String version);
}
