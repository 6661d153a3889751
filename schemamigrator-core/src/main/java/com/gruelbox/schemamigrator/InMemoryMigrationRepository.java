package com.gruelbox.schemamigrator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/** Holds records in memory. Useful for records defined in code and for tests. */
public class InMemoryMigrationRepository implements MigrationRepository {

  private final ConcurrentSkipListMap<String, MigrationRecord> records =
      new ConcurrentSkipListMap<>();

  public InMemoryMigrationRepository() {}

  public InMemoryMigrationRepository(Collection<MigrationRecord> initial) {
    initial.forEach(this::save);
  }

  public static InMemoryMigrationRepository of(MigrationRecord... records) {
    return new InMemoryMigrationRepository(List.of(records));
  }

  @Override
  public List<MigrationRecord> loadAll() {
    return new ArrayList<>(records.values());
  }

  @Override
  public void save(MigrationRecord record) {
    new Validator().validate(record);
    records.put(record.getVersion(), record);
  }

  @Override
  public void delete(String version) {
    records.remove(version);
  }
}
