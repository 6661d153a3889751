package com.gruelbox.schemamigrator.schema;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import lombok.Value;

/**
 * The tables of a schema at one instant, keyed by name. Describes either the desired state, built
 * from {@link EntityDefinition}s, or the actual state, read by {@link SchemaIntrospector}.
 */
@Value
public class SchemaSnapshot {

  private static final SchemaSnapshot EMPTY = new SchemaSnapshot(new TreeMap<>());

  Map<String, TableSnapshot> tables;

  private SchemaSnapshot(TreeMap<String, TableSnapshot> tables) {
    this.tables = Collections.unmodifiableMap(tables);
  }

  public static SchemaSnapshot empty() {
    return EMPTY;
  }

  public static SchemaSnapshot of(TableSnapshot... tables) {
    return of(Arrays.asList(tables));
  }

  public static SchemaSnapshot of(Collection<TableSnapshot> tables) {
    TreeMap<String, TableSnapshot> result = new TreeMap<>();
    for (TableSnapshot table : tables) {
      if (result.put(table.getName(), table) != null) {
        throw new MalformedSnapshotException("Duplicate table name " + table.getName());
      }
    }
    return new SchemaSnapshot(result);
  }

  public Optional<TableSnapshot> table(String name) {
    return Optional.ofNullable(tables.get(name));
  }

  public TableSnapshot requireTable(String name) {
    return table(name)
        .orElseThrow(() -> new IllegalStateException("Table " + name + " does not exist"));
  }

  public Set<String> tableNames() {
    return tables.keySet();
  }

  public boolean isEmpty() {
    return tables.isEmpty();
  }

  public SchemaSnapshot withTable(TableSnapshot table) {
    TreeMap<String, TableSnapshot> result = new TreeMap<>(tables);
    result.put(table.getName(), table);
    return new SchemaSnapshot(result);
  }

  public SchemaSnapshot withoutTable(String name) {
    requireTable(name);
    TreeMap<String, TableSnapshot> result = new TreeMap<>(tables);
    result.remove(name);
    return new SchemaSnapshot(result);
  }

  public SchemaSnapshot updateTable(String name, UnaryOperator<TableSnapshot> update) {
    return withTable(update.apply(requireTable(name)));
  }
}
