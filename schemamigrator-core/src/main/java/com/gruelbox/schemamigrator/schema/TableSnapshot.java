package com.gruelbox.schemamigrator.schema;

import static java.util.stream.Collectors.toList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import lombok.Value;

/**
 * One table: its columns in declaration order, plus its indexes and foreign keys, each held in name
 * order so that two snapshots of the same table compare equal however they were produced.
 */
@Value
public class TableSnapshot {

  String name;
  List<ColumnDefinition> columns;
  List<IndexDefinition> indexes;
  List<ForeignKeyDefinition> foreignKeys;

  public TableSnapshot(
      String name,
      List<ColumnDefinition> columns,
      List<IndexDefinition> indexes,
      List<ForeignKeyDefinition> foreignKeys) {
    if (name == null || name.isEmpty()) {
      throw new MalformedSnapshotException("Table name may not be blank");
    }
    this.name = name;
    this.columns = List.copyOf(columns);
    this.indexes = sorted(indexes, IndexDefinition::getName);
    this.foreignKeys = sorted(foreignKeys, ForeignKeyDefinition::getName);
    checkUnique("column", this.columns, ColumnDefinition::getName);
    checkUnique("index", this.indexes, IndexDefinition::getName);
    checkUnique("foreign key", this.foreignKeys, ForeignKeyDefinition::getName);
  }

  public static TableSnapshot of(String name, List<ColumnDefinition> columns) {
    return new TableSnapshot(name, columns, List.of(), List.of());
  }

  public Optional<ColumnDefinition> column(String columnName) {
    return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return column(columnName).isPresent();
  }

  public Optional<IndexDefinition> index(String indexName) {
    return indexes.stream().filter(i -> i.getName().equals(indexName)).findFirst();
  }

  public Optional<ForeignKeyDefinition> foreignKey(String foreignKeyName) {
    return foreignKeys.stream().filter(f -> f.getName().equals(foreignKeyName)).findFirst();
  }

  public List<String> primaryKeyColumns() {
    return columns.stream()
        .filter(ColumnDefinition::isPrimaryKey)
        .map(ColumnDefinition::getName)
        .collect(toList());
  }

  /**
   * @param column The new definition.
   * @return A copy with the column of the same name replaced in place, or with the column appended
   *     if there is none.
   */
  public TableSnapshot withColumn(ColumnDefinition column) {
    List<ColumnDefinition> result = new ArrayList<>(columns);
    boolean replaced = false;
    for (int i = 0; i < result.size(); i++) {
      if (result.get(i).getName().equals(column.getName())) {
        result.set(i, column);
        replaced = true;
      }
    }
    if (!replaced) {
      result.add(column);
    }
    return new TableSnapshot(name, result, indexes, foreignKeys);
  }

  public TableSnapshot withoutColumn(String columnName) {
    requireColumn(columnName);
    return new TableSnapshot(
        name,
        columns.stream().filter(c -> !c.getName().equals(columnName)).collect(toList()),
        indexes,
        foreignKeys);
  }

  /**
   * Renames a column along with every index and foreign key that uses it, as databases do.
   *
   * @param from The existing name.
   * @param to The new name.
   * @return The renamed copy.
   */
  public TableSnapshot renameColumn(String from, String to) {
    requireColumn(from);
    return new TableSnapshot(
        name,
        columns.stream()
            .map(c -> c.getName().equals(from) ? c.withName(to) : c)
            .collect(toList()),
        indexes.stream()
            .map(
                i ->
                    new IndexDefinition(
                        i.getName(),
                        i.getColumns().stream()
                            .map(c -> c.equals(from) ? to : c)
                            .collect(toList()),
                        i.isUnique()))
            .collect(toList()),
        foreignKeys.stream()
            .map(f -> f.getColumn().equals(from) ? f.toBuilder().column(to).build() : f)
            .collect(toList()));
  }

  public TableSnapshot withIndex(IndexDefinition index) {
    List<IndexDefinition> result = new ArrayList<>(indexes);
    result.removeIf(i -> i.getName().equals(index.getName()));
    result.add(index);
    return new TableSnapshot(name, columns, result, foreignKeys);
  }

  public TableSnapshot withoutIndex(String indexName) {
    List<IndexDefinition> result = new ArrayList<>(indexes);
    if (!result.removeIf(i -> i.getName().equals(indexName))) {
      throw new IllegalStateException("Index " + indexName + " does not exist on " + name);
    }
    return new TableSnapshot(name, columns, result, foreignKeys);
  }

  public TableSnapshot withForeignKey(ForeignKeyDefinition foreignKey) {
    List<ForeignKeyDefinition> result = new ArrayList<>(foreignKeys);
    result.removeIf(f -> f.getName().equals(foreignKey.getName()));
    result.add(foreignKey);
    return new TableSnapshot(name, columns, indexes, result);
  }

  public TableSnapshot withoutForeignKey(String foreignKeyName) {
    List<ForeignKeyDefinition> result = new ArrayList<>(foreignKeys);
    if (!result.removeIf(f -> f.getName().equals(foreignKeyName))) {
      throw new IllegalStateException(
          "Foreign key " + foreignKeyName + " does not exist on " + name);
    }
    return new TableSnapshot(name, columns, indexes, result);
  }

  public TableSnapshot withoutForeignKeys() {
    return new TableSnapshot(name, columns, indexes, List.of());
  }

  private void requireColumn(String columnName) {
    if (!hasColumn(columnName)) {
      throw new IllegalStateException("Column " + columnName + " does not exist on " + name);
    }
  }

  private static <T> List<T> sorted(List<T> items, Function<T, String> key) {
    List<T> result = new ArrayList<>(items);
    result.sort(Comparator.comparing(key));
    return List.copyOf(result);
  }

  private <T> void checkUnique(String kind, List<T> items, Function<T, String> key) {
    Set<String> seen = new HashSet<>();
    for (T item : items) {
      String itemName = key.apply(item);
      if (itemName == null || itemName.isEmpty()) {
        throw new MalformedSnapshotException("Unnamed " + kind + " on table " + name);
      }
      if (!seen.add(itemName)) {
        throw new MalformedSnapshotException(
            "Duplicate " + kind + " name " + itemName + " on table " + name);
      }
    }
  }
}
