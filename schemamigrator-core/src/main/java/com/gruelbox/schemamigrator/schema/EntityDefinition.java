package com.gruelbox.schemamigrator.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Declares the desired shape of one table. Replaces annotation scanning with an explicit list of
 * columns resolved when {@link #build()} is called.
 *
 * <pre>TableSnapshot posts = EntityDefinition.table("posts")
 *   .id()
 *   .column(ColumnDefinition.builder().name("title").type(ColumnType.VARCHAR).size(200)
 *       .nullable(false).build())
 *   .relation("author_id", "users", ReferentialAction.CASCADE)
 *   .index("idx_posts_title", "title")
 *   .build();</pre>
 *
 * <p>Every column with a foreign key gets an index and a constraint, both named {@code
 * fk_<table>_<column>}. Single column uniqueness is declared on the column, not as an index.
 */
public final class EntityDefinition {

  private final String table;
  private final List<ColumnDefinition> columns = new ArrayList<>();
  private final List<IndexDefinition> indexes = new ArrayList<>();

  private EntityDefinition(String table) {
    this.table = table;
  }

  public static EntityDefinition table(String name) {
    return new EntityDefinition(name);
  }

  public static SchemaSnapshot schema(EntityDefinition... entities) {
    return SchemaSnapshot.of(
        Arrays.stream(entities).map(EntityDefinition::build).collect(Collectors.toList()));
  }

  /**
   * Adds the conventional {@code id BIGINT AUTO_INCREMENT} primary key.
   *
   * @return This definition.
   */
  public EntityDefinition id() {
    return column(
        ColumnDefinition.builder()
            .name("id")
            .type(ColumnType.BIGINT)
            .primaryKey(true)
            .autoIncrement(true)
            .build());
  }

  public EntityDefinition column(ColumnDefinition column) {
    columns.add(column);
    return this;
  }

  public EntityDefinition column(String name, ColumnType type) {
    return column(ColumnDefinition.builder().name(name).type(type).build());
  }

  /**
   * Adds a nullable reference to the {@code id} of another table.
   *
   * @param name The column name.
   * @param referencedTable The referenced table.
   * @param onDelete The action when the referenced row is deleted.
   * @return This definition.
   */
  public EntityDefinition relation(
      String name, String referencedTable, ReferentialAction onDelete) {
    return column(
        ColumnDefinition.builder()
            .name(name)
            .type(ColumnType.RELATION)
            .references(referencedTable)
            .onDelete(onDelete)
            .build());
  }

  public EntityDefinition index(String name, String... indexColumns) {
    indexes.add(IndexDefinition.of(name, false, indexColumns));
    return this;
  }

  public EntityDefinition uniqueIndex(String name, String... indexColumns) {
    if (indexColumns.length < 2) {
      throw new MalformedSnapshotException(
          "Single column unique index "
              + name
              + " on "
              + table
              + " should be declared as a unique column instead");
    }
    indexes.add(IndexDefinition.of(name, true, indexColumns));
    return this;
  }

  public TableSnapshot build() {
    List<ColumnDefinition> resolved = new ArrayList<>();
    List<IndexDefinition> allIndexes = new ArrayList<>(indexes);
    List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();
    for (ColumnDefinition column : columns) {
      ColumnDefinition definition = column.resolved();
      resolved.add(definition);
      if (!definition.isForeignKey()) {
        continue;
      }
      if (definition.getReferences() == null) {
        throw new MalformedSnapshotException(
            "Column " + table + "." + definition.getName() + " has no referenced table");
      }
      String name = "fk_" + table + "_" + definition.getName();
      allIndexes.add(IndexDefinition.of(name, false, definition.getName()));
      foreignKeys.add(
          ForeignKeyDefinition.builder()
              .name(name)
              .column(definition.getName())
              .referencedTable(definition.referencedTable())
              .referencedColumn(definition.referencedColumn())
              .onDelete(definition.getOnDelete())
              .build());
    }
    return new TableSnapshot(table, resolved, allIndexes, foreignKeys);
  }
}
