package com.gruelbox.schemamigrator.schema;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * An immutable description of one column. Sized types without an explicit size get their default
 * size, primary keys are never nullable and {@link ReferentialAction#NO_ACTION} is normalised to
 * {@link ReferentialAction#RESTRICT}, so that definitions read back from a database compare equal
 * to the declarations which created them.
 */
@Value
public class ColumnDefinition {

  String name;
  ColumnType type;
  Integer size;
  Integer scale;
  boolean nullable;
  boolean unique;
  boolean primaryKey;
  boolean autoIncrement;
  boolean foreignKey;

  /** The referenced table, optionally qualified by column as in {@code users.id}. */
  String references;

  ReferentialAction onDelete;
  String defaultValue;
  List<String> enumValues;

  /**
   * @param name The column name.
   * @param type The column type.
   * @param size The length or precision of sized types. Ignored for other types.
   * @param scale The scale of {@link ColumnType#DECIMAL}. Ignored for other types.
   * @param nullable Whether the column accepts nulls. Defaults to true except for primary keys.
   * @param unique Whether values must be unique.
   * @param primaryKey Whether the column is (part of) the primary key.
   * @param autoIncrement Whether the database generates values.
   * @param foreignKey Whether the column references another table.
   * @param references The referenced table, optionally as {@code table.column}.
   * @param onDelete The action when the referenced row is deleted.
   * @param defaultValue The default value, unquoted.
   * @param enumValues The allowed values of an {@link ColumnType#ENUM}.
   */
  @SuppressWarnings("JavaDoc")
  @Builder(toBuilder = true)
  private ColumnDefinition(
      String name,
      ColumnType type,
      Integer size,
      Integer scale,
      Boolean nullable,
      boolean unique,
      boolean primaryKey,
      boolean autoIncrement,
      boolean foreignKey,
      String references,
      ReferentialAction onDelete,
      String defaultValue,
      List<String> enumValues) {
    this.name = name;
    this.type = type;
    boolean sized = type != null && type.isSized();
    this.size = sized ? (size == null ? type.getDefaultSize() : size) : null;
    this.scale = type == ColumnType.DECIMAL ? (scale == null ? 0 : scale) : null;
    this.nullable = !primaryKey && (nullable == null || nullable);
    this.unique = unique && !primaryKey;
    this.primaryKey = primaryKey;
    this.autoIncrement = autoIncrement;
    this.foreignKey = foreignKey || references != null || type == ColumnType.RELATION;
    this.references = references;
    this.onDelete = onDelete == null ? null : onDelete.normalised();
    this.defaultValue = defaultValue;
    this.enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
  }

  /**
   * @return The table named in {@link #getReferences()}, or null.
   */
  public String referencedTable() {
    if (references == null) {
      return null;
    }
    int dot = references.indexOf('.');
    return dot < 0 ? references : references.substring(0, dot);
  }

  /**
   * @return The column named in {@link #getReferences()}, defaulting to {@code id}, or null.
   */
  public String referencedColumn() {
    if (references == null) {
      return null;
    }
    int dot = references.indexOf('.');
    return dot < 0 ? "id" : references.substring(dot + 1);
  }

  public ColumnDefinition withName(String newName) {
    return toBuilder().name(newName).build();
  }

  /**
   * @return This definition with any {@link ColumnType#RELATION} replaced by the {@link
   *     ColumnType#BIGINT} column that stores it.
   */
  public ColumnDefinition resolved() {
    if (type != ColumnType.RELATION) {
      return this;
    }
    return toBuilder().type(ColumnType.BIGINT).foreignKey(true).build();
  }
}
