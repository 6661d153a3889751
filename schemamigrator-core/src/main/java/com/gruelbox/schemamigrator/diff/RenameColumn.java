package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/** A confirmed {@link RenameCandidate}. Keeps the column's data. */
@Value
public class RenameColumn implements SchemaOperation {

  String table;

  /** The column as it is before the rename. */
  ColumnDefinition column;

  String newName;

  @Override
  public Phase phase() {
    return Phase.MODIFY_COLUMN;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    List<String> result = new ArrayList<>();
    result.add("ALTER TABLE " + table + " RENAME COLUMN " + column.getName() + " TO " + newName);
    if (column.isUnique()) {
      result.add(
          dialect.renameIndexSql(
              table,
              Ddl.uniqueIndexName(table, column.getName()),
              Ddl.uniqueIndexName(table, newName)));
    }
    return result;
  }

  @Override
  public SchemaOperation inverse() {
    return new RenameColumn(table, column.withName(newName), column.getName());
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.renameColumn(column.getName(), newName));
  }

  @Override
  public String describe() {
    return "rename column " + table + "." + column.getName() + " to " + newName;
  }
}
