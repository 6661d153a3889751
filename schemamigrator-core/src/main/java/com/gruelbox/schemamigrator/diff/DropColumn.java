package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/** Drops a column. Holds the column's previous definition so that it can be re-added exactly. */
@Value
public class DropColumn implements SchemaOperation {

  String table;
  ColumnDefinition column;

  @Override
  public Phase phase() {
    return Phase.DROP_COLUMN;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    List<String> result = new ArrayList<>();
    if (column.isUnique()) {
      result.add(dialect.dropIndexSql(table, Ddl.uniqueIndexName(table, column.getName())));
    }
    result.add("ALTER TABLE " + table + " DROP COLUMN " + column.getName());
    return result;
  }

  @Override
  public SchemaOperation inverse() {
    return new AddColumn(table, column);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withoutColumn(column.getName()));
  }

  @Override
  public boolean isDestructive() {
    return true;
  }

  @Override
  public String describe() {
    return "drop column " + table + "." + column.getName();
  }
}
