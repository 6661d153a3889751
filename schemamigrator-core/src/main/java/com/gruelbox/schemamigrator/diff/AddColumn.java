package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

@Value
public class AddColumn implements SchemaOperation {

  String table;
  ColumnDefinition column;

  @Override
  public Phase phase() {
    return Phase.ADD_COLUMN;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    List<String> result = new ArrayList<>();
    result.add("ALTER TABLE " + table + " ADD COLUMN " + dialect.columnSql(column));
    if (column.isUnique()) {
      result.add(Ddl.createUniqueIndex(table, column.getName()));
    }
    return result;
  }

  @Override
  public SchemaOperation inverse() {
    return new DropColumn(table, column);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(
        table,
        t -> {
          if (t.hasColumn(column.getName())) {
            throw new IllegalStateException(
                "Column " + table + "." + column.getName() + " already exists");
          }
          return t.withColumn(column);
        });
  }

  @Override
  public String describe() {
    return "add column " + table + "." + column.getName();
  }
}
