package com.gruelbox.schemamigrator.diff;

import static java.util.stream.Collectors.joining;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

@Value
public class CreateTable implements SchemaOperation {

  TableSnapshot table;

  @Override
  public Phase phase() {
    return Phase.CREATE_TABLE;
  }

  @Override
  public String tableName() {
    return table.getName();
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    List<String> result = new ArrayList<>();
    String columns = table.getColumns().stream().map(dialect::columnSql).collect(joining(", "));
    List<String> primaryKey = table.primaryKeyColumns();
    String keyClause =
        primaryKey.isEmpty() ? "" : ", PRIMARY KEY (" + String.join(", ", primaryKey) + ")";
    result.add(
        "CREATE TABLE "
            + table.getName()
            + " ("
            + columns
            + keyClause
            + ")");
    for (ColumnDefinition column : table.getColumns()) {
      if (column.isUnique()) {
        result.add(Ddl.createUniqueIndex(table.getName(), column.getName()));
      }
    }
    for (IndexDefinition index : table.getIndexes()) {
      result.add(Ddl.createIndex(table.getName(), index));
    }
    for (ForeignKeyDefinition foreignKey : table.getForeignKeys()) {
      result.add(Ddl.addForeignKey(table.getName(), foreignKey));
    }
    return result;
  }

  @Override
  public SchemaOperation inverse() {
    return new DropTable(table);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    if (schema.table(table.getName()).isPresent()) {
      throw new IllegalStateException("Table " + table.getName() + " already exists");
    }
    return schema.withTable(table);
  }

  @Override
  public String describe() {
    return "create table " + table.getName();
  }
}
