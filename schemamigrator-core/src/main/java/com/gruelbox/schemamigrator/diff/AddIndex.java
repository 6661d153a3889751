package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import lombok.Value;

@Value
public class AddIndex implements SchemaOperation {

  String table;
  IndexDefinition index;

  @Override
  public Phase phase() {
    return Phase.ADD_INDEX;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    return List.of(Ddl.createIndex(table, index));
  }

  @Override
  public SchemaOperation inverse() {
    return new DropIndex(table, index);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withIndex(index));
  }

  @Override
  public String describe() {
    return "add index " + index.getName() + " on " + table;
  }
}
