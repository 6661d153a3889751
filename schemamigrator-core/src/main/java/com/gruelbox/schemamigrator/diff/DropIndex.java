package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import lombok.Value;

@Value
public class DropIndex implements SchemaOperation {

  String table;
  IndexDefinition index;

  @Override
  public Phase phase() {
    return Phase.DROP_INDEX;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    return List.of(dialect.dropIndexSql(table, index.getName()));
  }

  @Override
  public SchemaOperation inverse() {
    return new AddIndex(table, index);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withoutIndex(index.getName()));
  }

  @Override
  public String describe() {
    return "drop index " + index.getName() + " on " + table;
  }
}
