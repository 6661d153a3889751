package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import lombok.Value;

@Value
public class DropForeignKey implements SchemaOperation {

  String table;
  ForeignKeyDefinition foreignKey;

  @Override
  public Phase phase() {
    return Phase.DROP_FOREIGN_KEY;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    return List.of(dialect.dropForeignKeySql(table, foreignKey.getName()));
  }

  @Override
  public SchemaOperation inverse() {
    return new AddForeignKey(table, foreignKey);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withoutForeignKey(foreignKey.getName()));
  }

  @Override
  public String describe() {
    return "drop foreign key " + foreignKey.getName() + " on " + table;
  }
}
