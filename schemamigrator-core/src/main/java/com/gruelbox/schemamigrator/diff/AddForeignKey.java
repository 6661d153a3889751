package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import lombok.Value;

@Value
public class AddForeignKey implements SchemaOperation {

  String table;
  ForeignKeyDefinition foreignKey;

  @Override
  public Phase phase() {
    return Phase.ADD_FOREIGN_KEY;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    return List.of(Ddl.addForeignKey(table, foreignKey));
  }

  @Override
  public SchemaOperation inverse() {
    return new DropForeignKey(table, foreignKey);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withForeignKey(foreignKey));
  }

  @Override
  public String describe() {
    return "add foreign key "
        + foreignKey.getName()
        + " on "
        + table
        + "."
        + foreignKey.getColumn()
        + " -> "
        + foreignKey.getReferencedTable();
  }
}
