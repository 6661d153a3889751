package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.List;
import lombok.Value;

/** Drops a table. Holds the full definition of the table so that it can be recreated. */
@Value
public class DropTable implements SchemaOperation {

  TableSnapshot table;

  @Override
  public Phase phase() {
    return Phase.DROP_TABLE;
  }

  @Override
  public String tableName() {
    return table.getName();
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    return List.of("DROP TABLE " + table.getName());
  }

  @Override
  public SchemaOperation inverse() {
    return new CreateTable(table);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.withoutTable(table.getName());
  }

  @Override
  public boolean isDestructive() {
    return true;
  }

  @Override
  public String describe() {
    return "drop table " + table.getName();
  }
}
