package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;

/** DDL which is the same on every supported dialect. */
final class Ddl {

  private Ddl() {}

  static String uniqueIndexName(String table, String column) {
    return "uq_" + table + "_" + column;
  }

  static String createUniqueIndex(String table, String column) {
    return "CREATE UNIQUE INDEX "
        + uniqueIndexName(table, column)
        + " ON "
        + table
        + " ("
        + column
        + ")";
  }

  static String createIndex(String table, IndexDefinition index) {
    return "CREATE "
        + (index.isUnique() ? "UNIQUE " : "")
        + "INDEX "
        + index.getName()
        + " ON "
        + table
        + " ("
        + String.join(", ", index.getColumns())
        + ")";
  }

  static String addForeignKey(String table, ForeignKeyDefinition foreignKey) {
    return "ALTER TABLE "
        + table
        + " ADD CONSTRAINT "
        + foreignKey.getName()
        + " FOREIGN KEY ("
        + foreignKey.getColumn()
        + ") REFERENCES "
        + foreignKey.getReferencedTable()
        + " ("
        + foreignKey.getReferencedColumn()
        + ")"
        + (foreignKey.getOnDelete() == ReferentialAction.RESTRICT
            ? ""
            : (" ON DELETE " + foreignKey.getOnDelete().sql()));
  }
}
