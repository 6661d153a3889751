package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.SchemaIntrospector;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/** Empties the current schema, or part of it: foreign keys first, then tables. */
@Slf4j
@NotApi
public final class SchemaDropper {

  private SchemaDropper() {}

  public static void dropAll(Connection connection, Dialect dialect) throws SQLException {
    drop(connection, dialect, null);
  }

  /**
   * Drops the given tables along with every foreign key which belongs to or refers to one of them.
   * Tables which do not exist are ignored.
   *
   * @param tables The tables to drop, or null for all of them.
   */
  public static void drop(Connection connection, Dialect dialect, Set<String> tables)
      throws SQLException {
    SchemaSnapshot schema =
        SchemaIntrospector.builder().dialect(dialect).build().introspect(connection);
    Set<String> targets = new TreeSet<>(schema.tableNames());
    if (tables != null) {
      targets.retainAll(tables);
    }
    try (Statement statement = connection.createStatement()) {
      for (String name : schema.tableNames()) {
        TableSnapshot table = schema.requireTable(name);
        for (ForeignKeyDefinition foreignKey : table.getForeignKeys()) {
          if (targets.contains(name) || targets.contains(foreignKey.getReferencedTable())) {
            statement.execute(dialect.dropForeignKeySql(name, foreignKey.getName()));
          }
        }
      }
      for (String name : targets) {
        statement.execute("DROP TABLE " + name);
      }
    }
    log.info("Dropped {} tables", targets.size());
  }
}
