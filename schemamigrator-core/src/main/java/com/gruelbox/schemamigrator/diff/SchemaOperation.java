package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;

/**
 * One structural change to a schema. Every operation knows its exact inverse, so a migration built
 * from operations can always be reversed, and can be replayed against a {@link SchemaSnapshot}
 * without touching a database.
 */
public interface SchemaOperation {

  Phase phase();

  String tableName();

  /**
   * @param dialect The target dialect.
   * @return The statements which perform the operation, in order.
   */
  List<String> toSql(Dialect dialect);

  /**
   * @return The operation which exactly undoes this one.
   */
  SchemaOperation inverse();

  /**
   * @param schema The schema before the operation.
   * @return The schema after the operation.
   */
  SchemaSnapshot applyTo(SchemaSnapshot schema);

  /**
   * @return True if running the operation can discard existing data.
   */
  default boolean isDestructive() {
    return false;
  }

  String describe();
}
