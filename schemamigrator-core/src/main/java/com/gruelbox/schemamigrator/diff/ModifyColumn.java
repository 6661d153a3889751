package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Changes the definition of a column in place. Both definitions are held, so the inverse restores
 * the previous definition exactly.
 */
@Value
public class ModifyColumn implements SchemaOperation {

  String table;
  ColumnDefinition from;
  ColumnDefinition to;

  @Override
  public Phase phase() {
    return Phase.MODIFY_COLUMN;
  }

  @Override
  public String tableName() {
    return table;
  }

  @Override
  public List<String> toSql(Dialect dialect) {
    List<String> result = new ArrayList<>();
    if (from.isUnique() && !to.isUnique()) {
      result.add(dialect.dropIndexSql(table, Ddl.uniqueIndexName(table, from.getName())));
    }
    result.addAll(dialect.modifyColumnSql(table, from, to));
    if (!from.isUnique() && to.isUnique()) {
      result.add(Ddl.createUniqueIndex(table, to.getName()));
    }
    return result;
  }

  @Override
  public SchemaOperation inverse() {
    return new ModifyColumn(table, to, from);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    return schema.updateTable(table, t -> t.withColumn(to));
  }

  /**
   * @return True if the new definition cannot hold every value of the old one: a change of type
   *     family, a narrower type, size or scale, fewer digits before the decimal point, or fewer
   *     enum values.
   */
  @Override
  public boolean isDestructive() {
    if (!from.getType().widensTo(to.getType())) {
      return true;
    }
    if (from.getType() == to.getType()) {
      if (narrower(from.getSize(), to.getSize())
          || narrower(from.getScale(), to.getScale())
          || narrower(integerDigits(from), integerDigits(to))) {
        return true;
      }
    }
    return !from.getEnumValues().isEmpty()
        && !to.getEnumValues().isEmpty()
        && !to.getEnumValues().containsAll(from.getEnumValues());
  }

  private static Integer integerDigits(ColumnDefinition column) {
    if (column.getSize() == null || column.getScale() == null) {
      return null;
    }
    return column.getSize() - column.getScale();
  }

  private static boolean narrower(Integer before, Integer after) {
    return before != null && after != null && after < before;
  }

  @Override
  public String describe() {
    return "modify column " + table + "." + to.getName();
  }
}
