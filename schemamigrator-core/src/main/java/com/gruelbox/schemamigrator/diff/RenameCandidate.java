package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.DiffAmbiguityException;
import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.List;
import java.util.Locale;
import lombok.Value;

/**
 * A proposal that a column which disappeared and a column which appeared are the same column under
 * a new name. Never executable: it must be confirmed, becoming a {@link RenameColumn}, or denied,
 * becoming a {@link DropColumn} and an {@link AddColumn}.
 */
@Value
public class RenameCandidate implements SchemaOperation {

  String table;
  ColumnDefinition from;
  ColumnDefinition to;

  /** How alike the two columns are, between 0 and 1. */
  double confidence;

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
    throw new DiffAmbiguityException(List.of(this));
  }

  @Override
  public SchemaOperation inverse() {
    return new RenameCandidate(table, to, from, confidence);
  }

  @Override
  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    throw new DiffAmbiguityException(List.of(this));
  }

  /**
   * @return The operations which rename the column, followed by a {@link ModifyColumn} when its
   *     definition also changes.
   */
  public List<SchemaOperation> confirm() {
    RenameColumn rename = new RenameColumn(table, from, to.getName());
    ColumnDefinition renamed = from.withName(to.getName());
    if (SchemaDiffer.sameDefinition(renamed, to)) {
      return List.of(rename);
    }
    return List.of(rename, new ModifyColumn(table, renamed, to));
  }

  /**
   * @return The operations which drop the old column and add the new one, losing its data.
   */
  public List<SchemaOperation> deny() {
    return List.of(new DropColumn(table, from), new AddColumn(table, to));
  }

  @Override
  public String describe() {
    return String.format(
        Locale.ROOT,
        "%s.%s -> %s.%s (confidence %.2f)",
        table,
        from.getName(),
        table,
        to.getName(),
        confidence);
  }
}
