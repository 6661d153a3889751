package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares a desired schema with the actual one and produces the operations which turn the actual
 * schema into the desired one. Both sides are canonicalized through the {@link Dialect} first, so
 * differences which the database would not preserve are ignored.
 *
 * <p>Columns are compared on type, size, scale, nullability, uniqueness, auto increment and
 * default. Enum values are compared only when both sides report them. Indexes and foreign keys are
 * matched by name and a changed one is dropped and re-added.
 */
@Slf4j
public final class SchemaDiffer {

  private final Dialect dialect;
  private final RenameDetector renameDetector;

  /**
   * @param dialect The dialect of the target database.
   * @param detectRenames Whether to propose {@link RenameCandidate}s. Defaults to true. When false,
   *     a renamed column always shows up as a drop and an add.
   */
  @Builder
  private SchemaDiffer(Dialect dialect, Boolean detectRenames) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.renameDetector = detectRenames == null || detectRenames ? new RenameDetector() : null;
  }

  public SchemaDiff diff(SchemaSnapshot desired, SchemaSnapshot actual) {
    SchemaSnapshot target = canonicalize(desired);
    SchemaSnapshot current = canonicalize(actual);
    List<SchemaOperation> operations = new ArrayList<>();
    for (String name : target.tableNames()) {
      TableSnapshot table = target.requireTable(name);
      Optional<TableSnapshot> existing = current.table(name);
      if (existing.isEmpty()) {
        operations.add(new CreateTable(table.withoutForeignKeys()));
        table.getForeignKeys().forEach(fk -> operations.add(new AddForeignKey(name, fk)));
      } else {
        diffTable(table, existing.get(), operations);
      }
    }
    for (String name : current.tableNames()) {
      if (target.table(name).isEmpty()) {
        TableSnapshot table = current.requireTable(name);
        table.getForeignKeys().forEach(fk -> operations.add(new DropForeignKey(name, fk)));
        operations.add(new DropTable(table.withoutForeignKeys()));
      }
    }
    SchemaDiff result = SchemaDiff.of(operations);
    log.debug("Diff produced {} operations", result.getOperations().size());
    return result;
  }

  private void diffTable(TableSnapshot desired, TableSnapshot actual, List<SchemaOperation> out) {
    String table = desired.getName();
    List<ColumnDefinition> removed =
        actual.getColumns().stream()
            .filter(c -> !desired.hasColumn(c.getName()))
            .collect(Collectors.toCollection(ArrayList::new));
    List<ColumnDefinition> added =
        desired.getColumns().stream()
            .filter(c -> !actual.hasColumn(c.getName()))
            .collect(Collectors.toCollection(ArrayList::new));

    for (ColumnDefinition to : desired.getColumns()) {
      actual
          .column(to.getName())
          .filter(from -> !sameDefinition(from, to))
          .ifPresent(from -> out.add(new ModifyColumn(table, withKnownEnumValues(from, to), to)));
    }

    if (renameDetector != null) {
      for (RenameCandidate candidate : renameDetector.detect(table, removed, added)) {
        log.debug("Possible rename: {}", candidate.describe());
        out.add(candidate);
        removed.remove(candidate.getFrom());
        added.remove(candidate.getTo());
      }
    }
    added.forEach(c -> out.add(new AddColumn(table, c)));
    removed.forEach(c -> out.add(new DropColumn(table, c)));

    for (IndexDefinition index : desired.getIndexes()) {
      Optional<IndexDefinition> existing = actual.index(index.getName());
      if (existing.isEmpty()) {
        out.add(new AddIndex(table, index));
      } else if (!existing.get().equals(index)) {
        out.add(new DropIndex(table, existing.get()));
        out.add(new AddIndex(table, index));
      }
    }
    for (IndexDefinition index : actual.getIndexes()) {
      if (desired.index(index.getName()).isEmpty()) {
        out.add(new DropIndex(table, index));
      }
    }

    for (ForeignKeyDefinition foreignKey : desired.getForeignKeys()) {
      Optional<ForeignKeyDefinition> existing = actual.foreignKey(foreignKey.getName());
      if (existing.isEmpty()) {
        out.add(new AddForeignKey(table, foreignKey));
      } else if (!existing.get().equals(foreignKey)) {
        out.add(new DropForeignKey(table, existing.get()));
        out.add(new AddForeignKey(table, foreignKey));
      }
    }
    for (ForeignKeyDefinition foreignKey : actual.getForeignKeys()) {
      if (desired.foreignKey(foreignKey.getName()).isEmpty()) {
        out.add(new DropForeignKey(table, foreignKey));
      }
    }
  }

  static boolean sameDefinition(ColumnDefinition a, ColumnDefinition b) {
    return a.getType() == b.getType()
        && Objects.equals(a.getSize(), b.getSize())
        && Objects.equals(a.getScale(), b.getScale())
        && a.isNullable() == b.isNullable()
        && a.isUnique() == b.isUnique()
        && a.isAutoIncrement() == b.isAutoIncrement()
        && Objects.equals(a.getDefaultValue(), b.getDefaultValue())
        && (a.getEnumValues().isEmpty()
            || b.getEnumValues().isEmpty()
            || a.getEnumValues().equals(b.getEnumValues()));
  }

  // Databases which do not report enum values would otherwise produce an unrenderable inverse.
  private static ColumnDefinition withKnownEnumValues(ColumnDefinition from, ColumnDefinition to) {
    if (from.getType() == ColumnType.ENUM
        && from.getEnumValues().isEmpty()
        && to.getType() == ColumnType.ENUM) {
      return from.toBuilder().enumValues(to.getEnumValues()).build();
    }
    return from;
  }

  private SchemaSnapshot canonicalize(SchemaSnapshot schema) {
    return SchemaSnapshot.of(
        schema.tableNames().stream()
            .map(schema::requireTable)
            .map(
                t ->
                    new TableSnapshot(
                        t.getName(),
                        t.getColumns().stream()
                            .map(dialect::canonicalize)
                            .collect(Collectors.toList()),
                        t.getIndexes(),
                        t.getForeignKeys()))
            .collect(Collectors.toList()));
  }
}
