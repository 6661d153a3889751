package com.gruelbox.schemamigrator.diff;

import static java.util.stream.Collectors.toList;

import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * The operations which transform one schema into another, held in canonical order. The order is
 * stable, so operations in the same {@link Phase} keep the order in which they were supplied.
 */
@Value
public class SchemaDiff {

  List<SchemaOperation> operations;

  private SchemaDiff(List<SchemaOperation> operations) {
    this.operations = List.copyOf(operations);
  }

  public static SchemaDiff of(Collection<? extends SchemaOperation> operations) {
    return new SchemaDiff(canonicalOrder(operations));
  }

  public static SchemaDiff empty() {
    return new SchemaDiff(List.of());
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  public boolean isDestructive() {
    return operations.stream().anyMatch(SchemaOperation::isDestructive);
  }

  public List<RenameCandidate> renameCandidates() {
    return operations.stream()
        .filter(RenameCandidate.class::isInstance)
        .map(RenameCandidate.class::cast)
        .collect(toList());
  }

  public SchemaSnapshot applyTo(SchemaSnapshot schema) {
    SchemaSnapshot result = schema;
    for (SchemaOperation operation : operations) {
      result = operation.applyTo(result);
    }
    return result;
  }

  /**
   * Sorts operations into execution order. A dropped index or foreign key whose name is re-added on
   * the same table is moved ahead of the modifications, so that the name is free by the time it is
   * added again.
   *
   * @param operations The operations in any order.
   * @return The operations in execution order.
   */
  public static List<SchemaOperation> canonicalOrder(
      Collection<? extends SchemaOperation> operations) {
    Set<String> addedIndexes = new HashSet<>();
    Set<String> addedForeignKeys = new HashSet<>();
    for (SchemaOperation operation : operations) {
      if (operation instanceof AddIndex) {
        AddIndex add = (AddIndex) operation;
        addedIndexes.add(key(add.getTable(), add.getIndex().getName()));
      } else if (operation instanceof AddForeignKey) {
        AddForeignKey add = (AddForeignKey) operation;
        addedForeignKeys.add(key(add.getTable(), add.getForeignKey().getName()));
      }
    }
    List<SchemaOperation> result = new ArrayList<>(operations);
    result.sort(
        Comparator.comparing(
            operation -> effectivePhase(operation, addedIndexes, addedForeignKeys)));
    return result;
  }

  private static Phase effectivePhase(
      SchemaOperation operation, Set<String> addedIndexes, Set<String> addedForeignKeys) {
    if (operation instanceof DropIndex) {
      DropIndex drop = (DropIndex) operation;
      if (addedIndexes.contains(key(drop.getTable(), drop.getIndex().getName()))) {
        return Phase.REPLACE_INDEX;
      }
    } else if (operation instanceof DropForeignKey) {
      DropForeignKey drop = (DropForeignKey) operation;
      if (addedForeignKeys.contains(key(drop.getTable(), drop.getForeignKey().getName()))) {
        return Phase.REPLACE_FOREIGN_KEY;
      }
    }
    return operation.phase();
  }

  private static String key(String table, String name) {
    return table + "." + name;
  }
}
