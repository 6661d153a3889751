package com.gruelbox.schemamigrator.schema;

import lombok.Builder;
import lombok.Value;

/** A named single-column foreign key constraint. */
@Value
public class ForeignKeyDefinition {

  String name;
  String column;
  String referencedTable;
  String referencedColumn;
  ReferentialAction onDelete;

  @Builder(toBuilder = true)
  private ForeignKeyDefinition(
      String name,
      String column,
      String referencedTable,
      String referencedColumn,
      ReferentialAction onDelete) {
    this.name = name;
    this.column = column;
    this.referencedTable = referencedTable;
    this.referencedColumn = referencedColumn == null ? "id" : referencedColumn;
    this.onDelete = onDelete == null ? ReferentialAction.RESTRICT : onDelete.normalised();
  }
}
