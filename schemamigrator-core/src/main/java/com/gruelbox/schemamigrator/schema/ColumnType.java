package com.gruelbox.schemamigrator.schema;

import lombok.Getter;

/**
 * The column types understood by the migrator. Types are grouped into families; converting within
 * a family towards a higher rank preserves data, anything else is potentially lossy.
 */
public enum ColumnType {
  BOOLEAN(Family.INTEGER, 0, null),
  TINYINT(Family.INTEGER, 1, null),
  SMALLINT(Family.INTEGER, 2, null),
  INT(Family.INTEGER, 3, null),
  BIGINT(Family.INTEGER, 4, null),
  FLOAT(Family.DECIMAL, 1, null),
  DOUBLE(Family.DECIMAL, 2, null),
  DECIMAL(Family.DECIMAL, 2, 10),
  CHAR(Family.TEXT, 1, 1),
  VARCHAR(Family.TEXT, 2, 255),
  TEXT(Family.TEXT, 3, null),
  BLOB(Family.TEXT, 3, null),
  DATE(Family.TEMPORAL, 1, null),
  TIME(Family.TEMPORAL, 1, null),
  DATETIME(Family.TEMPORAL, 2, null),
  TIMESTAMP(Family.TEMPORAL, 2, null),
  JSON(Family.JSON, 1, null),
  ENUM(Family.ENUM, 1, null),

  /**
   * A reference to another table's {@code id}. Only valid in entity declarations; it resolves to
   * {@link #BIGINT} plus a foreign key when the table is built.
   */
  RELATION(Family.RELATION, 1, null);

  public enum Family {
    INTEGER,
    DECIMAL,
    TEXT,
    TEMPORAL,
    JSON,
    ENUM,
    RELATION
  }

  @Getter private final Family family;
  private final int rank;
  @Getter private final Integer defaultSize;

  ColumnType(Family family, int rank, Integer defaultSize) {
    this.family = family;
    this.rank = rank;
    this.defaultSize = defaultSize;
  }

  /**
   * @return True if the type takes a length or precision, as in {@code VARCHAR(255)}.
   */
  public boolean isSized() {
    return defaultSize != null;
  }

  /**
   * @param other Another type.
   * @return True if values of this type can be converted to {@code other} without loss.
   */
  public boolean widensTo(ColumnType other) {
    if (other == this) {
      return true;
    }
    return other.family == family && other.rank > rank;
  }

  /**
   * @param other Another type.
   * @return True if the two types hold the same kind of data.
   */
  public boolean isCompatibleWith(ColumnType other) {
    return other.family == family;
  }
}
