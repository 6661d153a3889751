package com.gruelbox.schemamigrator.schema;

import java.sql.DatabaseMetaData;
import java.util.Locale;

/** What happens to referencing rows when a referenced row is deleted. */
public enum ReferentialAction {
  CASCADE("CASCADE"),
  RESTRICT("RESTRICT"),
  SET_NULL("SET NULL"),
  SET_DEFAULT("SET DEFAULT"),

  /** Behaves as {@link #RESTRICT} on every supported database, and is normalised to it. */
  NO_ACTION("NO ACTION");

  private final String sql;

  ReferentialAction(String sql) {
    this.sql = sql;
  }

  public String sql() {
    return sql;
  }

  public ReferentialAction normalised() {
    return this == NO_ACTION ? RESTRICT : this;
  }

  /**
   * Maps a {@code DELETE_RULE} reported by {@link DatabaseMetaData#getImportedKeys}.
   *
   * @param rule The JDBC rule constant.
   * @return The action.
   */
  public static ReferentialAction fromJdbcRule(int rule) {
    switch (rule) {
      case DatabaseMetaData.importedKeyCascade:
        return CASCADE;
      case DatabaseMetaData.importedKeySetNull:
        return SET_NULL;
      case DatabaseMetaData.importedKeySetDefault:
        return SET_DEFAULT;
      default:
        return RESTRICT;
    }
  }

  /**
   * Parses either the enum name or the SQL form, case insensitively.
   *
   * @param value The text, such as {@code cascade} or {@code SET NULL}.
   * @return The action.
   */
  public static ReferentialAction parse(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_')).normalised();
  }
}
