package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * The database dialects supported by the migrator. A dialect renders the parts of the DDL which
 * differ between databases and knows how the database reports its own metadata. A single dialect
 * is used for the whole of a run.
 */
public interface Dialect {

  Dialect MY_SQL_8 = new MySQL8Dialect();

  /** H2 running with {@code MODE=MySQL}. */
  Dialect H2 = new H2Dialect();

  static Dialect forName(String name) {
    switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "H2":
        return H2;
      case "MY_SQL_8":
      case "MYSQL":
      case "MYSQL8":
        return MY_SQL_8;
      default:
        throw new IllegalArgumentException("Unsupported dialect: " + name);
    }
  }

  String getName();

  /**
   * @param connection The connection.
   * @return The catalog to pass to {@link java.sql.DatabaseMetaData} queries.
   * @throws SQLException If the connection fails.
   */
  String metadataCatalog(Connection connection) throws SQLException;

  /**
   * @param connection The connection.
   * @return The schema pattern to pass to {@link java.sql.DatabaseMetaData} queries.
   * @throws SQLException If the connection fails.
   */
  String metadataSchema(Connection connection) throws SQLException;

  /**
   * Rewrites a column into the form in which the database reports it back, so that declared and
   * introspected columns can be compared.
   *
   * @param column The column.
   * @return The canonical column.
   */
  ColumnDefinition canonicalize(ColumnDefinition column);

  ColumnType canonicalType(ColumnType type);

  String typeSql(ColumnDefinition column);

  /**
   * @param column The column.
   * @return The column definition as used in {@code CREATE TABLE} and {@code ADD COLUMN}.
   */
  String columnSql(ColumnDefinition column);

  /**
   * @param table The table.
   * @param from The current definition.
   * @param to The new definition, with the same name.
   * @return The statements changing the type, nullability and default. Uniqueness is handled
   *     separately, through an index.
   */
  List<String> modifyColumnSql(String table, ColumnDefinition from, ColumnDefinition to);

  String dropIndexSql(String table, String index);

  String renameIndexSql(String table, String from, String to);

  String dropForeignKeySql(String table, String foreignKey);

  String stringLiteral(String value);

  String jsonLiteral(String json);

  /**
   * @return True if a backslash escapes the next character inside string literals.
   */
  boolean backslashEscapes();

  String restartIdentitySql(String table, String column, long nextValue);
}
