package com.gruelbox.schemamigrator.schema;

import com.gruelbox.schemamigrator.Dialect;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the actual schema of a live database through {@link DatabaseMetaData}. The result is
 * canonicalised by the {@link Dialect} so it compares equal to the declarations that created it.
 *
 * <p>Primary key indexes are omitted. A single column unique index is reported as a unique column
 * rather than as an index.
 */
@Slf4j
public final class SchemaIntrospector {

  private static final Map<String, ColumnType> TYPE_NAMES = new HashMap<>();

  static {
    TYPE_NAMES.put("TINYINT", ColumnType.TINYINT);
    TYPE_NAMES.put("SMALLINT", ColumnType.SMALLINT);
    TYPE_NAMES.put("MEDIUMINT", ColumnType.INT);
    TYPE_NAMES.put("INT", ColumnType.INT);
    TYPE_NAMES.put("INTEGER", ColumnType.INT);
    TYPE_NAMES.put("BIGINT", ColumnType.BIGINT);
    TYPE_NAMES.put("BOOLEAN", ColumnType.BOOLEAN);
    TYPE_NAMES.put("BOOL", ColumnType.BOOLEAN);
    TYPE_NAMES.put("BIT", ColumnType.BOOLEAN);
    TYPE_NAMES.put("DECIMAL", ColumnType.DECIMAL);
    TYPE_NAMES.put("NUMERIC", ColumnType.DECIMAL);
    TYPE_NAMES.put("FLOAT", ColumnType.FLOAT);
    TYPE_NAMES.put("REAL", ColumnType.FLOAT);
    TYPE_NAMES.put("DOUBLE", ColumnType.DOUBLE);
    TYPE_NAMES.put("DOUBLE PRECISION", ColumnType.DOUBLE);
    TYPE_NAMES.put("CHAR", ColumnType.CHAR);
    TYPE_NAMES.put("CHARACTER", ColumnType.CHAR);
    TYPE_NAMES.put("VARCHAR", ColumnType.VARCHAR);
    TYPE_NAMES.put("CHARACTER VARYING", ColumnType.VARCHAR);
    TYPE_NAMES.put("TEXT", ColumnType.TEXT);
    TYPE_NAMES.put("TINYTEXT", ColumnType.TEXT);
    TYPE_NAMES.put("MEDIUMTEXT", ColumnType.TEXT);
    TYPE_NAMES.put("LONGTEXT", ColumnType.TEXT);
    TYPE_NAMES.put("CLOB", ColumnType.TEXT);
    TYPE_NAMES.put("CHARACTER LARGE OBJECT", ColumnType.TEXT);
    TYPE_NAMES.put("BLOB", ColumnType.BLOB);
    TYPE_NAMES.put("TINYBLOB", ColumnType.BLOB);
    TYPE_NAMES.put("MEDIUMBLOB", ColumnType.BLOB);
    TYPE_NAMES.put("LONGBLOB", ColumnType.BLOB);
    TYPE_NAMES.put("BINARY LARGE OBJECT", ColumnType.BLOB);
    TYPE_NAMES.put("DATE", ColumnType.DATE);
    TYPE_NAMES.put("TIME", ColumnType.TIME);
    TYPE_NAMES.put("DATETIME", ColumnType.DATETIME);
    TYPE_NAMES.put("TIMESTAMP", ColumnType.TIMESTAMP);
    TYPE_NAMES.put("JSON", ColumnType.JSON);
    TYPE_NAMES.put("ENUM", ColumnType.ENUM);
  }

  private final Dialect dialect;
  private final Set<String> excludedTables;

  /**
   * @param dialect The database dialect.
   * @param excludedTables Tables to leave out, such as the migration ledger. Matched case
   *     insensitively.
   */
  @SuppressWarnings("JavaDoc")
  @Builder
  private SchemaIntrospector(Dialect dialect, Set<String> excludedTables) {
    this.dialect = dialect;
    this.excludedTables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    if (excludedTables != null) {
      this.excludedTables.addAll(excludedTables);
    }
  }

  public SchemaSnapshot introspect(Connection connection) throws SQLException {
    DatabaseMetaData metaData = connection.getMetaData();
    String catalog = dialect.metadataCatalog(connection);
    String schema = dialect.metadataSchema(connection);
    List<TableSnapshot> tables = new ArrayList<>();
    for (String table : tableNames(metaData, catalog, schema)) {
      tables.add(readTable(metaData, catalog, schema, table));
    }
    log.debug("Introspected {} tables", tables.size());
    return SchemaSnapshot.of(tables);
  }

  /**
   * Lists the tables of the current schema, without applying any exclusions.
   *
   * @param connection The connection.
   * @return The table names.
   * @throws SQLException If the metadata cannot be read.
   */
  public List<String> allTableNames(Connection connection) throws SQLException {
    return tableNames(
        connection.getMetaData(),
        dialect.metadataCatalog(connection),
        dialect.metadataSchema(connection),
        false);
  }

  private List<String> tableNames(DatabaseMetaData metaData, String catalog, String schema)
      throws SQLException {
    return tableNames(metaData, catalog, schema, true);
  }

  private List<String> tableNames(
      DatabaseMetaData metaData, String catalog, String schema, boolean applyExclusions)
      throws SQLException {
    List<String> result = new ArrayList<>();
    try (ResultSet rs = metaData.getTables(catalog, schema, "%", null)) {
      while (rs.next()) {
        String type = rs.getString("TABLE_TYPE");
        String name = rs.getString("TABLE_NAME");
        if (!"TABLE".equalsIgnoreCase(type) && !"BASE TABLE".equalsIgnoreCase(type)) {
          continue;
        }
        if (applyExclusions && excludedTables.contains(name)) {
          continue;
        }
        result.add(name);
      }
    }
    return result;
  }

  private TableSnapshot readTable(
      DatabaseMetaData metaData, String catalog, String schema, String table)
      throws SQLException {
    Set<String> primaryKey = new HashSet<>();
    String primaryKeyName = null;
    try (ResultSet rs = metaData.getPrimaryKeys(catalog, schema, table)) {
      while (rs.next()) {
        primaryKey.add(rs.getString("COLUMN_NAME"));
        primaryKeyName = rs.getString("PK_NAME");
      }
    }

    Map<String, ForeignKeyDefinition> foreignKeysByColumn = new LinkedHashMap<>();
    try (ResultSet rs = metaData.getImportedKeys(catalog, schema, table)) {
      while (rs.next()) {
        if (rs.getInt("KEY_SEQ") > 1) {
          log.warn(
              "Composite foreign key {} on {} is not supported; only its first column is read",
              rs.getString("FK_NAME"),
              table);
          continue;
        }
        ForeignKeyDefinition foreignKey =
            ForeignKeyDefinition.builder()
                .name(rs.getString("FK_NAME"))
                .column(rs.getString("FKCOLUMN_NAME"))
                .referencedTable(rs.getString("PKTABLE_NAME"))
                .referencedColumn(rs.getString("PKCOLUMN_NAME"))
                .onDelete(ReferentialAction.fromJdbcRule(rs.getInt("DELETE_RULE")))
                .build();
        foreignKeysByColumn.put(foreignKey.getColumn(), foreignKey);
      }
    }

    Map<String, List<String>> indexColumns = new LinkedHashMap<>();
    Map<String, Boolean> indexUnique = new HashMap<>();
    try (ResultSet rs = metaData.getIndexInfo(catalog, schema, table, false, false)) {
      while (rs.next()) {
        String indexName = rs.getString("INDEX_NAME");
        String columnName = rs.getString("COLUMN_NAME");
        if (indexName == null
            || columnName == null
            || rs.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
          continue;
        }
        List<String> columns = indexColumns.computeIfAbsent(indexName, k -> new ArrayList<>());
        int position = rs.getInt("ORDINAL_POSITION");
        while (columns.size() < position) {
          columns.add(null);
        }
        columns.set(position - 1, columnName);
        indexUnique.put(indexName, !rs.getBoolean("NON_UNIQUE"));
      }
    }

    Set<String> uniqueColumns = new HashSet<>();
    List<IndexDefinition> indexes = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : indexColumns.entrySet()) {
      String indexName = entry.getKey();
      List<String> columns = entry.getValue();
      boolean unique = indexUnique.get(indexName);
      if (indexName.equals(primaryKeyName)
          || (unique && !primaryKey.isEmpty() && new HashSet<>(columns).equals(primaryKey))) {
        continue;
      }
      if (unique && columns.size() == 1) {
        uniqueColumns.add(columns.get(0));
        continue;
      }
      indexes.add(new IndexDefinition(indexName, columns, unique));
    }

    List<ColumnDefinition> columns = new ArrayList<>();
    try (ResultSet rs = metaData.getColumns(catalog, schema, table, "%")) {
      while (rs.next()) {
        String name = rs.getString("COLUMN_NAME");
        ColumnType type = mapType(rs.getString("TYPE_NAME"), rs.getInt("DATA_TYPE"), table, name);
        int size = rs.getInt("COLUMN_SIZE");
        int scale = rs.getInt("DECIMAL_DIGITS");
        boolean autoIncrement = "YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT"));
        ForeignKeyDefinition foreignKey = foreignKeysByColumn.get(name);
        ColumnDefinition column =
            ColumnDefinition.builder()
                .name(name)
                .type(type)
                .size(type.isSized() ? size : null)
                .scale(type == ColumnType.DECIMAL ? scale : null)
                .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                .primaryKey(primaryKey.contains(name))
                .unique(uniqueColumns.contains(name))
                .autoIncrement(autoIncrement)
                .references(
                    foreignKey == null
                        ? null
                        : foreignKey.getReferencedTable() + "." + foreignKey.getReferencedColumn())
                .onDelete(foreignKey == null ? null : foreignKey.getOnDelete())
                .defaultValue(autoIncrement ? null : rs.getString("COLUMN_DEF"))
                .build();
        columns.add(dialect.canonicalize(column));
      }
    }
    return new TableSnapshot(
        table, columns, indexes, new ArrayList<>(foreignKeysByColumn.values()));
  }

  private ColumnType mapType(String typeName, int dataType, String table, String column) {
    if (typeName != null) {
      String normalised = typeName.toUpperCase(Locale.ROOT).replace(" UNSIGNED", "").trim();
      int paren = normalised.indexOf('(');
      if (paren > 0) {
        normalised = normalised.substring(0, paren).trim();
      }
      ColumnType mapped = TYPE_NAMES.get(normalised);
      if (mapped != null) {
        return mapped;
      }
    }
    switch (dataType) {
      case Types.TINYINT:
        return ColumnType.TINYINT;
      case Types.SMALLINT:
        return ColumnType.SMALLINT;
      case Types.INTEGER:
        return ColumnType.INT;
      case Types.BIGINT:
        return ColumnType.BIGINT;
      case Types.BIT:
      case Types.BOOLEAN:
        return ColumnType.BOOLEAN;
      case Types.DECIMAL:
      case Types.NUMERIC:
        return ColumnType.DECIMAL;
      case Types.REAL:
      case Types.FLOAT:
        return ColumnType.FLOAT;
      case Types.DOUBLE:
        return ColumnType.DOUBLE;
      case Types.CHAR:
      case Types.NCHAR:
        return ColumnType.CHAR;
      case Types.VARCHAR:
      case Types.NVARCHAR:
        return ColumnType.VARCHAR;
      case Types.CLOB:
      case Types.NCLOB:
      case Types.LONGVARCHAR:
      case Types.LONGNVARCHAR:
        return ColumnType.TEXT;
      case Types.BLOB:
      case Types.BINARY:
      case Types.VARBINARY:
      case Types.LONGVARBINARY:
        return ColumnType.BLOB;
      case Types.DATE:
        return ColumnType.DATE;
      case Types.TIME:
      case Types.TIME_WITH_TIMEZONE:
        return ColumnType.TIME;
      case Types.TIMESTAMP:
      case Types.TIMESTAMP_WITH_TIMEZONE:
        return ColumnType.TIMESTAMP;
      default:
        log.warn(
            "Unrecognised type {} ({}) on {}.{}; treating it as TEXT",
            typeName,
            dataType,
            table,
            column);
        return ColumnType.TEXT;
    }
  }
}
