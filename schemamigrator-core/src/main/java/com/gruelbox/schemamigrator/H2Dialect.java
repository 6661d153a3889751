package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * H2 in MySQL compatibility mode. H2 has no distinct {@code DATETIME} or single precision {@code
 * FLOAT}, so both are reported back as their wider equivalents.
 */
final class H2Dialect extends BaseDialect {

  @Override
  public String getName() {
    return "H2";
  }

  @Override
  public String metadataCatalog(Connection connection) {
    return null;
  }

  @Override
  public String metadataSchema(Connection connection) throws SQLException {
    return connection.getSchema();
  }

  @Override
  public ColumnType canonicalType(ColumnType type) {
    switch (type) {
      case DATETIME:
        return ColumnType.TIMESTAMP;
      case FLOAT:
        return ColumnType.DOUBLE;
      default:
        return super.canonicalType(type);
    }
  }

  @Override
  public List<String> modifyColumnSql(String table, ColumnDefinition from, ColumnDefinition to) {
    String prefix = "ALTER TABLE " + table + " ALTER COLUMN " + to.getName();
    List<String> result = new ArrayList<>();
    if (!sameType(from, to)) {
      result.add(prefix + " SET DATA TYPE " + typeSql(to));
    }
    if (from.isNullable() != to.isNullable()) {
      result.add(prefix + (to.isNullable() ? " DROP NOT NULL" : " SET NOT NULL"));
    }
    if (!Objects.equals(from.getDefaultValue(), to.getDefaultValue())) {
      String defaultSql = defaultSql(to);
      result.add(prefix + (defaultSql == null ? " DROP DEFAULT" : (" SET DEFAULT " + defaultSql)));
    }
    return result;
  }

  @Override
  public String dropIndexSql(String table, String index) {
    return "DROP INDEX " + index;
  }

  @Override
  public String renameIndexSql(String table, String from, String to) {
    return "ALTER INDEX " + from + " RENAME TO " + to;
  }

  @Override
  public String dropForeignKeySql(String table, String foreignKey) {
    return "ALTER TABLE " + table + " DROP CONSTRAINT " + foreignKey;
  }

  @Override
  public String jsonLiteral(String json) {
    return stringLiteral(json) + " FORMAT JSON";
  }

  @Override
  public String restartIdentitySql(String table, String column, long nextValue) {
    return "ALTER TABLE " + table + " ALTER COLUMN " + column + " RESTART WITH " + nextValue;
  }
}
