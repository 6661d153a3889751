package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

final class MySQL8Dialect extends BaseDialect {

  @Override
  public String getName() {
    return "MY_SQL_8";
  }

  @Override
  public String metadataCatalog(Connection connection) throws SQLException {
    return connection.getCatalog();
  }

  @Override
  public String metadataSchema(Connection connection) {
    return null;
  }

  @Override
  public List<String> modifyColumnSql(String table, ColumnDefinition from, ColumnDefinition to) {
    return List.of("ALTER TABLE " + table + " MODIFY COLUMN " + columnSql(to, true));
  }

  @Override
  public String dropIndexSql(String table, String index) {
    return "ALTER TABLE " + table + " DROP INDEX " + index;
  }

  @Override
  public String renameIndexSql(String table, String from, String to) {
    return "ALTER TABLE " + table + " RENAME INDEX " + from + " TO " + to;
  }

  @Override
  public String dropForeignKeySql(String table, String foreignKey) {
    return "ALTER TABLE " + table + " DROP FOREIGN KEY " + foreignKey;
  }

  @Override
  public String stringLiteral(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  @Override
  public boolean backslashEscapes() {
    return true;
  }

  @Override
  public String restartIdentitySql(String table, String column, long nextValue) {
    return "ALTER TABLE " + table + " AUTO_INCREMENT = " + nextValue;
  }
}
