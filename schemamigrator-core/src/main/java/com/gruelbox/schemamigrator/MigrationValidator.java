package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.diff.AddColumn;
import com.gruelbox.schemamigrator.diff.ModifyColumn;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks a migration against the live database immediately before it runs. Errors stop the run
 * before any of the migration's SQL executes.
 */
class MigrationValidator {

  static final long LARGE_TABLE_ROWS = 100_000;

  ValidationResult validate(
      MigrationRecord record, SchemaSnapshot schema, Connection connection, boolean backupAvailable)
      throws SQLException {
    ValidationResult result =
        record.getValidation().map(v -> v.validate(schema)).orElse(ValidationResult.ok());
    if (record.isDestructive() && !(record.isRequiresBackup() && backupAvailable)) {
      result =
          result.and(
              ValidationResult.warning(
                  "Migration "
                      + record.getVersion()
                      + " is destructive and runs without a backup"));
    }
    List<SchemaOperation> operations = record.getOperations().orElse(List.of());
    Map<String, Long> rowCounts = new HashMap<>();
    for (SchemaOperation operation : operations) {
      if (operation instanceof AddColumn) {
        AddColumn add = (AddColumn) operation;
        ColumnDefinition column = add.getColumn();
        if (!column.isNullable()
            && column.getDefaultValue() == null
            && !column.isAutoIncrement()
            && schema.table(add.getTable()).isPresent()
            && rowCount(connection, add.getTable(), rowCounts) > 0) {
          result =
              result.and(
                  ValidationResult.error(
                      "Cannot add NOT NULL column "
                          + add.getTable()
                          + "."
                          + column.getName()
                          + " without a default to a table which contains rows"));
        }
      } else if (operation instanceof ModifyColumn) {
        ModifyColumn modify = (ModifyColumn) operation;
        if (modify.getFrom().isNullable()
            && !modify.getTo().isNullable()
            && schema.table(modify.getTable()).isPresent()
            && nullCount(connection, modify.getTable(), modify.getFrom().getName()) > 0) {
          result =
              result.and(
                  ValidationResult.error(
                      "Cannot make "
                          + modify.getTable()
                          + "."
                          + modify.getFrom().getName()
                          + " NOT NULL while it contains NULL values"));
        }
      }
    }
    Set<String> tables =
        operations.stream()
            .map(SchemaOperation::tableName)
            .collect(Collectors.toCollection(TreeSet::new));
    for (String table : tables) {
      if (schema.table(table).isPresent()) {
        long rows = rowCount(connection, table, rowCounts);
        if (rows > LARGE_TABLE_ROWS) {
          result =
              result.and(
                  ValidationResult.warning(
                      "Table " + table + " has " + rows + " rows and may be locked for some time"));
        }
      }
    }
    return result;
  }

  private static long rowCount(Connection connection, String table, Map<String, Long> cache)
      throws SQLException {
    Long cached = cache.get(table);
    if (cached != null) {
      return cached;
    }
    long count = count(connection, "SELECT COUNT(*) FROM " + table);
    cache.put(table, count);
    return count;
  }

  private static long nullCount(Connection connection, String table, String column)
      throws SQLException {
    return count(connection, "SELECT COUNT(*) FROM " + table + " WHERE " + column + " IS NULL");
  }

  private static long count(Connection connection, String sql) throws SQLException {
    try (Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }
}
