package com.gruelbox.schemamigrator;

import static java.util.stream.Collectors.joining;

import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/** SQL shared by the supported dialects, which all accept MySQL-style column definitions. */
abstract class BaseDialect implements Dialect {

  private static final Set<String> KEYWORD_DEFAULTS =
      Set.of("CURRENT_TIMESTAMP", "CURRENT_DATE", "CURRENT_TIME", "NULL");

  @Override
  public ColumnType canonicalType(ColumnType type) {
    return type == ColumnType.RELATION ? ColumnType.BIGINT : type;
  }

  @Override
  public ColumnDefinition canonicalize(ColumnDefinition column) {
    ColumnDefinition resolved = column.resolved();
    ColumnType type = canonicalType(resolved.getType());
    return resolved.toBuilder()
        .type(type)
        .size(type.isSized() ? resolved.getSize() : null)
        .defaultValue(
            resolved.isAutoIncrement() ? null : canonicalDefault(type, resolved.getDefaultValue()))
        .build();
  }

  String canonicalDefault(ColumnType type, String value) {
    if (value == null) {
      return null;
    }
    String result = value.trim();
    if (result.length() >= 2 && result.startsWith("'") && result.endsWith("'")) {
      result = result.substring(1, result.length() - 1).replace("''", "'");
    }
    if ("NULL".equalsIgnoreCase(result)) {
      return null;
    }
    if (type == ColumnType.BOOLEAN) {
      if ("1".equals(result) || "TRUE".equalsIgnoreCase(result)) {
        return "true";
      }
      if ("0".equals(result) || "FALSE".equalsIgnoreCase(result)) {
        return "false";
      }
    }
    if (KEYWORD_DEFAULTS.contains(result.toUpperCase(Locale.ROOT))) {
      return result.toUpperCase(Locale.ROOT);
    }
    return result;
  }

  @Override
  public String typeSql(ColumnDefinition column) {
    ColumnType type = canonicalType(column.getType());
    switch (type) {
      case CHAR:
      case VARCHAR:
        return type.name() + "(" + column.getSize() + ")";
      case DECIMAL:
        return "DECIMAL(" + column.getSize() + ", " + column.getScale() + ")";
      case ENUM:
        if (column.getEnumValues().isEmpty()) {
          throw new IllegalStateException(
              "The values of enum column " + column.getName() + " are not known");
        }
        return column.getEnumValues().stream()
            .map(this::stringLiteral)
            .collect(joining(",", "ENUM(", ")"));
      default:
        return type.name();
    }
  }

  @Override
  public String columnSql(ColumnDefinition column) {
    return columnSql(column, false);
  }

  String columnSql(ColumnDefinition column, boolean explicitNull) {
    StringBuilder sb = new StringBuilder();
    sb.append(column.getName()).append(' ').append(typeSql(column));
    if (!column.isNullable()) {
      sb.append(" NOT NULL");
    } else if (explicitNull) {
      sb.append(" NULL");
    }
    if (column.isAutoIncrement()) {
      sb.append(" AUTO_INCREMENT");
    }
    String defaultSql = defaultSql(column);
    if (defaultSql != null) {
      sb.append(" DEFAULT ").append(defaultSql);
    }
    return sb.toString();
  }

  String defaultSql(ColumnDefinition column) {
    String value = column.getDefaultValue();
    if (value == null || column.isAutoIncrement()) {
      return null;
    }
    ColumnType type = canonicalType(column.getType());
    if (type.getFamily() == ColumnType.Family.INTEGER
        || type.getFamily() == ColumnType.Family.DECIMAL) {
      return value;
    }
    if (KEYWORD_DEFAULTS.contains(value.toUpperCase(Locale.ROOT))) {
      return value.toUpperCase(Locale.ROOT);
    }
    return stringLiteral(value);
  }

  @Override
  public String stringLiteral(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  @Override
  public String jsonLiteral(String json) {
    return stringLiteral(json);
  }

  @Override
  public boolean backslashEscapes() {
    return false;
  }

  static boolean sameType(ColumnDefinition from, ColumnDefinition to) {
    return from.getType() == to.getType()
        && Objects.equals(from.getSize(), to.getSize())
        && Objects.equals(from.getScale(), to.getScale())
        && from.getEnumValues().equals(to.getEnumValues());
  }
}
