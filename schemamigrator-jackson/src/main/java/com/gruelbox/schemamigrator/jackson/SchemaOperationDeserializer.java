package com.gruelbox.schemamigrator.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gruelbox.schemamigrator.diff.AddColumn;
import com.gruelbox.schemamigrator.diff.AddForeignKey;
import com.gruelbox.schemamigrator.diff.AddIndex;
import com.gruelbox.schemamigrator.diff.CreateTable;
import com.gruelbox.schemamigrator.diff.DropColumn;
import com.gruelbox.schemamigrator.diff.DropForeignKey;
import com.gruelbox.schemamigrator.diff.DropIndex;
import com.gruelbox.schemamigrator.diff.DropTable;
import com.gruelbox.schemamigrator.diff.ModifyColumn;
import com.gruelbox.schemamigrator.diff.RenameColumn;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import com.gruelbox.schemamigrator.jackson.SchemaOperationSerializer.OperationType;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

class SchemaOperationDeserializer extends JsonDeserializer<SchemaOperation> {

  @Override
  public SchemaOperation deserialize(JsonParser p, DeserializationContext c) throws IOException {
    ObjectCodec oc = p.getCodec();
    JsonNode node = oc.readTree(p);
    return toOperation(node, p);
  }

  static SchemaOperation toOperation(JsonNode node, JsonParser p) throws IOException {
    OperationType type;
    try {
      type = OperationType.valueOf(required(node, "type", p).asText());
    } catch (IllegalArgumentException e) {
      throw JsonMappingException.from(p, "Unknown operation type " + node.get("type"));
    }
    switch (type) {
      case CREATE_TABLE:
        return new CreateTable(toTable(required(node, "table", p), p));
      case DROP_TABLE:
        return new DropTable(toTable(required(node, "table", p), p));
      case ADD_COLUMN:
        return new AddColumn(text(node, "table", p), toColumn(required(node, "column", p), p));
      case DROP_COLUMN:
        return new DropColumn(text(node, "table", p), toColumn(required(node, "column", p), p));
      case MODIFY_COLUMN:
        return new ModifyColumn(
            text(node, "table", p),
            toColumn(required(node, "from", p), p),
            toColumn(required(node, "to", p), p));
      case RENAME_COLUMN:
        return new RenameColumn(
            text(node, "table", p),
            toColumn(required(node, "column", p), p),
            text(node, "newName", p));
      case ADD_INDEX:
        return new AddIndex(text(node, "table", p), toIndex(required(node, "index", p), p));
      case DROP_INDEX:
        return new DropIndex(text(node, "table", p), toIndex(required(node, "index", p), p));
      case ADD_FOREIGN_KEY:
        return new AddForeignKey(
            text(node, "table", p), toForeignKey(required(node, "foreignKey", p), p));
      case DROP_FOREIGN_KEY:
        return new DropForeignKey(
            text(node, "table", p), toForeignKey(required(node, "foreignKey", p), p));
      default:
        throw new IllegalStateException("Unhandled operation type " + type);
    }
  }

  private static TableSnapshot toTable(JsonNode node, JsonParser p) throws IOException {
    List<ColumnDefinition> columns = new ArrayList<>();
    for (JsonNode column : required(node, "columns", p)) {
      columns.add(toColumn(column, p));
    }
    List<IndexDefinition> indexes = new ArrayList<>();
    for (JsonNode index : optional(node, "indexes")) {
      indexes.add(toIndex(index, p));
    }
    List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();
    for (JsonNode foreignKey : optional(node, "foreignKeys")) {
      foreignKeys.add(toForeignKey(foreignKey, p));
    }
    return new TableSnapshot(text(node, "name", p), columns, indexes, foreignKeys);
  }

  private static ColumnDefinition toColumn(JsonNode node, JsonParser p) throws IOException {
    return ColumnDefinition.builder()
        .name(text(node, "name", p))
        .type(ColumnType.valueOf(text(node, "type", p)))
        .size(node.hasNonNull("size") ? node.get("size").asInt() : null)
        .scale(node.hasNonNull("scale") ? node.get("scale").asInt() : null)
        .nullable(node.path("nullable").asBoolean(true))
        .unique(node.path("unique").asBoolean())
        .primaryKey(node.path("primaryKey").asBoolean())
        .autoIncrement(node.path("autoIncrement").asBoolean())
        .foreignKey(node.path("foreignKey").asBoolean())
        .references(nullableText(node, "references"))
        .onDelete(onDelete(node))
        .defaultValue(nullableText(node, "defaultValue"))
        .enumValues(strings(optional(node, "enumValues")))
        .build();
  }

  private static IndexDefinition toIndex(JsonNode node, JsonParser p) throws IOException {
    return new IndexDefinition(
        text(node, "name", p),
        strings(required(node, "columns", p)),
        node.path("unique").asBoolean());
  }

  private static ForeignKeyDefinition toForeignKey(JsonNode node, JsonParser p)
      throws IOException {
    return ForeignKeyDefinition.builder()
        .name(text(node, "name", p))
        .column(text(node, "column", p))
        .referencedTable(text(node, "referencedTable", p))
        .referencedColumn(nullableText(node, "referencedColumn"))
        .onDelete(onDelete(node))
        .build();
  }

  private static ReferentialAction onDelete(JsonNode node) {
    String value = nullableText(node, "onDelete");
    return value == null ? null : ReferentialAction.parse(value);
  }

  static JsonNode required(JsonNode node, String field, JsonParser p) throws IOException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw JsonMappingException.from(p, "Missing required field '" + field + "'");
    }
    return value;
  }

  static JsonNode optional(JsonNode node, String field) {
    return node.path(field);
  }

  static String text(JsonNode node, String field, JsonParser p) throws IOException {
    return required(node, field, p).asText();
  }

  static String nullableText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  static List<String> strings(JsonNode array) {
    List<String> result = new ArrayList<>();
    array.forEach(value -> result.add(value.asText()));
    return result;
  }
}
