package com.gruelbox.schemamigrator.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
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
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.io.IOException;

/**
 * Writes an operation as an object with a {@code type} field naming the operation. Unresolved
 * rename candidates cannot be written.
 */
class SchemaOperationSerializer extends StdSerializer<SchemaOperation> {

  SchemaOperationSerializer() {
    super(SchemaOperation.class);
  }

  @Override
  public void serializeWithType(
      SchemaOperation value,
      JsonGenerator gen,
      SerializerProvider serializers,
      TypeSerializer typeSer)
      throws IOException {
    serialize(value, gen, serializers);
  }

  @Override
  public void serialize(SchemaOperation value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    gen.writeStartObject();
    if (value instanceof CreateTable) {
      gen.writeStringField("type", OperationType.CREATE_TABLE.name());
      gen.writeFieldName("table");
      writeTable(((CreateTable) value).getTable(), gen);
    } else if (value instanceof DropTable) {
      gen.writeStringField("type", OperationType.DROP_TABLE.name());
      gen.writeFieldName("table");
      writeTable(((DropTable) value).getTable(), gen);
    } else if (value instanceof AddColumn) {
      AddColumn op = (AddColumn) value;
      gen.writeStringField("type", OperationType.ADD_COLUMN.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("column");
      writeColumn(op.getColumn(), gen);
    } else if (value instanceof DropColumn) {
      DropColumn op = (DropColumn) value;
      gen.writeStringField("type", OperationType.DROP_COLUMN.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("column");
      writeColumn(op.getColumn(), gen);
    } else if (value instanceof ModifyColumn) {
      ModifyColumn op = (ModifyColumn) value;
      gen.writeStringField("type", OperationType.MODIFY_COLUMN.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("from");
      writeColumn(op.getFrom(), gen);
      gen.writeFieldName("to");
      writeColumn(op.getTo(), gen);
    } else if (value instanceof RenameColumn) {
      RenameColumn op = (RenameColumn) value;
      gen.writeStringField("type", OperationType.RENAME_COLUMN.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("column");
      writeColumn(op.getColumn(), gen);
      gen.writeStringField("newName", op.getNewName());
    } else if (value instanceof AddIndex) {
      AddIndex op = (AddIndex) value;
      gen.writeStringField("type", OperationType.ADD_INDEX.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("index");
      writeIndex(op.getIndex(), gen);
    } else if (value instanceof DropIndex) {
      DropIndex op = (DropIndex) value;
      gen.writeStringField("type", OperationType.DROP_INDEX.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("index");
      writeIndex(op.getIndex(), gen);
    } else if (value instanceof AddForeignKey) {
      AddForeignKey op = (AddForeignKey) value;
      gen.writeStringField("type", OperationType.ADD_FOREIGN_KEY.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("foreignKey");
      writeForeignKey(op.getForeignKey(), gen);
    } else if (value instanceof DropForeignKey) {
      DropForeignKey op = (DropForeignKey) value;
      gen.writeStringField("type", OperationType.DROP_FOREIGN_KEY.name());
      gen.writeStringField("table", op.getTable());
      gen.writeFieldName("foreignKey");
      writeForeignKey(op.getForeignKey(), gen);
    } else {
      throw JsonMappingException.from(gen, "Cannot store operation: " + value.describe());
    }
    gen.writeEndObject();
  }

  private static void writeTable(TableSnapshot table, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", table.getName());
    gen.writeArrayFieldStart("columns");
    for (ColumnDefinition column : table.getColumns()) {
      writeColumn(column, gen);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("indexes");
    for (IndexDefinition index : table.getIndexes()) {
      writeIndex(index, gen);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("foreignKeys");
    for (ForeignKeyDefinition foreignKey : table.getForeignKeys()) {
      writeForeignKey(foreignKey, gen);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeColumn(ColumnDefinition column, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", column.getName());
    gen.writeStringField("type", column.getType().name());
    if (column.getSize() != null) {
      gen.writeNumberField("size", column.getSize());
    }
    if (column.getScale() != null) {
      gen.writeNumberField("scale", column.getScale());
    }
    gen.writeBooleanField("nullable", column.isNullable());
    gen.writeBooleanField("unique", column.isUnique());
    gen.writeBooleanField("primaryKey", column.isPrimaryKey());
    gen.writeBooleanField("autoIncrement", column.isAutoIncrement());
    gen.writeBooleanField("foreignKey", column.isForeignKey());
    if (column.getReferences() != null) {
      gen.writeStringField("references", column.getReferences());
    }
    if (column.getOnDelete() != null) {
      gen.writeStringField("onDelete", column.getOnDelete().name());
    }
    if (column.getDefaultValue() != null) {
      gen.writeStringField("defaultValue", column.getDefaultValue());
    }
    if (!column.getEnumValues().isEmpty()) {
      writeStrings("enumValues", column.getEnumValues(), gen);
    }
    gen.writeEndObject();
  }

  private static void writeIndex(IndexDefinition index, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", index.getName());
    writeStrings("columns", index.getColumns(), gen);
    gen.writeBooleanField("unique", index.isUnique());
    gen.writeEndObject();
  }

  private static void writeForeignKey(ForeignKeyDefinition foreignKey, JsonGenerator gen)
      throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", foreignKey.getName());
    gen.writeStringField("column", foreignKey.getColumn());
    gen.writeStringField("referencedTable", foreignKey.getReferencedTable());
    gen.writeStringField("referencedColumn", foreignKey.getReferencedColumn());
    gen.writeStringField("onDelete", foreignKey.getOnDelete().name());
    gen.writeEndObject();
  }

  static void writeStrings(String field, Iterable<String> values, JsonGenerator gen)
      throws IOException {
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  enum OperationType {
    CREATE_TABLE,
    DROP_TABLE,
    ADD_COLUMN,
    DROP_COLUMN,
    MODIFY_COLUMN,
    RENAME_COLUMN,
    ADD_INDEX,
    DROP_INDEX,
    ADD_FOREIGN_KEY,
    DROP_FOREIGN_KEY
  }
}
