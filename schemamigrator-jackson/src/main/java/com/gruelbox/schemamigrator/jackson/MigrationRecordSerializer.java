package com.gruelbox.schemamigrator.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.MigrationStep;
import com.gruelbox.schemamigrator.SqlScript;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import java.io.IOException;
import java.util.List;
import java.util.TreeSet;

class MigrationRecordSerializer extends StdSerializer<MigrationRecord> {

  private final SchemaOperationSerializer operationSerializer = new SchemaOperationSerializer();

  MigrationRecordSerializer() {
    super(MigrationRecord.class);
  }

  @Override
  public void serializeWithType(
      MigrationRecord value,
      JsonGenerator gen,
      SerializerProvider serializers,
      TypeSerializer typeSer)
      throws IOException {
    serialize(value, gen, serializers);
  }

  @Override
  public void serialize(MigrationRecord value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    gen.writeStartObject();
    gen.writeStringField("version", value.getVersion());
    gen.writeStringField("name", value.getName());
    gen.writeBooleanField("destructive", value.isDestructive());
    gen.writeBooleanField("requiresBackup", value.isRequiresBackup());
    gen.writeBooleanField("autoRollbackOnError", value.isAutoRollbackOnError());
    gen.writeBooleanField("canRunInParallel", value.isCanRunInParallel());
    SchemaOperationSerializer.writeStrings("dependsOn", new TreeSet<>(value.getDependsOn()), gen);
    SchemaOperationSerializer.writeStrings(
        "conflictsWith", new TreeSet<>(value.getConflictsWith()), gen);
    SchemaOperationSerializer.writeStrings("up", statements(value, "up", value.getUp(), gen), gen);
    SchemaOperationSerializer.writeStrings(
        "down", statements(value, "down", value.getDown(), gen), gen);
    if (value.getOperations().isPresent()) {
      gen.writeArrayFieldStart("operations");
      for (SchemaOperation operation : value.getOperations().get()) {
        operationSerializer.serialize(operation, gen, provider);
      }
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }

  private static List<String> statements(
      MigrationRecord record, String field, MigrationStep step, JsonGenerator gen)
      throws JsonMappingException {
    if (!(step instanceof SqlScript)) {
      throw JsonMappingException.from(
          gen, "Migration " + record + " cannot be stored: " + field + " is not a SQL script");
    }
    return ((SqlScript) step).getStatements();
  }
}
