package com.gruelbox.schemamigrator.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleDeserializers;
import com.fasterxml.jackson.databind.module.SimpleSerializers;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.diff.SchemaOperation;

/**
 * Teaches an {@code ObjectMapper} to read and write {@link MigrationRecord}s and {@link
 * SchemaOperation}s. Only records whose steps are plain SQL can be written; the validation and
 * dry run hooks are not persisted.
 */
public class SchemaMigratorJacksonModule extends Module {

  @Override
  public String getModuleName() {
    return "SchemaMigratorJacksonModule";
  }

  @Override
  public Version version() {
    return Version.unknownVersion();
  }

  @Override
  public void setupModule(SetupContext setupContext) {
    SimpleSerializers serializers = new SimpleSerializers();
    serializers.addSerializer(MigrationRecord.class, new MigrationRecordSerializer());
    serializers.addSerializer(SchemaOperation.class, new SchemaOperationSerializer());
    setupContext.addSerializers(serializers);

    SimpleDeserializers deserializers = new SimpleDeserializers();
    deserializers.addDeserializer(MigrationRecord.class, new MigrationRecordDeserializer());
    deserializers.addDeserializer(SchemaOperation.class, new SchemaOperationDeserializer());
    setupContext.addDeserializers(deserializers);
  }
}
