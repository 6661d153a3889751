package com.gruelbox.schemamigrator.jackson;

import static com.gruelbox.schemamigrator.jackson.SchemaOperationDeserializer.required;
import static com.gruelbox.schemamigrator.jackson.SchemaOperationDeserializer.strings;
import static com.gruelbox.schemamigrator.jackson.SchemaOperationDeserializer.text;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.SqlScript;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Reads a stored record. Where operations were stored, the statements they render are used as the
 * dry run preview.
 */
class MigrationRecordDeserializer extends JsonDeserializer<MigrationRecord> {

  @Override
  public MigrationRecord deserialize(JsonParser p, DeserializationContext c) throws IOException {
    ObjectCodec oc = p.getCodec();
    JsonNode entry = oc.readTree(p);
    List<String> up = strings(required(entry, "up", p));
    MigrationRecord.MigrationRecordBuilder builder =
        MigrationRecord.builder()
            .version(text(entry, "version", p))
            .name(text(entry, "name", p))
            .destructive(entry.path("destructive").asBoolean())
            .autoRollbackOnError(entry.path("autoRollbackOnError").asBoolean(true))
            .canRunInParallel(entry.path("canRunInParallel").asBoolean())
            .dependsOn(new HashSet<>(strings(entry.path("dependsOn"))))
            .conflictsWith(new HashSet<>(strings(entry.path("conflictsWith"))))
            .up(new SqlScript(up))
            .down(new SqlScript(strings(required(entry, "down", p))));
    if (entry.hasNonNull("requiresBackup")) {
      builder.requiresBackup(entry.get("requiresBackup").asBoolean());
    }
    JsonNode operations = entry.get("operations");
    if (operations != null && !operations.isNull()) {
      List<SchemaOperation> result = new ArrayList<>();
      for (JsonNode operation : operations) {
        result.add(SchemaOperationDeserializer.toOperation(operation, p));
      }
      builder.operations(List.copyOf(result)).dryRun(connection -> up);
    }
    return builder.build();
  }
}
