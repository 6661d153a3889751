package com.gruelbox.schemamigrator.jackson;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.MigrationGenerator;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.SqlScript;
import com.gruelbox.schemamigrator.diff.AddColumn;
import com.gruelbox.schemamigrator.diff.AddForeignKey;
import com.gruelbox.schemamigrator.diff.AddIndex;
import com.gruelbox.schemamigrator.diff.CreateTable;
import com.gruelbox.schemamigrator.diff.DropColumn;
import com.gruelbox.schemamigrator.diff.DropForeignKey;
import com.gruelbox.schemamigrator.diff.DropIndex;
import com.gruelbox.schemamigrator.diff.DropTable;
import com.gruelbox.schemamigrator.diff.ModifyColumn;
import com.gruelbox.schemamigrator.diff.RenameCandidate;
import com.gruelbox.schemamigrator.diff.RenameColumn;
import com.gruelbox.schemamigrator.diff.SchemaOperation;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.EntityDefinition;
import com.gruelbox.schemamigrator.schema.ForeignKeyDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TestMigrationRecordSerialization {

  private static final ColumnDefinition NAME =
      ColumnDefinition.builder().name("name").type(ColumnType.VARCHAR).size(100).build();
  private static final ColumnDefinition STATUS =
      ColumnDefinition.builder()
          .name("status")
          .type(ColumnType.ENUM)
          .enumValues(List.of("new", "paid"))
          .nullable(false)
          .defaultValue("new")
          .build();
  private static final ForeignKeyDefinition OWNER =
      ForeignKeyDefinition.builder()
          .name("fk_orders_owner_id")
          .column("owner_id")
          .referencedTable("users")
          .onDelete(ReferentialAction.SET_NULL)
          .build();

  private final ObjectMapper mapper = new ObjectMapper();

  {
    mapper.registerModule(new SchemaMigratorJacksonModule());
  }

  private static TableSnapshot orders() {
    return EntityDefinition.table("orders")
        .id()
        .column(
            ColumnDefinition.builder()
                .name("total")
                .type(ColumnType.DECIMAL)
                .size(12)
                .scale(2)
                .nullable(false)
                .build())
        .column(STATUS)
        .relation("owner_id", "users", ReferentialAction.CASCADE)
        .index("idx_orders_total", "total")
        .build();
  }

  private static MigrationRecord everyOperation() {
    List<SchemaOperation> operations =
        List.of(
            new CreateTable(orders()),
            new AddColumn("users", NAME),
            new ModifyColumn("users", NAME, NAME.toBuilder().size(200).build()),
            new RenameColumn("users", NAME.toBuilder().size(200).build(), "full_name"),
            new AddIndex("users", IndexDefinition.of("idx_users_a_b", true, "a", "b")),
            new DropIndex("users", IndexDefinition.of("idx_users_c", false, "c")),
            new DropForeignKey("orders", OWNER),
            new AddForeignKey("orders", OWNER),
            new DropColumn("users", STATUS),
            new DropTable(TableSnapshot.of("legacy", List.of(NAME))));
    return MigrationGenerator.builder()
        .dialect(Dialect.MY_SQL_8)
        .build()
        .fromOperations("20261018123456789", "everything", operations)
        .toBuilder()
        .dependsOn(Set.of("20261001000000000"))
        .conflictsWith(Set.of("20261002000000000", "20261003000000000"))
        .canRunInParallel(true)
        .autoRollbackOnError(false)
        .build();
  }

  @Test
  void recordSurvivesStorage() throws Exception {
    MigrationRecord record = everyOperation();

    MigrationRecord read =
        mapper.readValue(mapper.writeValueAsString(record), MigrationRecord.class);

    assertEquals(record.getVersion(), read.getVersion());
    assertEquals(record.getName(), read.getName());
    assertTrue(read.isDestructive());
    assertTrue(read.isRequiresBackup());
    assertFalse(read.isAutoRollbackOnError());
    assertTrue(read.isCanRunInParallel());
    assertEquals(record.getDependsOn(), read.getDependsOn());
    assertEquals(record.getConflictsWith(), read.getConflictsWith());
    assertEquals(record.getUp(), read.getUp());
    assertEquals(record.getDown(), read.getDown());
    assertEquals(record.getOperations(), read.getOperations());
    assertEquals(
        ((SqlScript) record.getUp()).getStatements(),
        read.getDryRun().orElseThrow().preview(null));
  }

  @Test
  void layoutIsReadable() throws Exception {
    JsonNode tree = mapper.readTree(mapper.writeValueAsString(everyOperation()));

    assertEquals("20261018123456789", tree.get("version").asText());
    assertEquals("CREATE_TABLE", tree.get("operations").get(0).get("type").asText());
    assertEquals("orders", tree.get("operations").get(0).get("table").get("name").asText());
    assertEquals(
        "SET_NULL", tree.get("operations").get(6).get("foreignKey").get("onDelete").asText());
    assertTrue(tree.get("up").isArray());
  }

  @Test
  void handWrittenSqlRecord() throws Exception {
    String json =
        "{\"version\":\"001\",\"name\":\"seed\",\"destructive\":true,"
            + "\"up\":[\"INSERT INTO t VALUES (1)\"],\"down\":[\"DELETE FROM t\"]}";

    MigrationRecord read = mapper.readValue(json, MigrationRecord.class);

    assertEquals("001", read.getVersion());
    assertEquals(SqlScript.of("INSERT INTO t VALUES (1)"), read.getUp());
    assertTrue(read.isRequiresBackup());
    assertTrue(read.isAutoRollbackOnError());
    assertTrue(read.getDependsOn().isEmpty());
    assertFalse(read.getOperations().isPresent());
    assertFalse(read.getDryRun().isPresent());
  }

  @Test
  void explicitBackupFlagWins() throws Exception {
    String json =
        "{\"version\":\"001\",\"name\":\"seed\",\"destructive\":true,\"requiresBackup\":false,"
            + "\"up\":[],\"down\":[]}";
    assertFalse(mapper.readValue(json, MigrationRecord.class).isRequiresBackup());
  }

  @Test
  void missingFieldsRejected() {
    JsonMappingException e =
        assertThrows(
            JsonMappingException.class,
            () ->
                mapper.readValue(
                    "{\"version\":\"001\",\"name\":\"x\",\"up\":[]}", MigrationRecord.class));
    assertThat(e.getMessage(), containsString("down"));
  }

  @Test
  void unknownOperationRejected() {
    String json =
        "{\"version\":\"001\",\"name\":\"x\",\"up\":[],\"down\":[],"
            + "\"operations\":[{\"type\":\"TRUNCATE\"}]}";
    assertThrows(JsonMappingException.class, () -> mapper.readValue(json, MigrationRecord.class));
  }

  @Test
  void customCodeCannotBeStored() {
    MigrationRecord record =
        MigrationRecord.builder()
            .version("001")
            .name("custom")
            .up(connection -> {})
            .down(SqlScript.of())
            .build();
    assertThrows(JsonMappingException.class, () -> mapper.writeValueAsString(record));
  }

  @Test
  void undecidedRenameCannotBeStored() {
    RenameCandidate candidate =
        new RenameCandidate("users", NAME, NAME.withName("full_name"), 0.8);
    assertThrows(JsonMappingException.class, () -> mapper.writeValueAsString(candidate));
  }
}
