package com.gruelbox.schemamigrator.diff;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.EntityDefinition;
import com.gruelbox.schemamigrator.schema.IndexDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class TestSchemaDiffer {

  private static final ColumnDefinition ID =
      ColumnDefinition.builder()
          .name("id")
          .type(ColumnType.BIGINT)
          .primaryKey(true)
          .autoIncrement(true)
          .build();

  private final SchemaDiffer differ = SchemaDiffer.builder().dialect(Dialect.H2).build();

  private static ColumnDefinition varchar(String name, int size, boolean nullable) {
    return ColumnDefinition.builder()
        .name(name)
        .type(ColumnType.VARCHAR)
        .size(size)
        .nullable(nullable)
        .build();
  }

  private static SchemaSnapshot users(ColumnDefinition... columns) {
    return SchemaSnapshot.of(
        TableSnapshot.of(
            "users",
            Stream.concat(Stream.of(ID), Arrays.stream(columns)).collect(Collectors.toList())));
  }

  private static List<Class<?>> types(SchemaDiff diff) {
    return diff.getOperations().stream().map(Object::getClass).collect(Collectors.toList());
  }

  @Test
  void addedColumn() {
    ColumnDefinition name = varchar("name", 100, true);
    ColumnDefinition email = varchar("email", 255, false);

    SchemaDiff diff = differ.diff(users(name, email), users(name));

    assertEquals(List.of(new AddColumn("users", email)), diff.getOperations());
    assertFalse(diff.isDestructive());
  }

  @Test
  void identicalSchemasProduceNothing() {
    ColumnDefinition name = varchar("name", 100, true);
    assertTrue(differ.diff(users(name), users(name)).isEmpty());
  }

  @Test
  void typesTheDatabaseReportsDifferentlyAreEquivalent() {
    ColumnDefinition declared =
        ColumnDefinition.builder().name("seen_at").type(ColumnType.DATETIME).build();
    ColumnDefinition reported =
        ColumnDefinition.builder().name("seen_at").type(ColumnType.TIMESTAMP).build();
    assertTrue(differ.diff(users(declared), users(reported)).isEmpty());
  }

  @Test
  void enumValuesOnlyComparedWhenBothSidesKnowThem() {
    ColumnDefinition declared =
        ColumnDefinition.builder()
            .name("status")
            .type(ColumnType.ENUM)
            .enumValues(List.of("active", "banned"))
            .build();
    ColumnDefinition reported =
        ColumnDefinition.builder().name("status").type(ColumnType.ENUM).build();
    ColumnDefinition changed = declared.toBuilder().enumValues(List.of("active")).build();

    assertTrue(differ.diff(users(declared), users(reported)).isEmpty());
    SchemaDiff diff = differ.diff(users(changed), users(declared));
    assertThat(types(diff), contains(ModifyColumn.class));
    assertTrue(diff.isDestructive());
  }

  @Test
  void newTablesAreCreatedBeforeTheirForeignKeys() {
    SchemaSnapshot desired =
        EntityDefinition.schema(
            EntityDefinition.table("users").id().column("name", ColumnType.VARCHAR),
            EntityDefinition.table("posts")
                .id()
                .relation("author_id", "users", ReferentialAction.CASCADE));

    SchemaDiff diff = differ.diff(desired, SchemaSnapshot.empty());

    assertThat(types(diff), contains(CreateTable.class, CreateTable.class, AddForeignKey.class));
    CreateTable posts = (CreateTable) diff.getOperations().get(0);
    assertThat(posts.getTable().getForeignKeys(), empty());
    AddForeignKey foreignKey = (AddForeignKey) diff.getOperations().get(2);
    assertEquals("fk_posts_author_id", foreignKey.getForeignKey().getName());
  }

  @Test
  void droppedTablesLoseTheirForeignKeysFirst() {
    SchemaSnapshot actual =
        EntityDefinition.schema(
            EntityDefinition.table("users").id(),
            EntityDefinition.table("posts")
                .id()
                .relation("author_id", "users", ReferentialAction.CASCADE));

    SchemaDiff diff = differ.diff(SchemaSnapshot.empty(), actual);

    assertThat(types(diff), contains(DropForeignKey.class, DropTable.class, DropTable.class));
    assertTrue(diff.isDestructive());
  }

  @Test
  void modifiedColumnCapturesBothDefinitions() {
    ColumnDefinition before = varchar("name", 100, true);
    ColumnDefinition after = varchar("name", 255, false);

    SchemaDiff diff = differ.diff(users(after), users(before));

    assertEquals(List.of(new ModifyColumn("users", before, after)), diff.getOperations());
    assertFalse(diff.isDestructive());
    assertTrue(differ.diff(users(before), users(after)).isDestructive());
  }

  @Test
  void similarColumnsBecomeRenameCandidates() {
    SchemaDiff diff =
        differ.diff(users(varchar("full_name", 255, true)), users(varchar("name", 255, true)));

    assertThat(types(diff), contains(RenameCandidate.class));
    RenameCandidate candidate = diff.renameCandidates().get(0);
    assertEquals("name", candidate.getFrom().getName());
    assertEquals("full_name", candidate.getTo().getName());
    assertEquals(0.72, candidate.getConfidence(), 0.001);
  }

  @Test
  void incompatibleColumnsAreDroppedAndAdded() {
    ColumnDefinition age = ColumnDefinition.builder().name("age").type(ColumnType.INT).build();
    ColumnDefinition email = varchar("email", 255, true);

    SchemaDiff diff = differ.diff(users(email), users(age));

    assertEquals(
        List.of(new AddColumn("users", email), new DropColumn("users", age)),
        diff.getOperations());
  }

  @Test
  void dissimilarNamesAreNotCandidates() {
    SchemaDiff diff =
        differ.diff(users(varchar("phone", 255, true)), users(varchar("email", 255, true)));
    assertThat(types(diff), contains(AddColumn.class, DropColumn.class));
  }

  @Test
  void renameDetectionCanBeDisabled() {
    SchemaDiffer plain = SchemaDiffer.builder().dialect(Dialect.H2).detectRenames(false).build();
    SchemaDiff diff =
        plain.diff(users(varchar("full_name", 255, true)), users(varchar("name", 255, true)));
    assertThat(types(diff), contains(AddColumn.class, DropColumn.class));
  }

  @Test
  void eachColumnIsUsedInOneCandidateAtMost() {
    SchemaDiff diff =
        differ.diff(
            users(varchar("first_name", 255, true), varchar("last_name", 255, true)),
            users(varchar("firstname", 255, true), varchar("lastname", 255, true)));

    List<RenameCandidate> candidates = diff.renameCandidates();
    assertEquals(2, candidates.size());
    assertEquals("firstname", candidates.get(0).getFrom().getName());
    assertEquals("first_name", candidates.get(0).getTo().getName());
    assertEquals("lastname", candidates.get(1).getFrom().getName());
    assertEquals("last_name", candidates.get(1).getTo().getName());
  }

  @Test
  void changedIndexIsDroppedBeforeItIsReAdded() {
    ColumnDefinition a = varchar("a", 10, true);
    ColumnDefinition b = varchar("b", 10, true);
    TableSnapshot before =
        new TableSnapshot(
            "users",
            List.of(ID, a, b),
            List.of(
                IndexDefinition.of("idx_ab", false, "a"),
                IndexDefinition.of("idx_old", false, "b")),
            List.of());
    TableSnapshot after =
        new TableSnapshot(
            "users",
            List.of(ID, a, b),
            List.of(IndexDefinition.of("idx_ab", false, "a", "b")),
            List.of());

    SchemaDiff diff = differ.diff(SchemaSnapshot.of(after), SchemaSnapshot.of(before));

    assertThat(types(diff), contains(DropIndex.class, AddIndex.class, DropIndex.class));
    assertEquals("idx_ab", ((DropIndex) diff.getOperations().get(0)).getIndex().getName());
    assertEquals("idx_old", ((DropIndex) diff.getOperations().get(2)).getIndex().getName());
  }

  @Test
  void diffAppliedToActualGivesDesired() {
    SchemaSnapshot desired =
        EntityDefinition.schema(
            EntityDefinition.table("users")
                .id()
                .column(varchar("email", 255, false))
                .index("idx_users_email", "email"),
            EntityDefinition.table("posts")
                .id()
                .relation("author_id", "users", ReferentialAction.CASCADE));
    SchemaSnapshot actual = EntityDefinition.schema(EntityDefinition.table("legacy").id());

    SchemaDiff diff = differ.diff(desired, actual);
    SchemaSnapshot result = diff.applyTo(actual);

    assertThat(differ.diff(desired, result).getOperations(), empty());
    assertTrue(result.table("legacy").isEmpty());
  }
}
