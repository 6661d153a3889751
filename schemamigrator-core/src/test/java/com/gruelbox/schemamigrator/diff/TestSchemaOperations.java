package com.gruelbox.schemamigrator.diff;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.schemamigrator.DiffAmbiguityException;
import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import com.gruelbox.schemamigrator.schema.ColumnType;
import com.gruelbox.schemamigrator.schema.EntityDefinition;
import com.gruelbox.schemamigrator.schema.ReferentialAction;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.gruelbox.schemamigrator.schema.TableSnapshot;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestSchemaOperations {

  private static final ColumnDefinition EMAIL =
      ColumnDefinition.builder()
          .name("email")
          .type(ColumnType.VARCHAR)
          .nullable(false)
          .unique(true)
          .build();

  @Test
  void createTableIncludesPrimaryKeyUniqueColumnsAndIndexes() {
    TableSnapshot users =
        EntityDefinition.table("users")
            .id()
            .column(EMAIL)
            .column(
                ColumnDefinition.builder()
                    .name("active")
                    .type(ColumnType.BOOLEAN)
                    .nullable(false)
                    .defaultValue("true")
                    .build())
            .column("name", ColumnType.VARCHAR)
            .index("idx_users_name", "name")
            .build();

    assertThat(
        new CreateTable(users).toSql(Dialect.H2),
        contains(
            "CREATE TABLE users (id BIGINT NOT NULL AUTO_INCREMENT, email VARCHAR(255) NOT NULL,"
                + " active BOOLEAN NOT NULL DEFAULT true, name VARCHAR(255), PRIMARY KEY (id))",
            "CREATE UNIQUE INDEX uq_users_email ON users (email)",
            "CREATE INDEX idx_users_name ON users (name)"));
  }

  @Test
  void foreignKeyOmitsRestrict() {
    TableSnapshot posts =
        EntityDefinition.table("posts")
            .id()
            .relation("author_id", "users", ReferentialAction.CASCADE)
            .relation("editor_id", "users", ReferentialAction.RESTRICT)
            .build();

    assertEquals(
        List.of(
            "ALTER TABLE posts ADD CONSTRAINT fk_posts_author_id FOREIGN KEY (author_id)"
                + " REFERENCES users (id) ON DELETE CASCADE"),
        new AddForeignKey("posts", posts.foreignKey("fk_posts_author_id").orElseThrow())
            .toSql(Dialect.H2));
    assertEquals(
        List.of(
            "ALTER TABLE posts ADD CONSTRAINT fk_posts_editor_id FOREIGN KEY (editor_id)"
                + " REFERENCES users (id)"),
        new AddForeignKey("posts", posts.foreignKey("fk_posts_editor_id").orElseThrow())
            .toSql(Dialect.H2));
  }

  @Test
  void uniqueColumnsCarryTheirIndex() {
    assertThat(
        new AddColumn("users", EMAIL).toSql(Dialect.MY_SQL_8),
        contains(
            "ALTER TABLE users ADD COLUMN email VARCHAR(255) NOT NULL",
            "CREATE UNIQUE INDEX uq_users_email ON users (email)"));
    assertThat(
        new DropColumn("users", EMAIL).toSql(Dialect.MY_SQL_8),
        contains(
            "ALTER TABLE users DROP INDEX uq_users_email", "ALTER TABLE users DROP COLUMN email"));
    assertThat(
        new RenameColumn("users", EMAIL, "mail").toSql(Dialect.H2),
        contains(
            "ALTER TABLE users RENAME COLUMN email TO mail",
            "ALTER INDEX uq_users_email RENAME TO uq_users_mail"));
  }

  @Test
  void modifyColumnPerDialect() {
    ColumnDefinition before =
        ColumnDefinition.builder().name("name").type(ColumnType.VARCHAR).size(100).build();
    ColumnDefinition after = before.toBuilder().size(200).nullable(false).build();

    assertThat(
        new ModifyColumn("users", before, after).toSql(Dialect.MY_SQL_8),
        contains("ALTER TABLE users MODIFY COLUMN name VARCHAR(200) NOT NULL"));
    assertThat(
        new ModifyColumn("users", after, before).toSql(Dialect.MY_SQL_8),
        contains("ALTER TABLE users MODIFY COLUMN name VARCHAR(100) NULL"));
    assertThat(
        new ModifyColumn("users", before, after).toSql(Dialect.H2),
        contains(
            "ALTER TABLE users ALTER COLUMN name SET DATA TYPE VARCHAR(200)",
            "ALTER TABLE users ALTER COLUMN name SET NOT NULL"));
  }

  @Test
  void lossyModifications() {
    ColumnDefinition bigint = ColumnDefinition.builder().name("n").type(ColumnType.BIGINT).build();
    ColumnDefinition integer = bigint.toBuilder().type(ColumnType.INT).build();
    ColumnDefinition text = bigint.toBuilder().type(ColumnType.TEXT).build();

    assertFalse(new ModifyColumn("t", integer, bigint).isDestructive());
    assertTrue(new ModifyColumn("t", bigint, integer).isDestructive());
    assertTrue(new ModifyColumn("t", integer, text).isDestructive());

    ColumnDefinition money =
        ColumnDefinition.builder().name("m").type(ColumnType.DECIMAL).size(10).scale(2).build();
    assertTrue(new ModifyColumn("t", money, money.toBuilder().scale(4).build()).isDestructive());
    assertFalse(
        new ModifyColumn("t", money, money.toBuilder().size(12).scale(4).build()).isDestructive());
    assertTrue(new ModifyColumn("t", money, money.toBuilder().scale(1).build()).isDestructive());
  }

  @Test
  void inversesAreExact() {
    TableSnapshot users = EntityDefinition.table("users").id().column(EMAIL).build();
    List<SchemaOperation> operations =
        List.of(
            new CreateTable(users),
            new AddColumn("users", EMAIL),
            new ModifyColumn("users", EMAIL, EMAIL.toBuilder().size(100).build()),
            new RenameColumn("users", EMAIL, "mail"));
    for (SchemaOperation operation : operations) {
      assertEquals(operation, operation.inverse().inverse());
    }
    assertEquals(new DropTable(users), new CreateTable(users).inverse());
    assertEquals(
        new RenameColumn("users", EMAIL.withName("mail"), "email"),
        new RenameColumn("users", EMAIL, "mail").inverse());
  }

  @Test
  void renameAppliesToSnapshot() {
    SchemaSnapshot schema =
        SchemaSnapshot.of(EntityDefinition.table("users").id().column(EMAIL).build());
    SchemaSnapshot renamed = new RenameColumn("users", EMAIL, "mail").applyTo(schema);
    assertTrue(renamed.requireTable("users").hasColumn("mail"));
    assertFalse(renamed.requireTable("users").hasColumn("email"));
  }

  @Test
  void candidatesCannotBeExecuted() {
    RenameCandidate candidate =
        new RenameCandidate("users", EMAIL, EMAIL.withName("mail"), 0.9);
    assertThrows(DiffAmbiguityException.class, () -> candidate.toSql(Dialect.H2));
    assertEquals("users.email -> users.mail (confidence 0.90)", candidate.describe());
    assertEquals(List.of(new RenameColumn("users", EMAIL, "mail")), candidate.confirm());
    assertEquals(
        List.of(new DropColumn("users", EMAIL), new AddColumn("users", EMAIL.withName("mail"))),
        candidate.deny());
  }
}
