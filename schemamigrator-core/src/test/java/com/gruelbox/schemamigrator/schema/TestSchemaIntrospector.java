package com.gruelbox.schemamigrator.schema;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItems;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.schemamigrator.AbstractDatabaseTest;
import com.gruelbox.schemamigrator.Dialect;
import com.gruelbox.schemamigrator.Utils;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestSchemaIntrospector extends AbstractDatabaseTest {

  @BeforeEach
  void setUp() {
    execute(
        "CREATE TABLE customers (id BIGINT NOT NULL AUTO_INCREMENT, name VARCHAR(100) NOT NULL,"
            + " code VARCHAR(20), active BOOLEAN NOT NULL DEFAULT TRUE,"
            + " tier VARCHAR(10) DEFAULT 'basic', balance DECIMAL(10,2), PRIMARY KEY (id))",
        "CREATE UNIQUE INDEX uq_customers_code ON customers (code)",
        "CREATE INDEX idx_customers_name_tier ON customers (name, tier)",
        "CREATE TABLE orders (id BIGINT NOT NULL AUTO_INCREMENT, customer_id BIGINT,"
            + " PRIMARY KEY (id))",
        "CREATE INDEX fk_orders_customer_id ON orders (customer_id)",
        "ALTER TABLE orders ADD CONSTRAINT fk_orders_customer_id FOREIGN KEY (customer_id)"
            + " REFERENCES customers (id) ON DELETE CASCADE",
        "CREATE TABLE audit_log (id INT)");
  }

  private SchemaSnapshot read(Set<String> excluded) {
    return Utils.uncheckedly(
        () ->
            transactionManager.inTransactionReturnsThrows(
                tx ->
                    SchemaIntrospector.builder()
                        .dialect(Dialect.H2)
                        .excludedTables(excluded)
                        .build()
                        .introspect(tx.connection())));
  }

  @Test
  void columns() {
    TableSnapshot customers = read(Set.of()).requireTable("customers");

    ColumnDefinition id = customers.column("id").orElseThrow();
    assertEquals(ColumnType.BIGINT, id.getType());
    assertTrue(id.isPrimaryKey());
    assertTrue(id.isAutoIncrement());
    assertFalse(id.isNullable());

    ColumnDefinition name = customers.column("name").orElseThrow();
    assertEquals(ColumnType.VARCHAR, name.getType());
    assertEquals(100, name.getSize());
    assertFalse(name.isNullable());
    assertNull(name.getDefaultValue());

    assertEquals("true", customers.column("active").orElseThrow().getDefaultValue());
    assertEquals("basic", customers.column("tier").orElseThrow().getDefaultValue());

    ColumnDefinition balance = customers.column("balance").orElseThrow();
    assertEquals(ColumnType.DECIMAL, balance.getType());
    assertEquals(10, balance.getSize());
    assertEquals(2, balance.getScale());
    assertTrue(balance.isNullable());

    assertThat(customers.primaryKeyColumns(), contains("id"));
  }

  @Test
  void singleColumnUniqueIndexBecomesUniqueColumn() {
    TableSnapshot customers = read(Set.of()).requireTable("customers");

    assertTrue(customers.column("code").orElseThrow().isUnique());
    assertTrue(customers.index("uq_customers_code").isEmpty());
    IndexDefinition composite = customers.index("idx_customers_name_tier").orElseThrow();
    assertFalse(composite.isUnique());
    assertEquals(List.of("name", "tier"), composite.getColumns());
  }

  @Test
  void foreignKeys() {
    TableSnapshot orders = read(Set.of()).requireTable("orders");

    ForeignKeyDefinition foreignKey = orders.foreignKey("fk_orders_customer_id").orElseThrow();
    assertEquals("customer_id", foreignKey.getColumn());
    assertEquals("customers", foreignKey.getReferencedTable());
    assertEquals("id", foreignKey.getReferencedColumn());
    assertEquals(ReferentialAction.CASCADE, foreignKey.getOnDelete());
    assertTrue(orders.column("customer_id").orElseThrow().isForeignKey());
  }

  @Test
  void excludedTablesAreLeftOut() {
    assertThat(read(Set.of()).tableNames(), contains("audit_log", "customers", "orders"));
    assertThat(read(Set.of("AUDIT_LOG")).tableNames(), contains("customers", "orders"));

    List<String> all =
        Utils.uncheckedly(
            () ->
                transactionManager.inTransactionReturnsThrows(
                    tx ->
                        SchemaIntrospector.builder()
                            .dialect(Dialect.H2)
                            .excludedTables(Set.of("audit_log"))
                            .build()
                            .allTableNames(tx.connection())));
    assertThat(all, hasItems("audit_log", "customers", "orders"));
  }
}
