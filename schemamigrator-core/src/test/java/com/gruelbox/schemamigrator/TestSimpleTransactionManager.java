package com.gruelbox.schemamigrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestSimpleTransactionManager extends AbstractDatabaseTest {

  private static final String INSERT = "INSERT INTO items (id) VALUES ";

  @BeforeEach
  void createTable() {
    execute("CREATE TABLE items (id INT PRIMARY KEY)");
  }

  @Test
  void commitsOnSuccess() {
    transactionManager.inTransaction(tx -> insert(tx, 1));
    assertEquals(1, count("SELECT COUNT(*) FROM items"));
  }

  @Test
  void rollsBackAndRethrowsOnFailure() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                transactionManager.inTransaction(
                    tx -> {
                      insert(tx, 1);
                      throw new IllegalStateException("boom");
                    }));
    assertEquals("boom", e.getMessage());
    assertEquals(0, count("SELECT COUNT(*) FROM items"));
  }

  @Test
  void checkedExceptionsPropagateUnwrapped() {
    assertThrows(
        SQLException.class,
        () ->
            transactionManager.inTransactionThrows(
                tx -> SqlScript.of(INSERT + "(1)", INSERT + "(1)").apply(tx.connection())));
    assertEquals(0, count("SELECT COUNT(*) FROM items"));
  }

  @Test
  void nestedTransactionIsIndependent() {
    assertThrows(
        IllegalStateException.class,
        () ->
            transactionManager.inTransaction(
                outer -> {
                  insert(outer, 1);
                  transactionManager.inTransaction(
                      inner -> {
                        assertNotSame(outer.connection(), inner.connection());
                        insert(inner, 2);
                      });
                  throw new IllegalStateException("outer fails");
                }));
    assertEquals(1, count("SELECT COUNT(*) FROM items WHERE id = 2"));
    assertEquals(0, count("SELECT COUNT(*) FROM items WHERE id = 1"));
  }

  @Test
  void requireTransactionJoinsTheCurrentOne() {
    AtomicReference<Connection> joined = new AtomicReference<>();
    transactionManager.inTransaction(
        tx -> {
          Connection connection =
              transactionManager.requireTransactionReturns(inner -> inner.connection());
          joined.set(connection);
          assertSame(tx.connection(), connection);
        });
    assertTrue(joined.get() != null);
    assertThrows(
        NoTransactionActiveException.class,
        () -> transactionManager.requireTransactionReturns(Transaction::connection));
  }

  private static void insert(Transaction tx, int id) {
    Utils.uncheck(() -> SqlScript.of(INSERT + "(" + id + ")").apply(tx.connection()));
  }
}
