package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.util.Deque;
import java.util.LinkedList;
import java.util.Optional;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * A simple {@link TransactionManager} implementation suitable for applications with no existing
 * transaction management. Active transactions are tracked per thread.
 */
@Slf4j
final class SimpleTransactionManager implements TransactionManager {

  private final ThreadLocal<Deque<SimpleTransaction>> transactions =
      ThreadLocal.withInitial(LinkedList::new);

  private final ConnectionProvider connectionProvider;

  @Builder
  private SimpleTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = connectionProvider;
  }

  @Override
  public <T, E extends Exception> T inTransactionReturnsThrows(
      ThrowingTransactionalSupplier<T, E> work) throws E {
    return withTransaction(
        transaction -> processAndCommitOrRollback(work, (SimpleTransaction) transaction));
  }

  @Override
  public <T, E extends Exception> T requireTransactionReturns(
      ThrowingTransactionalSupplier<T, E> work) throws E, NoTransactionActiveException {
    return work.doWork(peekTransaction().orElseThrow(NoTransactionActiveException::new));
  }

  private <T, E extends Exception> T processAndCommitOrRollback(
      ThrowingTransactionalSupplier<T, E> work, SimpleTransaction transaction) throws E {
    try {
      log.debug("Processing work");
      T result = work.doWork(transaction);
      log.debug("Committing transaction");
      transaction.commit();
      return result;
    } catch (Exception e) {
      try {
        log.warn(
            "Exception in transactional block ({}{}). Rolling back. See later messages for detail",
            e.getClass().getSimpleName(),
            e.getMessage() == null ? "" : (" - " + e.getMessage()));
        transaction.rollback();
      } catch (Exception ex) {
        log.warn("Failed to roll back", ex);
      }
      throw e;
    }
  }

  private <T, E extends Exception> T withTransaction(
      ThrowingTransactionalSupplier<T, E> work) throws E {
    Connection connection = connectionProvider.obtainConnection();
    try {
      log.debug("Got connection {}", connection);
      boolean autoCommit = Utils.uncheckedly(connection::getAutoCommit);
      if (autoCommit) {
        log.debug("Setting auto-commit false");
        Utils.uncheck(() -> connection.setAutoCommit(false));
      }
      SimpleTransaction transaction = pushTransaction(new SimpleTransaction(connection));
      try {
        return work.doWork(transaction);
      } finally {
        popTransaction();
        if (autoCommit) {
          Utils.safelyRun("restoring auto-commit", () -> connection.setAutoCommit(true));
        }
      }
    } finally {
      Utils.safelyClose(connection);
    }
  }

  private SimpleTransaction pushTransaction(SimpleTransaction transaction) {
    transactions.get().push(transaction);
    return transaction;
  }

  private void popTransaction() {
    transactions.get().pop();
    if (transactions.get().isEmpty()) {
      transactions.remove();
    }
  }

  private Optional<SimpleTransaction> peekTransaction() {
    return Optional.ofNullable(transactions.get().peek());
  }
}
