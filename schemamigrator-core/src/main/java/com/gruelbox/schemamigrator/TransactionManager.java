package com.gruelbox.schemamigrator;

import javax.sql.DataSource;

/**
 * Runs work in JDBC transactions. Every migration step, ledger write and rollback happens inside
 * one of these scopes, which always ends in either a commit or a rollback.
 *
 * <p>Transactions are bound to the calling thread. Starting a transaction while another is active
 * on the same thread opens a second, independent transaction on a new connection.
 */
public interface TransactionManager {

  /**
   * Creates a simple transaction manager which uses the specified {@link DataSource} to source
   * connections. A new connection is requested for each transaction.
   *
   * @param dataSource The data source.
   * @return The transaction manager.
   */
  static TransactionManager fromDataSource(DataSource dataSource) {
    return fromConnectionProvider(
        DataSourceConnectionProvider.builder().dataSource(dataSource).build());
  }

  /**
   * Creates a simple transaction manager which uses the specified {@link ConnectionProvider}.
   *
   * @param connectionProvider The connection provider.
   * @return The transaction manager.
   */
  static TransactionManager fromConnectionProvider(ConnectionProvider connectionProvider) {
    return SimpleTransactionManager.builder().connectionProvider(connectionProvider).build();
  }

  /**
   * Runs {@code work} in a new transaction, committing on success and rolling back on failure.
   *
   * @param work Code which must be called while the transaction is active.
   */
  default void inTransaction(TransactionalWork work) {
    inTransactionReturnsThrows(ThrowingTransactionalSupplier.fromWork(work));
  }

  /**
   * Runs {@code supplier} in a new transaction, committing on success and rolling back on failure.
   *
   * @param supplier Code which must be called while the transaction is active.
   * @param <T> The type returned.
   * @return The result of {@code supplier}.
   */
  default <T> T inTransactionReturns(TransactionalSupplier<T> supplier) {
    return inTransactionReturnsThrows(ThrowingTransactionalSupplier.fromSupplier(supplier));
  }

  /**
   * Runs {@code work} in a new transaction, committing on success and rolling back on failure.
   *
   * @param work Code which must be called while the transaction is active.
   * @param <E> The exception type.
   * @throws E If any exception is thrown by {@code work}.
   */
  default <E extends Exception> void inTransactionThrows(ThrowingTransactionalWork<E> work)
      throws E {
    inTransactionReturnsThrows(ThrowingTransactionalSupplier.fromWork(work));
  }

  /**
   * Runs {@code work} in a new transaction, committing on success and rolling back on failure.
   *
   * @param work Code which must be called while the transaction is active.
   * @param <T> The type returned.
   * @param <E> The exception type.
   * @return The result of {@code work}.
   * @throws E If any exception is thrown by {@code work}.
   */
  <T, E extends Exception> T inTransactionReturnsThrows(ThrowingTransactionalSupplier<T, E> work)
      throws E;

  /**
   * Runs {@code work} in the transaction already active on the current thread.
   *
   * @param work Code which must be called while the transaction is active.
   * @param <T> The type returned.
   * @param <E> The exception type.
   * @return The result of {@code work}.
   * @throws E If any exception is thrown by {@code work}.
   * @throws NoTransactionActiveException If no transaction is active.
   */
  <T, E extends Exception> T requireTransactionReturns(ThrowingTransactionalSupplier<T, E> work)
      throws E, NoTransactionActiveException;
}
