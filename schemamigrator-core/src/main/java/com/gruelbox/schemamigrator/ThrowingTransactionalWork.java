package com.gruelbox.schemamigrator;

@FunctionalInterface
public interface ThrowingTransactionalWork<E extends Exception> {

  void doWork(Transaction transaction) throws E;
}
