package com.gruelbox.schemamigrator;

@FunctionalInterface
public interface TransactionalSupplier<T> {

  T doWork(Transaction transaction);
}
