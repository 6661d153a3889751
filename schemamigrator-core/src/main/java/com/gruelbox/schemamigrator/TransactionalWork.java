package com.gruelbox.schemamigrator;

@FunctionalInterface
public interface TransactionalWork {

  void doWork(Transaction transaction);
}
