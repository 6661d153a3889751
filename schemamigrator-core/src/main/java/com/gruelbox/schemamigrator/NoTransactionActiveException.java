package com.gruelbox.schemamigrator;

/** Thrown when work must join the caller's transaction but the thread has none open. */
public final class NoTransactionActiveException extends RuntimeException {

  public NoTransactionActiveException() {
    super("No transaction is active on thread " + Thread.currentThread().getName());
  }
}
