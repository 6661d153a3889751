package com.gruelbox.schemamigrator;

/** A runnable... that throws. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
