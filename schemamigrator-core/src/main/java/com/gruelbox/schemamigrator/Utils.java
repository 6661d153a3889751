package com.gruelbox.schemamigrator;

import java.util.Arrays;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility methods used across the migrator. These are very firmly {@link NotApi}. Don't use them in
 * your code as they may be modified or removed without warning.
 */
@Slf4j
@NotApi
public class Utils {

  private Utils() {}

  @SuppressWarnings("UnusedReturnValue")
  public static boolean safelyRun(String gerund, ThrowingRunnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  public static void safelyClose(AutoCloseable... closeables) {
    safelyClose(Arrays.asList(closeables));
  }

  public static void safelyClose(Iterable<? extends AutoCloseable> closeables) {
    closeables.forEach(
        d -> {
          if (d == null) return;
          safelyRun("closing resource", d::close);
        });
  }

  public static void uncheck(ThrowingRunnable runnable) {
    try {
      runnable.run();
    } catch (Exception e) {
      uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckedly(Callable<T> runnable) {
    try {
      return runnable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }

  /**
   * Walks the cause chain of {@code e} looking for an exception of the given type.
   *
   * @param e The exception.
   * @param type The type sought.
   * @param <T> The type sought.
   * @return The first match, or null.
   */
  public static <T extends Throwable> T findCause(Throwable e, Class<T> type) {
    Throwable current = e;
    while (current != null) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      if (current.getCause() == current) {
        return null;
      }
      current = current.getCause();
    }
    return null;
  }
}
