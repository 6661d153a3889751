package com.gruelbox.schemamigrator;

/** A checked {@link Exception} wrapped so that it can propagate as a runtime exception. */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
