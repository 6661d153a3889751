package com.gruelbox.schemamigrator;

/** Implemented by configuration and data objects which can check their own consistency. */
public interface Validatable {

  /**
   * Checks the object, throwing {@link IllegalArgumentException} on the first problem found.
   *
   * @param validator The validator to report problems through.
   */
  void validate(Validator validator);
}
