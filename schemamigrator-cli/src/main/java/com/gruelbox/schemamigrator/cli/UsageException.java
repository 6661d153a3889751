package com.gruelbox.schemamigrator.cli;

/** Thrown when the command line or configuration is wrong. Exits with code 2. */
class UsageException extends RuntimeException {

  UsageException(String message) {
    super(message);
  }
}
