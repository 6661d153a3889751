package com.gruelbox.schemamigrator;

import java.util.List;
import lombok.Getter;

/** Thrown when pre-execution checks reject a migration. Nothing from it has been executed. */
@Getter
public class MigrationValidationException extends MigrationException {

  private final String version;
  private final List<String> errors;

  public MigrationValidationException(String version, List<String> errors) {
    super("Migration " + version + " failed validation: " + String.join("; ", errors));
    this.version = version;
    this.errors = List.copyOf(errors);
  }
}
