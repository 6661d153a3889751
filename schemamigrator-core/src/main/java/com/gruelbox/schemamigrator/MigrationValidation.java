package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.schema.SchemaSnapshot;

/**
 * A migration's own pre-flight check, run against the live schema immediately before the
 * migration executes.
 */
@FunctionalInterface
public interface MigrationValidation {

  ValidationResult validate(SchemaSnapshot schema);
}
