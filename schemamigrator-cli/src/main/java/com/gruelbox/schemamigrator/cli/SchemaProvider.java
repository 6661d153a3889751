package com.gruelbox.schemamigrator.cli;

import com.gruelbox.schemamigrator.schema.SchemaSnapshot;

/**
 * Supplies the schema the application wants, usually built with {@link
 * com.gruelbox.schemamigrator.schema.EntityDefinition}. {@code make:migration} diffs it against
 * the live database. Named in the configuration by its fully qualified class name and created
 * through its no-args constructor.
 */
public interface SchemaProvider {

  SchemaSnapshot desiredSchema();
}
