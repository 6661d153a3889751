package com.gruelbox.schemamigrator;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MigrateOptions {

  public static final MigrateOptions DEFAULT = MigrateOptions.builder().build();

  /** Skip pre-execution validation. */
  boolean force;

  /** Collect the statements each pending migration would run, without running anything. */
  boolean dryRun;
}
