package com.gruelbox.schemamigrator;

import java.time.Instant;
import lombok.Value;

@Value
public class MigrationStatus {

  public enum State {
    EXECUTED,
    PENDING,
    FAILED,

    /** Recorded in the ledger, but no longer known to the repository. */
    MISSING
  }

  String version;

  /** Null for {@link State#MISSING}. */
  String name;

  State state;

  /** Null for {@link State#PENDING}. */
  Instant executedAt;
}
