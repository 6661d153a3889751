package com.gruelbox.schemamigrator;

import java.time.Instant;
import lombok.Value;

/** The outcome of the most recent execution of one migration version. */
@Value
public class LedgerEntry {

  String version;
  Instant executedAt;
  boolean success;

  /** Milliseconds spent executing, or null if unknown. */
  Long executionTime;
}
