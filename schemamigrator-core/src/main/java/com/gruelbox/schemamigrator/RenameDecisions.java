package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.diff.RenameCandidate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Answers, for each {@link RenameCandidate}, whether the columns really are the same column
 * renamed. Nothing is ever assumed: a candidate without an answer stops generation.
 */
@FunctionalInterface
public interface RenameDecisions {

  /**
   * @param candidate The candidate.
   * @return True to rename, false to drop and add, empty if undecided.
   */
  Optional<Boolean> decide(RenameCandidate candidate);

  static RenameDecisions none() {
    return candidate -> Optional.empty();
  }

  static RenameDecisions confirmAll() {
    return candidate -> Optional.of(true);
  }

  static RenameDecisions denyAll() {
    return candidate -> Optional.of(false);
  }

  static Explicit explicit() {
    return new Explicit();
  }

  /** Decisions keyed by table and the old and new column names. */
  final class Explicit implements RenameDecisions {

    private final Map<String, Boolean> decisions = new HashMap<>();

    private Explicit() {}

    public Explicit confirm(String table, String from, String to) {
      decisions.put(key(table, from, to), true);
      return this;
    }

    public Explicit deny(String table, String from, String to) {
      decisions.put(key(table, from, to), false);
      return this;
    }

    @Override
    public Optional<Boolean> decide(RenameCandidate candidate) {
      return Optional.ofNullable(
          decisions.get(
              key(
                  candidate.getTable(),
                  candidate.getFrom().getName(),
                  candidate.getTo().getName())));
    }

    private static String key(String table, String from, String to) {
      return table + "." + from + "->" + to;
    }
  }
}
