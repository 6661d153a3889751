package com.gruelbox.schemamigrator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

@Value
public class MigrationResult {

  /** Versions executed, in execution order. Empty for a dry run. */
  List<String> executed;

  /** For a dry run, the statements of each pending version, in version order. */
  Map<String, List<String>> previews;

  List<String> warnings;

  public MigrationResult(
      List<String> executed, Map<String, List<String>> previews, List<String> warnings) {
    this.executed = List.copyOf(executed);
    this.previews = Collections.unmodifiableMap(new LinkedHashMap<>(previews));
    this.warnings = List.copyOf(warnings);
  }
}
