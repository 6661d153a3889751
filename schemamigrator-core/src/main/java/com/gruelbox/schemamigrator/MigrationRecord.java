package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.diff.SchemaOperation;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * One versioned, reversible schema change. Behaviour is carried as data: flags plus the {@link
 * MigrationStep}s and optional capabilities, so records can be generated, stored and loaded
 * without subclassing.
 */
@Value
@Builder(toBuilder = true)
public class MigrationRecord implements Validatable {

  static final Pattern VERSION_PATTERN = Pattern.compile("[A-Za-z0-9.-]+");

  /** Unique, lexically sortable identifier. Records execute in version order. */
  String version;

  String name;

  /** Whether running {@link #up} can discard data. */
  boolean destructive;

  /** Defaults to {@link #destructive}. */
  @Getter(AccessLevel.NONE)
  Boolean requiresBackup;

  /** Whether a failure should run {@link #down} and restore the backup taken for the run. */
  @Builder.Default boolean autoRollbackOnError = true;

  /** Versions which must have executed successfully first. */
  @Builder.Default Set<String> dependsOn = Set.of();

  /** Versions which may never be pending in the same run as this one. */
  @Builder.Default Set<String> conflictsWith = Set.of();

  /** Whether the record may execute concurrently with adjacent records which also allow it. */
  boolean canRunInParallel;

  MigrationStep up;
  MigrationStep down;

  @Getter(AccessLevel.NONE)
  DryRun dryRun;

  @Getter(AccessLevel.NONE)
  MigrationValidation validation;

  /**
   * The structured operations the record was generated from, if any. Required to squash the
   * record and to run the data checks of the {@link MigrationValidator}.
   */
  @Getter(AccessLevel.NONE)
  List<SchemaOperation> operations;

  public boolean isRequiresBackup() {
    return requiresBackup == null ? destructive : requiresBackup;
  }

  public Optional<DryRun> getDryRun() {
    return Optional.ofNullable(dryRun);
  }

  public Optional<MigrationValidation> getValidation() {
    return Optional.ofNullable(validation);
  }

  public Optional<List<SchemaOperation>> getOperations() {
    return Optional.ofNullable(operations);
  }

  @Override
  public void validate(Validator validator) {
    validator.matches("version", version, VERSION_PATTERN);
    validator.notBlank("name", name);
    validator.notNull("up", up);
    validator.notNull("down", down);
    validator.notNull("dependsOn", dependsOn);
    validator.notNull("conflictsWith", conflictsWith);
    validator.isTrue(
        "dependsOn", !dependsOn.contains(version), "may not contain the record's own version");
    validator.isTrue(
        "conflictsWith",
        !conflictsWith.contains(version),
        "may not contain the record's own version");
  }

  @Override
  public String toString() {
    return version + "_" + name;
  }
}
