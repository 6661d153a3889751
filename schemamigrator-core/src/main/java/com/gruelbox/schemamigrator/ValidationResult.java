package com.gruelbox.schemamigrator;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/** Errors prevent a migration from running. Warnings are reported and ignored. */
@Value
public class ValidationResult {

  private static final ValidationResult OK = new ValidationResult(List.of(), List.of());

  List<String> errors;
  List<String> warnings;

  public ValidationResult(List<String> errors, List<String> warnings) {
    this.errors = List.copyOf(errors);
    this.warnings = List.copyOf(warnings);
  }

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult error(String message) {
    return new ValidationResult(List.of(message), List.of());
  }

  public static ValidationResult warning(String message) {
    return new ValidationResult(List.of(), List.of(message));
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public ValidationResult and(ValidationResult other) {
    List<String> allErrors = new ArrayList<>(errors);
    allErrors.addAll(other.errors);
    List<String> allWarnings = new ArrayList<>(warnings);
    allWarnings.addAll(other.warnings);
    return new ValidationResult(allErrors, allWarnings);
  }
}
