package com.gruelbox.schemamigrator;

import com.gruelbox.schemamigrator.diff.RenameCandidate;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Thrown when SQL is requested for a diff with rename candidates nobody has decided on. */
@Getter
public class DiffAmbiguityException extends MigrationException {

  private final List<RenameCandidate> undecided;

  public DiffAmbiguityException(List<RenameCandidate> undecided) {
    super(
        "Rename candidates require an explicit confirm or deny decision: "
            + undecided.stream().map(RenameCandidate::describe).collect(Collectors.joining(", ")));
    this.undecided = List.copyOf(undecided);
  }
}
