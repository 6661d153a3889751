package com.gruelbox.schemamigrator.diff;

import com.gruelbox.schemamigrator.schema.ColumnDefinition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs columns which disappeared from a table with columns which appeared in it, where they look
 * like the same column under a new name. Only columns in the same type family are considered.
 *
 * <p>The score is half name similarity, plus 0.3 for a compatible type, plus 0.2 when nullability,
 * uniqueness and primary key membership all match. Pairs scoring at least {@link #THRESHOLD} are
 * matched greedily, best first, so each column appears in at most one candidate.
 */
final class RenameDetector {

  static final double THRESHOLD = 0.6;

  List<RenameCandidate> detect(
      String table, List<ColumnDefinition> removed, List<ColumnDefinition> added) {
    List<RenameCandidate> scored = new ArrayList<>();
    for (ColumnDefinition from : removed) {
      for (ColumnDefinition to : added) {
        if (!from.getType().isCompatibleWith(to.getType())) {
          continue;
        }
        double score = score(from, to);
        if (score >= THRESHOLD) {
          scored.add(new RenameCandidate(table, from, to, score));
        }
      }
    }
    scored.sort(Comparator.comparingDouble(RenameCandidate::getConfidence).reversed());
    Set<String> usedFrom = new HashSet<>();
    Set<String> usedTo = new HashSet<>();
    List<RenameCandidate> result = new ArrayList<>();
    for (RenameCandidate candidate : scored) {
      if (usedFrom.contains(candidate.getFrom().getName())
          || usedTo.contains(candidate.getTo().getName())) {
        continue;
      }
      usedFrom.add(candidate.getFrom().getName());
      usedTo.add(candidate.getTo().getName());
      result.add(candidate);
    }
    return result;
  }

  static double score(ColumnDefinition from, ColumnDefinition to) {
    double score = 0.5 * similarity(from.getName(), to.getName());
    if (from.getType().isCompatibleWith(to.getType())) {
      score += 0.3;
    }
    if (from.isNullable() == to.isNullable()
        && from.isUnique() == to.isUnique()
        && from.isPrimaryKey() == to.isPrimaryKey()) {
      score += 0.2;
    }
    return Math.round(score * 100) / 100.0;
  }

  /**
   * @return One minus the Levenshtein distance over the longer length. 1 for identical names.
   */
  static double similarity(String a, String b) {
    int longest = Math.max(a.length(), b.length());
    if (longest == 0) {
      return 1.0;
    }
    return 1.0 - ((double) levenshtein(a, b) / longest);
  }

  private static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
