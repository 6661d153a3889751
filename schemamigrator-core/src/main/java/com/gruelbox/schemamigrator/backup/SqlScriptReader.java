package com.gruelbox.schemamigrator.backup;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into statements on semicolons, ignoring semicolons inside string literals
 * and {@code --} line comments.
 */
final class SqlScriptReader {

  private final boolean backslashEscapes;

  SqlScriptReader(boolean backslashEscapes) {
    this.backslashEscapes = backslashEscapes;
  }

  List<String> split(String script) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inString = false;
    int i = 0;
    while (i < script.length()) {
      char c = script.charAt(i);
      if (inString) {
        current.append(c);
        if (backslashEscapes && c == '\\' && i + 1 < script.length()) {
          current.append(script.charAt(i + 1));
          i += 2;
          continue;
        }
        if (c == '\'') {
          if (i + 1 < script.length() && script.charAt(i + 1) == '\'') {
            current.append('\'');
            i += 2;
            continue;
          }
          inString = false;
        }
        i++;
        continue;
      }
      if (c == '-' && i + 1 < script.length() && script.charAt(i + 1) == '-') {
        int end = script.indexOf('\n', i);
        i = end < 0 ? script.length() : end + 1;
        continue;
      }
      if (c == ';') {
        add(statements, current);
        current.setLength(0);
      } else {
        if (c == '\'') {
          inString = true;
        }
        current.append(c);
      }
      i++;
    }
    add(statements, current);
    return statements;
  }

  private static void add(List<String> statements, StringBuilder statement) {
    String sql = statement.toString().trim();
    if (!sql.isEmpty()) {
      statements.add(sql);
    }
  }
}
