package com.gruelbox.schemamigrator.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Prints rows as a bordered, left aligned table. */
final class TextTable {

  private final List<String> headers;
  private final List<List<String>> rows = new ArrayList<>();

  TextTable(String... headers) {
    this.headers = Arrays.asList(headers);
  }

  TextTable row(Object... values) {
    if (values.length != headers.size()) {
      throw new IllegalArgumentException(
          "Expected " + headers.size() + " values but got " + values.length);
    }
    List<String> row = new ArrayList<>();
    for (Object value : values) {
      row.add(value == null ? "" : value.toString());
    }
    rows.add(row);
    return this;
  }

  void print(PrintStream out) {
    int[] widths = new int[headers.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = headers.get(i).length();
      for (List<String> row : rows) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }
    String border = border(widths);
    out.println(border);
    out.println(line(headers, widths));
    out.println(border);
    for (List<String> row : rows) {
      out.println(line(row, widths));
    }
    out.println(border);
  }

  private static String border(int[] widths) {
    StringBuilder sb = new StringBuilder("+");
    for (int width : widths) {
      sb.append("-".repeat(width + 2)).append('+');
    }
    return sb.toString();
  }

  private static String line(List<String> values, int[] widths) {
    StringBuilder sb = new StringBuilder("|");
    for (int i = 0; i < widths.length; i++) {
      String value = values.get(i);
      sb.append(' ').append(value).append(" ".repeat(widths[i] - value.length() + 1)).append('|');
    }
    return sb.toString();
  }
}
