package com.gruelbox.schemamigrator.schema;

import java.util.Arrays;
import java.util.List;
import lombok.Value;

/** A named, possibly unique, index over one or more columns. */
@Value
public class IndexDefinition {

  String name;
  List<String> columns;
  boolean unique;

  public IndexDefinition(String name, List<String> columns, boolean unique) {
    this.name = name;
    this.columns = List.copyOf(columns);
    this.unique = unique;
  }

  public static IndexDefinition of(String name, boolean unique, String... columns) {
    return new IndexDefinition(name, Arrays.asList(columns), unique);
  }

  public boolean covers(String column) {
    return columns.contains(column);
  }
}
