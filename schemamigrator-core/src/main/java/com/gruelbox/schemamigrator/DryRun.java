package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/** Previews the statements a migration would run, without changing anything. */
@FunctionalInterface
public interface DryRun {

  List<String> preview(Connection connection) throws SQLException;
}
