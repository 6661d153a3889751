package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.sql.SQLException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;

@AllArgsConstructor(access = AccessLevel.PACKAGE)
final class SimpleTransaction implements Transaction {

  private final Connection connection;

  @Override
  public Connection connection() {
    return connection;
  }

  void commit() {
    Utils.uncheck(connection::commit);
  }

  void rollback() throws SQLException {
    connection.rollback();
  }
}
