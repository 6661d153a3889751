package com.gruelbox.schemamigrator;

import java.sql.Connection;
import java.util.Objects;
import javax.sql.DataSource;
import lombok.Builder;

/**
 * Borrows a connection from a {@link DataSource} for each transaction. With a pool, the pool must
 * be at least as large as the executor's parallelism, plus one for backups.
 */
final class DataSourceConnectionProvider implements ConnectionProvider {

  private final DataSource dataSource;

  @Builder
  private DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection obtainConnection() {
    return Utils.uncheckedly(dataSource::getConnection);
  }
}
