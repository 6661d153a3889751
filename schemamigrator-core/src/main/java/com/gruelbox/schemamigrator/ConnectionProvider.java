package com.gruelbox.schemamigrator;

import java.sql.Connection;

/**
 * Source for JDBC connections to be provided to a {@link TransactionManager}. Migrations running
 * in parallel each obtain their own connection, so a pooled source is strongly recommended.
 */
@SuppressWarnings("WeakerAccess")
public interface ConnectionProvider {

  /**
   * Requests a new connection, or an available connection from a pool. The caller is responsible
   * for calling {@link Connection#close()}.
   *
   * @return The connection.
   */
  Connection obtainConnection();
}
