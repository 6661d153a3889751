package com.gruelbox.schemamigrator;

import java.sql.Connection;

/** Access to the current transaction. */
public interface Transaction {

  /**
   * @return The connection for the transaction. Do not commit, roll back or close it; the {@link
   *     TransactionManager} owns its lifecycle.
   */
  Connection connection();
}
