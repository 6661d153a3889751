package com.gruelbox.schemamigrator.diff;

/**
 * The canonical execution order of schema operations. Objects are created before anything refers
 * to them and are only dropped once nothing still depends on them.
 */
public enum Phase {
  CREATE_TABLE,
  ADD_COLUMN,

  /** A foreign key dropped so it can be re-added under the same name with a new definition. */
  REPLACE_FOREIGN_KEY,

  /** An index dropped so it can be re-added under the same name with a new definition. */
  REPLACE_INDEX,

  MODIFY_COLUMN,
  ADD_INDEX,
  ADD_FOREIGN_KEY,
  DROP_FOREIGN_KEY,
  DROP_INDEX,
  DROP_COLUMN,
  DROP_TABLE
}
