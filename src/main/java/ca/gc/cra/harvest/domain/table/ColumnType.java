package ca.gc.cra.harvest.domain.table;

/**
 * Logical column types a plugin can declare. Opaque to the fetch scheduler.
 *
 * @since 0.1.0
 */
public enum ColumnType {
  BOOL,
  INT,
  BIGINT,
  FLOAT,
  STRING,
  TIMESTAMP,
  JSON,
  UUID,
  STRING_ARRAY
}
