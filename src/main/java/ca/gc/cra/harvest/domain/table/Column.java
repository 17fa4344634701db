package ca.gc.cra.harvest.domain.table;

import java.util.Objects;

/**
 * Column descriptor declared by a plugin table.
 *
 * @param name column name; never blank
 * @param type logical type
 * @since 0.1.0
 */
public record Column(String name, ColumnType type) {
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("column name must not be blank");
    }
  }
}
