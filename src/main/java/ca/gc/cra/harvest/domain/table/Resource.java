package ca.gc.cra.harvest.domain.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One record fetched for a table.
 * <p><strong>Role:</strong> Domain value emitted by resolvers to the fetch sink; relation resolvers receive
 * their parent record through {@link #parent()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; column values are copied on construction.</p>
 *
 * @param table owning table name
 * @param values column values in declaration order; {@code null} values are allowed
 * @param parent parent record for relation tables, {@code null} for root tables
 * @since 0.1.0
 */
public record Resource(String table, Map<String, Object> values, Resource parent) {

  public Resource {
    Objects.requireNonNull(table, "table");
    values = values == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Creates a root-level record.
   *
   * @param table owning table name
   * @param values column values
   * @return new record without a parent
   */
  public static Resource of(String table, Map<String, Object> values) {
    return new Resource(table, values, null);
  }

  /**
   * Returns the value of one column.
   *
   * @param column column name
   * @return value, empty when absent or {@code null}
   */
  public Optional<Object> get(String column) {
    return Optional.ofNullable(values.get(column));
  }

  /**
   * Returns the parent record.
   *
   * @return parent, empty for root-level records
   */
  public Optional<Resource> parentResource() {
    return Optional.ofNullable(parent);
  }
}
