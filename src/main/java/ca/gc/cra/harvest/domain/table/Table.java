package ca.gc.cra.harvest.domain.table;

import ca.gc.cra.harvest.application.port.Multiplexer;
import ca.gc.cra.harvest.application.port.TableResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A named, resolvable data type declared by a plugin.
 * <p><strong>Why:</strong> The fetch engine schedules root tables; relation tables hang under their parent
 * and are resolved by the parent's resolver in the context of a parent record.</p>
 * <p><strong>Invariants:</strong> Names are unique across the whole table forest; that is checked by
 * {@code TableRegistry}, not here.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class Table {
  private final String name;
  private final String description;
  private final TableResolver resolver;
  private final Multiplexer multiplexer;
  private final List<Table> relations;
  private final List<Column> columns;

  private Table(Builder builder) {
    this.name = builder.name;
    this.description = builder.description;
    this.resolver = builder.resolver;
    this.multiplexer = builder.multiplexer;
    this.relations = List.copyOf(builder.relations);
    this.columns = List.copyOf(builder.columns);
  }

  /**
   * Starts building a table.
   *
   * @param name table name; must not be blank
   * @return builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public TableResolver resolver() {
    return resolver;
  }

  /**
   * Returns the multiplex capability.
   *
   * @return multiplexer, empty when the table runs once with the base client
   */
  public Optional<Multiplexer> multiplexer() {
    return Optional.ofNullable(multiplexer);
  }

  /**
   * Returns the child relation tables in declaration order.
   *
   * @return immutable list of relations
   */
  public List<Table> relations() {
    return relations;
  }

  public List<Column> columns() {
    return columns;
  }

  @Override
  public String toString() {
    return "Table[" + name + ", relations=" + relations.size() + "]";
  }

  /** Builder for {@link Table}. */
  public static final class Builder {
    private final String name;
    private String description = "";
    private TableResolver resolver = TableResolver.NONE;
    private Multiplexer multiplexer;
    private final List<Table> relations = new ArrayList<>();
    private final List<Column> columns = new ArrayList<>();

    private Builder(String name) {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("table name must not be blank");
      }
      this.name = name;
    }

    public Builder description(String description) {
      this.description = description == null ? "" : description;
      return this;
    }

    public Builder resolver(TableResolver resolver) {
      this.resolver = Objects.requireNonNull(resolver, "resolver");
      return this;
    }

    public Builder multiplexer(Multiplexer multiplexer) {
      this.multiplexer = multiplexer;
      return this;
    }

    public Builder relation(Table relation) {
      relations.add(Objects.requireNonNull(relation, "relation"));
      return this;
    }

    public Builder column(String columnName, ColumnType type) {
      columns.add(new Column(columnName, type));
      return this;
    }

    public Table build() {
      return new Table(this);
    }
  }
}
