package ca.gc.cra.harvest.application.table;

import ca.gc.cra.harvest.domain.fetch.FetchConfigurationException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.domain.table.Table;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Index of a plugin's table forest plus the selection rules applied before a fetch.
 * <p><strong>Why:</strong> An ambiguous selection or a table name used twice would make fetch output
 * impossible to attribute; both are rejected before any unit launches.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expand {@code ["*"]} to every root table in forest order.</li>
 *   <li>Reject {@code "*"} mixed with explicit names and names requested twice.</li>
 *   <li>Reject table names repeated anywhere in the forest, including nested relations.</li>
 *   <li>Remove skipped tables from the selection.</li>
 * </ul>
 * <p>Relation tables are never selectable directly. Explicit names that match no root table are left for
 * the scheduler to reject at launch.</p>
 * <p><strong>Thread-safety:</strong> Immutable; resolution is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class TableRegistry {
  private final List<Table> roots;
  private final Map<String, Table> rootsByName;

  /**
   * Indexes the root tables of a forest.
   *
   * @param forest root tables in declaration order
   */
  public TableRegistry(List<Table> forest) {
    this.roots = List.copyOf(Objects.requireNonNull(forest, "forest"));
    Map<String, Table> index = new LinkedHashMap<>();
    for (Table root : roots) {
      index.putIfAbsent(root.name(), root);
    }
    this.rootsByName = Collections.unmodifiableMap(index);
  }

  public List<Table> roots() {
    return roots;
  }

  /**
   * Looks up a root table.
   *
   * @param name table name
   * @return root table, empty when no root table has that name
   */
  public Optional<Table> root(String name) {
    return Optional.ofNullable(rootsByName.get(name));
  }

  /**
   * Resolves the selection of a fetch request.
   *
   * @param spec fetch request
   * @return ordered, conflict-free root table names to fetch
   * @throws FetchConfigurationException on ambiguous selection or duplicate table names
   */
  public Set<String> resolve(FetchSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return resolve(spec.tables(), spec.skipTables());
  }

  /**
   * Resolves a table selection against the forest.
   *
   * @param selection explicit root table names, or the single wildcard
   * @param skipTables names removed from the result
   * @return ordered, conflict-free root table names to fetch
   * @throws FetchConfigurationException on ambiguous selection or duplicate table names
   */
  public Set<String> resolve(List<String> selection, Collection<String> skipTables) {
    List<String> expanded = expand(Objects.requireNonNull(selection, "selection"));
    verifyUniqueNames();
    Set<String> skip = skipTables == null ? Set.of() : Set.copyOf(skipTables);
    Set<String> resolved = new LinkedHashSet<>();
    for (String name : expanded) {
      if (!skip.contains(name)) {
        resolved.add(name);
      }
    }
    return Collections.unmodifiableSet(resolved);
  }

  /**
   * Verifies that no table name appears twice anywhere in the forest.
   *
   * @throws FetchConfigurationException naming the duplicate and both owning root tables
   */
  public void verifyUniqueNames() {
    Map<String, String> owners = new HashMap<>();
    for (Table root : roots) {
      collect(root.name(), root, owners);
    }
  }

  private List<String> expand(List<String> selection) {
    if (selection.size() == 1 && FetchSpec.WILDCARD.equals(selection.get(0))) {
      List<String> all = new ArrayList<>(roots.size());
      for (Table root : roots) {
        all.add(root.name());
      }
      return all;
    }
    if (selection.contains(FetchSpec.WILDCARD)) {
      throw new FetchConfigurationException("invalid \"*\" table selection combined with explicit tables");
    }
    Set<String> seen = new LinkedHashSet<>();
    for (String name : selection) {
      if (!seen.add(name)) {
        throw new FetchConfigurationException("table " + name + " requested more than once");
      }
    }
    return List.copyOf(seen);
  }

  private static void collect(String owner, Table table, Map<String, String> owners) {
    String existing = owners.putIfAbsent(table.name(), owner);
    if (existing != null) {
      throw new FetchConfigurationException(
          "table name " + table.name() + " used more than once, duplicates are in "
              + existing + " and " + owner);
    }
    for (Table relation : table.relations()) {
      collect(owner, relation, owners);
    }
  }
}
