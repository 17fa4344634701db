package ca.gc.cra.harvest.domain.fetch;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Per-call fetch request: which tables to fetch and how hard to push.
 * <p><strong>Role:</strong> Validated input to {@code FetchScheduler#fetch}; one instance per call.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param tables selected root table names, or the single wildcard {@code "*"}
 * @param skipTables table names removed from the selection
 * @param maxConcurrency explicit concurrency budget; {@code 0} computes one from host resources
 * @param unitTimeout per-unit deadline; {@link Duration#ZERO} disables it
 * @since 0.1.0
 */
public record FetchSpec(
    List<String> tables, Set<String> skipTables, long maxConcurrency, Duration unitTimeout) {

  /** Selection token matching every root table. */
  public static final String WILDCARD = "*";

  public FetchSpec {
    tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    skipTables = skipTables == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(skipTables));
    unitTimeout = unitTimeout == null ? Duration.ZERO : unitTimeout;
    if (maxConcurrency < 0) {
      throw new FetchConfigurationException(
          "max_concurrency must not be negative (was " + maxConcurrency + ")");
    }
    if (unitTimeout.isNegative()) {
      throw new FetchConfigurationException("unit_timeout must not be negative (was " + unitTimeout + ")");
    }
  }

  /**
   * Selects every root table with a computed budget and no unit timeout.
   *
   * @return wildcard spec
   */
  public static FetchSpec all() {
    return new FetchSpec(List.of(WILDCARD), Set.of(), 0L, Duration.ZERO);
  }

  /**
   * Selects the given tables with a computed budget and no unit timeout.
   *
   * @param tables table names
   * @return spec for the named tables
   */
  public static FetchSpec of(String... tables) {
    return new FetchSpec(List.of(tables), Set.of(), 0L, Duration.ZERO);
  }

  /**
   * Returns a copy with a different skip list.
   *
   * @param skip table names to skip
   * @return new spec
   */
  public FetchSpec withSkipTables(Set<String> skip) {
    return new FetchSpec(tables, skip, maxConcurrency, unitTimeout);
  }

  /**
   * Returns a copy with an explicit concurrency budget.
   *
   * @param max budget override; {@code 0} computes one
   * @return new spec
   */
  public FetchSpec withMaxConcurrency(long max) {
    return new FetchSpec(tables, skipTables, max, unitTimeout);
  }

  /**
   * Returns a copy with a per-unit timeout.
   *
   * @param timeout unit deadline; {@link Duration#ZERO} disables it
   * @return new spec
   */
  public FetchSpec withUnitTimeout(Duration timeout) {
    return new FetchSpec(tables, skipTables, maxConcurrency, timeout);
  }
}
