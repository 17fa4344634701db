package ca.gc.cra.harvest.domain.fetch;

/**
 * Maximum number of fetch units allowed to run at the same time.
 *
 * @param slots permits available to fetch units; always at least one
 * @param source what the budget was derived from
 * @since 0.1.0
 */
public record ConcurrencyBudget(int slots, Source source) {

  /** Origin of a budget value. */
  public enum Source {
    /** Explicit value from the fetch request. */
    OVERRIDE,
    /** Derived from total system memory. */
    MEMORY,
    /** Reduced to a share of the available file descriptors. */
    FILE_DESCRIPTORS
  }

  public ConcurrencyBudget {
    if (slots < 1) {
      throw new IllegalArgumentException("slots must be positive (was " + slots + ")");
    }
    if (source == null) {
      throw new IllegalArgumentException("source must not be null");
    }
  }
}
