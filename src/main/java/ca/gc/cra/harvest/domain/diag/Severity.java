package ca.gc.cra.harvest.domain.diag;

/**
 * Severity of a {@link Diagnostic}, ordered from least to most severe.
 *
 * <p>Declaration order is significant: {@link #compareTo(Enum)} is used to compute the aggregate
 * severity of a {@link Diagnostics} collection.</p>
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Diagnostic that was recorded but deliberately ignored by the SDK. */
  IGNORE,
  /** Problem that should be fixed but did not abort the fetch. */
  WARNING,
  /** Problem that was fatal to the fetch and must be fixed. */
  ERROR;

  /**
   * Returns the more severe of this severity and {@code other}.
   *
   * @param other severity to compare; {@code null} returns {@code this}
   * @return the maximum of the two severities
   */
  public Severity max(Severity other) {
    if (other == null) {
      return this;
    }
    return compareTo(other) >= 0 ? this : other;
  }
}
