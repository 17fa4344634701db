package ca.gc.cra.harvest.domain.fetch;

import ca.gc.cra.harvest.domain.diag.Diagnostic;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised by a fetch once every launched unit has settled, carrying the first unit failure.
 *
 * <p>Later failures of sibling units are logged and dropped, never merged into this exception.</p>
 *
 * @since 0.1.0
 */
public class FetchException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient FetchSummary summary;

  /**
   * Creates an exception for a fetch that failed.
   *
   * @param diagnostic first captured failure; becomes the cause
   * @param summary counters of the failed fetch; may be {@code null} when no unit ran
   */
  public FetchException(Diagnostic diagnostic, FetchSummary summary) {
    super("fetch failed: " + Objects.requireNonNull(diagnostic, "diagnostic").describe(), diagnostic);
    this.summary = summary;
  }

  /**
   * Returns the representative failure.
   *
   * @return first captured diagnostic
   */
  public Diagnostic diagnostic() {
    return (Diagnostic) getCause();
  }

  /**
   * Returns the counters of the failed fetch.
   *
   * @return summary, empty when the fetch failed before launching units
   */
  public Optional<FetchSummary> summary() {
    return Optional.ofNullable(summary);
  }
}
