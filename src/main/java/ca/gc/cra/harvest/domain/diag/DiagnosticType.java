package ca.gc.cra.harvest.domain.diag;

/**
 * Classification family of a {@link Diagnostic}.
 *
 * @since 0.1.0
 */
public enum DiagnosticType {
  UNKNOWN("Unknown"),
  RESOLVING("Resolving"),
  ACCESS("Access"),
  THROTTLE("Throttle"),
  DATABASE("Database"),
  SCHEMA("Schema"),
  INTERNAL("Internal"),
  TELEMETRY("Telemetry");

  private final String label;

  DiagnosticType(String label) {
    this.label = label;
  }

  /**
   * Returns the human readable label used when rendering diagnostics.
   *
   * @return display label
   */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
