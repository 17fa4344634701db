package ca.gc.cra.harvest.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and the CLI.
 * <p><strong>Why:</strong> Rejects out-of-range budgets and timeouts before a fetch allocates threads.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside the range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String value = Strings.requireNonBlank(name, raw);
    long parsed;
    try {
      parsed = Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be an integer (was " + value + ")", ex);
    }
    return requireRange(name, parsed, min, max);
  }
}
