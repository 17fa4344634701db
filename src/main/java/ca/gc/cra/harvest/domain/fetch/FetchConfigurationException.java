package ca.gc.cra.harvest.domain.fetch;

/**
 * Raised synchronously, before any fetch unit launches, when a fetch request or table forest is
 * inconsistent: ambiguous wildcard selection, duplicate table names, unknown tables or invalid limits.
 *
 * @since 0.1.0
 */
public class FetchConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public FetchConfigurationException(String message) {
    super(message);
  }

  public FetchConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
