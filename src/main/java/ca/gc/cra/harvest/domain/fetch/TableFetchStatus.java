package ca.gc.cra.harvest.domain.fetch;

/**
 * Outcome reported for a table once all of its fetch units have settled.
 *
 * @since 0.1.0
 */
public enum TableFetchStatus {
  /** Every unit finished while the fetch was live. */
  COMPLETE,
  /** The shared fetch context was already cancelled when the table settled. */
  CANCELED
}
