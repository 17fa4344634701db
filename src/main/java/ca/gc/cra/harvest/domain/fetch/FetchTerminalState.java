package ca.gc.cra.harvest.domain.fetch;

/**
 * Terminal state of one fetch call.
 *
 * @since 0.1.0
 */
public enum FetchTerminalState {
  /** Every planned unit ran and none failed. */
  ALL_COMPLETE,
  /** A unit failed; its error was captured and every launched unit drained. */
  FIRST_ERROR,
  /** Cancellation stopped some units from launching; none of the launched units failed. */
  CANCELED_BEFORE_LAUNCH
}
