package ca.gc.cra.harvest.domain.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a fetch call.
 *
 * @param state terminal state
 * @param budget concurrency budget the call ran with
 * @param unitsLaunched units that acquired a slot and ran
 * @param unitsSkipped planned units that never launched because of cancellation
 * @param totalRecords records emitted by all units
 * @param elapsed wall-clock duration of the call
 * @since 0.1.0
 */
public record FetchSummary(
    FetchTerminalState state,
    ConcurrencyBudget budget,
    int unitsLaunched,
    int unitsSkipped,
    long totalRecords,
    Duration elapsed) {

  public FetchSummary {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(budget, "budget");
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }
}
