package ca.gc.cra.harvest.application.fetch;

import ca.gc.cra.harvest.domain.fetch.TableFetchStatus;
import ca.gc.cra.harvest.domain.fetch.TableProgress;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Tracks launched and finished units per root table and decides when a table has settled.
 *
 * <p>A table settles once launching for it is sealed and every launched unit has finished. Exactly one
 * {@link TableProgress} is produced per settled table; tables that never launched a unit produce none.
 * All counters live under a single lock; callers emit the returned progress outside of it.</p>
 */
final class TableCompletionTracker {
  private final Object lock = new Object();
  private final Map<String, Boolean> completion = new LinkedHashMap<>();
  private final Map<String, TableState> states = new HashMap<>();
  private final BooleanSupplier cancelled;

  TableCompletionTracker(Collection<String> tables, BooleanSupplier cancelled) {
    this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
    for (String table : tables) {
      completion.put(table, Boolean.FALSE);
      states.put(table, new TableState());
    }
  }

  /** Records that a unit of {@code table} is about to run. */
  void launched(String table) {
    synchronized (lock) {
      state(table).launched++;
    }
  }

  /**
   * Records a finished unit.
   *
   * @return progress to emit when this unit settled the table
   */
  Optional<TableProgress> finished(String table, long records) {
    synchronized (lock) {
      TableState state = state(table);
      state.finished++;
      state.records += records;
      return settleIfDone(table, state);
    }
  }

  /**
   * Marks that no further units of {@code table} will launch.
   *
   * @return progress to emit when every launched unit had already finished
   */
  Optional<TableProgress> seal(String table) {
    synchronized (lock) {
      TableState state = state(table);
      state.sealed = true;
      return settleIfDone(table, state);
    }
  }

  private Optional<TableProgress> settleIfDone(String table, TableState state) {
    if (state.emitted || !state.sealed || state.launched == 0 || state.finished < state.launched) {
      return Optional.empty();
    }
    state.emitted = true;
    completion.put(table, Boolean.TRUE);
    TableFetchStatus status =
        cancelled.getAsBoolean() ? TableFetchStatus.CANCELED : TableFetchStatus.COMPLETE;
    return Optional.of(new TableProgress(table, completion, state.records, status));
  }

  private TableState state(String table) {
    TableState state = states.get(table);
    if (state == null) {
      throw new IllegalArgumentException("Unknown table " + table);
    }
    return state;
  }

  private static final class TableState {
    int launched;
    int finished;
    long records;
    boolean sealed;
    boolean emitted;
  }
}
