package ca.gc.cra.harvest.domain.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Progress record emitted to the fetch sink when a root table settles.
 *
 * @param tableName table that settled
 * @param completion snapshot of every selected table's completion flag at emission time
 * @param recordCountDelta records fetched for {@code tableName}
 * @param status whether the table settled before or after cancellation
 * @since 0.1.0
 */
public record TableProgress(
    String tableName, Map<String, Boolean> completion, long recordCountDelta, TableFetchStatus status) {

  public TableProgress {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(status, "status");
    completion = completion == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(completion));
  }

  /**
   * Counts the tables marked complete in the snapshot.
   *
   * @return number of finished tables
   */
  public long finishedTables() {
    return completion.values().stream().filter(Boolean::booleanValue).count();
  }
}
