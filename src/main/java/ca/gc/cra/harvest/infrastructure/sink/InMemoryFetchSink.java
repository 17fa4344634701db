package ca.gc.cra.harvest.infrastructure.sink;

import ca.gc.cra.harvest.application.port.FetchSink;
import ca.gc.cra.harvest.domain.fetch.TableProgress;
import ca.gc.cra.harvest.domain.table.Resource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Unbounded fetch sink that keeps everything in memory; intended for tests and small diagnostics runs.
 *
 * @since 0.1.0
 */
public final class InMemoryFetchSink implements FetchSink {
  private final List<Resource> records = new ArrayList<>();
  private final List<TableProgress> progress = new ArrayList<>();

  @Override
  public synchronized void record(Resource resource) {
    records.add(Objects.requireNonNull(resource, "resource"));
  }

  @Override
  public synchronized void progress(TableProgress value) {
    progress.add(Objects.requireNonNull(value, "progress"));
  }

  public synchronized List<Resource> records() {
    return List.copyOf(records);
  }

  public synchronized List<TableProgress> progress() {
    return List.copyOf(progress);
  }

  /**
   * Counts received records per table.
   *
   * @return record count keyed by table name
   */
  public synchronized Map<String, Long> countsByTable() {
    return records.stream().collect(Collectors.groupingBy(Resource::table, Collectors.counting()));
  }
}
