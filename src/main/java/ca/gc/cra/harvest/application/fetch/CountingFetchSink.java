package ca.gc.cra.harvest.application.fetch;

import ca.gc.cra.harvest.application.port.FetchSink;
import ca.gc.cra.harvest.domain.fetch.TableProgress;
import ca.gc.cra.harvest.domain.table.Resource;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Sink decorator handed to one fetch unit; counts the records the unit emits.
 */
final class CountingFetchSink implements FetchSink {
  private final FetchSink delegate;
  private final LongAdder records = new LongAdder();

  CountingFetchSink(FetchSink delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public void record(Resource resource) throws InterruptedException {
    Objects.requireNonNull(resource, "resource");
    delegate.record(resource);
    records.increment();
  }

  @Override
  public void progress(TableProgress progress) {
    delegate.progress(progress);
  }

  long recordCount() {
    return records.sum();
  }
}
