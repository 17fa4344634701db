package ca.gc.cra.harvest.infrastructure.sink;

import ca.gc.cra.harvest.application.port.FetchSink;
import ca.gc.cra.harvest.domain.fetch.TableProgress;
import ca.gc.cra.harvest.domain.table.Resource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Fetch sink backed by a bounded record queue that the host drains while a fetch runs.
 * <p><strong>Why:</strong> Applies back-pressure to resolvers when the consumer (an RPC stream, a database
 * writer) falls behind.</p>
 * <p><strong>Back-pressure:</strong> {@link #record(Resource)} blocks while the queue is full. Progress
 * records go to a separate unbounded queue and never block.</p>
 * <p><strong>Thread-safety:</strong> Many producers, any number of consumers.</p>
 *
 * @since 0.1.0
 */
public final class QueueFetchSink implements FetchSink {
  private final BlockingQueue<Resource> records;
  private final Queue<TableProgress> progress = new ConcurrentLinkedQueue<>();
  private final AtomicInteger highWaterMark = new AtomicInteger();

  /**
   * Creates a sink with the given record capacity.
   *
   * @param capacity maximum buffered records; must be positive
   */
  public QueueFetchSink(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.records = new ArrayBlockingQueue<>(capacity);
  }

  @Override
  public void record(Resource resource) throws InterruptedException {
    records.put(Objects.requireNonNull(resource, "resource"));
    highWaterMark.accumulateAndGet(records.size(), Math::max);
  }

  @Override
  public void progress(TableProgress value) {
    progress.offer(Objects.requireNonNull(value, "progress"));
  }

  /**
   * Waits for the next record.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return record, empty when none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<Resource> poll(long timeout, TimeUnit unit) throws InterruptedException {
    return Optional.ofNullable(records.poll(timeout, unit));
  }

  /**
   * Moves every buffered record into {@code target}.
   *
   * @param target destination collection
   * @return number of records moved
   */
  public int drainRecords(Collection<? super Resource> target) {
    return records.drainTo(target);
  }

  /**
   * Removes and returns every buffered progress record in arrival order.
   *
   * @return progress records
   */
  public List<TableProgress> drainProgress() {
    List<TableProgress> drained = new ArrayList<>();
    TableProgress next;
    while ((next = progress.poll()) != null) {
      drained.add(next);
    }
    return drained;
  }

  public int pendingRecords() {
    return records.size();
  }

  /**
   * Largest number of records buffered at once.
   *
   * @return queue high-water mark
   */
  public int highWaterMark() {
    return highWaterMark.get();
  }
}
