package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.fetch.TableProgress;
import ca.gc.cra.harvest.domain.table.Resource;

/**
 * <strong>What:</strong> Output port receiving fetched records and table progress.
 * <p><strong>Why:</strong> Decouples the scheduler from transport and destination concerns; hosts adapt it
 * to an RPC stream, a queue, or a storage writer.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent, unordered calls from many
 * fetch units.</p>
 * <p><strong>Back-pressure:</strong> {@link #record(Resource)} may block; the caller of a fetch must keep
 * draining a blocking sink until the fetch returns.</p>
 *
 * @since 0.1.0
 */
public interface FetchSink {
  /**
   * Accepts one fetched record.
   *
   * @param resource record; never {@code null}
   * @throws InterruptedException if interrupted while waiting for capacity
   */
  void record(Resource resource) throws InterruptedException;

  /**
   * Accepts a table progress record. Must not block.
   *
   * @param progress progress record; never {@code null}
   */
  void progress(TableProgress progress);
}
