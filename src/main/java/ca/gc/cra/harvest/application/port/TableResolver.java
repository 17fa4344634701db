package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.fetch.FetchContext;
import ca.gc.cra.harvest.domain.table.Resource;

/**
 * <strong>What:</strong> Plugin-supplied unit of work that fetches records of one table.
 * <p><strong>Role:</strong> External collaborator invoked once per fetch unit by the scheduler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit every fetched record to {@code sink}.</li>
 *   <li>Observe {@link FetchContext#isCancelled()} at its own suspension points.</li>
 *   <li>Optionally resolve child relation tables itself, passing the parent record along.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Invoked concurrently for different clients of the same table.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TableResolver {
  /** Resolver that fetches nothing; used by tables that only group relations. */
  TableResolver NONE = (context, client, parent, sink) -> {};

  /**
   * Fetches records for one (table, client) pairing.
   *
   * @param context cancellation context of the unit
   * @param client configured client for this unit
   * @param parent parent record for relation tables, {@code null} at the root
   * @param sink destination for fetched records
   * @throws Exception when fetching fails; the scheduler classifies it into a diagnostic
   */
  void resolve(FetchContext context, ClientMeta client, Resource parent, FetchSink sink) throws Exception;
}
