/**
 * Structured diagnostics raised while fetching tables.
 * <p><strong>Role:</strong> Domain values shared by resolvers, the fetch scheduler and plugin hosts.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.harvest.domain.diag.Diagnostic} is immutable;
 * {@link ca.gc.cra.harvest.domain.diag.Diagnostics} is a single-threaded collection.
 * <p><strong>Observability:</strong> Rendering helpers produce the one-line form used in logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.domain.diag;
