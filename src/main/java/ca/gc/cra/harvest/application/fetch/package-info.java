/**
 * <strong>Purpose:</strong> Fetch scheduling: turns a table selection into budgeted, cancellable fetch units.
 * <p><strong>Concurrency:</strong> Each fetch call owns its worker pool, permit semaphore and completion
 * tracker; units run on {@code fetch-unit-*} threads and synchronise only through the tracker lock.
 * <p><strong>Failure model:</strong> Configuration errors are raised before launch; the first unit failure
 * cancels the fetch and is reported through {@link ca.gc.cra.harvest.domain.fetch.FetchException}.
 * <p><strong>Observability:</strong> Unit counters and latencies through
 * {@link ca.gc.cra.harvest.application.port.MetricsPort}; MDC keys {@code pipeline}, {@code table} and
 * {@code client}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.fetch;
