/**
 * Fetch sink adapters.
 * <p><strong>Concurrency:</strong> Both sinks accept concurrent writes from fetch unit threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.sink;
