/**
 * Executor construction for fetch units.
 * <p><strong>Concurrency:</strong> Pools are created per fetch call and shut down when the call returns.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.exec;
