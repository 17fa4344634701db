/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound error text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from fetch unit threads.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.logging;
