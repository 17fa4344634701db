/**
 * Ports of the fetch engine: plugin-supplied capabilities (resolver, multiplexer, client), output sink,
 * metrics, host resources and error classification.
 * <p><strong>Concurrency:</strong> Every port may be called from several fetch unit threads at once unless
 * stated otherwise.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.port;
