/**
 * Infrastructure adapters binding application ports to the operating system, OpenTelemetry and JSON output.
 * <p><strong>Role:</strong> Adapter layer implementing sink, metrics, executor and system-resource contracts.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees.</p>
 */
package ca.gc.cra.harvest.infrastructure;
