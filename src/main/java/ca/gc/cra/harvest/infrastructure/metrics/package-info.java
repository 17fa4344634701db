/**
 * Metrics adapters that bridge {@link ca.gc.cra.harvest.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe and cache instruments per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code fetch.*} namespace.</p>
 */
package ca.gc.cra.harvest.infrastructure.metrics;
