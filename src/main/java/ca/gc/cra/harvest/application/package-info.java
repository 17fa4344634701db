/**
 * Application layer orchestration for source plugins.
 * <p><strong>Role:</strong> Hosts the fetch scheduler, budget calculator, table registry and the ports they depend on.</p>
 * <p><strong>Concurrency:</strong> The scheduler owns its worker pool; ports document caller responsibilities.</p>
 * <p><strong>Metrics:</strong> Emits {@code fetch.*} counters and latencies through {@code MetricsPort}.</p>
 */
package ca.gc.cra.harvest.application;
