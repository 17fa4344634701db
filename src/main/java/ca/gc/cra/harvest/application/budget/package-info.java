/**
 * Concurrency budget sizing for fetch execution.
 * <p><strong>Role:</strong> Application service consumed by the fetch scheduler and the {@code budget} CLI.
 * <p><strong>Failure model:</strong> Host limits that cannot be read fall back to computed defaults; only a
 * negative override is rejected.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.budget;
