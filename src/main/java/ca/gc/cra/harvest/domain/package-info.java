/**
 * Core domain model for fetch scheduling: tables, fetch specs, progress and diagnostics.
 * <p><strong>Role:</strong> Domain layer types with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@code FetchContext} is the shared cancellation handle.</p>
 */
package ca.gc.cra.harvest.domain;
