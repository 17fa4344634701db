/**
 * Fetch request, budget, progress and result values plus the cooperative cancellation context.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.domain.fetch;
