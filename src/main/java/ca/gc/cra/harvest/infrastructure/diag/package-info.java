/**
 * Diagnostic output adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.diag;
