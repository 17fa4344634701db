/**
 * Table forest indexing and selection validation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.table;
