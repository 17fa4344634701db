/**
 * Plugin table model: the table forest, column descriptors and fetched records.
 * <p>Tables are owned by the plugin and immutable during a fetch. Each table owns its child relation
 * tables; resolution only flows from parent to child.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.domain.table;
