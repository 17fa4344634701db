/**
 * Source plugin definition: name, version, table forest and client configuration.
 * <p><strong>Role:</strong> Entry point plugin hosts call to run a fetch.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.plugin;
