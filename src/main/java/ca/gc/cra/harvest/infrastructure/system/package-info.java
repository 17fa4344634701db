/**
 * Host resource adapters.
 * <p><strong>Role:</strong> Infrastructure implementations of
 * {@link ca.gc.cra.harvest.application.port.SystemResourcesPort}.</p>
 * <p><strong>Failure model:</strong> Never throws; undeterminable values are empty.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.system;
