/**
 * <strong>Purpose:</strong> {@code harvest} command-line tools for operators of source plugins.
 * <p><strong>Failure model:</strong> Commands never throw; outcomes map to {@link ca.gc.cra.harvest.api.ExitCode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.api;
