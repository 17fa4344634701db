/**
 * <strong>Purpose:</strong> Fetch spec loading and composition of the fetch engine.
 * <p><strong>Failure model:</strong> Invalid documents raise {@link IllegalArgumentException} naming the
 * offending key; missing files are reported as empty results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.config;
