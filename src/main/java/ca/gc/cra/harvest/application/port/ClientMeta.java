package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Configured upstream client handed to resolvers.
 * <p><strong>Why:</strong> The SDK never looks inside a client; it only fans it out through a
 * {@link Multiplexer} and passes each instance to the table resolver.</p>
 * <p><strong>Role:</strong> Port implemented by plugin authors (for example one client per account and
 * region).</p>
 * <p><strong>Thread-safety:</strong> A client may be shared by several concurrent fetch units; implementations
 * must be safe for that.</p>
 *
 * @since 0.1.0
 */
public interface ClientMeta {
  /**
   * Short identifier used in logs and the {@code client} MDC key, such as {@code "account-1/us-east-1"}.
   *
   * @return client identifier; never {@code null}
   */
  default String id() {
    return getClass().getSimpleName();
  }
}
