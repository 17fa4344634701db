package ca.gc.cra.harvest.application.port;

import java.util.List;

/**
 * Fans one configured client out into several per-unit clients, for example one per account or region.
 *
 * <p>Returning an empty list is treated like having no multiplexer: the table runs once with the base
 * client.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Multiplexer {
  /**
   * Produces the clients a table is fetched with.
   *
   * @param client base client
   * @return per-unit clients; may be empty
   */
  List<ClientMeta> multiplex(ClientMeta client);
}
