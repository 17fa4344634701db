package ca.gc.cra.harvest.application.fetch;

import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.domain.table.Table;
import java.util.Objects;

/**
 * One (root table, client) pairing scheduled as an independent task.
 *
 * @param table root table to resolve
 * @param client client produced by the table's multiplexer, or the base client
 * @param clientIndex 1-based position of {@code client} in the multiplexed list
 * @param clientCount number of clients the table was multiplexed into
 * @since 0.1.0
 */
record FetchUnit(Table table, ClientMeta client, int clientIndex, int clientCount) {

  FetchUnit {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(client, "client");
  }

  String tableName() {
    return table.name();
  }

  String label() {
    return table.name() + "[" + clientIndex + "/" + clientCount + "]";
  }
}
