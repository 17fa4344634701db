package ca.gc.cra.harvest.application.plugin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.application.budget.ConcurrencyBudgetCalculator;
import ca.gc.cra.harvest.application.fetch.FetchScheduler;
import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import ca.gc.cra.harvest.domain.fetch.FetchConfigurationException;
import ca.gc.cra.harvest.domain.fetch.FetchContext;
import ca.gc.cra.harvest.domain.fetch.FetchException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.domain.fetch.FetchSummary;
import ca.gc.cra.harvest.domain.fetch.FetchTerminalState;
import ca.gc.cra.harvest.domain.table.Resource;
import ca.gc.cra.harvest.domain.table.Table;
import ca.gc.cra.harvest.infrastructure.sink.InMemoryFetchSink;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class SourcePluginTest {
  private final FetchScheduler scheduler = new FetchScheduler(
      new ConcurrencyBudgetCalculator(new SystemResourcesPort() {
        @Override
        public OptionalLong totalMemoryBytes() {
          return OptionalLong.empty();
        }

        @Override
        public OptionalLong availableFileDescriptors() {
          return OptionalLong.empty();
        }
      }),
      MetricsPort.NO_OP);

  @Test
  void configuresClientAndFetchesWithIt() throws Exception {
    ClientMeta client = new AccountClient("acct-7");
    AtomicReference<Map<String, Object>> seenConfig = new AtomicReference<>();
    AtomicReference<ClientMeta> seenClient = new AtomicReference<>();
    Table users = Table.builder("users")
        .resolver((ctx, c, parent, sink) -> {
          seenClient.set(c);
          sink.record(Resource.of("users", Map.of("name", "alice")));
        })
        .build();
    SourcePlugin plugin = new SourcePlugin("directory", "1.2.0", List.of(users), config -> {
      seenConfig.set(config);
      return client;
    }, scheduler);
    InMemoryFetchSink sink = new InMemoryFetchSink();

    FetchSummary summary = plugin.fetch(FetchSpec.all(), Map.of("account", "acct-7"), sink,
        FetchContext.background());

    assertEquals(FetchTerminalState.ALL_COMPLETE, summary.state());
    assertEquals(Map.of("account", "acct-7"), seenConfig.get());
    assertSame(client, seenClient.get());
    assertEquals(1, sink.records().size());
  }

  @Test
  void nullConfigIsTreatedAsEmpty() throws Exception {
    AtomicReference<Map<String, Object>> seenConfig = new AtomicReference<>();
    SourcePlugin plugin = new SourcePlugin("directory", "1.2.0", List.of(Table.builder("users").build()),
        config -> {
          seenConfig.set(config);
          return new AccountClient("a");
        }, scheduler);

    plugin.fetch(FetchSpec.all(), null, new InMemoryFetchSink(), FetchContext.background());

    assertTrue(seenConfig.get().isEmpty());
  }

  @Test
  void configureFailureBecomesInternalDiagnostic() {
    SourcePlugin plugin = new SourcePlugin("directory", "1.2.0", List.of(Table.builder("users").build()),
        config -> {
          throw new IOException("missing credentials");
        }, scheduler);

    FetchException ex = assertThrows(FetchException.class,
        () -> plugin.fetch(FetchSpec.all(), Map.of(), new InMemoryFetchSink(), FetchContext.background()));

    assertEquals(DiagnosticType.INTERNAL, ex.diagnostic().type());
    assertEquals("failed to configure plugin directory", ex.diagnostic().summary());
    assertEquals("missing credentials", ex.diagnostic().getMessage());
    assertTrue(ex.summary().isEmpty());
  }

  @Test
  void nullClientRejected() {
    SourcePlugin plugin = new SourcePlugin("directory", "1.2.0", List.of(Table.builder("users").build()),
        config -> null, scheduler);

    FetchException ex = assertThrows(FetchException.class,
        () -> plugin.fetch(FetchSpec.all(), Map.of(), new InMemoryFetchSink(), FetchContext.background()));

    assertTrue(ex.diagnostic().summary().startsWith("failed to configure plugin directory"));
  }

  @Test
  void duplicateTableNamesRejectedAtConstruction() {
    Table first = Table.builder("org").relation(Table.builder("accounts").build()).build();
    Table second = Table.builder("billing").relation(Table.builder("accounts").build()).build();

    assertThrows(FetchConfigurationException.class,
        () -> new SourcePlugin("cloud", "0.1.0", List.of(first, second), config -> new AccountClient("a"),
            scheduler));
  }

  @Test
  void blankNameRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SourcePlugin(" ", "0.1.0", List.of(), config -> new AccountClient("a"), scheduler));
  }

  private static final class AccountClient implements ClientMeta {
    private final String account;

    AccountClient(String account) {
      this.account = account;
    }

    @Override
    public String id() {
      return account;
    }
  }
}
