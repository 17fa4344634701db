package ca.gc.cra.harvest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.harvest.application.plugin.SourcePlugin;
import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ca.gc.cra.harvest.domain.diag.Diagnostic;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import ca.gc.cra.harvest.domain.diag.Severity;
import ca.gc.cra.harvest.domain.fetch.ConcurrencyBudget;
import ca.gc.cra.harvest.domain.fetch.FetchContext;
import ca.gc.cra.harvest.domain.fetch.FetchException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.domain.table.Table;
import ca.gc.cra.harvest.infrastructure.sink.InMemoryFetchSink;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private final SystemResourcesPort resources = new SystemResourcesPort() {
    @Override
    public OptionalLong totalMemoryBytes() {
      return OptionalLong.empty();
    }

    @Override
    public OptionalLong availableFileDescriptors() {
      return OptionalLong.of(100L);
    }
  };

  @Test
  void budgetCalculatorUsesInjectedResources() {
    CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP, resources);

    ConcurrencyBudget budget = root.budgetCalculator().calculate(0L);

    assertEquals(30, budget.slots());
    assertEquals(ConcurrencyBudget.Source.FILE_DESCRIPTORS, budget.source());
    assertSame(MetricsPort.NO_OP, root.metrics());
  }

  @Test
  void extraClassifiersRunBeforeDescriptorClassifier() {
    CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP, resources);
    Table table = Table.builder("rows")
        .resolver((ctx, client, parent, sink) -> {
          throw new IOException("too many open files");
        })
        .build();
    SourcePlugin plugin = new SourcePlugin("db", "1.0.0", List.of(table), config -> new ClientMeta() {},
        root.fetchScheduler(List.of((name, client, error) -> Optional.of(
            Diagnostic.of(Severity.ERROR, DiagnosticType.DATABASE, name, "connection pool exhausted")))));

    FetchException ex = assertThrows(FetchException.class,
        () -> plugin.fetch(FetchSpec.all(), Map.of(), new InMemoryFetchSink(), FetchContext.background()));

    assertEquals(DiagnosticType.DATABASE, ex.diagnostic().type());
  }

  @Test
  void defaultPluginClassifiesDescriptorExhaustion() {
    CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP, resources);
    Table table = Table.builder("rows")
        .resolver((ctx, client, parent, sink) -> {
          throw new IOException("Too many open files");
        })
        .build();
    SourcePlugin plugin = root.sourcePlugin("db", "1.0.0", List.of(table), config -> new ClientMeta() {});

    FetchException ex = assertThrows(FetchException.class,
        () -> plugin.fetch(FetchSpec.all(), Map.of(), new InMemoryFetchSink(), FetchContext.background()));

    assertEquals(DiagnosticType.THROTTLE, ex.diagnostic().type());
    assertEquals(Severity.WARNING, ex.diagnostic().severity());
  }
}
