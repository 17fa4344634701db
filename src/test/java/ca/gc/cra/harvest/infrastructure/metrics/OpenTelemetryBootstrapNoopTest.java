package ca.gc.cra.harvest.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    Properties props = new Properties();
    props.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(props);

    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterDisablesMetrics() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void noopAdapterAcceptsUpdates() {
    Properties props = new Properties();
    props.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(props))) {
      adapter.increment("fetch.unit.started");
      adapter.observe("fetch.unit.latencyNanos", 10L);
      adapter.forceFlush();
      assertTrue(adapter.isNoop());
    }
  }
}
