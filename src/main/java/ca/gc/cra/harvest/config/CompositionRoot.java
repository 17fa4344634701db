package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.application.budget.ConcurrencyBudgetCalculator;
import ca.gc.cra.harvest.application.fetch.FetchScheduler;
import ca.gc.cra.harvest.application.fetch.FileDescriptorLimitClassifier;
import ca.gc.cra.harvest.application.plugin.SourcePlugin;
import ca.gc.cra.harvest.application.port.ErrorClassifier;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ca.gc.cra.harvest.domain.table.Table;
import ca.gc.cra.harvest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.harvest.infrastructure.system.OperatingSystemResourcesAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the fetch engine to its default adapters.
 * <p><strong>Why:</strong> Plugin authors should get a working scheduler from one call; tests and hosts swap
 * individual ports through the explicit constructor.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter (OpenTelemetry, disabled unless an exporter is configured).</li>
 *   <li>Bind host resource limits to the budget calculator.</li>
 *   <li>Build schedulers with the default classifier chain plus plugin-specific classifiers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final SystemResourcesPort resources;

  /** Creates a composition root backed by OpenTelemetry metrics and the running JVM's host limits. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter(), new OperatingSystemResourcesAdapter());
  }

  /**
   * Creates a composition root with explicit adapters.
   *
   * @param metrics metrics adapter used by schedulers
   * @param resources host limits used to size budgets
   */
  public CompositionRoot(MetricsPort metrics, SystemResourcesPort resources) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.resources = Objects.requireNonNull(resources, "resources");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ConcurrencyBudgetCalculator budgetCalculator() {
    return new ConcurrencyBudgetCalculator(resources);
  }

  /**
   * Builds a scheduler with the default classifiers.
   *
   * @return new scheduler
   */
  public FetchScheduler fetchScheduler() {
    return fetchScheduler(List.of());
  }

  /**
   * Builds a scheduler whose classifier chain starts with {@code extraClassifiers}, followed by the default
   * descriptor-limit classifier.
   *
   * @param extraClassifiers plugin-specific classifiers consulted first
   * @return new scheduler
   */
  public FetchScheduler fetchScheduler(List<ErrorClassifier> extraClassifiers) {
    List<ErrorClassifier> chain = new ArrayList<>(Objects.requireNonNull(extraClassifiers, "extraClassifiers"));
    chain.add(new FileDescriptorLimitClassifier());
    return new FetchScheduler(budgetCalculator(), metrics, chain);
  }

  /**
   * Builds a source plugin running on a default scheduler.
   *
   * @param name plugin name
   * @param version plugin version
   * @param tables root tables
   * @param configurer client factory
   * @return new plugin
   */
  public SourcePlugin sourcePlugin(
      String name, String version, List<Table> tables, SourcePlugin.Configurer configurer) {
    return new SourcePlugin(name, version, tables, configurer, fetchScheduler());
  }
}
