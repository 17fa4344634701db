package ca.gc.cra.harvest.application.plugin;

import ca.gc.cra.harvest.application.fetch.FetchScheduler;
import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.application.port.FetchSink;
import ca.gc.cra.harvest.application.table.TableRegistry;
import ca.gc.cra.harvest.domain.diag.Diagnostic;
import ca.gc.cra.harvest.domain.diag.DiagnosticOption;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import ca.gc.cra.harvest.domain.fetch.FetchContext;
import ca.gc.cra.harvest.domain.fetch.FetchException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.domain.fetch.FetchSummary;
import ca.gc.cra.harvest.domain.table.Table;
import ca.gc.cra.harvest.validation.Strings;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A named, versioned source plugin: its table forest plus the hook that turns raw
 * configuration into a client.
 * <p><strong>Why:</strong> Plugin authors declare tables and a configurer; hosts call {@link #fetch} and never
 * touch the scheduler directly.</p>
 * <p><strong>Invariants:</strong> Table names are unique across the forest; checked at construction.</p>
 * <p><strong>Thread-safety:</strong> Immutable; concurrent fetches are independent.</p>
 *
 * @since 0.1.0
 */
public final class SourcePlugin {
  private static final Logger log = LoggerFactory.getLogger(SourcePlugin.class);

  /**
   * Builds the client a fetch runs with from the plugin's raw configuration section.
   */
  @FunctionalInterface
  public interface Configurer {
    /**
     * Creates the base client.
     *
     * @param config plugin-specific configuration values; never {@code null}
     * @return configured client; must not be {@code null}
     * @throws Exception when the configuration is invalid or the upstream cannot be reached
     */
    ClientMeta configure(Map<String, Object> config) throws Exception;
  }

  private final String name;
  private final String version;
  private final List<Table> tables;
  private final Configurer configurer;
  private final FetchScheduler scheduler;

  /**
   * Creates a plugin.
   *
   * @param name plugin name
   * @param version plugin version
   * @param tables root tables in declaration order
   * @param configurer client factory
   * @param scheduler scheduler used for every fetch
   * @throws IllegalArgumentException if a name is blank or a table name is used twice
   */
  public SourcePlugin(
      String name, String version, List<Table> tables, Configurer configurer, FetchScheduler scheduler) {
    this.name = Strings.requireNonBlank("name", name);
    this.version = Strings.requireNonBlank("version", version);
    this.tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    this.configurer = Objects.requireNonNull(configurer, "configurer");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    new TableRegistry(this.tables).verifyUniqueNames();
  }

  public String name() {
    return name;
  }

  public String version() {
    return version;
  }

  /**
   * Returns the plugin's root tables.
   *
   * @return immutable forest in declaration order
   */
  public List<Table> tables() {
    return tables;
  }

  /**
   * Configures a client and fetches the requested tables with it.
   *
   * @param spec selection and limits
   * @param config raw plugin configuration; {@code null} is treated as empty
   * @param sink destination for records and progress
   * @param context caller's cancellation context
   * @return summary of the fetch
   * @throws FetchException if configuring the client or any fetch unit failed
   */
  public FetchSummary fetch(FetchSpec spec, Map<String, Object> config, FetchSink sink, FetchContext context)
      throws FetchException {
    ClientMeta client = configure(config == null ? Map.of() : config);
    log.info("Plugin {} {} configured client {}", name, version, client.id());
    return scheduler.fetch(tables, spec, client, sink, context);
  }

  private ClientMeta configure(Map<String, Object> config) throws FetchException {
    ClientMeta client;
    try {
      client = configurer.configure(config);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new FetchException(configurationFailure(ie), null);
    } catch (Exception ex) {
      throw new FetchException(configurationFailure(ex), null);
    }
    if (client == null) {
      throw new FetchException(Diagnostic.wrap(null, DiagnosticType.INTERNAL,
          DiagnosticOption.summary("failed to configure plugin %s: configurer returned no client", name)), null);
    }
    return client;
  }

  private Diagnostic configurationFailure(Exception cause) {
    return Diagnostic.wrap(cause, DiagnosticType.INTERNAL,
        DiagnosticOption.type(DiagnosticType.INTERNAL),
        DiagnosticOption.summary("failed to configure plugin %s", name));
  }

  @Override
  public String toString() {
    return "SourcePlugin[" + name + " " + version + ", tables=" + tables.size() + "]";
  }
}
