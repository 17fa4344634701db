package ca.gc.cra.harvest.application.fetch;

import ca.gc.cra.harvest.application.budget.ConcurrencyBudgetCalculator;
import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.application.port.ErrorClassifier;
import ca.gc.cra.harvest.application.port.FetchSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.Multiplexer;
import ca.gc.cra.harvest.application.table.TableRegistry;
import ca.gc.cra.harvest.domain.diag.Diagnostic;
import ca.gc.cra.harvest.domain.diag.DiagnosticOption;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import ca.gc.cra.harvest.domain.diag.Severity;
import ca.gc.cra.harvest.domain.fetch.ConcurrencyBudget;
import ca.gc.cra.harvest.domain.fetch.FetchConfigurationException;
import ca.gc.cra.harvest.domain.fetch.FetchContext;
import ca.gc.cra.harvest.domain.fetch.FetchException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.domain.fetch.FetchSummary;
import ca.gc.cra.harvest.domain.fetch.FetchTerminalState;
import ca.gc.cra.harvest.domain.fetch.TableProgress;
import ca.gc.cra.harvest.domain.table.Table;
import ca.gc.cra.harvest.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.harvest.logging.Logs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs every selected root table of a plugin, once per multiplexed client, under a
 * concurrency budget.
 * <p><strong>Why:</strong> Source plugins fan out into thousands of independent API calls; the scheduler
 * bounds how many run at once, stops launching new work after the first failure and reports per-table
 * progress as tables settle.</p>
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Validate the selection and reject names that match no root table.</li>
 *   <li>Size the budget and multiplex every table into fetch units.</li>
 *   <li>Acquire one slot per unit before launching it; cancellation stops launching.</li>
 *   <li>Capture the first unit failure, cancel the shared context and wait for running units.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless between calls; concurrent {@code fetch} calls each get their
 * own pool, budget and context.</p>
 * <p><strong>Observability:</strong> Emits {@code fetch.unit.started}, {@code fetch.unit.failed},
 * {@code fetch.unit.latencyNanos}, {@code fetch.table.completed} and {@code fetch.slots.inUse}; unit logs
 * carry the MDC keys {@code pipeline}, {@code table} and {@code client}.</p>
 *
 * @since 0.1.0
 */
public final class FetchScheduler {
  private static final Logger log = LoggerFactory.getLogger(FetchScheduler.class);

  private static final long SLOT_POLL_MILLIS = 25L;
  private static final long AWAIT_POLL_SECONDS = 1L;
  private static final String THREAD_PREFIX = "fetch-unit";

  private final ConcurrencyBudgetCalculator calculator;
  private final MetricsPort metrics;
  private final List<ErrorClassifier> classifiers;

  /**
   * Creates a scheduler with the default error classifiers.
   *
   * @param calculator budget calculator consulted once per fetch
   * @param metrics metrics sink for unit counters and latencies
   */
  public FetchScheduler(ConcurrencyBudgetCalculator calculator, MetricsPort metrics) {
    this(calculator, metrics, List.of(new FileDescriptorLimitClassifier()));
  }

  /**
   * Creates a scheduler with an explicit classifier chain.
   *
   * @param calculator budget calculator consulted once per fetch
   * @param metrics metrics sink; {@code null} disables metrics
   * @param classifiers classifiers consulted in order for unit failures
   */
  public FetchScheduler(
      ConcurrencyBudgetCalculator calculator, MetricsPort metrics, List<ErrorClassifier> classifiers) {
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.classifiers = List.copyOf(Objects.requireNonNull(classifiers, "classifiers"));
  }

  /**
   * Fetches the selected tables.
   *
   * <p>Blocks until every launched unit has finished. Interrupting the calling thread cancels the fetch and
   * still waits for running units; the interrupt flag is restored before returning.</p>
   *
   * @param forest root tables of the plugin
   * @param spec selection, budget override and unit timeout
   * @param client configured base client
   * @param sink destination for records and table progress
   * @param context caller's cancellation context
   * @return summary of a fetch in which no unit failed
   * @throws FetchConfigurationException if the selection is invalid; raised before any unit launches
   * @throws FetchException if a multiplexer or a unit failed; carries the first failure
   */
  public FetchSummary fetch(
      List<Table> forest, FetchSpec spec, ClientMeta client, FetchSink sink, FetchContext context)
      throws FetchException {
    Objects.requireNonNull(forest, "forest");
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(context, "context");
    long startNanos = System.nanoTime();

    TableRegistry registry = new TableRegistry(forest);
    Set<String> selected = registry.resolve(spec);
    List<Table> tables = new ArrayList<>(selected.size());
    for (String name : selected) {
      tables.add(registry.root(name).orElseThrow(
          () -> new FetchConfigurationException("table " + name + " not found in plugin tables")));
    }
    ConcurrencyBudget budget = calculator.calculate(spec.maxConcurrency());
    List<List<FetchUnit>> plan = plan(tables, client);

    String previousPipeline = MDC.get("pipeline");
    MDC.put("pipeline", "fetch");
    try {
      log.info("Starting fetch of {} tables with concurrency budget {} ({})",
          tables.size(), budget.slots(), budget.source());
      return execute(plan, selected, budget, spec.unitTimeout(), sink, context, startNanos);
    } finally {
      if (previousPipeline == null) {
        MDC.remove("pipeline");
      } else {
        MDC.put("pipeline", previousPipeline);
      }
    }
  }

  private FetchSummary execute(
      List<List<FetchUnit>> plan,
      Set<String> selected,
      ConcurrencyBudget budget,
      Duration unitTimeout,
      FetchSink sink,
      FetchContext context,
      long startNanos)
      throws FetchException {
    FetchContext shared = context.child();
    Semaphore slots = new Semaphore(budget.slots());
    TableCompletionTracker tracker = new TableCompletionTracker(selected, shared::isCancelled);
    AtomicReference<Diagnostic> firstFailure = new AtomicReference<>();
    LongAdder totalRecords = new LongAdder();
    ExecutorService pool = ExecutorFactories.newFetchPool(THREAD_PREFIX, this::handleUncaught);
    UnitRun run = new UnitRun(shared, slots, unitTimeout, sink, tracker, firstFailure, totalRecords);

    int launched = 0;
    int skipped = 0;
    boolean interrupted = false;
    try {
      boolean launching = true;
      for (List<FetchUnit> tableUnits : plan) {
        String table = tableUnits.get(0).tableName();
        for (FetchUnit unit : tableUnits) {
          if (launching) {
            try {
              launching = acquireSlot(slots, shared);
            } catch (InterruptedException ie) {
              interrupted = true;
              shared.cancel("interrupted");
              launching = false;
            }
          }
          if (!launching) {
            skipped++;
            continue;
          }
          metrics.observe("fetch.slots.inUse", budget.slots() - slots.availablePermits());
          tracker.launched(table);
          try {
            pool.execute(() -> run.run(unit));
            launched++;
          } catch (RejectedExecutionException ex) {
            slots.release();
            run.fail(unit, Diagnostic.wrap(ex, DiagnosticType.INTERNAL,
                DiagnosticOption.resource(table),
                DiagnosticOption.summary("failed to launch fetch unit %s", unit.label())));
            run.emit(tracker.finished(table, 0L));
            skipped++;
            launching = false;
          }
        }
        run.emit(tracker.seal(table));
      }
      if (skipped > 0) {
        log.info("Stopped launching fetch units ({}); {} units skipped",
            shared.cancelReason().orElse("canceled"), skipped);
      }
    } finally {
      pool.shutdown();
      interrupted |= awaitUnits(pool, shared);
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    Diagnostic failure = firstFailure.get();
    if (failure != null) {
      FetchSummary summary = new FetchSummary(
          FetchTerminalState.FIRST_ERROR, budget, launched, skipped, totalRecords.sum(), elapsed);
      log.warn("Fetch failed after {} units ({} skipped): {}",
          launched, skipped, Logs.truncate(failure.describe(), 256));
      throw new FetchException(failure, summary);
    }
    FetchTerminalState state =
        skipped > 0 ? FetchTerminalState.CANCELED_BEFORE_LAUNCH : FetchTerminalState.ALL_COMPLETE;
    FetchSummary summary = new FetchSummary(state, budget, launched, skipped, totalRecords.sum(), elapsed);
    log.info("Fetch finished {}: {} units launched, {} skipped, {} records in {} ms",
        state, launched, skipped, summary.totalRecords(), elapsed.toMillis());
    return summary;
  }

  private static List<List<FetchUnit>> plan(List<Table> tables, ClientMeta client) throws FetchException {
    List<List<FetchUnit>> plan = new ArrayList<>(tables.size());
    for (Table table : tables) {
      List<ClientMeta> clients = clientsFor(table, client);
      List<FetchUnit> units = new ArrayList<>(clients.size());
      for (int i = 0; i < clients.size(); i++) {
        units.add(new FetchUnit(table, clients.get(i), i + 1, clients.size()));
      }
      plan.add(units);
    }
    return plan;
  }

  private static List<ClientMeta> clientsFor(Table table, ClientMeta client) throws FetchException {
    Optional<Multiplexer> multiplexer = table.multiplexer();
    if (multiplexer.isEmpty()) {
      return List.of(client);
    }
    List<ClientMeta> clients;
    try {
      clients = multiplexer.get().multiplex(client);
    } catch (RuntimeException ex) {
      throw new FetchException(Diagnostic.wrap(ex, DiagnosticType.INTERNAL,
          DiagnosticOption.resource(table.name()),
          DiagnosticOption.summary("failed to multiplex clients for table %s", table.name())), null);
    }
    if (clients == null || clients.isEmpty()) {
      return List.of(client);
    }
    if (clients.stream().anyMatch(Objects::isNull)) {
      throw new FetchException(Diagnostic.of(Severity.ERROR, DiagnosticType.INTERNAL, table.name(),
          "multiplexer for table " + table.name() + " returned a null client"), null);
    }
    return List.copyOf(clients);
  }

  private static boolean acquireSlot(Semaphore slots, FetchContext shared) throws InterruptedException {
    while (!shared.isCancelled()) {
      if (slots.tryAcquire(SLOT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (shared.isCancelled()) {
          slots.release();
          return false;
        }
        return true;
      }
    }
    return false;
  }

  private static boolean awaitUnits(ExecutorService pool, FetchContext shared) {
    boolean interrupted = false;
    while (true) {
      try {
        if (pool.awaitTermination(AWAIT_POLL_SECONDS, TimeUnit.SECONDS)) {
          return interrupted;
        }
      } catch (InterruptedException ie) {
        interrupted = true;
        shared.cancel("interrupted");
        log.info("Fetch interrupted; waiting for running units to observe cancellation");
      }
    }
  }

  private Diagnostic classify(FetchUnit unit, Throwable error, FetchContext unitContext, Duration timeout) {
    for (ErrorClassifier classifier : classifiers) {
      Optional<Diagnostic> classified = classifier.classify(unit.tableName(), unit.client(), error);
      if (classified.isPresent()) {
        return classified.get();
      }
    }
    if (error instanceof Diagnostic diagnostic) {
      return diagnostic.resource().isEmpty()
          ? Diagnostic.wrap(diagnostic, DiagnosticType.RESOLVING, DiagnosticOption.resource(unit.tableName()))
          : diagnostic;
    }
    if (error instanceof CancellationException && unitContext.cancelReason().isPresent()
        && !timeout.isZero()) {
      return Diagnostic.wrap(error, DiagnosticType.RESOLVING,
          DiagnosticOption.resource(unit.tableName()),
          DiagnosticOption.summary("fetch unit %s timed out after %s", unit.label(), timeout));
    }
    return Diagnostic.wrap(error, DiagnosticType.RESOLVING,
        DiagnosticOption.resource(unit.tableName()),
        DiagnosticOption.summary("failed to resolve table %s", unit.tableName()));
  }

  private void handleUncaught(Thread thread, Throwable error) {
    log.error("Fetch unit thread {} terminated unexpectedly", thread.getName(), error);
  }

  /** State shared by the units of one fetch call. */
  private final class UnitRun {
    private final FetchContext shared;
    private final Semaphore slots;
    private final Duration unitTimeout;
    private final FetchSink sink;
    private final TableCompletionTracker tracker;
    private final AtomicReference<Diagnostic> firstFailure;
    private final LongAdder totalRecords;

    UnitRun(
        FetchContext shared,
        Semaphore slots,
        Duration unitTimeout,
        FetchSink sink,
        TableCompletionTracker tracker,
        AtomicReference<Diagnostic> firstFailure,
        LongAdder totalRecords) {
      this.shared = shared;
      this.slots = slots;
      this.unitTimeout = unitTimeout;
      this.sink = sink;
      this.tracker = tracker;
      this.firstFailure = firstFailure;
      this.totalRecords = totalRecords;
    }

    void run(FetchUnit unit) {
      MDC.put("pipeline", "fetch");
      MDC.put("table", unit.tableName());
      MDC.put("client", unit.client().id());
      FetchContext unitContext = unitTimeout.isZero() ? shared.child() : shared.withTimeout(unitTimeout);
      CountingFetchSink counting = new CountingFetchSink(sink);
      long start = System.nanoTime();
      metrics.increment("fetch.unit.started");
      try {
        log.debug("Resolving fetch unit {}", unit.label());
        unit.table().resolver().resolve(unitContext, unit.client(), null, counting);
        log.debug("Fetch unit {} finished with {} records", unit.label(), counting.recordCount());
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        onFailure(unit, ie, unitContext);
      } catch (Exception ex) {
        onFailure(unit, ex, unitContext);
      } catch (Error error) {
        onFailure(unit, error, unitContext);
        throw error;
      } finally {
        slots.release();
        long records = counting.recordCount();
        totalRecords.add(records);
        metrics.observe("fetch.unit.latencyNanos", System.nanoTime() - start);
        emit(tracker.finished(unit.tableName(), records));
        MDC.remove("client");
        MDC.remove("table");
        MDC.remove("pipeline");
      }
    }

    private void onFailure(FetchUnit unit, Throwable error, FetchContext unitContext) {
      if (error instanceof CancellationException && shared.isCancelled()) {
        log.debug("Fetch unit {} stopped after cancellation: {}", unit.label(), error.getMessage());
        return;
      }
      fail(unit, classify(unit, error, unitContext, unitTimeout));
    }

    void fail(FetchUnit unit, Diagnostic diagnostic) {
      metrics.increment("fetch.unit.failed");
      if (firstFailure.compareAndSet(null, diagnostic)) {
        log.warn("Fetch unit {} failed; cancelling remaining units: {}",
            unit.label(), Logs.truncate(diagnostic.describe(), 256), diagnostic);
        shared.cancel("fetch unit " + unit.label() + " failed");
      } else {
        log.warn("Dropping additional failure of fetch unit {}: {}",
            unit.label(), Logs.truncate(diagnostic.describe(), 256));
      }
    }

    void emit(Optional<TableProgress> progress) {
      if (progress.isEmpty()) {
        return;
      }
      TableProgress value = progress.get();
      metrics.increment("fetch.table.completed");
      log.info("Table {} settled {} with {} records ({}/{} tables done)",
          value.tableName(), value.status(), value.recordCountDelta(),
          value.finishedTables(), value.completion().size());
      try {
        sink.progress(value);
      } catch (RuntimeException ex) {
        log.error("Fetch sink rejected progress for table {}", value.tableName(), ex);
      }
    }
  }
}
