package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.application.budget.ConcurrencyBudgetCalculator;
import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ca.gc.cra.harvest.domain.fetch.ConcurrencyBudget;
import ca.gc.cra.harvest.infrastructure.system.OperatingSystemResourcesAdapter;
import ca.gc.cra.harvest.logging.LoggingConfigurator;
import ca.gc.cra.harvest.validation.Numbers;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the fetch concurrency budget this host would get, with the limits it was derived from.
 *
 * @since 0.1.0
 */
public final class BudgetCli {
  private static final Logger log = LoggerFactory.getLogger(BudgetCli.class);
  private static final String SUMMARY_USAGE = "usage: harvest budget [maxConcurrency=N]";
  private static final String HELP_TEXT = """
      harvest budget

      Usage:
        harvest budget [maxConcurrency=N]

      Optional:
        maxConcurrency=N   Explicit budget override; 0 computes one from host limits (default 0)
        --verbose          Enable DEBUG logging
        --help             Show this message

      Output:
        budget, source (OVERRIDE|MEMORY|FILE_DESCRIPTORS) and the host limits that were read
      """;

  private BudgetCli() {}

  static ExitCode run(String[] args) {
    return run(args, new OperatingSystemResourcesAdapter());
  }

  static ExitCode run(String[] args, SystemResourcesPort resources) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    long override;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      CliArgsParser.requireKnown(kv, Set.of("maxConcurrency"));
      String raw = kv.get("maxConcurrency");
      override = raw == null ? 0L : Numbers.parseRange("maxConcurrency", raw, 0L, Integer.MAX_VALUE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      OptionalLong memory = resources.totalMemoryBytes();
      OptionalLong descriptors = resources.availableFileDescriptors();
      ConcurrencyBudget budget = new ConcurrencyBudgetCalculator(resources).calculate(override);
      CliPrinter.println("budget=" + budget.slots());
      CliPrinter.println("source=" + budget.source());
      CliPrinter.println("totalMemoryBytes=" + describe(memory));
      CliPrinter.println("availableFileDescriptors=" + describe(descriptors));
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while computing the concurrency budget", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String describe(OptionalLong value) {
    return value.isPresent() ? Long.toString(value.getAsLong()) : "unknown";
  }
}
