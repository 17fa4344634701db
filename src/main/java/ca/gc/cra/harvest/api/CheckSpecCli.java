package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.config.FetchSpecLoader;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a fetch spec file and prints its normalized form.
 *
 * @since 0.1.0
 */
public final class CheckSpecCli {
  private static final Logger log = LoggerFactory.getLogger(CheckSpecCli.class);
  private static final String SUMMARY_USAGE = "usage: harvest check-spec spec=PATH";
  private static final String HELP_TEXT = """
      harvest check-spec

      Usage:
        harvest check-spec spec=./fetch.yaml

      Required:
        spec=PATH    YAML document with a 'fetch' section

      Optional:
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private CheckSpecCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path specPath;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      CliArgsParser.requireKnown(kv, Set.of("spec"));
      String raw = kv.get("spec");
      if (raw == null) {
        throw new IllegalArgumentException("spec is required");
      }
      specPath = Path.of(raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<FetchSpec> loaded;
    try {
      loaded = FetchSpecLoader.load(specPath);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fetch spec: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read fetch spec {}", specPath, ex);
      return ExitCode.IO_ERROR;
    }
    if (loaded.isEmpty()) {
      log.error("Fetch spec does not exist: {}", specPath);
      return ExitCode.CONFIG_ERROR;
    }

    FetchSpec spec = loaded.get();
    CliPrinter.println("tables=" + String.join(",", spec.tables()));
    CliPrinter.println("skip_tables=" + String.join(",", spec.skipTables()));
    CliPrinter.println("max_concurrency=" + (spec.maxConcurrency() == 0 ? "auto" : spec.maxConcurrency()));
    CliPrinter.println("unit_timeout=" + (spec.unitTimeout().isZero() ? "none" : spec.unitTimeout()));
    return ExitCode.SUCCESS;
  }
}
