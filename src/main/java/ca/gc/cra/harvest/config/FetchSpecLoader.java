package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.domain.fetch.FetchConfigurationException;
import ca.gc.cra.harvest.domain.fetch.FetchSpec;
import ca.gc.cra.harvest.validation.Numbers;
import ca.gc.cra.harvest.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link FetchSpec} from the {@code fetch} section of a YAML document.
 *
 * <pre>{@code
 * fetch:
 *   tables: ["*"]
 *   skip_tables: [audit_logs]
 *   max_concurrency: 0
 *   unit_timeout: PT30S
 * }</pre>
 *
 * <p>Every key is optional. An empty document or a document without a {@code fetch} section yields
 * {@link FetchSpec#all()}. {@code unit_timeout} accepts an ISO-8601 duration or a number of seconds.</p>
 */
public final class FetchSpecLoader {
  static final String SECTION = "fetch";
  static final String TABLES = "tables";
  static final String SKIP_TABLES = "skip_tables";
  static final String MAX_CONCURRENCY = "max_concurrency";
  static final String UNIT_TIMEOUT = "unit_timeout";
  private static final Set<String> KNOWN_KEYS = Set.of(TABLES, SKIP_TABLES, MAX_CONCURRENCY, UNIT_TIMEOUT);

  private FetchSpecLoader() {}

  /**
   * Loads a fetch spec file.
   *
   * @param path location of the YAML document
   * @return parsed spec, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static Optional<FetchSpec> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(read(reader, path.toString()));
    }
  }

  /**
   * Parses a fetch spec from YAML text.
   *
   * @param yaml YAML document
   * @return parsed spec
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static FetchSpec parse(String yaml) {
    return read(new StringReader(Objects.requireNonNull(yaml, "yaml")), "<inline>");
  }

  private static FetchSpec read(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML fetch spec at " + source, ex);
    }
    if (document == null) {
      return FetchSpec.all();
    }
    Object section = asMap(document, "root").get(SECTION);
    if (section == null) {
      return FetchSpec.all();
    }
    Map<String, Object> fetch = asMap(section, SECTION);
    for (String key : fetch.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown key " + SECTION + "." + key + " in " + source);
      }
    }
    List<String> tables = fetch.containsKey(TABLES)
        ? stringList(fetch.get(TABLES), TABLES)
        : List.of(FetchSpec.WILDCARD);
    if (tables.isEmpty()) {
      throw new IllegalArgumentException(SECTION + "." + TABLES + " must not be empty");
    }
    Set<String> skip = new LinkedHashSet<>(stringList(fetch.get(SKIP_TABLES), SKIP_TABLES));
    long maxConcurrency = maxConcurrency(fetch.get(MAX_CONCURRENCY));
    Duration unitTimeout = unitTimeout(fetch.get(UNIT_TIMEOUT));
    try {
      return new FetchSpec(tables, skip, maxConcurrency, unitTimeout);
    } catch (FetchConfigurationException ex) {
      throw new IllegalArgumentException("Invalid fetch spec at " + source + ": " + ex.getMessage(), ex);
    }
  }

  private static List<String> stringList(Object node, String key) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof String single) {
      return List.of(Strings.requireTableName(SECTION + "." + key, single));
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(SECTION + "." + key + " must be a list of table names");
    }
    List<String> names = new ArrayList<>(raw.size());
    for (Object item : raw) {
      if (!(item instanceof String name)) {
        throw new IllegalArgumentException(SECTION + "." + key + " must only contain strings (found " + item + ")");
      }
      names.add(Strings.requireTableName(SECTION + "." + key, name));
    }
    return names;
  }

  private static long maxConcurrency(Object node) {
    String name = SECTION + "." + MAX_CONCURRENCY;
    if (node == null) {
      return 0L;
    }
    if (node instanceof Integer || node instanceof Long) {
      return Numbers.requireRange(name, ((Number) node).longValue(), 0L, Integer.MAX_VALUE);
    }
    if (node instanceof String text) {
      return Numbers.parseRange(name, text, 0L, Integer.MAX_VALUE);
    }
    throw new IllegalArgumentException(name + " must be an integer (was " + node + ")");
  }

  private static Duration unitTimeout(Object node) {
    String name = SECTION + "." + UNIT_TIMEOUT;
    if (node == null) {
      return Duration.ZERO;
    }
    if (node instanceof Integer || node instanceof Long) {
      return Duration.ofSeconds(Numbers.requireRange(name, ((Number) node).longValue(), 0L, Long.MAX_VALUE));
    }
    if (node instanceof String text) {
      String value = Strings.requireNonBlank(name, text).toUpperCase(Locale.ROOT);
      try {
        Duration parsed = Duration.parse(value);
        if (parsed.isNegative()) {
          throw new IllegalArgumentException(name + " must not be negative (was " + text + ")");
        }
        return parsed;
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(name + " must be an ISO-8601 duration such as PT30S (was " + text + ")", ex);
      }
    }
    throw new IllegalArgumentException(name + " must be a duration (was " + node + ")");
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key.trim().toLowerCase(Locale.ROOT), entry.getValue());
    }
    return map;
  }
}
