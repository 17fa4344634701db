package ca.gc.cra.harvest.domain.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered collection of {@link Diagnostic}s gathered during a fetch.
 *
 * <p>Plain exceptions added to the collection become {@link Severity#ERROR}/{@link DiagnosticType#INTERNAL}
 * diagnostics. Not thread-safe; callers that collect from several threads must synchronize externally.</p>
 *
 * @since 0.1.0
 */
public final class Diagnostics implements Iterable<Diagnostic> {
  private static final Comparator<Diagnostic> SEVERITY_FIRST =
      Comparator.comparing(Diagnostic::severity, Comparator.reverseOrder())
          .thenComparing(Diagnostic::type, Comparator.reverseOrder())
          .thenComparing(Diagnostic::resource);

  private final List<Diagnostic> items = new ArrayList<>();

  /**
   * Creates a collection holding the given failures.
   *
   * @param errors failures to add; {@code null} entries are skipped
   * @return new collection
   */
  public static Diagnostics of(Throwable... errors) {
    Diagnostics diagnostics = new Diagnostics();
    if (errors != null) {
      for (Throwable error : errors) {
        diagnostics.add(error);
      }
    }
    return diagnostics;
  }

  /**
   * Adds a failure to the collection.
   *
   * @param error diagnostic or plain exception; {@code null} is ignored
   * @return this collection
   */
  public Diagnostics add(Throwable error) {
    if (error == null) {
      return this;
    }
    if (error instanceof Diagnostic diagnostic) {
      items.add(diagnostic);
    } else {
      items.add(Diagnostic.wrap(error, DiagnosticType.INTERNAL));
    }
    return this;
  }

  /**
   * Appends every diagnostic of {@code other}, flattening it into this collection.
   *
   * @param other collection to append; {@code null} is ignored
   * @return this collection
   */
  public Diagnostics addAll(Diagnostics other) {
    if (other != null && other != this) {
      items.addAll(other.items);
    }
    return this;
  }

  /**
   * Returns the maximum severity present.
   *
   * @return aggregate severity, empty when the collection is empty
   */
  public Optional<Severity> severity() {
    Severity max = null;
    for (Diagnostic diagnostic : items) {
      max = diagnostic.severity().max(max);
    }
    return Optional.ofNullable(max);
  }

  public boolean hasErrors() {
    return severity().filter(s -> s == Severity.ERROR).isPresent();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public int size() {
    return items.size();
  }

  public long errors() {
    return countBySeverity(Severity.ERROR);
  }

  public long warnings() {
    return countBySeverity(Severity.WARNING);
  }

  /**
   * Counts diagnostics of one severity, honouring squashed repeat counts.
   *
   * @param severity severity to count
   * @return number of occurrences
   */
  public long countBySeverity(Severity severity) {
    long count = 0;
    for (Diagnostic diagnostic : items) {
      if (diagnostic.severity() == severity) {
        count += diagnostic.repeatCount();
      }
    }
    return count;
  }

  /**
   * Merges diagnostics that share message, account, resource, severity and classification into a single
   * entry whose repeat count is the number of merged occurrences.
   *
   * @return new squashed collection, first-seen order preserved
   */
  public Diagnostics squash() {
    Map<String, long[]> counts = new LinkedHashMap<>();
    Map<String, Diagnostic> firstSeen = new LinkedHashMap<>();
    for (Diagnostic diagnostic : items) {
      String key = diagnostic.getMessage() + '_' + diagnostic.accountId() + '_' + diagnostic.resource()
          + '_' + diagnostic.severity() + '_' + diagnostic.type();
      firstSeen.putIfAbsent(key, diagnostic);
      counts.computeIfAbsent(key, k -> new long[1])[0] += diagnostic.repeatCount();
    }
    Diagnostics squashed = new Diagnostics();
    for (Map.Entry<String, Diagnostic> entry : firstSeen.entrySet()) {
      long count = counts.get(entry.getKey())[0];
      Diagnostic first = entry.getValue();
      squashed.items.add(count == first.repeatCount() ? first : first.withRepeatCount(count));
    }
    return squashed;
  }

  /**
   * Returns a copy ordered by severity (most severe first), then classification, then resource name.
   *
   * @return sorted copy
   */
  public Diagnostics sorted() {
    Diagnostics copy = new Diagnostics();
    copy.items.addAll(items);
    copy.items.sort(SEVERITY_FIRST);
    return copy;
  }

  /**
   * Flattens the collection into plain values suitable for JSON output or assertions.
   *
   * @param skipDescription whether to omit the nested description
   * @return flat diagnostics in collection order
   */
  public List<FlatDiagnostic> flatten(boolean skipDescription) {
    List<FlatDiagnostic> flat = new ArrayList<>(items.size());
    for (Diagnostic diagnostic : items) {
      flat.add(FlatDiagnostic.from(diagnostic, skipDescription));
    }
    return flat;
  }

  public List<Diagnostic> asList() {
    return Collections.unmodifiableList(items);
  }

  @Override
  public Iterator<Diagnostic> iterator() {
    return asList().iterator();
  }

  /**
   * Renders the collection: a single line for one diagnostic, a bulleted list for several.
   *
   * @return rendering
   */
  @Override
  public String toString() {
    switch (items.size()) {
      case 0:
        return "no errors";
      case 1:
        return items.get(0).renderLine();
      default:
        StringBuilder out = new StringBuilder();
        out.append(items.size()).append(" problems:");
        for (Diagnostic diagnostic : items) {
          out.append("\n- ").append(diagnostic.renderLine());
        }
        return out.toString();
    }
  }
}
