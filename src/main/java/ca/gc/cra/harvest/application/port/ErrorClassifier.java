package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.diag.Diagnostic;
import java.util.Optional;

/**
 * Turns a raw fetch unit failure into a {@link Diagnostic} when it recognises the failure.
 *
 * <p>The scheduler consults classifiers in order; the first non-empty result wins and unrecognised
 * failures become {@code RESOLVING} errors.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ErrorClassifier {
  /**
   * Classifies a failure raised while fetching {@code table}.
   *
   * @param table root table being fetched
   * @param client client of the failing unit
   * @param error failure raised by the resolver
   * @return diagnostic, empty when this classifier does not recognise the failure
   */
  Optional<Diagnostic> classify(String table, ClientMeta client, Throwable error);
}
