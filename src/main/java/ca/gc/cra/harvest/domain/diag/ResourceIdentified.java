package ca.gc.cra.harvest.domain.diag;

import java.util.List;

/**
 * Mix-in for exceptions that know which upstream resource they failed on.
 *
 * <p>When such an exception is wrapped by {@link Diagnostic#wrap}, its id path seeds the diagnostic's
 * {@code resourceIdPath}.</p>
 *
 * @since 0.1.0
 */
public interface ResourceIdentified {
  /**
   * Returns the identifier path of the failing resource, outermost first.
   *
   * @return identifier path; never {@code null}
   */
  List<String> resourceIdPath();
}
