package ca.gc.cra.harvest.application.fetch;

import ca.gc.cra.harvest.application.port.ClientMeta;
import ca.gc.cra.harvest.application.port.ErrorClassifier;
import ca.gc.cra.harvest.domain.diag.Diagnostic;
import ca.gc.cra.harvest.domain.diag.DiagnosticOption;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import ca.gc.cra.harvest.domain.diag.Severity;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies socket failures caused by the process running out of file descriptors.
 *
 * <p>Such failures are reported as {@link Severity#WARNING} {@link DiagnosticType#THROTTLE} diagnostics whose
 * summary tells the operator how to raise the limit. The whole cause chain is inspected because HTTP
 * clients usually wrap the underlying {@code SocketException}.</p>
 *
 * @since 0.1.0
 */
public final class FileDescriptorLimitClassifier implements ErrorClassifier {
  static final String MARKER = "too many open files";
  static final String HINT =
      "try increasing number of available file descriptors via `ulimit -n 10240` "
          + "or by increasing timeout via provider specific parameters";

  private static final int MAX_CAUSE_DEPTH = 16;

  @Override
  public Optional<Diagnostic> classify(String table, ClientMeta client, Throwable error) {
    if (!mentionsDescriptorLimit(error)) {
      return Optional.empty();
    }
    return Optional.of(Diagnostic.wrap(error, DiagnosticType.THROTTLE,
        DiagnosticOption.severity(Severity.WARNING),
        DiagnosticOption.type(DiagnosticType.THROTTLE),
        DiagnosticOption.resource(table),
        DiagnosticOption.summary(HINT)));
  }

  static boolean mentionsDescriptorLimit(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      String message = current.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(MARKER)) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
