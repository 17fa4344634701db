package ca.gc.cra.harvest.domain.diag;

import java.util.List;

/**
 * Plain value view of a {@link Diagnostic}, used for JSON output and test assertions.
 *
 * @param error externally visible message
 * @param resource table name
 * @param resourceIdPath identifier path of the failing resource
 * @param accountId account identifier
 * @param type classification
 * @param severity severity
 * @param summary summary as set on the diagnostic
 * @param description full description, or {@code null} when skipped
 * @since 0.1.0
 */
public record FlatDiagnostic(
    String error,
    String resource,
    List<String> resourceIdPath,
    String accountId,
    DiagnosticType type,
    Severity severity,
    String summary,
    DiagnosticDescription description) {

  public FlatDiagnostic {
    resourceIdPath = resourceIdPath == null ? List.of() : List.copyOf(resourceIdPath);
  }

  static FlatDiagnostic from(Diagnostic diagnostic, boolean skipDescription) {
    DiagnosticDescription description = diagnostic.description();
    return new FlatDiagnostic(
        diagnostic.getMessage(),
        description.resource(),
        description.resourceIdPath(),
        description.accountId(),
        diagnostic.type(),
        diagnostic.severity(),
        description.summary(),
        skipDescription ? null : description);
  }
}
