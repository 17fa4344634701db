package ca.gc.cra.harvest.domain.diag;

import java.util.List;

/**
 * Human facing description of a {@link Diagnostic}.
 *
 * @param resource table the diagnostic refers to; empty when unknown
 * @param resourceIdPath identifier path of the failing resource; never {@code null}
 * @param accountId account the failure belongs to; empty when unknown
 * @param summary short description of the problem
 * @param detail optional second message, usually a hint for the user
 * @since 0.1.0
 */
public record DiagnosticDescription(
    String resource, List<String> resourceIdPath, String accountId, String summary, String detail) {

  public DiagnosticDescription {
    resource = resource == null ? "" : resource;
    resourceIdPath = resourceIdPath == null ? List.of() : List.copyOf(resourceIdPath);
    accountId = accountId == null ? "" : accountId;
    summary = summary == null ? "" : summary;
    detail = detail == null ? "" : detail;
  }
}
