package ca.gc.cra.harvest.domain.diag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticTest {

  @Test
  void wrapDefaultsToErrorWithGivenType() {
    IOException cause = new IOException("connection reset");

    Diagnostic diagnostic = Diagnostic.wrap(cause, DiagnosticType.ACCESS);

    assertEquals(Severity.ERROR, diagnostic.severity());
    assertEquals(DiagnosticType.ACCESS, diagnostic.type());
    assertSame(cause, diagnostic.getCause());
    assertEquals("connection reset", diagnostic.getMessage());
    assertEquals("", diagnostic.resource());
    assertTrue(diagnostic.resourceIdPath().isEmpty());
  }

  @Test
  void protectedSummaryWinsOverLaterOptionsInSameCall() {
    Diagnostic diagnostic = Diagnostic.wrap(new IllegalStateException("boom"), DiagnosticType.RESOLVING,
        DiagnosticOption.summary("outer").protect(),
        DiagnosticOption.summary("inner"));

    assertEquals("outer", diagnostic.summary());
  }

  @Test
  void protectionDoesNotCarryIntoLaterWrapCalls() {
    Diagnostic first = Diagnostic.wrap(new IllegalStateException("boom"), DiagnosticType.RESOLVING,
        DiagnosticOption.summary("outer").protect());

    Diagnostic second = Diagnostic.wrap(first, DiagnosticType.RESOLVING, DiagnosticOption.summary("inner"));

    assertEquals("outer", first.summary());
    assertEquals("inner", second.summary());
  }

  @Test
  void rewrappingSeedsFromExistingDiagnosticAndKeepsClassification() {
    IOException cause = new IOException("throttled by upstream");
    Diagnostic inner = Diagnostic.wrap(cause, DiagnosticType.THROTTLE,
        DiagnosticOption.severity(Severity.WARNING),
        DiagnosticOption.resource("instances"),
        DiagnosticOption.accountId("acct-1"));

    Diagnostic outer = Diagnostic.wrap(inner, DiagnosticType.INTERNAL, DiagnosticOption.detail("retry later"));

    assertEquals(DiagnosticType.THROTTLE, outer.type());
    assertEquals(Severity.WARNING, outer.severity());
    assertEquals("instances", outer.resource());
    assertEquals("acct-1", outer.accountId());
    assertEquals("retry later", outer.detail());
    assertSame(cause, outer.getCause());
  }

  @Test
  void explicitTypeOptionStillOverridesSeededClassification() {
    Diagnostic inner = Diagnostic.wrap(new IOException("x"), DiagnosticType.RESOLVING);

    Diagnostic outer = Diagnostic.wrap(inner, DiagnosticType.UNKNOWN, DiagnosticOption.type(DiagnosticType.ACCESS));

    assertEquals(DiagnosticType.ACCESS, outer.type());
  }

  @Test
  void messageFallsBackToSummaryWithoutCause() {
    Diagnostic diagnostic = Diagnostic.of(Severity.WARNING, DiagnosticType.SCHEMA, "buckets", "column dropped");

    assertNull(diagnostic.getCause());
    assertEquals("column dropped", diagnostic.getMessage());
    assertEquals("column dropped", diagnostic.describe());
  }

  @Test
  void describeJoinsSummaryAndCauseMessageWhenDifferent() {
    Diagnostic diagnostic = Diagnostic.wrap(new IOException("403 forbidden"), DiagnosticType.ACCESS,
        DiagnosticOption.summary("cannot list buckets"));

    assertEquals("403 forbidden", diagnostic.getMessage());
    assertEquals("cannot list buckets: 403 forbidden", diagnostic.describe());
  }

  @Test
  void describeDoesNotRepeatIdenticalText() {
    Diagnostic diagnostic = Diagnostic.wrap(new IOException("same"), DiagnosticType.ACCESS,
        DiagnosticOption.summary("same"));

    assertEquals("same", diagnostic.describe());
  }

  @Test
  void summaryOptionFormatsArguments() {
    Diagnostic diagnostic = Diagnostic.wrap(null, DiagnosticType.RESOLVING,
        DiagnosticOption.summary("failed %d of %d pages", 2, 5));

    assertEquals("failed 2 of 5 pages", diagnostic.summary());
  }

  @Test
  void resourceIdentifiedCauseProvidesIdPath() {
    Diagnostic diagnostic = Diagnostic.wrap(new MissingInstance("i-123"), DiagnosticType.RESOLVING);

    assertEquals(List.of("us-east-1", "i-123"), diagnostic.resourceIdPath());
  }

  @Test
  void descriptionFallsBackToMessageWhenSummaryMissing() {
    Diagnostic diagnostic = Diagnostic.wrap(new IOException("timeout"), DiagnosticType.RESOLVING);

    assertEquals("timeout", diagnostic.description().summary());
  }

  @Test
  void renderLineIncludesAccountAndIds() {
    Diagnostic diagnostic = Diagnostic.wrap(null, DiagnosticType.ACCESS,
        DiagnosticOption.accountId("123456"),
        DiagnosticOption.resourceId("bucket-a", "key-1"),
        DiagnosticOption.summary("access denied"),
        DiagnosticOption.detail("check IAM policy"));

    assertEquals("[123456:bucket-a,key-1] access denied: check IAM policy", diagnostic.renderLine());
  }

  @Test
  void telemetryDiagnosticsAreIgnored() {
    Diagnostic diagnostic = Diagnostic.telemetry(new IOException("slow"), "latency.spike");

    assertEquals(Severity.IGNORE, diagnostic.severity());
    assertEquals(DiagnosticType.TELEMETRY, diagnostic.type());
    assertEquals("latency.spike", diagnostic.detail());
  }

  private static final class MissingInstance extends Exception implements ResourceIdentified {
    private final String id;

    MissingInstance(String id) {
      super("instance " + id + " not found");
      this.id = id;
    }

    @Override
    public List<String> resourceIdPath() {
      return List.of("us-east-1", id);
    }
  }
}
