package ca.gc.cra.harvest.domain.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.diag.Diagnostic;
import ca.gc.cra.harvest.domain.diag.DiagnosticOption;
import ca.gc.cra.harvest.domain.diag.DiagnosticType;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class FetchExceptionTest {

  @Test
  void carriesDiagnosticAndOptionalSummary() {
    Diagnostic diagnostic = Diagnostic.wrap(new IOException("reset"), DiagnosticType.RESOLVING,
        DiagnosticOption.summary("failed to resolve table %s", "instances"));
    FetchSummary summary = new FetchSummary(FetchTerminalState.FIRST_ERROR,
        new ConcurrencyBudget(4, ConcurrencyBudget.Source.OVERRIDE), 3, 1, 12L, Duration.ofMillis(5));

    FetchException withSummary = new FetchException(diagnostic, summary);
    FetchException withoutSummary = new FetchException(diagnostic, null);

    assertSame(diagnostic, withSummary.diagnostic());
    assertSame(diagnostic, withSummary.getCause());
    assertEquals("fetch failed: failed to resolve table instances: reset", withSummary.getMessage());
    assertEquals(summary, withSummary.summary().orElseThrow());
    assertTrue(withoutSummary.summary().isEmpty());
  }
}
