package ca.gc.cra.harvest.domain.diag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticOptionTest {

  @Test
  void mistypedSeverityIsRejectedAtConstruction() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.SEVERITY, "high", false));

    assertTrue(ex.getMessage().contains("SEVERITY"));
  }

  @Test
  void missingSeverityOrTypeIsRejected() {
    assertThrows(NullPointerException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.SEVERITY, null, false));
    assertThrows(NullPointerException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.TYPE, null, false));
  }

  @Test
  void mistypedTextFieldIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.SUMMARY, 42, false));
    assertThrows(IllegalArgumentException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.TYPE, Severity.ERROR, false));
  }

  @Test
  void resourceIdPathMustHoldStrings() {
    assertThrows(IllegalArgumentException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.RESOURCE_ID, "vpc-1", false));
    assertThrows(IllegalArgumentException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.RESOURCE_ID, List.of(1, 2), false));
    assertThrows(NullPointerException.class,
        () -> new DiagnosticOption(DiagnosticOption.Field.RESOURCE_ID, Arrays.asList("a", null), false));
  }

  @Test
  void nullTextAndIdValuesNormalizeToEmpty() {
    Diagnostic diagnostic = Diagnostic.wrap(null, DiagnosticType.RESOLVING,
        new DiagnosticOption(DiagnosticOption.Field.RESOURCE, null, false),
        new DiagnosticOption(DiagnosticOption.Field.RESOURCE_ID, null, false),
        new DiagnosticOption(DiagnosticOption.Field.DETAIL, null, false));

    assertEquals("", diagnostic.resource());
    assertEquals(List.of(), diagnostic.resourceIdPath());
    assertEquals("", diagnostic.detail());
    assertEquals(Severity.ERROR, Diagnostics.of(diagnostic).severity());
  }

  @Test
  void resourceIdPathIsCopiedOnConstruction() {
    List<String> ids = new ArrayList<>(List.of("account", "bucket"));
    DiagnosticOption option = DiagnosticOption.resourceId(ids);
    ids.add("later");

    Diagnostic diagnostic = Diagnostic.wrap(null, DiagnosticType.RESOLVING, option.protect());

    assertEquals(List.of("account", "bucket"), diagnostic.resourceIdPath());
  }
}
