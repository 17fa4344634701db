package ca.gc.cra.harvest.domain.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FetchSpecTest {

  @Test
  void allSelectsWildcardWithAutomaticBudget() {
    FetchSpec spec = FetchSpec.all();

    assertEquals(List.of(FetchSpec.WILDCARD), spec.tables());
    assertTrue(spec.skipTables().isEmpty());
    assertEquals(0L, spec.maxConcurrency());
    assertEquals(Duration.ZERO, spec.unitTimeout());
  }

  @Test
  void withersKeepOtherFields() {
    FetchSpec spec = FetchSpec.of("instances", "buckets")
        .withSkipTables(Set.of("buckets"))
        .withMaxConcurrency(10)
        .withUnitTimeout(Duration.ofSeconds(30));

    assertEquals(List.of("instances", "buckets"), spec.tables());
    assertEquals(Set.of("buckets"), spec.skipTables());
    assertEquals(10L, spec.maxConcurrency());
    assertEquals(Duration.ofSeconds(30), spec.unitTimeout());
  }

  @Test
  void negativeValuesAreConfigurationErrors() {
    FetchSpec spec = FetchSpec.all();

    FetchConfigurationException ex =
        assertThrows(FetchConfigurationException.class, () -> spec.withMaxConcurrency(-1));
    assertEquals("max_concurrency must not be negative (was -1)", ex.getMessage());
    assertThrows(FetchConfigurationException.class, () -> spec.withUnitTimeout(Duration.ofSeconds(-5)));
  }

  @Test
  void nullTimeoutMeansNoTimeout() {
    FetchSpec spec = new FetchSpec(List.of("a"), null, 0L, null);

    assertEquals(Duration.ZERO, spec.unitTimeout());
    assertTrue(spec.skipTables().isEmpty());
  }
}
