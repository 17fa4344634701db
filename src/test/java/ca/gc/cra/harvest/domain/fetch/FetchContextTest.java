package ca.gc.cra.harvest.domain.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class FetchContextTest {

  @Test
  void backgroundContextIsLiveWithoutDeadline() {
    FetchContext context = FetchContext.background();

    assertFalse(context.isCancelled());
    assertEquals(Optional.empty(), context.remaining());
    context.throwIfCancelled();
  }

  @Test
  void cancellingParentCancelsChildrenButNotTheOtherWay() {
    FetchContext parent = FetchContext.background();
    FetchContext child = parent.child();
    FetchContext sibling = parent.child();

    child.cancel("unit failed");

    assertTrue(child.isCancelled());
    assertFalse(parent.isCancelled());
    assertFalse(sibling.isCancelled());

    parent.cancel("shutdown");

    assertTrue(sibling.isCancelled());
    assertEquals(Optional.of("shutdown"), sibling.cancelReason());
    assertEquals(Optional.of("unit failed"), child.cancelReason());
  }

  @Test
  void firstReasonIsRetained() {
    FetchContext context = FetchContext.background();

    context.cancel("first");
    context.cancel("second");

    assertEquals(Optional.of("first"), context.cancelReason());
  }

  @Test
  void blankReasonFallsBackToDefault() {
    FetchContext context = FetchContext.background();

    context.cancel(" ");

    assertEquals(Optional.of("canceled"), context.cancelReason());
  }

  @Test
  void throwIfCancelledCarriesReason() {
    FetchContext context = FetchContext.background();
    context.cancel("stop");

    CancellationException ex = assertThrows(CancellationException.class, context::throwIfCancelled);

    assertEquals("stop", ex.getMessage());
  }

  @Test
  void timeoutExpiresChildOnly() throws InterruptedException {
    FetchContext parent = FetchContext.background();
    FetchContext timed = parent.withTimeout(Duration.ofMillis(20));

    Thread.sleep(60);

    assertTrue(timed.isCancelled());
    assertEquals(Optional.of("deadline exceeded"), timed.cancelReason());
    assertFalse(parent.isCancelled());
  }

  @Test
  void remainingReportsNearestDeadline() {
    FetchContext outer = FetchContext.background().withTimeout(Duration.ofMillis(500));
    FetchContext inner = outer.withTimeout(Duration.ofHours(1));

    Duration remaining = inner.remaining().orElseThrow();

    assertTrue(remaining.compareTo(Duration.ofMillis(500)) <= 0);
  }

  @Test
  void nonPositiveTimeoutRejected() {
    FetchContext context = FetchContext.background();

    assertThrows(IllegalArgumentException.class, () -> context.withTimeout(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> context.withTimeout(Duration.ofSeconds(-1)));
  }
}
