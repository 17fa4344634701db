package ca.gc.cra.harvest.domain.fetch;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Cooperative cancellation token shared by the fetch scheduler and resolvers.
 * <p><strong>Why:</strong> Resolvers spend most of their time in upstream I/O the scheduler cannot
 * interrupt safely; they poll {@link #isCancelled()} (or call {@link #throwIfCancelled()}) at their own
 * suspension points instead.</p>
 * <p><strong>Hierarchy:</strong> A child context is cancelled when its parent is. Cancelling a child never
 * affects the parent. A child created with {@link #withTimeout(Duration)} also reports cancellation once
 * its deadline passes.</p>
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class FetchContext {
  private static final String DEADLINE_REASON = "deadline exceeded";

  private final FetchContext parent;
  private final long deadlineNanos;
  private final boolean hasDeadline;
  private final AtomicReference<String> cancelReason = new AtomicReference<>();

  private FetchContext(FetchContext parent, boolean hasDeadline, long deadlineNanos) {
    this.parent = parent;
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
  }

  /**
   * Creates a root context that is only cancelled explicitly.
   *
   * @return new root context
   */
  public static FetchContext background() {
    return new FetchContext(null, false, 0L);
  }

  /**
   * Creates a child context cancelled together with this one.
   *
   * @return new child context
   */
  public FetchContext child() {
    return new FetchContext(this, false, 0L);
  }

  /**
   * Creates a child context that additionally expires after {@code timeout}.
   *
   * @param timeout positive time budget
   * @return new child context with a deadline
   * @throws IllegalArgumentException if {@code timeout} is zero or negative
   */
  public FetchContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive (was " + timeout + ")");
    }
    return new FetchContext(this, true, System.nanoTime() + timeout.toNanos());
  }

  /**
   * Cancels this context and all of its children. Only the first reason is retained.
   *
   * @param reason short reason recorded for diagnostics
   */
  public void cancel(String reason) {
    cancelReason.compareAndSet(null, reason == null || reason.isBlank() ? "canceled" : reason);
  }

  /** Cancels this context without a specific reason. */
  public void cancel() {
    cancel("canceled");
  }

  /**
   * Reports whether this context, an ancestor, or a deadline has cancelled the work.
   *
   * @return {@code true} once cancelled; never reverts to {@code false}
   */
  public boolean isCancelled() {
    return cancelReason().isPresent();
  }

  /**
   * Returns why this context is cancelled.
   *
   * @return reason, empty while the context is live
   */
  public Optional<String> cancelReason() {
    String own = cancelReason.get();
    if (own != null) {
      return Optional.of(own);
    }
    if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
      return Optional.of(DEADLINE_REASON);
    }
    return parent == null ? Optional.empty() : parent.cancelReason();
  }

  /**
   * Throws when the context is cancelled; intended for resolver suspension points.
   *
   * @throws CancellationException if cancelled
   */
  public void throwIfCancelled() {
    Optional<String> reason = cancelReason();
    if (reason.isPresent()) {
      throw new CancellationException(reason.get());
    }
  }

  /**
   * Returns the time left before the nearest deadline in this context's ancestry.
   *
   * @return remaining time, empty when no deadline applies
   */
  public Optional<Duration> remaining() {
    Optional<Duration> inherited = parent == null ? Optional.empty() : parent.remaining();
    if (!hasDeadline) {
      return inherited;
    }
    Duration own = Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    if (inherited.isPresent() && inherited.get().compareTo(own) < 0) {
      return inherited;
    }
    return Optional.of(own);
  }
}
