package ca.gc.cra.harvest.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that run fetch units.
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded executor for fetch units.
   *
   * <p>Every submitted unit gets a thread immediately; the caller bounds concurrency with its own permits.
   * Threads are named {@code <prefix>-<hex index>} and are not daemons, so a fetch must be awaited.</p>
   *
   * @param prefix thread-name prefix used to tag unit threads
   * @param handler uncaught exception handler installed on each unit thread
   * @return configured executor service
   */
  public static ExecutorService newFetchPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "fetch-unit" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + Integer.toHexString(index.getAndIncrement()));
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
