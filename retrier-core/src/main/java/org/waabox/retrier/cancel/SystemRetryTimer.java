package org.waabox.retrier.cancel;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A {@link RetryTimer} backed by a single daemon scheduler thread.
 *
 * <p>Cancelling a returned future removes its scheduled task, so an
 * aborted wait does not linger until its delay elapses.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SystemRetryTimer implements RetryTimer {

  /** The shared instance. */
  public static final SystemRetryTimer INSTANCE = new SystemRetryTimer();

  /** The scheduler that completes the waits, never null. */
  private final ScheduledThreadPoolExecutor scheduler;

  private SystemRetryTimer() {
    scheduler = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread thread = new Thread(r, "retrier-timer");
      thread.setDaemon(true);
      return thread;
    });
    scheduler.setRemoveOnCancelPolicy(true);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<?> after(final Duration delay) {
    final long nanos = toNanos(delay);
    if (nanos <= 0) {
      return CompletableFuture.completedFuture(null);
    }
    final CompletableFuture<Void> elapsed = new CompletableFuture<>();
    final ScheduledFuture<?> task = scheduler.schedule(
        () -> elapsed.complete(null), nanos, TimeUnit.NANOSECONDS);
    elapsed.whenComplete((ignored, error) -> {
      if (elapsed.isCancelled()) {
        task.cancel(false);
      }
    });
    return elapsed;
  }

  /**
   * Returns the number of waits still scheduled.
   *
   * @return the number of pending waits
   */
  int pending() {
    return scheduler.getQueue().size();
  }

  private static long toNanos(final Duration delay) {
    try {
      return delay.toNanos();
    } catch (final ArithmeticException e) {
      return delay.isNegative() ? 0L : Long.MAX_VALUE;
    }
  }
}
