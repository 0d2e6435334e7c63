package org.waabox.retrier.cancel;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * The sleep primitive of a retry loop.
 *
 * <p>Replacing the timer lets tests drive the retry loop without waiting.
 * Implementations shared across retry loops must be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 *
 * @see SystemRetryTimer
 */
@FunctionalInterface
public interface RetryTimer {

  /**
   * Returns a future that completes once the given delay has elapsed.
   *
   * <p>The retry loop cancels the returned future once the wait is over or
   * aborted. Implementations should release any scheduled work on
   * cancellation.
   *
   * @param delay the delay to wait, never null; zero or negative delays
   *              complete immediately
   *
   * @return the future, never null
   */
  CompletableFuture<?> after(Duration delay);
}
