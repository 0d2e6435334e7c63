package org.waabox.retrier.delay;

import java.time.Duration;

import org.waabox.retrier.RetryConfig;

/**
 * Computes the wait before the next attempt of a retry loop.
 *
 * <p>Implementations must be free of side effects. The result is capped by
 * {@link RetryConfig#maxDelay()} by the caller.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 *
 * @see DelayStrategies
 */
@FunctionalInterface
public interface DelayStrategy {

  /**
   * Computes the wait after the given failed attempt.
   *
   * @param attempt the index of the failed attempt: zero-based with an
   *                attempt ceiling, one-based (the retry count) without one
   * @param error   the error thrown by the attempt, never null
   * @param config  the retry configuration, never null
   *
   * @return the wait duration, never null
   */
  Duration delay(int attempt, Exception error, RetryConfig config);
}
