package org.waabox.retrier;

/**
 * Callback notified each time a failed attempt is going to be retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RetryListener {

  /** A listener that does nothing. */
  RetryListener NOOP = (attempt, error) -> { };

  /**
   * Called after a failed attempt that passed the retry predicate, before
   * waiting for the next one.
   *
   * @param attempt the index of the failed attempt: zero-based with an
   *                attempt ceiling, one-based (the retry count) without one
   * @param error   the error thrown by the attempt, never null
   */
  void onRetry(int attempt, Exception error);
}
