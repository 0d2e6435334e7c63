package org.waabox.retrier.metrics;

/**
 * An abstraction for recording operational metrics of retry loops.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopRetryMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RetryMetrics {

  /**
   * Records a failed attempt.
   *
   * @param attempt the zero-based index of the failed attempt
   * @param cause   the error thrown by the attempt, never null
   */
  void attemptFailed(int attempt, Throwable cause);

  /**
   * Records a retry loop that ended with a successful attempt.
   *
   * @param attempts the number of attempts made, including the successful
   *                 one
   */
  void succeeded(int attempts);

  /**
   * Records a retry loop that gave up after its attempts, per-error budgets
   * or retry predicate told it to stop.
   *
   * @param attempts the number of attempts made
   * @param cause    the error surfaced to the caller, never null
   */
  void exhausted(int attempts, Throwable cause);

  /**
   * Records a retry loop aborted by its cancellation source or by an
   * interruption.
   *
   * @param attempts the number of attempts made before the cancellation
   */
  void cancelled(int attempts);
}
