package org.waabox.retrier.metrics;

/**
 * A no-operation implementation of {@link RetryMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRetryMetrics implements RetryMetrics {

  /** {@inheritDoc} */
  @Override
  public void attemptFailed(final int attempt, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void succeeded(final int attempts) {
  }

  /** {@inheritDoc} */
  @Override
  public void exhausted(final int attempts, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void cancelled(final int attempts) {
  }
}
