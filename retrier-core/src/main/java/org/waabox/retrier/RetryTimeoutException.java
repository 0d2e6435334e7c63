package org.waabox.retrier;

import java.time.Duration;

/**
 * Thrown when the deadline of a
 * {@link org.waabox.retrier.cancel.CancellationSource} expires before the
 * retry loop completes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryTimeoutException extends RetryCancelledException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given deadline.
   *
   * @param timeout the timeout that expired, never null
   */
  public RetryTimeoutException(final Duration timeout) {
    super("Retry deadline exceeded after " + timeout);
  }
}
