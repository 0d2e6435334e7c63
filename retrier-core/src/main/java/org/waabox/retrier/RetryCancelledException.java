package org.waabox.retrier;

/**
 * Thrown when a retry loop is aborted by its cancellation source or by an
 * interruption of the waiting thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RetryCancelledException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RetryCancelledException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RetryCancelledException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
