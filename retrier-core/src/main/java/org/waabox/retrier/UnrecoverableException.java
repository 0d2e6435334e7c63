package org.waabox.retrier;

import java.util.Objects;

/**
 * Marks an error as unrecoverable.
 *
 * <p>Throwing this exception from a retried operation stops the retry loop
 * regardless of the remaining attempts. The tag is a control signal only:
 * the {@link Retrier} always surfaces the wrapped error, never this wrapper.
 *
 * <p>Instances are created through {@link Errors#unrecoverable(Exception)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnrecoverableException extends RuntimeException
    implements MatchableError {

  private static final long serialVersionUID = 1L;

  /** The original error, never null. */
  private final Exception error;

  /** Creates a new unrecoverable marker.
   *
   * @param theError the error to tag, cannot be null.
   */
  UnrecoverableException(final Exception theError) {
    super(Objects.requireNonNull(theError, "error must not be null")
        .getMessage(), theError);
    error = theError;
  }

  /**
   * Returns the original error this marker wraps.
   *
   * @return the original error, never null
   */
  public Exception error() {
    return error;
  }

  /**
   * Any unrecoverable marker matches any other unrecoverable marker.
   *
   * @param target the error to compare against, never null
   *
   * @return {@code true} if the target is an unrecoverable marker
   */
  @Override
  public boolean is(final Throwable target) {
    return target instanceof UnrecoverableException;
  }
}
