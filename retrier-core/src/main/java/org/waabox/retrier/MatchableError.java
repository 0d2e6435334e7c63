package org.waabox.retrier;

import java.util.Optional;

/**
 * An error that declares its own equivalence to other errors.
 *
 * <p>Java exceptions compare by identity. Error kinds that want to take part
 * in {@link Errors#is(Throwable, Throwable)} and
 * {@link Errors#as(Throwable, Class)} with a looser relation (an error code,
 * a family of errors, a collection of errors) implement this interface.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MatchableError {

  /**
   * Checks whether this error should be considered equivalent to the given
   * target.
   *
   * @param target the error to compare against, never null
   *
   * @return {@code true} if this error matches the target
   */
  boolean is(Throwable target);

  /**
   * Extracts an error of the given type from this error.
   *
   * <p>The default implementation extracts nothing, leaving the decision to
   * the cause chain walk of {@link Errors#as(Throwable, Class)}.
   *
   * @param type the type to extract, never null
   * @param <E>  the error type
   *
   * @return the extracted error, or empty if there is none
   */
  default <E extends Throwable> Optional<E> as(final Class<E> type) {
    return Optional.empty();
  }
}
