package org.waabox.retrier;

import java.util.Objects;

/**
 * Decides whether an attempt error belongs to a given error identity.
 *
 * <p>Used as the key of an {@link ErrorBudget}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ErrorMatcher {

  /**
   * Checks whether the given attempt error matches this identity.
   *
   * @param error the error thrown by the attempt, never null
   *
   * @return {@code true} if the error matches
   */
  boolean matches(Exception error);

  /**
   * Creates a matcher for a specific error, matched through
   * {@link Errors#is(Throwable, Throwable)}.
   *
   * <p>Exceptions overriding {@code equals} are matched structurally, any
   * other exception by identity.
   *
   * @param target the error to match, never null
   *
   * @return the matcher, never null
   *
   * @throws NullPointerException if target is null
   */
  static ErrorMatcher of(final Throwable target) {
    Objects.requireNonNull(target, "target must not be null");
    return error -> Errors.is(error, target);
  }

  /**
   * Creates a matcher for an error type, matched through
   * {@link Errors#as(Throwable, Class)}.
   *
   * @param type the error type to match, never null
   *
   * @return the matcher, never null
   *
   * @throws NullPointerException if type is null
   */
  static ErrorMatcher ofType(final Class<? extends Throwable> type) {
    Objects.requireNonNull(type, "type must not be null");
    return error -> Errors.as(error, type).isPresent();
  }
}
