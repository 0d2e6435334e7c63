package org.waabox.retrier;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Error classification and cause chain matching.
 *
 * <p>The chain of an error is the error itself followed by its successive
 * {@link Throwable#getCause() causes}. Cycles are walked once.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Errors {

  private Errors() {
  }

  /**
   * Tags an error as unrecoverable.
   *
   * <p>An operation throwing the returned exception is not retried by the
   * default retry predicate.
   *
   * @param error the error to tag, never null
   *
   * @return the unrecoverable marker, never null
   *
   * @throws NullPointerException if error is null
   */
  public static UnrecoverableException unrecoverable(final Exception error) {
    return new UnrecoverableException(error);
  }

  /**
   * Checks whether an error is retriable, meaning that neither the error nor
   * any error of its chain is an {@link UnrecoverableException}.
   *
   * <p>This is the default retry predicate of {@link RetryConfig}.
   *
   * @param error the error to check, never null
   *
   * @return {@code true} if the error can be retried
   */
  public static boolean isRecoverable(final Throwable error) {
    return as(error, UnrecoverableException.class).isEmpty();
  }

  /**
   * Checks whether any error of the chain matches the target.
   *
   * <p>An element matches when it {@link Object#equals(Object) equals} the
   * target, or when it is a {@link MatchableError} reporting a match.
   *
   * @param error  the error whose chain is walked, may be null
   * @param target the error to look for, may be null
   *
   * @return {@code true} if the target was found
   */
  public static boolean is(final Throwable error, final Throwable target) {
    if (error == null || target == null) {
      return error == target;
    }
    final Set<Throwable> seen = visited();
    for (Throwable current = error; current != null && seen.add(current);
        current = current.getCause()) {
      if (current.equals(target)) {
        return true;
      }
      if (current instanceof MatchableError
          && ((MatchableError) current).is(target)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds the first error of the chain that is an instance of the given
   * type, or that a {@link MatchableError} element extracts to it.
   *
   * @param error the error whose chain is walked, may be null
   * @param type  the type to extract, never null
   * @param <E>   the error type
   *
   * @return the first matching error, or empty
   */
  public static <E extends Throwable> Optional<E> as(final Throwable error,
      final Class<E> type) {
    Objects.requireNonNull(type, "type must not be null");
    final Set<Throwable> seen = visited();
    for (Throwable current = error; current != null && seen.add(current);
        current = current.getCause()) {
      if (type.isInstance(current)) {
        return Optional.of(type.cast(current));
      }
      if (current instanceof MatchableError) {
        final Optional<E> found = ((MatchableError) current).as(type);
        if (found.isPresent()) {
          return found;
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Removes the unrecoverable tag from an error, if present.
   *
   * <p>Only the outermost tag is removed.
   *
   * @param error the error, never null
   *
   * @return the original error, never null
   */
  static Exception unwrap(final Exception error) {
    if (error instanceof UnrecoverableException) {
      return ((UnrecoverableException) error).error();
    }
    return error;
  }

  private static Set<Throwable> visited() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
