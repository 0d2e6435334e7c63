package org.waabox.retrier;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The errors of a failed retry loop, one per failed attempt.
 *
 * <p>Errors are kept in attempt order: index 0 holds the first failure and
 * the last index the most recent one. They are never reordered nor
 * deduplicated. When the loop was cancelled, the cancellation error is the
 * last element.
 *
 * <p>{@link #getCause()} returns the most recent error only. Earlier errors
 * are reachable through {@link #errors()}, {@link #is(Throwable)} and
 * {@link #as(Class)}.
 *
 * <p>This class is immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryFailedException extends RuntimeException
    implements MatchableError {

  private static final long serialVersionUID = 1L;

  /** The errors in attempt order, never null nor empty. */
  private final List<Exception> errors;

  /**
   * Creates a new exception holding the given errors.
   *
   * @param theErrors the errors in attempt order, never null nor empty
   *
   * @throws NullPointerException     if theErrors is null
   * @throws IllegalArgumentException if theErrors is empty
   */
  public RetryFailedException(final List<? extends Exception> theErrors) {
    super(render(theErrors), last(theErrors));
    errors = List.copyOf(theErrors);
  }

  /**
   * Returns the errors in attempt order.
   *
   * @return an unmodifiable list of errors, never null nor empty
   */
  public List<Exception> errors() {
    return errors;
  }

  /**
   * Returns the number of errors, one per failed attempt.
   *
   * @return the number of errors, always greater than zero
   */
  public int size() {
    return errors.size();
  }

  /**
   * Returns the most recent error.
   *
   * @return the last error, never null
   */
  public Exception lastError() {
    return errors.get(errors.size() - 1);
  }

  /**
   * Checks whether any of the errors matches the target through
   * {@link Errors#is(Throwable, Throwable)}.
   *
   * @param target the error to look for, never null
   *
   * @return {@code true} if at least one error matches
   */
  @Override
  public boolean is(final Throwable target) {
    for (final Exception error : errors) {
      if (Errors.is(error, target)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Extracts the first error, in attempt order, that resolves to the given
   * type through {@link Errors#as(Throwable, Class)}.
   *
   * @param type the type to extract, never null
   * @param <E>  the error type
   *
   * @return the first matching error, or empty
   */
  @Override
  public <E extends Throwable> Optional<E> as(final Class<E> type) {
    for (final Exception error : errors) {
      final Optional<E> found = Errors.as(error, type);
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  /**
   * Renders the numbered, multi-line summary of the errors.
   *
   * @param errors the errors, never null
   *
   * @return the summary, never null
   */
  private static String render(final List<? extends Exception> errors) {
    Objects.requireNonNull(errors, "errors must not be null");
    final StringBuilder sb = new StringBuilder("All attempts fail:");
    for (int i = 0; i < errors.size(); i++) {
      sb.append('\n').append('#').append(i + 1).append(": ")
          .append(describe(errors.get(i)));
    }
    return sb.toString();
  }

  private static String describe(final Exception error) {
    final String message = error.getMessage();
    return message != null ? message : error.toString();
  }

  private static Exception last(final List<? extends Exception> errors) {
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors must not be empty");
    }
    return errors.get(errors.size() - 1);
  }
}
