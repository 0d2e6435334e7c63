package org.waabox.retrier;

import java.util.Objects;

/**
 * Limits the attempts for a specific error identity, independently of the
 * global attempt ceiling of the {@link RetryConfig}.
 *
 * <p>Every attempt whose error matches consumes one unit of the budget. The
 * retry loop stops once any budget reaches zero. Attempts counted here are
 * also counted against the global ceiling.
 *
 * <p>This class is immutable. The remaining counters live in the retry loop,
 * one set per invocation.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ErrorBudget {

  /** The matcher selecting the errors this budget applies to. */
  private final ErrorMatcher matcher;

  /** The number of attempts allowed for matching errors. */
  private final int attempts;

  /**
   * Creates a new budget.
   *
   * @param theMatcher  the matcher, never null
   * @param theAttempts the number of attempts, greater than zero
   */
  private ErrorBudget(final ErrorMatcher theMatcher, final int theAttempts) {
    matcher = theMatcher;
    attempts = theAttempts;
  }

  /**
   * Creates a budget for the errors selected by the given matcher.
   *
   * @param matcher  the matcher, never null
   * @param attempts the number of attempts allowed, greater than zero
   *
   * @return a new budget, never null
   *
   * @throws NullPointerException     if matcher is null
   * @throws IllegalArgumentException if attempts is less than or equal to
   *                                  zero
   */
  public static ErrorBudget of(final ErrorMatcher matcher,
      final int attempts) {
    Objects.requireNonNull(matcher, "matcher must not be null");
    if (attempts <= 0) {
      throw new IllegalArgumentException(
          "attempts must be greater than 0, got: " + attempts);
    }
    return new ErrorBudget(matcher, attempts);
  }

  /**
   * Returns the matcher selecting the errors this budget applies to.
   *
   * @return the matcher, never null
   */
  public ErrorMatcher matcher() {
    return matcher;
  }

  /**
   * Returns the number of attempts allowed for matching errors.
   *
   * @return the attempts, always greater than zero
   */
  public int attempts() {
    return attempts;
  }
}
