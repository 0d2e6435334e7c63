package org.waabox.retrier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.waabox.retrier.cancel.CancellationSource;
import org.waabox.retrier.cancel.RetryTimer;
import org.waabox.retrier.cancel.SystemRetryTimer;
import org.waabox.retrier.delay.DelayStrategies;
import org.waabox.retrier.delay.DelayStrategy;
import org.waabox.retrier.metrics.NoopRetryMetrics;
import org.waabox.retrier.metrics.RetryMetrics;

/**
 * Defines how a {@link Retrier} retries an operation.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}. The default configuration makes 10 attempts, waiting
 * an exponential backoff of 100ms plus up to 100ms of random jitter between
 * them, and retries every error not tagged through
 * {@link Errors#unrecoverable(Exception)}.
 *
 * <p>This class is immutable and thread-safe. Per-invocation state, such as
 * the remaining per-error budgets, lives in the retry loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryConfig {

  /** The default number of attempts. */
  static final int DEFAULT_ATTEMPTS = 10;

  /** The default base delay. */
  static final Duration DEFAULT_DELAY = Duration.ofMillis(100);

  /** The default random jitter ceiling. */
  static final Duration DEFAULT_MAX_JITTER = Duration.ofMillis(100);

  /** The attempt ceiling, 0 means retry until success. */
  private final int attempts;

  /** The per-error attempt budgets, in configuration order. */
  private final List<ErrorBudget> errorBudgets;

  /** The base delay used by the delay strategies. */
  private final Duration delay;

  /** The cap of every computed wait, zero means no cap. */
  private final Duration maxDelay;

  /** The ceiling of the random jitter. */
  private final Duration maxJitter;

  /** Computes the wait between attempts. */
  private final DelayStrategy delayStrategy;

  /** Decides whether a failed attempt is retried. */
  private final Predicate<Exception> retryIf;

  /** Notified before each retry. */
  private final RetryListener listener;

  /** Whether only the last error is surfaced instead of all of them. */
  private final boolean lastErrorOnly;

  /** The cancellation signal. */
  private final CancellationSource cancellation;

  /** The sleep primitive. */
  private final RetryTimer timer;

  /** Whether a cancellation in unbounded mode also carries the last error. */
  private final boolean wrapCancellationWithLastError;

  /** The metrics reporter. */
  private final RetryMetrics metrics;

  /** The backoff shift bound, derived from the base delay. */
  private final int maxBackoffShift;

  /**
   * Creates a new configuration from a validated builder.
   *
   * @param builder the builder, never null
   */
  private RetryConfig(final Builder builder) {
    attempts = builder.attempts;
    errorBudgets = List.copyOf(builder.errorBudgets.values());
    delay = builder.delay;
    maxDelay = builder.maxDelay;
    maxJitter = builder.maxJitter;
    delayStrategy = builder.delayStrategy;
    retryIf = builder.retryIf;
    listener = builder.listener;
    lastErrorOnly = builder.lastErrorOnly;
    cancellation = builder.cancellation;
    timer = builder.timer;
    wrapCancellationWithLastError = builder.wrapCancellationWithLastError;
    metrics = builder.metrics;
    maxBackoffShift = maxBackoffShift(delay);
  }

  /**
   * Creates a new builder initialized with the default configuration.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the default configuration.
   *
   * @return the default configuration, never null
   */
  public static RetryConfig defaults() {
    return builder().build();
  }

  /**
   * Computes the largest shift that keeps {@code delay << shift} inside a
   * signed 64-bit count of nanoseconds.
   *
   * <p>The bound is {@code 62 - floor(log2(delay))}, taking a zero delay as
   * one nanosecond.
   *
   * @param delay the base delay, never null
   *
   * @return the shift bound, between 0 and 62
   */
  static int maxBackoffShift(final Duration delay) {
    long nanos;
    try {
      nanos = delay.toNanos();
    } catch (final ArithmeticException e) {
      nanos = Long.MAX_VALUE;
    }
    if (nanos <= 0) {
      nanos = 1L;
    }
    final int log2 = Long.SIZE - 1 - Long.numberOfLeadingZeros(nanos);
    return DelayStrategies.MAX_SHIFT - log2;
  }

  /**
   * Returns the attempt ceiling.
   *
   * @return the maximum number of attempts, 0 meaning no limit
   */
  public int attempts() {
    return attempts;
  }

  /**
   * Returns the per-error attempt budgets.
   *
   * @return an unmodifiable list of budgets, never null
   */
  public List<ErrorBudget> errorBudgets() {
    return errorBudgets;
  }

  /**
   * Returns the base delay of the delay strategies.
   *
   * @return the base delay, never null
   */
  public Duration delay() {
    return delay;
  }

  /**
   * Returns the cap applied to every computed wait.
   *
   * @return the cap, {@link Duration#ZERO} meaning no cap, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }

  /**
   * Returns the ceiling of the random jitter.
   *
   * @return the jitter ceiling, never null
   */
  public Duration maxJitter() {
    return maxJitter;
  }

  /**
   * Returns the strategy computing the wait between attempts.
   *
   * @return the delay strategy, never null
   */
  public DelayStrategy delayStrategy() {
    return delayStrategy;
  }

  /**
   * Returns the predicate deciding whether a failed attempt is retried.
   *
   * @return the retry predicate, never null
   */
  public Predicate<Exception> retryIf() {
    return retryIf;
  }

  /**
   * Returns the listener notified before each retry.
   *
   * @return the listener, never null
   */
  public RetryListener listener() {
    return listener;
  }

  /**
   * Returns whether only the most recent error is surfaced.
   *
   * @return {@code true} to surface the last error instead of a
   *         {@link RetryFailedException}
   */
  public boolean lastErrorOnly() {
    return lastErrorOnly;
  }

  /**
   * Returns the cancellation signal.
   *
   * @return the cancellation source, never null
   */
  public CancellationSource cancellation() {
    return cancellation;
  }

  /**
   * Returns the sleep primitive.
   *
   * @return the timer, never null
   */
  public RetryTimer timer() {
    return timer;
  }

  /**
   * Returns whether a cancellation of an unbounded loop is surfaced together
   * with the last attempt error.
   *
   * @return {@code true} to combine both errors in a
   *         {@link RetryFailedException}
   */
  public boolean wrapCancellationWithLastError() {
    return wrapCancellationWithLastError;
  }

  /**
   * Returns the metrics reporter.
   *
   * @return the metrics, never null
   */
  public RetryMetrics metrics() {
    return metrics;
  }

  /**
   * Returns the largest shift the backoff strategy applies to the base
   * delay.
   *
   * @return the shift bound, between 0 and 62
   */
  public int maxBackoffShift() {
    return maxBackoffShift;
  }

  /**
   * A fluent builder for {@link RetryConfig} instances.
   *
   * <p>Every setting is optional. Defaults:
   * <ul>
   *   <li>attempts: 10</li>
   *   <li>delay: 100ms</li>
   *   <li>maxDelay: none</li>
   *   <li>maxJitter: 100ms</li>
   *   <li>delayStrategy: backoff combined with random jitter</li>
   *   <li>retryIf: {@link Errors#isRecoverable(Throwable)}</li>
   *   <li>listener: {@link RetryListener#NOOP}</li>
   *   <li>lastErrorOnly: false</li>
   *   <li>cancellation: {@link CancellationSource#never()}</li>
   *   <li>timer: {@link SystemRetryTimer}</li>
   *   <li>wrapCancellationWithLastError: false</li>
   *   <li>metrics: {@link NoopRetryMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    private int attempts = DEFAULT_ATTEMPTS;

    /** The budgets keyed by the error, type or matcher they were set for. */
    private final Map<Object, ErrorBudget> errorBudgets =
        new LinkedHashMap<>();

    private Duration delay = DEFAULT_DELAY;

    private Duration maxDelay = Duration.ZERO;

    private Duration maxJitter = DEFAULT_MAX_JITTER;

    private DelayStrategy delayStrategy = DelayStrategies.combine(
        DelayStrategies.backoff(), DelayStrategies.random());

    private Predicate<Exception> retryIf = Errors::isRecoverable;

    private RetryListener listener = RetryListener.NOOP;

    private boolean lastErrorOnly = false;

    private CancellationSource cancellation = CancellationSource.never();

    private RetryTimer timer = SystemRetryTimer.INSTANCE;

    private boolean wrapCancellationWithLastError = false;

    private RetryMetrics metrics = new NoopRetryMetrics();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the attempt ceiling.
     *
     * @param theAttempts the maximum number of attempts, 0 to retry until
     *                    the operation succeeds
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theAttempts is negative
     */
    public Builder attempts(final int theAttempts) {
      if (theAttempts < 0) {
        throw new IllegalArgumentException(
            "attempts must not be negative, got: " + theAttempts);
      }
      attempts = theAttempts;
      return this;
    }

    /**
     * Limits the attempts failing with the given error.
     *
     * <p>Errors are matched through {@link ErrorMatcher#of(Throwable)}.
     * Setting a budget again for the same error replaces the previous one.
     *
     * @param theAttempts the number of attempts, greater than zero
     * @param error       the error to limit, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if error is null
     * @throws IllegalArgumentException if theAttempts is not positive
     */
    public Builder attemptsForError(final int theAttempts,
        final Exception error) {
      Objects.requireNonNull(error, "error must not be null");
      errorBudgets.put(error,
          ErrorBudget.of(ErrorMatcher.of(error), theAttempts));
      return this;
    }

    /**
     * Limits the attempts failing with an error of the given type.
     *
     * <p>Errors are matched through {@link ErrorMatcher#ofType(Class)}.
     * Setting a budget again for the same type replaces the previous one.
     *
     * @param theAttempts the number of attempts, greater than zero
     * @param type        the error type to limit, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if type is null
     * @throws IllegalArgumentException if theAttempts is not positive
     */
    public Builder attemptsForError(final int theAttempts,
        final Class<? extends Throwable> type) {
      Objects.requireNonNull(type, "type must not be null");
      errorBudgets.put(type,
          ErrorBudget.of(ErrorMatcher.ofType(type), theAttempts));
      return this;
    }

    /**
     * Limits the attempts failing with an error selected by the given
     * matcher.
     *
     * @param theAttempts the number of attempts, greater than zero
     * @param matcher     the matcher selecting the errors, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if matcher is null
     * @throws IllegalArgumentException if theAttempts is not positive
     */
    public Builder attemptsForError(final int theAttempts,
        final ErrorMatcher matcher) {
      errorBudgets.put(matcher, ErrorBudget.of(matcher, theAttempts));
      return this;
    }

    /**
     * Sets the base delay of the delay strategies.
     *
     * @param theDelay the base delay, never null nor negative
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theDelay is null
     * @throws IllegalArgumentException if theDelay is negative
     */
    public Builder delay(final Duration theDelay) {
      delay = requireNotNegative(theDelay, "delay");
      return this;
    }

    /**
     * Caps every computed wait.
     *
     * @param theMaxDelay the cap, {@link Duration#ZERO} for no cap, never
     *                    null nor negative
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theMaxDelay is null
     * @throws IllegalArgumentException if theMaxDelay is negative
     */
    public Builder maxDelay(final Duration theMaxDelay) {
      maxDelay = requireNotNegative(theMaxDelay, "maxDelay");
      return this;
    }

    /**
     * Sets the ceiling of the random jitter.
     *
     * @param theMaxJitter the jitter ceiling, zero for no jitter, never null
     *                     nor negative
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theMaxJitter is null
     * @throws IllegalArgumentException if theMaxJitter is negative
     */
    public Builder maxJitter(final Duration theMaxJitter) {
      maxJitter = requireNotNegative(theMaxJitter, "maxJitter");
      return this;
    }

    /**
     * Sets the strategy computing the wait between attempts.
     *
     * @param theDelayStrategy the delay strategy, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theDelayStrategy is null
     */
    public Builder delayStrategy(final DelayStrategy theDelayStrategy) {
      delayStrategy = Objects.requireNonNull(theDelayStrategy,
          "delayStrategy must not be null");
      return this;
    }

    /**
     * Sets the predicate deciding whether a failed attempt is retried.
     *
     * <p>The predicate replaces the default one entirely: errors tagged
     * through {@link Errors#unrecoverable(Exception)} are retried unless
     * the predicate checks {@link Errors#isRecoverable(Throwable)} itself.
     * An unbounded loop never retries them.
     *
     * @param theRetryIf the retry predicate, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theRetryIf is null
     */
    public Builder retryIf(final Predicate<Exception> theRetryIf) {
      retryIf = Objects.requireNonNull(theRetryIf,
          "retryIf must not be null");
      return this;
    }

    /**
     * Sets the listener notified before each retry.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theListener is null
     */
    public Builder onRetry(final RetryListener theListener) {
      listener = Objects.requireNonNull(theListener,
          "listener must not be null");
      return this;
    }

    /**
     * Surfaces only the most recent error instead of all of them.
     *
     * @param isLastErrorOnly whether to surface the last error only
     *
     * @return this builder for chaining, never null
     */
    public Builder lastErrorOnly(final boolean isLastErrorOnly) {
      lastErrorOnly = isLastErrorOnly;
      return this;
    }

    /**
     * Sets the cancellation signal.
     *
     * @param theCancellation the cancellation source, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theCancellation is null
     */
    public Builder cancellation(final CancellationSource theCancellation) {
      cancellation = Objects.requireNonNull(theCancellation,
          "cancellation must not be null");
      return this;
    }

    /**
     * Replaces the sleep primitive.
     *
     * @param theTimer the timer, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theTimer is null
     */
    public Builder timer(final RetryTimer theTimer) {
      timer = Objects.requireNonNull(theTimer, "timer must not be null");
      return this;
    }

    /**
     * Surfaces the cancellation of an unbounded loop together with the
     * last attempt error.
     *
     * <p>Bounded loops always surface the cancellation error after the
     * attempt errors, so this setting only applies when attempts is 0.
     *
     * @param isWrap whether to combine both errors
     *
     * @return this builder for chaining, never null
     */
    public Builder wrapCancellationWithLastError(final boolean isWrap) {
      wrapCancellationWithLastError = isWrap;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final RetryMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public RetryConfig build() {
      return new RetryConfig(this);
    }

    private static Duration requireNotNegative(final Duration duration,
        final String name) {
      Objects.requireNonNull(duration, name + " must not be null");
      if (duration.isNegative()) {
        throw new IllegalArgumentException(
            name + " must not be negative, got: " + duration);
      }
      return duration;
    }
  }
}
