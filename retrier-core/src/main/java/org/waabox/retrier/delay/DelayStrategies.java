package org.waabox.retrier.delay;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

import org.waabox.retrier.Errors;
import org.waabox.retrier.RetryConfig;

/**
 * The built-in {@link DelayStrategy delay strategies}.
 *
 * <p>Durations are computed in nanoseconds, the unit of
 * {@link Duration#toNanos()}, and never overflow a signed 64-bit value.
 *
 * <p>Usage example:
 * <pre>{@code
 * RetryConfig config = RetryConfig.builder()
 *     .delay(Duration.ofMillis(100))
 *     .maxJitter(Duration.ofMillis(50))
 *     .delayStrategy(DelayStrategies.combine(
 *         DelayStrategies.backoff(), DelayStrategies.random()))
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DelayStrategies {

  /** The highest shift that keeps one nanosecond inside a signed long. */
  public static final int MAX_SHIFT = 62;

  private DelayStrategies() {
  }

  /**
   * Always waits {@link RetryConfig#delay()}.
   *
   * @return the fixed strategy, never null
   */
  public static DelayStrategy fixed() {
    return (attempt, error, config) -> config.delay();
  }

  /**
   * Doubles the wait on every attempt.
   *
   * <p>The n-th wait is {@code delay << min(n, maxBackoffShift)}, where the
   * shift bound of the configuration keeps the result below
   * {@link Long#MAX_VALUE} nanoseconds. A zero delay is taken as one
   * nanosecond.
   *
   * @return the backoff strategy, never null
   */
  public static DelayStrategy backoff() {
    return (attempt, error, config) -> {
      final long base = Math.max(toNanos(config.delay()), 1L);
      final int shift = Math.min(Math.max(attempt, 0),
          config.maxBackoffShift());
      return Duration.ofNanos(base << shift);
    };
  }

  /**
   * Waits a uniformly distributed duration in
   * {@code [0, maxJitter)}.
   *
   * <p>A zero jitter ceiling yields no wait.
   *
   * @return the random strategy, never null
   */
  public static DelayStrategy random() {
    return (attempt, error, config) -> {
      final long ceiling = toNanos(config.maxJitter());
      if (ceiling <= 0) {
        return Duration.ZERO;
      }
      return Duration.ofNanos(ThreadLocalRandom.current().nextLong(ceiling));
    };
  }

  /**
   * Sums the waits of the given strategies, in order.
   *
   * <p>The running total saturates at {@link Long#MAX_VALUE} nanoseconds.
   * Negative waits count as zero.
   *
   * @param strategies the strategies to sum, never null
   *
   * @return the combined strategy, never null
   *
   * @throws NullPointerException if strategies or any of its elements is
   *                              null
   */
  public static DelayStrategy combine(final DelayStrategy... strategies) {
    Objects.requireNonNull(strategies, "strategies must not be null");
    final List<DelayStrategy> delays = List.of(strategies);
    return (attempt, error, config) -> {
      long total = 0L;
      for (final DelayStrategy delay : delays) {
        final long nanos = toNanos(delay.delay(attempt, error, config));
        total = nanos > Long.MAX_VALUE - total
            ? Long.MAX_VALUE : total + Math.max(nanos, 0L);
      }
      return Duration.ofNanos(total);
    };
  }

  /**
   * Takes the wait from an error of the given type found in the failed
   * attempt's chain, falling back to another strategy when there is none or
   * when the extracted wait is null.
   *
   * <p>This is how a caller-computed override, such as a server provided
   * retry-after hint, is honored.
   *
   * @param type      the error type carrying the wait, never null
   * @param extractor reads the wait from the error, never null
   * @param fallback  the strategy used otherwise, never null
   * @param <E>       the error type
   *
   * @return the error based strategy, never null
   */
  public static <E extends Throwable> DelayStrategy basedOnError(
      final Class<E> type, final Function<? super E, Duration> extractor,
      final DelayStrategy fallback) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(extractor, "extractor must not be null");
    Objects.requireNonNull(fallback, "fallback must not be null");
    return (attempt, error, config) -> {
      final Optional<Duration> hinted = Errors.as(error, type)
          .map(extractor);
      return hinted.orElseGet(() -> fallback.delay(attempt, error, config));
    };
  }

  /**
   * Converts a duration to nanoseconds, saturating instead of overflowing.
   *
   * @param duration the duration, never null
   *
   * @return the nanoseconds, between {@link Long#MIN_VALUE} and
   *         {@link Long#MAX_VALUE}
   */
  static long toNanos(final Duration duration) {
    try {
      return duration.toNanos();
    } catch (final ArithmeticException e) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }
}
