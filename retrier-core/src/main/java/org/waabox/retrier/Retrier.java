package org.waabox.retrier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.retrier.cancel.CancellationSource;
import org.waabox.retrier.metrics.RetryMetrics;

/**
 * Retries a fallible operation according to a {@link RetryConfig}.
 *
 * <p>The operation is invoked until it succeeds, the attempt ceiling or a
 * per-error budget is exhausted, the retry predicate rejects its error, the
 * error is tagged as unrecoverable, or the cancellation source is signaled.
 *
 * <p>A ceiling of 0 attempts retries until success. In that mode no errors
 * are accumulated: the loop ends with the error that stopped it. Otherwise
 * every attempt error is kept and surfaced as a
 * {@link RetryFailedException}, or as the last error alone when
 * {@link RetryConfig#lastErrorOnly()} is set.
 *
 * <p>Usage example:
 * <pre>{@code
 * Retrier retrier = Retrier.of(RetryConfig.builder()
 *     .attempts(5)
 *     .delay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(2))
 *     .attemptsForError(2, AccessDeniedException.class)
 *     .build());
 *
 * byte[] body = retrier.call(() -> client.fetch(url));
 * }</pre>
 *
 * <p>This class is immutable and thread-safe: each invocation keeps its own
 * counters, so a single instance may serve concurrent calls.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Retrier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  /** The retry configuration. */
  private final RetryConfig config;

  /**
   * Creates a new retrier.
   *
   * @param theConfig the configuration, never null
   */
  private Retrier(final RetryConfig theConfig) {
    config = theConfig;
  }

  /**
   * Creates a retrier for the given configuration.
   *
   * @param config the configuration, never null
   *
   * @return a new retrier, never null
   *
   * @throws NullPointerException if config is null
   */
  public static Retrier of(final RetryConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    return new Retrier(config);
  }

  /**
   * Creates a retrier with the default configuration.
   *
   * @return a new retrier, never null
   */
  public static Retrier withDefaults() {
    return new Retrier(RetryConfig.defaults());
  }

  /**
   * Returns the configuration of this retrier.
   *
   * @return the configuration, never null
   */
  public RetryConfig config() {
    return config;
  }

  /**
   * Runs the given action until it succeeds or the retry loop gives up.
   *
   * @param action the action to run, never null
   *
   * @throws Exception the error that ended the retry loop, see
   *                   {@link #call(RetryOperation)}
   */
  public void run(final RetryAction action) throws Exception {
    Objects.requireNonNull(action, "action must not be null");
    call(() -> {
      action.run();
      return null;
    });
  }

  /**
   * Calls the given operation until it succeeds or the retry loop gives up.
   *
   * <p>On failure, throws exactly one of:
   * <ul>
   *   <li>the original error, when the loop is unbounded or when
   *       {@link RetryConfig#lastErrorOnly()} is set; an unrecoverable tag
   *       is removed first</li>
   *   <li>a {@link RetryCancelledException}, when the cancellation source
   *       was signaled before the first attempt or, with
   *       {@link RetryConfig#lastErrorOnly()} or an unbounded loop, while
   *       waiting</li>
   *   <li>a {@link RetryFailedException} holding every attempt error, plus
   *       the cancellation error when cancelled while waiting</li>
   * </ul>
   *
   * @param operation the operation to call, never null
   * @param <T>       the type of the produced value
   *
   * @return the value of the first successful attempt, may be null
   *
   * @throws Exception the error that ended the retry loop
   */
  public <T> T call(final RetryOperation<T> operation) throws Exception {
    Objects.requireNonNull(operation, "operation must not be null");

    final CancellationSource cancellation = config.cancellation();
    if (cancellation.isCancelled()) {
      config.metrics().cancelled(0);
      throw cancellation.error().orElseThrow();
    }

    if (config.attempts() == 0) {
      return callUntilSuccess(operation);
    }
    return callBounded(operation);
  }

  /**
   * Retries the operation without an attempt ceiling.
   *
   * @param operation the operation to call, never null
   * @param <T>       the type of the produced value
   *
   * @return the value of the first successful attempt
   *
   * @throws Exception the error that ended the retry loop
   */
  private <T> T callUntilSuccess(final RetryOperation<T> operation)
      throws Exception {
    final RetryMetrics metrics = config.metrics();
    int retries = 0;

    while (true) {
      final Exception error;
      try {
        final T value = operation.call();
        metrics.succeeded(retries + 1);
        return value;
      } catch (final InterruptedException e) {
        throw interrupted(e, retries);
      } catch (final Exception e) {
        error = e;
      }

      metrics.attemptFailed(retries, error);

      if (!Errors.isRecoverable(error) || !config.retryIf().test(error)) {
        log.debug("Attempt {} failed with a non retriable error: {}",
            retries + 1, error.getMessage());
        final Exception surfaced = Errors.unwrap(error);
        metrics.exhausted(retries + 1, surfaced);
        throw surfaced;
      }

      // Without a ceiling, retries are numbered from 1.
      if (retries < Integer.MAX_VALUE - 1) {
        retries++;
      }

      log.debug("Attempt {} failed, retrying: {}", retries,
          error.getMessage());
      config.listener().onRetry(retries, error);

      final RetryCancelledException cancelled =
          awaitNextAttempt(delayFor(retries, error));
      if (cancelled != null) {
        log.debug("Retry cancelled after {} attempt(s)", retries);
        metrics.cancelled(retries);
        if (config.wrapCancellationWithLastError()) {
          throw new RetryFailedException(
              List.of(cancelled, Errors.unwrap(error)));
        }
        throw cancelled;
      }
    }
  }

  /**
   * Retries the operation up to the attempt ceiling, accumulating every
   * attempt error.
   *
   * @param operation the operation to call, never null
   * @param <T>       the type of the produced value
   *
   * @return the value of the first successful attempt
   *
   * @throws Exception the error that ended the retry loop
   */
  private <T> T callBounded(final RetryOperation<T> operation)
      throws Exception {
    final RetryMetrics metrics = config.metrics();
    final int maxAttempts = config.attempts();
    final List<ErrorBudget> budgets = config.errorBudgets();

    final List<Exception> errors = new ArrayList<>();
    final int[] remaining = new int[budgets.size()];
    for (int i = 0; i < remaining.length; i++) {
      remaining[i] = budgets.get(i).attempts();
    }

    int attempt = 0;
    boolean shouldRetry = true;

    while (shouldRetry) {
      final Exception error;
      try {
        final T value = operation.call();
        metrics.succeeded(attempt + 1);
        return value;
      } catch (final InterruptedException e) {
        throw interrupted(e, attempt);
      } catch (final Exception e) {
        error = e;
      }

      metrics.attemptFailed(attempt, error);
      errors.add(Errors.unwrap(error));

      if (!config.retryIf().test(error)) {
        log.debug("Attempt {}/{} failed with a non retriable error: {}",
            attempt + 1, maxAttempts, error.getMessage());
        break;
      }

      log.debug("Attempt {}/{} failed: {}", attempt + 1, maxAttempts,
          error.getMessage());
      config.listener().onRetry(attempt, error);

      for (int i = 0; i < remaining.length; i++) {
        if (budgets.get(i).matcher().matches(error)) {
          remaining[i]--;
          if (remaining[i] <= 0) {
            log.debug("Attempt budget for error exhausted after {} "
                + "attempt(s)", attempt + 1);
            shouldRetry = false;
          }
        }
      }

      if (attempt == maxAttempts - 1) {
        log.warn("All {} attempts failed, last error: {}", maxAttempts,
            error.getMessage());
        break;
      }
      if (!shouldRetry) {
        break;
      }

      final RetryCancelledException cancelled =
          awaitNextAttempt(delayFor(attempt, error));
      if (cancelled != null) {
        log.debug("Retry cancelled after {}/{} attempts", attempt + 1,
            maxAttempts);
        metrics.cancelled(attempt + 1);
        if (config.lastErrorOnly()) {
          throw cancelled;
        }
        errors.add(cancelled);
        throw new RetryFailedException(errors);
      }

      attempt++;
    }

    final Exception surfaced = config.lastErrorOnly()
        ? errors.get(errors.size() - 1)
        : new RetryFailedException(errors);
    metrics.exhausted(errors.size(), surfaced);
    throw surfaced;
  }

  /**
   * Computes the wait after the given failed attempt, capped by
   * {@link RetryConfig#maxDelay()}.
   *
   * @param attempt the index passed to the delay strategy
   * @param error   the error thrown by the attempt, never null
   *
   * @return the wait, never null
   */
  Duration delayFor(final int attempt, final Exception error) {
    final Duration delay = config.delayStrategy().delay(attempt, error,
        config);
    final Duration maxDelay = config.maxDelay();
    if (!maxDelay.isZero() && delay.compareTo(maxDelay) > 0) {
      return maxDelay;
    }
    return delay;
  }

  /**
   * Waits for the given delay or for the cancellation signal, whichever
   * comes first.
   *
   * <p>The cancellation wins when both are ready. An interruption of the
   * waiting thread counts as a cancellation and keeps the interrupt flag.
   *
   * @param delay the delay to wait, never null
   *
   * @return the cancellation error, or null once the delay elapsed
   */
  private RetryCancelledException awaitNextAttempt(final Duration delay) {
    final CancellationSource cancellation = config.cancellation();
    if (cancellation.isCancelled()) {
      return cancellation.error().orElseThrow();
    }

    final CompletableFuture<?> elapsed = config.timer().after(delay);
    final CompletableFuture<RetryCancelledException> signal =
        cancellation.isCancellable() ? cancellation.whenCancelled() : null;
    try {
      if (signal == null) {
        elapsed.get();
      } else {
        CompletableFuture.anyOf(elapsed, signal).get();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return new RetryCancelledException("Retry interrupted", e);
    } catch (final ExecutionException e) {
      log.debug("Retry timer failed, continuing with the next attempt",
          e.getCause());
    } finally {
      elapsed.cancel(false);
      if (signal != null) {
        cancellation.release(signal);
      }
    }

    return cancellation.error().orElse(null);
  }

  /**
   * Handles an interruption surfaced by the operation itself.
   *
   * @param e       the interruption, never null
   * @param attempt the zero-based index of the interrupted attempt
   *
   * @return the interruption to rethrow, never null
   */
  private InterruptedException interrupted(final InterruptedException e,
      final int attempt) {
    Thread.currentThread().interrupt();
    log.debug("Attempt {} interrupted, giving up", attempt + 1);
    config.metrics().cancelled(attempt + 1);
    return e;
  }
}
