package org.waabox.retrier.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.retrier.delay.DelayStrategies;
import org.waabox.retrier.delay.DelayStrategy;

/**
 * Configuration properties for the retrier, mapped from the
 * {@code retrier.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code retrier.attempts} - the attempt ceiling, 0 retries until
 *       success. Defaults to 10.</li>
 *   <li>{@code retrier.delay} - the base delay. Defaults to 100ms.</li>
 *   <li>{@code retrier.max-delay} - the cap of every wait, 0 for no cap.
 *       Defaults to no cap.</li>
 *   <li>{@code retrier.max-jitter} - the random jitter ceiling. Defaults to
 *       100ms.</li>
 *   <li>{@code retrier.delay-type} - one of {@link DelayType}. Defaults to
 *       {@code BACKOFF_WITH_JITTER}.</li>
 *   <li>{@code retrier.last-error-only} - surface only the last error.</li>
 *   <li>{@code retrier.wrap-cancellation-with-last-error} - surface the
 *       cancellation of an unbounded loop with the last error.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "retrier")
public class RetrierProperties {

  /** The built-in delay strategies selectable from properties. */
  public enum DelayType {

    /** Always waits the base delay. */
    FIXED,

    /** Doubles the base delay on every attempt. */
    BACKOFF,

    /** Waits a random duration up to the jitter ceiling. */
    RANDOM,

    /** Backoff plus random jitter. */
    BACKOFF_WITH_JITTER;

    /**
     * Returns the delay strategy this type stands for.
     *
     * @return the delay strategy, never null
     */
    public DelayStrategy strategy() {
      switch (this) {
        case FIXED:
          return DelayStrategies.fixed();
        case BACKOFF:
          return DelayStrategies.backoff();
        case RANDOM:
          return DelayStrategies.random();
        default:
          return DelayStrategies.combine(DelayStrategies.backoff(),
              DelayStrategies.random());
      }
    }
  }

  /** The attempt ceiling, 0 means retry until success. */
  private int attempts = 10;

  /** The base delay. */
  private Duration delay = Duration.ofMillis(100);

  /** The cap of every wait, zero means no cap. */
  private Duration maxDelay = Duration.ZERO;

  /** The random jitter ceiling. */
  private Duration maxJitter = Duration.ofMillis(100);

  /** The delay strategy. */
  private DelayType delayType = DelayType.BACKOFF_WITH_JITTER;

  /** Whether only the last error is surfaced. */
  private boolean lastErrorOnly = false;

  /** Whether an unbounded loop cancellation carries the last error. */
  private boolean wrapCancellationWithLastError = false;

  /**
   * Returns the attempt ceiling.
   *
   * @return the attempt ceiling, 0 meaning no limit
   */
  public int getAttempts() {
    return attempts;
  }

  /**
   * Sets the attempt ceiling.
   *
   * @param attempts the attempt ceiling, 0 to retry until success
   */
  public void setAttempts(final int attempts) {
    this.attempts = attempts;
  }

  /**
   * Returns the base delay.
   *
   * @return the base delay, never null
   */
  public Duration getDelay() {
    return delay;
  }

  /**
   * Sets the base delay.
   *
   * @param delay the base delay, never null
   */
  public void setDelay(final Duration delay) {
    this.delay = delay;
  }

  /**
   * Returns the cap of every wait.
   *
   * @return the cap, zero meaning no cap
   */
  public Duration getMaxDelay() {
    return maxDelay;
  }

  /**
   * Sets the cap of every wait.
   *
   * @param maxDelay the cap, zero for no cap
   */
  public void setMaxDelay(final Duration maxDelay) {
    this.maxDelay = maxDelay;
  }

  /**
   * Returns the random jitter ceiling.
   *
   * @return the jitter ceiling, never null
   */
  public Duration getMaxJitter() {
    return maxJitter;
  }

  /**
   * Sets the random jitter ceiling.
   *
   * @param maxJitter the jitter ceiling, never null
   */
  public void setMaxJitter(final Duration maxJitter) {
    this.maxJitter = maxJitter;
  }

  /**
   * Returns the delay strategy type.
   *
   * @return the delay type, never null
   */
  public DelayType getDelayType() {
    return delayType;
  }

  /**
   * Sets the delay strategy type.
   *
   * @param delayType the delay type, never null
   */
  public void setDelayType(final DelayType delayType) {
    this.delayType = delayType;
  }

  /**
   * Returns whether only the last attempt error is surfaced.
   *
   * @return {@code true} to surface only the last error
   */
  public boolean isLastErrorOnly() {
    return lastErrorOnly;
  }

  /**
   * Sets whether only the last attempt error is surfaced.
   *
   * @param lastErrorOnly {@code true} to surface only the last error
   */
  public void setLastErrorOnly(final boolean lastErrorOnly) {
    this.lastErrorOnly = lastErrorOnly;
  }

  /**
   * Returns whether a cancellation without an attempt ceiling is combined
   * with the last attempt error.
   *
   * @return {@code true} to combine both errors
   */
  public boolean isWrapCancellationWithLastError() {
    return wrapCancellationWithLastError;
  }

  /**
   * Sets whether a cancellation without an attempt ceiling is combined with
   * the last attempt error.
   *
   * @param wrapCancellationWithLastError {@code true} to combine both errors
   */
  public void setWrapCancellationWithLastError(
      final boolean wrapCancellationWithLastError) {
    this.wrapCancellationWithLastError = wrapCancellationWithLastError;
  }
}
