package org.waabox.retrier.cancel;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.waabox.retrier.RetryCancelledException;
import org.waabox.retrier.RetryTimeoutException;

/**
 * The cancellation signal of a retry loop.
 *
 * <p>A source is signaled at most once, either explicitly through
 * {@link #cancel()} or when the deadline of {@link #withTimeout(Duration)}
 * expires. The first signal wins and fixes the cancellation error.
 *
 * <p>Usage example:
 * <pre>{@code
 * CancellationSource cancellation = CancellationSource.withTimeout(
 *     Duration.ofSeconds(30));
 *
 * Retrier retrier = Retrier.of(RetryConfig.builder()
 *     .attempts(0)
 *     .cancellation(cancellation)
 *     .build());
 * }</pre>
 *
 * <p>This class is thread-safe; a source can be shared by several retry
 * loops that must be cancelled together.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CancellationSource {

  /** The source that is never signaled. */
  private static final CancellationSource NEVER =
      new CancellationSource(false);

  /** Completed with the cancellation error once signaled. */
  private final CompletableFuture<RetryCancelledException> signal =
      new CompletableFuture<>();

  /** The futures of the waits in progress, completed on cancellation. */
  private final Set<CompletableFuture<RetryCancelledException>> waiters =
      ConcurrentHashMap.newKeySet();

  /** Whether this source can be signaled at all. */
  private final boolean cancellable;

  /**
   * Creates a new source.
   *
   * @param isCancellable whether the source can be signaled
   */
  private CancellationSource(final boolean isCancellable) {
    cancellable = isCancellable;
  }

  /**
   * Creates a source that is signaled only through {@link #cancel()}.
   *
   * @return a new source, never null
   */
  public static CancellationSource create() {
    return new CancellationSource(true);
  }

  /**
   * Returns the shared source that is never signaled.
   *
   * <p>Calls to {@link #cancel()} on it are ignored.
   *
   * @return the never signaled source, never null
   */
  public static CancellationSource never() {
    return NEVER;
  }

  /**
   * Creates a source that signals a {@link RetryTimeoutException} once the
   * given timeout elapses.
   *
   * @param timeout the timeout, never null nor negative
   *
   * @return a new source, never null
   *
   * @throws NullPointerException     if timeout is null
   * @throws IllegalArgumentException if timeout is negative
   */
  public static CancellationSource withTimeout(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must not be negative, got: " + timeout);
    }
    final CancellationSource source = create();
    CompletableFuture.delayedExecutor(timeout.toMillis(),
        TimeUnit.MILLISECONDS).execute(() ->
        source.cancel(new RetryTimeoutException(timeout)));
    return source;
  }

  /**
   * Signals the cancellation with a {@link RetryCancelledException}.
   *
   * @return {@code true} if this call signaled the source, {@code false} if
   *         it was already signaled or cannot be signaled
   */
  public boolean cancel() {
    return cancel(new RetryCancelledException("Retry cancelled"));
  }

  /**
   * Signals the cancellation with the given error.
   *
   * @param error the cancellation error, never null
   *
   * @return {@code true} if this call signaled the source, {@code false} if
   *         it was already signaled or cannot be signaled
   *
   * @throws NullPointerException if error is null
   */
  public boolean cancel(final RetryCancelledException error) {
    Objects.requireNonNull(error, "error must not be null");
    if (!cancellable || !signal.complete(error)) {
      return false;
    }
    waiters.removeIf(waiter -> {
      waiter.complete(error);
      return true;
    });
    return true;
  }

  /**
   * Checks whether this source has been signaled.
   *
   * @return {@code true} once signaled
   */
  public boolean isCancelled() {
    return signal.isDone();
  }

  /**
   * Checks whether this source can ever be signaled.
   *
   * @return {@code false} only for {@link #never()}
   */
  public boolean isCancellable() {
    return cancellable;
  }

  /**
   * Returns the cancellation error, if signaled.
   *
   * @return the cancellation error, or empty while not signaled
   */
  public Optional<RetryCancelledException> error() {
    return Optional.ofNullable(signal.getNow(null));
  }

  /**
   * Registers a wait on this source.
   *
   * <p>The returned future completes with the cancellation error once
   * signaled. Completing it has no effect on this source. Every wait must be
   * handed back through {@link #release(CompletableFuture)} once it is over,
   * or the source keeps a reference to it until signaled.
   *
   * @return the future, never null
   */
  public CompletableFuture<RetryCancelledException> whenCancelled() {
    if (!cancellable) {
      return new CompletableFuture<>();
    }
    final RetryCancelledException current = signal.getNow(null);
    if (current != null) {
      return CompletableFuture.completedFuture(current);
    }
    final CompletableFuture<RetryCancelledException> waiter =
        new CompletableFuture<>();
    waiters.add(waiter);
    // A signal raised while registering may have missed the new waiter.
    final RetryCancelledException raced = signal.getNow(null);
    if (raced != null) {
      waiters.remove(waiter);
      waiter.complete(raced);
    }
    return waiter;
  }

  /**
   * Releases a wait registered through {@link #whenCancelled()}.
   *
   * @param waiter the future of the wait, never null
   */
  public void release(final CompletableFuture<RetryCancelledException> waiter) {
    Objects.requireNonNull(waiter, "waiter must not be null");
    waiters.remove(waiter);
    waiter.cancel(false);
  }

  /**
   * Returns the number of waits registered and not yet released.
   *
   * @return the number of pending waits
   */
  int waiting() {
    return waiters.size();
  }
}
