package org.waabox.retrier;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.waabox.retrier.cancel.CancellationSource;
import org.waabox.retrier.cancel.RetryTimer;
import org.waabox.retrier.delay.DelayStrategies;
import org.waabox.retrier.metrics.RetryMetrics;

/**
 * Tests for {@link Retrier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RetrierTest {

  /** A timer that completes immediately and remembers every delay. */
  static final class RecordingTimer implements RetryTimer {

    /** The requested delays, in order. */
    private final List<Duration> delays = new ArrayList<>();

    @Override
    public CompletableFuture<?> after(final Duration delay) {
      delays.add(delay);
      return CompletableFuture.completedFuture(null);
    }

    List<Duration> delays() {
      return delays;
    }
  }

  /** An error kind compared by its code. */
  static final class CodedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int code;

    CodedException(final int theCode) {
      super("code " + theCode);
      code = theCode;
    }

    @Override
    public boolean equals(final Object other) {
      return other instanceof CodedException
          && ((CodedException) other).code == code;
    }

    @Override
    public int hashCode() {
      return code;
    }
  }

  @Test
  void whenCalling_givenSucceedingOperation_shouldReturnFirstValue()
      throws Exception {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .timer(timer)
        .build());

    final String value = retrier.call(() -> {
      calls.incrementAndGet();
      return "hello";
    });

    assertEquals("hello", value);
    assertEquals(1, calls.get());
    assertTrue(timer.delays().isEmpty());
  }

  @Test
  void whenCalling_givenAlwaysFailing_shouldMakeExactlyAttemptsAndAggregate() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(4)
        .timer(timer)
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.call(() -> {
          throw new IOException("failure #" + calls.incrementAndGet());
        }));

    assertEquals(4, calls.get());
    assertEquals(4, failure.size());
    assertEquals("failure #1", failure.errors().get(0).getMessage());
    assertEquals("failure #4", failure.lastError().getMessage());
    assertSame(failure.lastError(), failure.getCause());
    assertEquals(3, timer.delays().size());
  }

  @Test
  void whenCalling_givenLastErrorOnly_shouldThrowMostRecentError() {
    final AtomicInteger calls = new AtomicInteger();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .lastErrorOnly(true)
        .timer(new RecordingTimer())
        .build());

    final IOException error = assertThrows(IOException.class,
        () -> retrier.call(() -> {
          throw new IOException("failure #" + calls.incrementAndGet());
        }));

    assertEquals("failure #3", error.getMessage());
    assertEquals(3, calls.get());
  }

  @Test
  void whenCalling_givenUnrecoverableError_shouldStopAfterOneAttempt() {
    final AtomicInteger calls = new AtomicInteger();
    final IOException original = new IOException("bad request");
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(5)
        .lastErrorOnly(true)
        .timer(timer)
        .build());

    final IOException error = assertThrows(IOException.class,
        () -> retrier.call(() -> {
          calls.incrementAndGet();
          throw Errors.unrecoverable(original);
        }));

    assertSame(original, error);
    assertEquals(1, calls.get());
    assertTrue(timer.delays().isEmpty());
  }

  @Test
  void whenCalling_givenUnrecoverableErrorAndAggregate_shouldStoreOriginal() {
    final IOException original = new IOException("bad request");

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(5)
        .timer(new RecordingTimer())
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.run(() -> {
          throw Errors.unrecoverable(original);
        }));

    assertEquals(1, failure.size());
    assertSame(original, failure.lastError());
  }

  @Test
  void whenCalling_givenUnboundedAndUnrecoverableError_shouldThrowOriginal() {
    final AtomicInteger calls = new AtomicInteger();
    final IOException original = new IOException("gone");

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .retryIf(error -> true)
        .timer(new RecordingTimer())
        .build());

    final IOException error = assertThrows(IOException.class,
        () -> retrier.call(() -> {
          if (calls.incrementAndGet() < 3) {
            throw new IOException("transient");
          }
          throw Errors.unrecoverable(original);
        }));

    assertSame(original, error);
    assertEquals(3, calls.get());
  }

  @Test
  void whenCalling_givenPredicateRejection_shouldStopWithRejectedErrorLast() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(10)
        .retryIf(error -> !(error instanceof IllegalArgumentException))
        .timer(timer)
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.call(() -> {
          if (calls.incrementAndGet() < 3) {
            throw new IOException("transient");
          }
          throw new IllegalArgumentException("rejected");
        }));

    assertEquals(3, calls.get());
    assertEquals(3, failure.size());
    assertInstanceOf(IllegalArgumentException.class, failure.lastError());
    assertEquals(2, timer.delays().size());
  }

  @Test
  void whenCalling_givenUnboundedAndPredicateRejection_shouldThrowAsIs() {
    final IllegalStateException rejected = new IllegalStateException("no");

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .retryIf(error -> error != rejected)
        .timer(new RecordingTimer())
        .build());

    final IllegalStateException error = assertThrows(
        IllegalStateException.class, () -> retrier.call(() -> {
          throw rejected;
        }));

    assertSame(rejected, error);
  }

  @Test
  void whenCalling_givenBackoffAndMaxDelay_shouldDoubleWaitsUpToCap() {
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(7)
        .delay(Duration.ofMillis(100))
        .maxDelay(Duration.ofSeconds(1))
        .delayStrategy(DelayStrategies.backoff())
        .timer(timer)
        .build());

    assertThrows(RetryFailedException.class, () -> retrier.run(() -> {
      throw new IOException("down");
    }));

    assertEquals(List.of(
        Duration.ofMillis(100),
        Duration.ofMillis(200),
        Duration.ofMillis(400),
        Duration.ofMillis(800),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1)), timer.delays());
  }

  @Test
  void whenCalling_givenErrorBudget_shouldStopAfterBudgetAttempts() {
    final AtomicInteger calls = new AtomicInteger();
    final CodedException throttled = new CodedException(429);
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(10)
        .attemptsForError(2, throttled)
        .timer(timer)
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.call(() -> {
          calls.incrementAndGet();
          throw new CodedException(429);
        }));

    assertEquals(2, calls.get());
    assertEquals(2, failure.size());
    assertTrue(failure.is(throttled));
    assertEquals(1, timer.delays().size());
  }

  @Test
  void whenCalling_givenErrorBudgetByType_shouldIgnoreOtherErrors() {
    final AtomicInteger calls = new AtomicInteger();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(10)
        .attemptsForError(2, IllegalStateException.class)
        .timer(new RecordingTimer())
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.call(() -> {
          final int call = calls.incrementAndGet();
          if (call % 2 == 1) {
            throw new IOException("io #" + call);
          }
          throw new IllegalStateException("state #" + call);
        }));

    assertEquals(4, calls.get());
    assertEquals("state #4", failure.lastError().getMessage());
  }

  @Test
  void whenCalling_givenSharedRetrier_shouldResetErrorBudgetPerCall() {
    final AtomicInteger calls = new AtomicInteger();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(10)
        .attemptsForError(2, IOException.class)
        .timer(new RecordingTimer())
        .build());

    for (int i = 0; i < 2; i++) {
      calls.set(0);
      assertThrows(RetryFailedException.class, () -> retrier.run(() -> {
        calls.incrementAndGet();
        throw new IOException("down");
      }));
      assertEquals(2, calls.get());
    }
  }

  @Test
  void whenCalling_givenListener_shouldNotifyEveryRetriedAttempt()
      throws Exception {
    final IOException error = new IOException("down");

    final RetryListener listener = createMock(RetryListener.class);
    listener.onRetry(0, error);
    listener.onRetry(1, error);
    listener.onRetry(2, error);
    replay(listener);

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .onRetry(listener)
        .timer(new RecordingTimer())
        .build());

    assertThrows(RetryFailedException.class, () -> retrier.run(() -> {
      throw error;
    }));

    verify(listener);
  }

  @Test
  void whenCalling_givenMetrics_shouldRecordFailuresAndSuccess()
      throws Exception {
    final AtomicInteger calls = new AtomicInteger();
    final IOException error = new IOException("down");

    final RetryMetrics metrics = createMock(RetryMetrics.class);
    metrics.attemptFailed(eq(0), same(error));
    metrics.attemptFailed(eq(1), same(error));
    metrics.succeeded(3);
    replay(metrics);

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(5)
        .metrics(metrics)
        .timer(new RecordingTimer())
        .build());

    final Integer value = retrier.call(() -> {
      if (calls.incrementAndGet() < 3) {
        throw error;
      }
      return 42;
    });

    assertEquals(42, value);
    verify(metrics);
  }

  @Test
  void whenCalling_givenExhaustedAttempts_shouldRecordExhaustion() {
    final RetryMetrics metrics = createMock(RetryMetrics.class);
    metrics.attemptFailed(eq(0), anyObject(Throwable.class));
    metrics.attemptFailed(eq(1), anyObject(Throwable.class));
    metrics.exhausted(eq(2), anyObject(RetryFailedException.class));
    replay(metrics);

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(2)
        .metrics(metrics)
        .timer(new RecordingTimer())
        .build());

    assertThrows(RetryFailedException.class, () -> retrier.run(() -> {
      throw new IOException("down");
    }));

    verify(metrics);
  }

  @Test
  void whenCalling_givenUnboundedOperation_shouldRetryUntilSuccess()
      throws Exception {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();
    final List<Integer> retries = new ArrayList<>();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .delay(Duration.ofMillis(10))
        .delayStrategy(DelayStrategies.backoff())
        .onRetry((attempt, error) -> retries.add(attempt))
        .timer(timer)
        .build());

    final String value = retrier.call(() -> {
      if (calls.incrementAndGet() <= 20) {
        throw new IOException("not yet");
      }
      return "done";
    });

    assertEquals("done", value);
    assertEquals(21, calls.get());
    assertEquals(20, timer.delays().size());
    assertEquals(Duration.ofMillis(20), timer.delays().get(0));
    assertEquals(Duration.ofMillis(40), timer.delays().get(1));
    assertEquals(List.of(1, 2, 3), retries.subList(0, 3));
    assertEquals(20, retries.get(19));
  }

  @Test
  void whenRunning_givenActionSucceedingLater_shouldReturnNormally()
      throws Exception {
    final AtomicInteger calls = new AtomicInteger();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .timer(new RecordingTimer())
        .build());

    retrier.run(() -> {
      if (calls.incrementAndGet() < 4) {
        throw new IOException("not yet");
      }
    });

    assertEquals(4, calls.get());
  }

  @Test
  void whenCalling_givenCancelledSource_shouldNotInvokeOperation() {
    final AtomicInteger calls = new AtomicInteger();
    final CancellationSource cancellation = CancellationSource.create();
    cancellation.cancel();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .cancellation(cancellation)
        .build());

    final RetryCancelledException error = assertThrows(
        RetryCancelledException.class, () -> retrier.call(() -> {
          calls.incrementAndGet();
          return "never";
        }));

    assertSame(cancellation.error().orElseThrow(), error);
    assertEquals(0, calls.get());
  }

  @Test
  void whenCalling_givenCancellationDuringWait_shouldAppendCancellation() {
    final CancellationSource cancellation = CancellationSource.create();
    final IOException error = new IOException("down");

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .cancellation(cancellation)
        .build());

    cancelLater(cancellation);

    final long start = System.nanoTime();
    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.run(() -> {
          throw error;
        }));
    final long elapsed = System.nanoTime() - start;

    assertTrue(elapsed < TimeUnit.SECONDS.toNanos(10));
    assertEquals(2, failure.size());
    assertSame(error, failure.errors().get(0));
    assertInstanceOf(RetryCancelledException.class, failure.lastError());
  }

  @Test
  void whenCalling_givenCancellationAndLastErrorOnly_shouldThrowCancellation() {
    final CancellationSource cancellation = CancellationSource.create();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .lastErrorOnly(true)
        .cancellation(cancellation)
        .build());

    cancelLater(cancellation);

    assertThrows(RetryCancelledException.class, () -> retrier.run(() -> {
      throw new IOException("down");
    }));
  }

  @Test
  void whenCalling_givenUnboundedCancellation_shouldThrowCancellationAlone() {
    final CancellationSource cancellation = CancellationSource.create();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .cancellation(cancellation)
        .build());

    cancelLater(cancellation);

    final RetryCancelledException error = assertThrows(
        RetryCancelledException.class, () -> retrier.run(() -> {
          throw new IOException("down");
        }));

    assertSame(cancellation.error().orElseThrow(), error);
  }

  @Test
  void whenCalling_givenUnboundedCancellationAndWrap_shouldCombineErrors() {
    final CancellationSource cancellation = CancellationSource.create();
    final IOException error = new IOException("down");

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .wrapCancellationWithLastError(true)
        .cancellation(cancellation)
        .build());

    cancelLater(cancellation);

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.run(() -> {
          throw error;
        }));

    assertEquals(2, failure.size());
    assertInstanceOf(RetryCancelledException.class, failure.errors().get(0));
    assertSame(error, failure.lastError());
    assertTrue(failure.is(error));
  }

  @Test
  void whenCalling_givenCancellationAndElapsedWaitTogether_shouldCancel() {
    final CancellationSource cancellation = CancellationSource.create();
    final IOException error = new IOException("down");
    final AtomicInteger calls = new AtomicInteger();

    final RetryTimer cancellingTimer = delay -> {
      cancellation.cancel();
      return CompletableFuture.completedFuture(null);
    };

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(5)
        .timer(cancellingTimer)
        .cancellation(cancellation)
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.run(() -> {
          calls.incrementAndGet();
          throw error;
        }));

    assertEquals(1, calls.get());
    assertEquals(2, failure.size());
    assertSame(error, failure.errors().get(0));
    assertSame(cancellation.error().orElseThrow(), failure.lastError());
  }

  @Test
  void whenCalling_givenListenerCancelling_shouldNotCallAgain() {
    final CancellationSource cancellation = CancellationSource.create();
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .onRetry((attempt, error) -> cancellation.cancel())
        .timer(timer)
        .cancellation(cancellation)
        .build());

    final RetryCancelledException error = assertThrows(
        RetryCancelledException.class, () -> retrier.run(() -> {
          calls.incrementAndGet();
          throw new IOException("down");
        }));

    assertEquals(1, calls.get());
    assertSame(cancellation.error().orElseThrow(), error);
  }

  @Test
  void whenCalling_givenHugeJitterAndMaxDelay_shouldCapTheWait() {
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .maxJitter(Duration.ofSeconds(Long.MAX_VALUE / 2))
        .maxDelay(Duration.ofMillis(1))
        .delayStrategy(DelayStrategies.random())
        .timer(timer)
        .build());

    final RetryFailedException failure = assertThrows(
        RetryFailedException.class, () -> retrier.run(() -> {
          throw new IOException("down");
        }));

    assertEquals(3, failure.size());
    assertEquals(2, timer.delays().size());
    for (final Duration delay : timer.delays()) {
      assertTrue(delay.compareTo(Duration.ofMillis(1)) <= 0);
    }
  }

  @Test
  void whenCalling_givenTimeoutSource_shouldThrowTimeout() {
    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(0)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .cancellation(CancellationSource.withTimeout(Duration.ofMillis(100)))
        .build());

    assertThrows(RetryTimeoutException.class, () -> retrier.run(() -> {
      throw new IOException("down");
    }));
  }

  @Test
  void whenCalling_givenInterruptedWait_shouldThrowCancellation() {
    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .attempts(3)
        .delay(Duration.ofSeconds(30))
        .delayStrategy(DelayStrategies.fixed())
        .lastErrorOnly(true)
        .build());

    try {
      final RetryCancelledException error = assertThrows(
          RetryCancelledException.class, () -> retrier.run(() -> {
            Thread.currentThread().interrupt();
            throw new IOException("down");
          }));

      assertInstanceOf(InterruptedException.class, error.getCause());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void whenCalling_givenOperationInterrupted_shouldNotRetry() {
    final AtomicInteger calls = new AtomicInteger();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .timer(new RecordingTimer())
        .build());

    try {
      assertThrows(InterruptedException.class, () -> retrier.run(() -> {
        calls.incrementAndGet();
        throw new InterruptedException("stop");
      }));

      assertEquals(1, calls.get());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void whenCalling_givenZeroJitter_shouldNotFail() throws Exception {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingTimer timer = new RecordingTimer();

    final Retrier retrier = Retrier.of(RetryConfig.builder()
        .delay(Duration.ZERO)
        .maxJitter(Duration.ZERO)
        .timer(timer)
        .build());

    final String value = retrier.call(() -> {
      if (calls.incrementAndGet() < 3) {
        throw new IOException("not yet");
      }
      return "ok";
    });

    assertEquals("ok", value);
    assertEquals(List.of(Duration.ofNanos(1), Duration.ofNanos(2)),
        timer.delays());
  }

  @Test
  void whenCalling_givenNullValue_shouldReturnNull() throws Exception {
    final Retrier retrier = Retrier.withDefaults();

    assertNull(retrier.call(() -> null));
    assertFalse(Thread.currentThread().isInterrupted());
  }

  @Test
  void whenCreating_givenNullConfig_shouldThrow() {
    assertThrows(NullPointerException.class, () -> Retrier.of(null));
  }

  /**
   * Cancels the given source shortly after the call, from another thread.
   *
   * @param cancellation the source to cancel, never null
   */
  private static void cancelLater(final CancellationSource cancellation) {
    CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS)
        .execute(cancellation::cancel);
  }
}
