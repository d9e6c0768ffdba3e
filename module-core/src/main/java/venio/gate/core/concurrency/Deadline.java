package venio.gate.core.concurrency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import venio.gate.error.exception.StoreUnavailableException;

/**
 * Caller's deadline and cancellation signal for one unit of work.
 *
 * <p>Passed explicitly as the first parameter of every blocking store call. Expiry is judged by
 * the injected {@link Clock}; waiting on a store future is bounded by the smaller of the remaining
 * time and the per-call timeout.
 *
 * <p>A call abandoned because the deadline expired or the caller cancelled is reported as a
 * non-retryable {@link StoreUnavailableException}. A call that hit only its per-call timeout while
 * the deadline still had time left is retryable.
 */
public final class Deadline {

  private final Clock clock;
  private final Instant expiresAt;
  private final CompletableFuture<Void> cancellation = new CompletableFuture<>();

  private Deadline(Clock clock, Instant expiresAt) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public static Deadline after(Clock clock, Duration timeout) {
    return new Deadline(clock, clock.instant().plus(timeout));
  }

  public static Deadline at(Clock clock, Instant expiresAt) {
    return new Deadline(clock, expiresAt);
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  /** Signal cancellation. Pending {@link #await} calls return immediately. */
  public void cancel() {
    cancellation.complete(null);
  }

  public boolean isCancelled() {
    return cancellation.isDone();
  }

  public boolean isExpired() {
    return isCancelled() || !clock.instant().isBefore(expiresAt);
  }

  /** Time left, never negative. */
  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /**
   * Fail fast before starting a blocking call.
   *
   * @throws StoreUnavailableException non-retryable, when cancelled or expired
   */
  public void throwIfDone(String operation) {
    if (isExpired()) {
      throw new StoreUnavailableException(operation, false);
    }
  }

  /**
   * Wait for a store future, bounded by this deadline and {@code callTimeout}.
   *
   * <p>On timeout or cancellation the future is cancelled so the underlying call is abandoned.
   */
  public <T> T await(CompletableFuture<T> future, Duration callTimeout, String operation) {
    throwIfDone(operation);
    Duration left = remaining();
    boolean boundedByCall = callTimeout.compareTo(left) < 0;
    long waitMillis = Math.max(1L, (boundedByCall ? callTimeout : left).toMillis());

    try {
      CompletableFuture.anyOf(future, cancellation).get(waitMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new StoreUnavailableException(operation, boundedByCall, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new StoreUnavailableException(operation, false, e);
    } catch (ExecutionException | CancellationException e) {
      return join(future, operation);
    }

    if (!future.isDone()) {
      future.cancel(true);
      throw new StoreUnavailableException(operation, false);
    }
    return join(future, operation);
  }

  private static <T> T join(CompletableFuture<T> future, String operation) {
    try {
      return future.join();
    } catch (CancellationException e) {
      throw new StoreUnavailableException(operation, false, e);
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof StoreUnavailableException sue) {
        throw sue;
      }
      throw new StoreUnavailableException(operation, true, cause);
    }
  }
}
