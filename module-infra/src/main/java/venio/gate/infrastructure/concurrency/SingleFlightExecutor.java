package venio.gate.infrastructure.concurrency;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.concurrency.Deadline;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.infrastructure.util.LogMasking;

/**
 * Single-flight 실행기
 *
 * <h4>핵심 기능</h4>
 *
 * <ul>
 *   <li>동일 키에 대한 동시 요청 N개 중 실제 로드는 1회만 수행 (Leader)
 *   <li>나머지 요청은 Leader의 결과 또는 예외를 공유 (Follower)
 *   <li>Leader는 호출 스레드에서 자신의 {@link Deadline} 아래 실행
 *   <li>Follower는 각자의 Deadline으로만 대기하며, 다른 키의 요청을 막지 않음
 * </ul>
 *
 * <p>Follower마다 독립 Future를 만들어 대기하므로, 한 Follower의 타임아웃/취소가 공유 promise를 오염시키지 않습니다.
 *
 * @param <T> 로드 결과 타입
 */
@Slf4j
public class SingleFlightExecutor<T> {

  private static final String OPERATION = "single-flight-wait";

  /** Follower 대기 상한 (Deadline이 더 짧으면 Deadline 우선) */
  private final Duration followerTimeout;

  private final ConcurrentHashMap<String, InFlightEntry<T>> inFlight = new ConcurrentHashMap<>();

  private record InFlightEntry<T>(CompletableFuture<T> promise) {}

  public SingleFlightExecutor(Duration followerTimeout) {
    this.followerTimeout = Objects.requireNonNull(followerTimeout, "followerTimeout");
  }

  /**
   * Single-flight 실행
   *
   * <ol>
   *   <li>키에 대한 inFlight 엔트리 확인
   *   <li>없으면 Leader로 등록 후 loader 실행
   *   <li>있으면 Follower로 Leader 결과 대기
   * </ol>
   */
  public T execute(Deadline deadline, String key, Supplier<T> loader) {
    CompletableFuture<T> promise = new CompletableFuture<>();
    InFlightEntry<T> newEntry = new InFlightEntry<>(promise);
    InFlightEntry<T> existing = inFlight.putIfAbsent(key, newEntry);

    if (existing == null) {
      return executeAsLeader(key, newEntry, loader);
    }
    return executeAsFollower(deadline, key, existing.promise());
  }

  /** loader가 예외를 던져도 promise 완료와 inFlight 정리는 반드시 수행 */
  private T executeAsLeader(String key, InFlightEntry<T> entry, Supplier<T> loader) {
    CompletableFuture<T> promise = entry.promise();
    try {
      T result = loader.get();
      promise.complete(result);
      return result;
    } catch (RuntimeException | Error e) {
      log.debug("[SingleFlight] Leader failed for key: {}", LogMasking.maskKey(key));
      promise.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, entry);
    }
  }

  private T executeAsFollower(Deadline deadline, String key, CompletableFuture<T> leaderFuture) {
    CompletableFuture<T> isolatedFuture = new CompletableFuture<>();
    leaderFuture.whenComplete(
        (result, error) -> {
          if (error != null) {
            isolatedFuture.completeExceptionally(error);
          } else {
            isolatedFuture.complete(result);
          }
        });

    try {
      return deadline.await(isolatedFuture, followerTimeout, OPERATION);
    } catch (StoreUnavailableException e) {
      Throwable leaderFailure = failureOf(leaderFuture);
      if (leaderFailure instanceof RuntimeException re) {
        throw re;
      }
      log.warn("[SingleFlight] Follower gave up waiting for key: {}", LogMasking.maskKey(key));
      throw e;
    }
  }

  private Throwable failureOf(CompletableFuture<T> future) {
    if (!future.isCompletedExceptionally()) {
      return null;
    }
    Throwable error = future.handle((r, t) -> t).join();
    return (error instanceof CompletionException ce && ce.getCause() != null)
        ? ce.getCause()
        : error;
  }

  /** 진행 중인 로드를 분리합니다. 이후 호출은 새 Leader를 시작합니다. */
  public void forget(String key) {
    inFlight.remove(key);
  }

  public void forgetAll() {
    inFlight.clear();
  }

  /** 현재 inFlight 엔트리 수 (모니터링용) */
  public int getInFlightCount() {
    return inFlight.size();
  }
}
