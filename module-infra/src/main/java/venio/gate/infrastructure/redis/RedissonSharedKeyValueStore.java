package venio.gate.infrastructure.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.core.port.out.WindowCounter;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.executor.TaskContext;
import venio.gate.infrastructure.executor.function.ThrowingSupplier;
import venio.gate.infrastructure.executor.strategy.ExceptionTranslator;
import venio.gate.infrastructure.redis.script.LuaScripts;
import venio.gate.infrastructure.util.LogMasking;

/**
 * Redisson 기반 공유 KV 저장소
 *
 * <p>모든 호출은 비동기 API로 보낸 뒤 {@link Deadline#await}로 대기합니다. 호출자 deadline이 끝나거나 취소되면 대기를 중단하고
 * Future를 취소합니다.
 *
 * <h4>원자성</h4>
 *
 * <ul>
 *   <li>incrementWithExpiry: Lua Script 1회 ({@link LuaScripts#INCREMENT_WITH_EXPIRY})
 *   <li>setIfAbsent: {@code SET key value PX ttl NX}
 * </ul>
 */
@Slf4j
public class RedissonSharedKeyValueStore implements SharedKeyValueStore {

  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final Duration callTimeout;

  public RedissonSharedKeyValueStore(
      RedissonClient redissonClient, LogicExecutor executor, Duration callTimeout) {
    this.redissonClient = redissonClient;
    this.executor = executor;
    this.callTimeout = callTimeout;
  }

  @Override
  public WindowCounter incrementWithExpiry(Deadline deadline, String key, Duration window) {
    return call(
        "Incr",
        key,
        () -> {
          RScript script = redissonClient.getScript(StringCodec.INSTANCE);
          CompletableFuture<List<Object>> future =
              script
                  .<List<Object>>evalAsync(
                      key,
                      RScript.Mode.READ_WRITE,
                      LuaScripts.INCREMENT_WITH_EXPIRY,
                      RScript.ReturnType.MULTI,
                      List.<Object>of(key),
                      String.valueOf(window.toMillis()))
                  .toCompletableFuture();

          List<Object> result = deadline.await(future, callTimeout, "incr");
          long count = Long.parseLong(String.valueOf(result.get(0)));
          long pttl = Long.parseLong(String.valueOf(result.get(1)));
          return new WindowCounter(count, Duration.ofMillis(Math.max(pttl, 0L)));
        });
  }

  @Override
  public Optional<String> get(Deadline deadline, String key) {
    return call(
        "Get",
        key,
        () ->
            Optional.ofNullable(
                deadline.await(bucket(key).getAsync().toCompletableFuture(), callTimeout, "get")));
  }

  @Override
  public void set(Deadline deadline, String key, String value, Duration ttl) {
    call(
        "Set",
        key,
        () ->
            deadline.await(
                bucket(key)
                    .setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS)
                    .toCompletableFuture(),
                callTimeout,
                "set"));
  }

  @Override
  public boolean setIfAbsent(Deadline deadline, String key, String value, Duration ttl) {
    return call(
        "SetNx",
        key,
        () ->
            Boolean.TRUE.equals(
                deadline.await(
                    bucket(key).setIfAbsentAsync(value, ttl).toCompletableFuture(),
                    callTimeout,
                    "setnx")));
  }

  @Override
  public boolean delete(Deadline deadline, String key) {
    return call(
        "Delete",
        key,
        () ->
            Boolean.TRUE.equals(
                deadline.await(
                    bucket(key).deleteAsync().toCompletableFuture(), callTimeout, "delete")));
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(key, StringCodec.INSTANCE);
  }

  private <T> T call(String operation, String key, ThrowingSupplier<T> task) {
    return executor.executeWithTranslation(
        task,
        ExceptionTranslator.forStore(),
        TaskContext.of("Store", operation, LogMasking.maskKey(key)));
  }
}
